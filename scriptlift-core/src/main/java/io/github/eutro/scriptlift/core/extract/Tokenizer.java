package io.github.eutro.scriptlift.core.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * A forgiving tokenizer for Lua-like source text.
 * <p>
 * Whitespace, {@code --} line comments and {@code --[[ ]]} block comments are skipped,
 * as is any character that starts no token. Unterminated strings run to the end of the line.
 */
public final class Tokenizer {
    private Tokenizer() {
    }

    /**
     * The types of token.
     */
    public enum Type {
        WORD,
        NUMBER,
        OPERATOR,
        BRACKET,
        PUNCTUATION,
        STRING,
    }

    /**
     * A token, with its position in the text.
     */
    public static final class Token {
        public final Type type;
        public final String text;
        public final int start;
        public final int end;

        public Token(Type type, String text, int start, int end) {
            this.type = type;
            this.text = text;
            this.start = start;
            this.end = end;
        }

        @Override
        public String toString() {
            return type + " " + text;
        }
    }

    private static final String OPERATOR_CHARS = "+-*/%^#=~<>";
    private static final String BRACKET_CHARS = "()[]{}";
    private static final String PUNCTUATION_CHARS = ";,.:";

    public static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int n = text.length();
        int pos = 0;
        while (pos < n) {
            char c = text.charAt(pos);
            int start = pos;
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (text.startsWith("--", pos)) {
                pos = skipComment(text, pos + 2);
            } else if (Character.isLetter(c) || c == '_') {
                while (pos < n && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) pos++;
                tokens.add(new Token(Type.WORD, text.substring(start, pos), start, pos));
            } else if (Character.isDigit(c)) {
                while (pos < n && Character.isDigit(text.charAt(pos))) pos++;
                if (pos + 1 < n && text.charAt(pos) == '.' && Character.isDigit(text.charAt(pos + 1))) {
                    pos++;
                    while (pos < n && Character.isDigit(text.charAt(pos))) pos++;
                }
                tokens.add(new Token(Type.NUMBER, text.substring(start, pos), start, pos));
            } else if (c == '"' || c == '\'') {
                pos = skipString(text, pos + 1, c);
                tokens.add(new Token(Type.STRING, text.substring(start, pos), start, pos));
            } else if (text.startsWith("..", pos)) {
                pos += text.startsWith("...", pos) ? 3 : 2;
                tokens.add(new Token(Type.OPERATOR, text.substring(start, pos), start, pos));
            } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                pos++;
                if (pos < n && text.charAt(pos) == '=' && "=~<>".indexOf(c) >= 0) pos++;
                tokens.add(new Token(Type.OPERATOR, text.substring(start, pos), start, pos));
            } else if (BRACKET_CHARS.indexOf(c) >= 0) {
                pos++;
                tokens.add(new Token(Type.BRACKET, text.substring(start, pos), start, pos));
            } else if (PUNCTUATION_CHARS.indexOf(c) >= 0) {
                pos++;
                tokens.add(new Token(Type.PUNCTUATION, text.substring(start, pos), start, pos));
            } else {
                pos++;
            }
        }
        return tokens;
    }

    private static int skipComment(String text, int pos) {
        if (text.startsWith("[[", pos)) {
            int close = text.indexOf("]]", pos + 2);
            return close < 0 ? text.length() : close + 2;
        }
        int eol = text.indexOf('\n', pos);
        return eol < 0 ? text.length() : eol + 1;
    }

    private static int skipString(String text, int pos, char quote) {
        int n = text.length();
        while (pos < n) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < n) {
                pos += 2;
            } else if (c == quote) {
                return pos + 1;
            } else if (c == '\n') {
                return pos;
            } else {
                pos++;
            }
        }
        return pos;
    }
}
