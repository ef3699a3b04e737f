package io.github.eutro.scriptlift.core.extract;

import io.github.eutro.scriptlift.core.insn.InsnMetadata;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.insn.Opcode;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthesizes one instruction per construct token of the text.
 * <p>
 * Brackets and punctuation only delimit. Every other token becomes an instruction, {@link Opcode#NOP}
 * if nothing better fits, so that the sequence keeps the shape of the text.
 */
public class TokenSynthesis implements ExtractionStrategy {
    public static final TokenSynthesis INSTANCE = new TokenSynthesis();

    private static final Map<String, Opcode> KEYWORDS = new HashMap<>();
    private static final Map<String, Opcode> OPERATORS = new HashMap<>();

    static {
        KEYWORDS.put("function", Opcode.NEWCLOSURE);
        KEYWORDS.put("return", Opcode.RETURN);
        KEYWORDS.put("if", Opcode.JUMPIF);
        KEYWORDS.put("while", Opcode.JUMPBACK);
        KEYWORDS.put("for", Opcode.FORNPREP);
        KEYWORDS.put("local", Opcode.MOVE);
        KEYWORDS.put("and", Opcode.AND);
        KEYWORDS.put("or", Opcode.OR);
        KEYWORDS.put("not", Opcode.NOT);

        OPERATORS.put("+", Opcode.ADD);
        OPERATORS.put("-", Opcode.SUB);
        OPERATORS.put("*", Opcode.MUL);
        OPERATORS.put("/", Opcode.DIV);
        OPERATORS.put("%", Opcode.MOD);
        OPERATORS.put("^", Opcode.POW);
        OPERATORS.put("..", Opcode.CONCAT);
        OPERATORS.put("#", Opcode.LENGTH);
    }

    @Override
    public Kind getKind() {
        return Kind.TOKEN_SYNTHESIS;
    }

    @Override
    public List<Instruction> extract(ScriptObject script, @Nullable String text) {
        if (text == null) return Collections.emptyList();
        List<Tokenizer.Token> tokens = Tokenizer.tokenize(text);
        List<Instruction> insns = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Tokenizer.Token token = tokens.get(i);
            if (token.type == Tokenizer.Type.BRACKET || token.type == Tokenizer.Type.PUNCTUATION) continue;

            Opcode opcode;
            int[] operands = new int[Instruction.ARITY];
            switch (token.type) {
                case WORD:
                    opcode = KEYWORDS.get(token.text);
                    if (opcode == null) {
                        boolean called = i + 1 < tokens.size() && tokens.get(i + 1).text.equals("(");
                        opcode = called ? Opcode.CALL : Opcode.NOP;
                    }
                    break;
                case NUMBER:
                    opcode = Opcode.LOADN;
                    int dot = token.text.indexOf('.');
                    operands[1] = PatternTagging.parseClamped(dot < 0 ? token.text : token.text.substring(0, dot));
                    break;
                case STRING:
                    opcode = Opcode.LOADK;
                    break;
                default:
                    opcode = OPERATORS.getOrDefault(token.text, Opcode.NOP);
                    break;
            }

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put(InsnMetadata.TOKEN, token.text);
            meta.put(InsnMetadata.SOURCE_START, token.start);
            meta.put(InsnMetadata.SOURCE_END, token.end);
            meta.put(InsnMetadata.SYNTHETIC, true);
            insns.add(new Instruction(opcode, operands, insns.size() * Instruction.STRIDE, Instruction.STRIDE, meta));
        }
        return insns;
    }
}
