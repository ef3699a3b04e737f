package io.github.eutro.scriptlift.core.extract;

import io.github.eutro.scriptlift.core.insn.InsnMetadata;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.insn.Opcode;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags recognizable constructs of readable source with the opcode they most likely compile to.
 * <p>
 * Matches of all tags are ordered by position, ties going to the tag listed first.
 * A match that starts inside an accepted one is dropped, so that e.g. the {@code if} in
 * {@code print("if")} is not tagged.
 */
public class PatternTagging implements ExtractionStrategy {
    public static final PatternTagging INSTANCE = new PatternTagging();

    private static final String NOT_KEYWORD =
            "(?!(?:and|break|do|else|elseif|end|for|function|if|in|local|not|or|repeat|return|then|until|while)\\b)";
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\b");

    private static final List<Tag> TAGS = Collections.unmodifiableList(Arrays.asList(
            new Tag(Opcode.NEWCLOSURE, "\\bfunction\\b\\s*[\\w.:]*\\s*\\("),
            new Tag(Opcode.MOVE, "\\blocal\\s+(?!function\\b)[A-Za-z_]\\w*"),
            new Tag(Opcode.RETURN, "\\breturn\\b"),
            new Tag(Opcode.JUMPIF, "\\bif\\b"),
            new Tag(Opcode.JUMPBACK, "\\bwhile\\b"),
            new Tag(Opcode.FORNPREP, "\\bfor\\b"),
            new Tag(Opcode.NAMECALL, "[.:][A-Za-z_]\\w*\\s*\\("),
            new Tag(Opcode.CALL, "\\b" + NOT_KEYWORD + "[A-Za-z_]\\w*\\s*\\("),
            new Tag(Opcode.LOADK, "\"[^\"\\\\\\n]*+(?:\\\\.[^\"\\\\\\n]*+)*+\"|'[^'\\\\\\n]*+(?:\\\\.[^'\\\\\\n]*+)*+'")
    ));

    @Override
    public Kind getKind() {
        return Kind.PATTERN_TAGGING;
    }

    @Override
    public List<Instruction> extract(ScriptObject script, @Nullable String text) {
        if (text == null || text.isEmpty()) return Collections.emptyList();

        List<Match> matches = new ArrayList<>();
        for (int priority = 0; priority < TAGS.size(); priority++) {
            Tag tag = TAGS.get(priority);
            Matcher m = tag.pattern.matcher(text);
            while (m.find()) {
                matches.add(new Match(tag, priority, m.start(), m.end()));
            }
        }
        matches.sort(Comparator.<Match>comparingInt(it -> it.start).thenComparingInt(it -> it.priority));

        List<Instruction> insns = new ArrayList<>();
        int acceptedEnd = 0;
        for (Match match : matches) {
            if (match.start < acceptedEnd) continue;
            acceptedEnd = match.end;
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put(InsnMetadata.SOURCE_START, match.start);
            meta.put(InsnMetadata.SOURCE_END, match.end);
            meta.put(InsnMetadata.PATTERN, match.tag.pattern.pattern());
            insns.add(new Instruction(match.tag.opcode,
                    numbersIn(text.substring(match.start, match.end)),
                    insns.size() * Instruction.STRIDE,
                    Instruction.STRIDE,
                    meta));
        }
        return insns;
    }

    private static int[] numbersIn(String matched) {
        int[] operands = new int[Instruction.ARITY];
        Matcher m = NUMBER.matcher(matched);
        for (int i = 0; i < operands.length && m.find(); i++) {
            operands[i] = parseClamped(m.group());
        }
        return operands;
    }

    /**
     * Parse a run of decimal digits, saturating at {@link Integer#MAX_VALUE}.
     *
     * @param digits The digits.
     * @return The value.
     */
    static int parseClamped(String digits) {
        String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
        if (trimmed.length() > 10) return Integer.MAX_VALUE;
        long value = Long.parseLong(trimmed);
        return (int) Math.min(Integer.MAX_VALUE, value);
    }

    private static final class Tag {
        final Opcode opcode;
        final Pattern pattern;

        Tag(Opcode opcode, String regex) {
            this.opcode = opcode;
            this.pattern = Pattern.compile(regex);
        }
    }

    private static final class Match {
        final Tag tag;
        final int priority;
        final int start;
        final int end;

        Match(Tag tag, int priority, int start, int end) {
            this.tag = tag;
            this.priority = priority;
            this.start = start;
            this.end = end;
        }
    }
}
