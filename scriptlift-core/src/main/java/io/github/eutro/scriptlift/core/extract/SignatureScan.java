package io.github.eutro.scriptlift.core.extract;

import io.github.eutro.scriptlift.core.insn.InsnMetadata;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.insn.Opcode;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads disassembly-like listings embedded in the text.
 * <p>
 * Every whole-word mnemonic becomes an instruction whose operands are the integers after it on the same line.
 * The listing is only trusted if it contains one of the known {@link #SIGNATURES signature fragments}.
 */
public class SignatureScan implements ExtractionStrategy {
    public static final SignatureScan INSTANCE = new SignatureScan();

    /**
     * Adjacent opcode pairs that real code frequently contains.
     */
    public static final List<Opcode[]> SIGNATURES = Collections.unmodifiableList(Arrays.asList(
            new Opcode[]{Opcode.LOADK, Opcode.CALL},
            new Opcode[]{Opcode.GETGLOBAL, Opcode.CALL},
            new Opcode[]{Opcode.GETIMPORT, Opcode.CALL},
            new Opcode[]{Opcode.NAMECALL, Opcode.CALL},
            new Opcode[]{Opcode.MOVE, Opcode.RETURN},
            new Opcode[]{Opcode.LOADN, Opcode.RETURN}
    ));

    private static final Pattern WORD = Pattern.compile("\\b[A-Z][A-Z0-9_]*\\b");
    private static final Pattern INTEGER = Pattern.compile("(?<![\\w.])-?\\d+\\b");

    @Override
    public Kind getKind() {
        return Kind.SIGNATURE_SCAN;
    }

    @Override
    public List<Instruction> extract(ScriptObject script, @Nullable String text) {
        if (text == null) return Collections.emptyList();

        List<Instruction> insns = new ArrayList<>();
        int lineStart = 0;
        for (String line : text.split("\n", -1)) {
            scanLine(line, lineStart, insns);
            lineStart += line.length() + 1;
        }
        String signature = findSignature(insns);
        if (signature == null) return Collections.emptyList();

        List<Instruction> tagged = new ArrayList<>(insns.size());
        for (Instruction insn : insns) {
            tagged.add(insn.withMeta(InsnMetadata.PATTERN, signature));
        }
        return tagged;
    }

    private static void scanLine(String line, int lineStart, List<Instruction> out) {
        List<int[]> mnemonics = new ArrayList<>();
        List<Opcode> opcodes = new ArrayList<>();
        Matcher m = WORD.matcher(line);
        while (m.find()) {
            Opcode op = Opcode.byMnemonic(m.group());
            if (op != null) {
                mnemonics.add(new int[]{m.start(), m.end()});
                opcodes.add(op);
            }
        }
        for (int i = 0; i < opcodes.size(); i++) {
            int from = mnemonics.get(i)[1];
            int to = i + 1 < mnemonics.size() ? mnemonics.get(i + 1)[0] : line.length();
            List<Integer> found = new ArrayList<>();
            Matcher ints = INTEGER.matcher(line.substring(from, to));
            while (ints.find()) {
                found.add(parseSigned(ints.group()));
            }
            int[] operands = new int[Math.max(Instruction.ARITY, found.size())];
            for (int j = 0; j < found.size(); j++) {
                operands[j] = found.get(j);
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put(InsnMetadata.SOURCE_START, lineStart + mnemonics.get(i)[0]);
            meta.put(InsnMetadata.SOURCE_END, lineStart + to);
            out.add(new Instruction(opcodes.get(i), operands, out.size() * Instruction.STRIDE, Instruction.STRIDE, meta));
        }
    }

    private static int parseSigned(String s) {
        boolean negative = s.startsWith("-");
        int magnitude = PatternTagging.parseClamped(negative ? s.substring(1) : s);
        return negative ? -magnitude : magnitude;
    }

    @Nullable
    private static String findSignature(List<Instruction> insns) {
        for (int i = 0; i + 1 < insns.size(); i++) {
            Opcode first = insns.get(i).getOpcode();
            Opcode second = insns.get(i + 1).getOpcode();
            for (Opcode[] signature : SIGNATURES) {
                if (signature[0] == first && signature[1] == second) {
                    return first.getMnemonic() + " " + second.getMnemonic();
                }
            }
        }
        return null;
    }
}
