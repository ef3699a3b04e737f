package io.github.eutro.scriptlift.core.insn;

import org.jetbrains.annotations.Contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Static utilities for instruction sequences.
 * <p>
 * Addressing is index based: the instruction at index {@code i} of a normalized sequence
 * lives at address {@code i * STRIDE}, and a jump at index {@code i} whose first operand
 * is {@code k} targets index {@code i + k}.
 */
public class Instructions {
    /**
     * Marker for a jump target that is not resolvable.
     */
    public static final int NO_TARGET = -1;

    /**
     * Re-assign addresses to a sequence, gap-free from zero, and stamp each instruction
     * with a metadata entry.
     *
     * @param insns The instructions.
     * @param key   The metadata key to stamp, or null to stamp nothing.
     * @param value The metadata value.
     * @return The normalized, unmodifiable sequence.
     */
    @Contract(pure = true)
    public static List<Instruction> normalize(List<Instruction> insns, String key, Object value) {
        List<Instruction> out = new ArrayList<>(insns.size());
        for (int i = 0; i < insns.size(); i++) {
            Instruction insn = insns.get(i).withAddress(i * Instruction.STRIDE);
            if (key != null && !value.equals(insn.getMeta(key))) {
                insn = insn.withMeta(key, value);
            }
            out.add(insn);
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Resolve the index a jump targets.
     *
     * @param insns The sequence the jump is in.
     * @param index The index of the jump in the sequence.
     * @return The target index, or {@link #NO_TARGET} if the instruction is not a jump
     * or the target lies outside the sequence.
     */
    public static int jumpTarget(List<Instruction> insns, int index) {
        Instruction insn = insns.get(index);
        if (!insn.getOpcode().isJump()) return NO_TARGET;
        long target = (long) index + insn.getOperandOr(0, 0);
        if (target < 0 || target >= insns.size()) return NO_TARGET;
        return (int) target;
    }

    /**
     * Compute the address a jump would target, whether or not it is in range.
     *
     * @param index The index of the jump.
     * @param insn  The jump.
     * @return The address.
     */
    public static long rawTargetAddress(int index, Instruction insn) {
        return ((long) index + insn.getOperandOr(0, 0)) * Instruction.STRIDE;
    }

    /**
     * Disassemble a sequence, one instruction per line.
     *
     * @param insns The instructions.
     * @return The disassembly.
     */
    public static String disassemble(List<Instruction> insns) {
        StringBuilder sb = new StringBuilder();
        for (Instruction insn : insns) {
            if (sb.length() != 0) sb.append('\n');
            sb.append(insn);
        }
        return sb.toString();
    }
}
