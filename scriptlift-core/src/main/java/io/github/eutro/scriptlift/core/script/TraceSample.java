package io.github.eutro.scriptlift.core.script;

import io.github.eutro.scriptlift.core.insn.Opcode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single instruction observed by a {@link ReflectionHost}.
 */
public final class TraceSample {
    private final Opcode opcode;
    private final int[] operands;
    private final Map<String, Object> detail;

    /**
     * Construct a trace sample.
     *
     * @param opcode   The opcode observed.
     * @param operands The operands, copied.
     * @param detail   Extra information about where the sample came from, e.g. a line number.
     */
    public TraceSample(Opcode opcode, int[] operands, Map<String, ?> detail) {
        this.opcode = Objects.requireNonNull(opcode, "opcode");
        this.operands = operands.clone();
        this.detail = Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public int[] getOperands() {
        return operands.clone();
    }

    public Map<String, Object> getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(opcode.getMnemonic());
        for (int i = 0; i < operands.length; i++) {
            sb.append(i == 0 ? " " : ", ").append(operands[i]);
        }
        if (!detail.isEmpty()) sb.append(' ').append(detail);
        return sb.toString();
    }
}
