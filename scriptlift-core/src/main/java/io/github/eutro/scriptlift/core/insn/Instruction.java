package io.github.eutro.scriptlift.core.insn;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single symbolic instruction in a recovered trace.
 * <p>
 * Instructions are immutable. The operands are plain integers whose meaning depends on the
 * consumer: the first operand of a {@link Opcode#isJump() jump} is a signed offset
 * in instructions, and {@link io.github.eutro.scriptlift.core.passes.meta.ComputeLiveVars liveness}
 * reads the first operand as a written slot and the rest as read slots.
 * <p>
 * The metadata map records provenance, see {@link InsnMetadata} for the well-known keys.
 */
public final class Instruction {
    /**
     * The distance between the addresses of two consecutive instructions.
     */
    public static final int STRIDE = 4;
    /**
     * The number of operands synthesized instructions carry.
     */
    public static final int ARITY = 3;

    private final Opcode opcode;
    private final int[] operands;
    private final int address;
    private final int size;
    private final Map<String, Object> metadata;

    /**
     * Construct an instruction.
     *
     * @param opcode   The opcode.
     * @param operands The operands, copied.
     * @param address  The address.
     * @param size     The size of the instruction, in address units.
     * @param metadata The metadata, copied.
     */
    public Instruction(@NotNull Opcode opcode,
                       int[] operands,
                       int address,
                       int size,
                       Map<String, ?> metadata) {
        this.opcode = Objects.requireNonNull(opcode, "opcode");
        this.operands = operands.clone();
        this.address = address;
        this.size = size;
        this.metadata = metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Construct an instruction of the standard {@link #STRIDE size} without metadata.
     *
     * @param opcode   The opcode.
     * @param address  The address.
     * @param operands The operands.
     * @return The instruction.
     */
    public static Instruction of(Opcode opcode, int address, int... operands) {
        return new Instruction(opcode, operands, address, STRIDE, Collections.emptyMap());
    }

    /**
     * Pad or truncate operands to the fixed {@link #ARITY}, filling with zeros.
     *
     * @param operands The operands found, possibly fewer than the arity.
     * @return A new array of exactly {@link #ARITY} operands.
     */
    public static int[] fixedArity(int... operands) {
        return Arrays.copyOf(operands, ARITY);
    }

    public Opcode getOpcode() {
        return opcode;
    }

    /**
     * Get the number of operands.
     *
     * @return The operand count.
     */
    public int getOperandCount() {
        return operands.length;
    }

    /**
     * Get an operand.
     *
     * @param index The index of the operand.
     * @return The operand.
     * @throws IndexOutOfBoundsException if there is no such operand.
     */
    public int getOperand(int index) {
        return operands[index];
    }

    /**
     * Get an operand, or a default if this instruction has too few.
     *
     * @param index The index of the operand.
     * @param dflt  The default.
     * @return The operand, or the default.
     */
    public int getOperandOr(int index, int dflt) {
        return index < operands.length ? operands[index] : dflt;
    }

    /**
     * Get a copy of the operands.
     *
     * @return The operands.
     */
    public int[] getOperands() {
        return operands.clone();
    }

    public int getAddress() {
        return address;
    }

    public int getSize() {
        return size;
    }

    /**
     * Get the metadata of this instruction.
     *
     * @return An unmodifiable view of the metadata.
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Get a single metadata value.
     *
     * @param key The key.
     * @return The value, or null if absent.
     */
    @Nullable
    public Object getMeta(String key) {
        return metadata.get(key);
    }

    /**
     * Get a copy of this instruction at a different address.
     *
     * @param newAddress The address.
     * @return The relocated instruction, or this if the address is unchanged.
     */
    public Instruction withAddress(int newAddress) {
        if (newAddress == address) return this;
        return new Instruction(opcode, operands, newAddress, size, metadata);
    }

    /**
     * Get a copy of this instruction with an extra metadata entry.
     *
     * @param key   The key.
     * @param value The value.
     * @return The new instruction.
     */
    public Instruction withMeta(String key, Object value) {
        Map<String, Object> newMeta = new LinkedHashMap<>(metadata);
        newMeta.put(key, value);
        return new Instruction(opcode, operands, address, size, newMeta);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction that = (Instruction) o;
        return address == that.address
                && size == that.size
                && opcode == that.opcode
                && Arrays.equals(operands, that.operands)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(opcode, address, size, metadata);
        result = 31 * result + Arrays.hashCode(operands);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%04x: ", address)).append(opcode.getMnemonic());
        for (int i = 0; i < operands.length; i++) {
            sb.append(i == 0 ? " " : ", ").append(operands[i]);
        }
        return sb.toString();
    }
}
