package io.github.eutro.scriptlift.core.cfg;

import io.github.eutro.scriptlift.core.insn.Instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block: a maximal straight-line run of instructions with one entry and one exit.
 * <p>
 * Blocks are owned by the {@link ControlFlowGraph} that contains them. Edges to other blocks are
 * stored as block ids, which are indices into {@link ControlFlowGraph#getBlocks()}.
 */
public final class BasicBlock {
    private final int id;
    private final int firstIndex;
    private final List<Instruction> instructions;
    private final List<Integer> predecessors;
    private final List<Integer> successors;

    /**
     * Construct a basic block.
     *
     * @param id           The id of the block, its index in the graph.
     * @param firstIndex   The index, in the whole sequence, of the first instruction of the block.
     * @param instructions The instructions of the block, must be non-empty.
     * @param predecessors The ids of the predecessor blocks.
     * @param successors   The ids of the successor blocks.
     */
    public BasicBlock(int id,
                      int firstIndex,
                      List<Instruction> instructions,
                      List<Integer> predecessors,
                      List<Integer> successors) {
        if (instructions.isEmpty()) {
            throw new IllegalArgumentException("empty basic block " + id);
        }
        this.id = id;
        this.firstIndex = firstIndex;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.predecessors = Collections.unmodifiableList(new ArrayList<>(predecessors));
        this.successors = Collections.unmodifiableList(new ArrayList<>(successors));
    }

    public int getId() {
        return id;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    /**
     * Get the index of the first instruction of this block in the whole sequence.
     *
     * @return The index.
     */
    public int getFirstIndex() {
        return firstIndex;
    }

    /**
     * Get the index of the last instruction of this block in the whole sequence.
     *
     * @return The index.
     */
    public int getLastIndex() {
        return firstIndex + instructions.size() - 1;
    }

    public int getStartAddress() {
        return instructions.get(0).getAddress();
    }

    /**
     * Get the address of the last instruction of this block (inclusive).
     *
     * @return The address.
     */
    public int getEndAddress() {
        return getLast().getAddress();
    }

    /**
     * Get the last instruction of this block, the one which decides where control goes next.
     *
     * @return The instruction.
     */
    public Instruction getLast() {
        return instructions.get(instructions.size() - 1);
    }

    public List<Integer> getPredecessors() {
        return predecessors;
    }

    public List<Integer> getSuccessors() {
        return successors;
    }

    /**
     * Get whether this block has no successors.
     *
     * @return Whether control leaves the graph from this block.
     */
    public boolean isExit() {
        return successors.isEmpty();
    }

    /**
     * Format this block as a jump target, for debugging.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        return "B" + id;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString())
                .append(String.format(" [%04x-%04x]", getStartAddress(), getEndAddress()))
                .append(" preds=").append(predecessors)
                .append(" succs=").append(successors)
                .append("\n{\n");
        for (Instruction insn : instructions) {
            sb.append(' ').append(insn).append('\n');
        }
        sb.append('}');
        return sb.toString();
    }
}
