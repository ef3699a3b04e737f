package io.github.eutro.scriptlift.core.cfg;

import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.util.GraphWalker;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A control flow graph over an instruction sequence.
 * <p>
 * Every instruction of the sequence belongs to exactly one block, blocks are contiguous and
 * do not overlap, and block {@code i} covers the instructions directly before those of block {@code i + 1}.
 * The entry block is block 0, the one containing address 0. A graph over an empty sequence has no blocks,
 * and no entry.
 */
public final class ControlFlowGraph {
    private final List<Instruction> instructions;
    private final List<BasicBlock> blocks;
    private final int[] blockOfIndex;

    /**
     * Construct a graph from its blocks.
     *
     * @param instructions The whole instruction sequence.
     * @param blocks       The blocks, in address order, which must partition the sequence.
     * @throws IllegalArgumentException if the blocks do not partition the sequence.
     */
    public ControlFlowGraph(List<Instruction> instructions, List<BasicBlock> blocks) {
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        blockOfIndex = new int[instructions.size()];
        int next = 0;
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            if (block.getId() != i || block.getFirstIndex() != next) {
                throw new IllegalArgumentException("block " + block.getId() + " does not continue at index " + next);
            }
            for (int j = block.getFirstIndex(); j <= block.getLastIndex(); j++) {
                blockOfIndex[j] = i;
            }
            next = block.getLastIndex() + 1;
        }
        if (next != instructions.size()) {
            throw new IllegalArgumentException("blocks cover " + next + " of " + instructions.size() + " instructions");
        }
    }

    /**
     * Get an empty graph, with no blocks.
     *
     * @return The graph.
     */
    public static ControlFlowGraph empty() {
        return new ControlFlowGraph(Collections.emptyList(), Collections.emptyList());
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public BasicBlock getBlock(int id) {
        return blocks.get(id);
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    /**
     * Get the entry block, the block containing address 0.
     *
     * @return The entry block, or null if the graph is empty.
     */
    @Nullable
    public BasicBlock getEntry() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /**
     * Get the blocks with no successors.
     *
     * @return The exit blocks, in address order.
     */
    public List<BasicBlock> getExits() {
        List<BasicBlock> exits = new ArrayList<>();
        for (BasicBlock block : blocks) {
            if (block.isExit()) exits.add(block);
        }
        return exits;
    }

    /**
     * Get the block containing the instruction at an index.
     *
     * @param index The index of the instruction.
     * @return The block, or null if the index is out of range.
     */
    @Nullable
    public BasicBlock blockOfIndex(int index) {
        if (index < 0 || index >= blockOfIndex.length) return null;
        return blocks.get(blockOfIndex[index]);
    }

    /**
     * Get the block containing an address.
     *
     * @param address The address.
     * @return The block, or null if no instruction is at that address.
     */
    @Nullable
    public BasicBlock blockAt(long address) {
        if (address < 0 || address % Instruction.STRIDE != 0) return null;
        long index = address / Instruction.STRIDE;
        return index > Integer.MAX_VALUE ? null : blockOfIndex((int) index);
    }

    /**
     * Get the block that starts at an address.
     *
     * @param address The address.
     * @return The block, or null if no block starts there.
     */
    @Nullable
    public BasicBlock blockStartingAt(long address) {
        BasicBlock block = blockAt(address);
        return block != null && block.getStartAddress() == address ? block : null;
    }

    /**
     * Get the blocks reachable from the entry, in depth-first pre-order.
     *
     * @return The reachable blocks.
     */
    public Set<BasicBlock> getReachable() {
        BasicBlock entry = getEntry();
        if (entry == null) return Collections.emptySet();
        Set<BasicBlock> reachable = new LinkedHashSet<>();
        for (BasicBlock block : GraphWalker.blockWalker(this).preOrder()) {
            reachable.add(block);
        }
        return reachable;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("cfg {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
