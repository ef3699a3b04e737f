package io.github.eutro.scriptlift.core.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The result of liveness analysis over a {@link ControlFlowGraph}.
 * <p>
 * All per-block data is indexed by block id. Slot sets iterate in ascending order.
 */
public final class DataFlowInfo {
    private final ControlFlowGraph graph;
    private final List<BlockData> blocks;
    private final int iterations;
    private final boolean converged;

    public DataFlowInfo(ControlFlowGraph graph, List<BlockData> blocks, int iterations, boolean converged) {
        this.graph = graph;
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        this.iterations = iterations;
        this.converged = converged;
    }

    public static DataFlowInfo empty(ControlFlowGraph graph) {
        return new DataFlowInfo(graph, Collections.emptyList(), 0, true);
    }

    /**
     * Get the graph the analysis ran over.
     *
     * @return The graph.
     */
    public ControlFlowGraph getGraph() {
        return graph;
    }

    public List<BlockData> getBlocks() {
        return blocks;
    }

    public BlockData getBlock(int id) {
        return blocks.get(id);
    }

    /**
     * Get the number of rounds over all blocks that were run.
     *
     * @return The iteration count.
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * Get whether a fixed point was reached before the iteration cap.
     * If not, the live sets are a best-effort under-approximation.
     *
     * @return Whether the analysis converged.
     */
    public boolean isConverged() {
        return converged;
    }

    public Set<Integer> getLiveIn(int id) {
        return blocks.get(id).liveIn;
    }

    public Set<Integer> getLiveOut(int id) {
        return blocks.get(id).liveOut;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (BlockData data : blocks) {
            if (sb.length() != 0) sb.append('\n');
            sb.append(data);
        }
        return sb.toString();
    }

    /**
     * Def/use and liveness data for a single block.
     */
    public static final class BlockData {
        private final int blockId;
        private final List<Integer> definitions;
        private final List<Integer> uses;
        private final Set<Integer> def;
        private final Set<Integer> use;
        private final Set<Integer> liveIn;
        private final Set<Integer> liveOut;

        /**
         * Construct block data.
         *
         * @param blockId     The id of the block.
         * @param definitions Every slot written, in instruction order.
         * @param uses        Every slot read, in instruction order.
         * @param def         The slots written in the block.
         * @param use         The slots read in the block before any write to them in the block.
         * @param liveIn      The slots live on entry.
         * @param liveOut     The slots live on exit.
         */
        public BlockData(int blockId,
                         List<Integer> definitions,
                         List<Integer> uses,
                         Set<Integer> def,
                         Set<Integer> use,
                         Set<Integer> liveIn,
                         Set<Integer> liveOut) {
            this.blockId = blockId;
            this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
            this.uses = Collections.unmodifiableList(new ArrayList<>(uses));
            this.def = frozen(def);
            this.use = frozen(use);
            this.liveIn = frozen(liveIn);
            this.liveOut = frozen(liveOut);
        }

        private static Set<Integer> frozen(Set<Integer> set) {
            return Collections.unmodifiableSet(new TreeSet<>(set));
        }

        public int getBlockId() {
            return blockId;
        }

        public List<Integer> getDefinitions() {
            return definitions;
        }

        public List<Integer> getUses() {
            return uses;
        }

        public Set<Integer> getDef() {
            return def;
        }

        public Set<Integer> getUse() {
            return use;
        }

        public Set<Integer> getLiveIn() {
            return liveIn;
        }

        public Set<Integer> getLiveOut() {
            return liveOut;
        }

        @Override
        public String toString() {
            return "B" + blockId + " def=" + def + " use=" + use + " in=" + liveIn + " out=" + liveOut;
        }
    }
}
