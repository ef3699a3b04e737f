package io.github.eutro.scriptlift.core.passes.meta;

import io.github.eutro.scriptlift.core.cfg.BasicBlock;
import io.github.eutro.scriptlift.core.cfg.ControlFlowGraph;
import io.github.eutro.scriptlift.core.cfg.DataFlowInfo;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.passes.AnalysisPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the {@link DataFlowInfo live slots} of each block of a graph.
 * <p>
 * The first operand of every instruction is taken as the slot it writes, and the remaining operands
 * as the slots it reads, whatever the opcode. Rounds over all blocks, last block first, are repeated until
 * no live-out set changes, or until the iteration cap is reached, in which case the result is
 * marked as not {@link DataFlowInfo#isConverged() converged}.
 */
public class ComputeLiveVars implements AnalysisPass<ControlFlowGraph, DataFlowInfo> {
    private static final Logger logger = LoggerFactory.getLogger(ComputeLiveVars.class);

    /**
     * The default iteration cap.
     */
    public static final int DEFAULT_ITERATION_CAP = 100;

    /**
     * An instance of this pass with the default iteration cap.
     */
    public static final ComputeLiveVars INSTANCE = new ComputeLiveVars(DEFAULT_ITERATION_CAP);

    private final int iterationCap;

    /**
     * Construct the pass with an iteration cap.
     *
     * @param iterationCap The maximum number of rounds over all blocks, at least 1.
     */
    public ComputeLiveVars(int iterationCap) {
        if (iterationCap < 1) throw new IllegalArgumentException("iteration cap must be positive: " + iterationCap);
        this.iterationCap = iterationCap;
    }

    public int getIterationCap() {
        return iterationCap;
    }

    @Override
    public DataFlowInfo run(ControlFlowGraph cfg) {
        List<BasicBlock> blocks = cfg.getBlocks();
        int n = blocks.size();
        if (n == 0) return DataFlowInfo.empty(cfg);

        List<List<Integer>> definitions = new ArrayList<>(n);
        List<List<Integer>> uses = new ArrayList<>(n);
        List<Set<Integer>> def = new ArrayList<>(n);
        List<Set<Integer>> use = new ArrayList<>(n);
        List<Set<Integer>> liveIn = new ArrayList<>(n);
        List<Set<Integer>> liveOut = new ArrayList<>(n);

        for (BasicBlock block : blocks) {
            List<Integer> blockDefs = new ArrayList<>();
            List<Integer> blockUses = new ArrayList<>();
            Set<Integer> assigned = new HashSet<>();
            Set<Integer> used = new HashSet<>();
            for (Instruction insn : block.getInstructions()) {
                for (int i = 1; i < insn.getOperandCount(); i++) {
                    int arg = insn.getOperand(i);
                    blockUses.add(arg);
                    if (!assigned.contains(arg)) used.add(arg);
                }
                if (insn.getOperandCount() > 0) {
                    blockDefs.add(insn.getOperand(0));
                    assigned.add(insn.getOperand(0));
                }
            }
            definitions.add(blockDefs);
            uses.add(blockUses);
            def.add(assigned);
            use.add(used);
            liveIn.add(new HashSet<>(used));
            liveOut.add(new HashSet<>());
        }

        int iterations = 0;
        boolean converged = false;
        while (iterations < iterationCap) {
            iterations++;
            boolean changed = false;
            for (int b = n - 1; b >= 0; b--) {
                Set<Integer> out = new HashSet<>();
                for (int succ : blocks.get(b).getSuccessors()) {
                    out.addAll(liveIn.get(succ));
                }
                if (!out.equals(liveOut.get(b))) {
                    changed = true;
                    liveOut.set(b, out);
                    Set<Integer> in = new HashSet<>(use.get(b));
                    for (Integer slot : out) {
                        if (!def.get(b).contains(slot)) in.add(slot);
                    }
                    liveIn.set(b, in);
                }
            }
            if (!changed) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            logger.warn("Liveness did not converge within {} iterations over {} blocks; live sets are incomplete",
                    iterationCap, n);
        } else {
            logger.debug("Liveness converged after {} iterations over {} blocks", iterations, n);
        }

        List<DataFlowInfo.BlockData> data = new ArrayList<>(n);
        for (int b = 0; b < n; b++) {
            data.add(new DataFlowInfo.BlockData(b,
                    definitions.get(b),
                    uses.get(b),
                    def.get(b),
                    use.get(b),
                    liveIn.get(b),
                    liveOut.get(b)));
        }
        return new DataFlowInfo(cfg, data, iterations, converged);
    }
}
