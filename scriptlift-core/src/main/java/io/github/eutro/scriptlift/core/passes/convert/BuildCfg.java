package io.github.eutro.scriptlift.core.passes.convert;

import io.github.eutro.scriptlift.core.cfg.BasicBlock;
import io.github.eutro.scriptlift.core.cfg.ControlFlowGraph;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.insn.Instructions;
import io.github.eutro.scriptlift.core.passes.AnalysisPass;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Partitions an instruction sequence into basic blocks, and links them.
 * <p>
 * Leaders are the first instruction, every resolvable jump target, and the instruction after every jump.
 * A block ending in a jump gets an edge to the block at the target, and unless it cannot fall through,
 * an edge to the next block. Jumps out of the sequence get neither a leader nor an edge.
 */
public class BuildCfg implements AnalysisPass<List<Instruction>, ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final BuildCfg INSTANCE = new BuildCfg();

    @Override
    public ControlFlowGraph run(List<Instruction> insns) {
        int n = insns.size();
        if (n == 0) return ControlFlowGraph.empty();

        BitSet leaders = new BitSet(n);
        leaders.set(0);
        for (int i = 0; i < n; i++) {
            if (!insns.get(i).getOpcode().isJump()) continue;
            int target = Instructions.jumpTarget(insns, i);
            if (target != Instructions.NO_TARGET) leaders.set(target);
            if (i + 1 < n) leaders.set(i + 1);
        }

        int blockCount = leaders.cardinality();
        int[] starts = new int[blockCount];
        int[] blockOf = new int[n];
        for (int b = 0, i = leaders.nextSetBit(0); i >= 0; i = leaders.nextSetBit(i + 1), b++) {
            starts[b] = i;
        }
        for (int b = 0; b < blockCount; b++) {
            int end = b + 1 < blockCount ? starts[b + 1] : n;
            for (int i = starts[b]; i < end; i++) {
                blockOf[i] = b;
            }
        }

        List<List<Integer>> succs = new ArrayList<>(blockCount);
        List<List<Integer>> preds = new ArrayList<>(blockCount);
        for (int b = 0; b < blockCount; b++) {
            succs.add(new ArrayList<>());
            preds.add(new ArrayList<>());
        }
        for (int b = 0; b < blockCount; b++) {
            int last = b + 1 < blockCount ? starts[b + 1] - 1 : n - 1;
            Instruction lastInsn = insns.get(last);
            List<Integer> out = succs.get(b);
            if (lastInsn.getOpcode().isJump()) {
                int target = Instructions.jumpTarget(insns, last);
                if (target != Instructions.NO_TARGET) out.add(blockOf[target]);
            }
            if (!lastInsn.getOpcode().isUnconditional() && b + 1 < blockCount) {
                if (!out.contains(b + 1)) out.add(b + 1);
            }
            for (int succ : out) {
                preds.get(succ).add(b);
            }
        }

        List<BasicBlock> blocks = new ArrayList<>(blockCount);
        for (int b = 0; b < blockCount; b++) {
            int end = b + 1 < blockCount ? starts[b + 1] : n;
            blocks.add(new BasicBlock(b, starts[b], insns.subList(starts[b], end), preds.get(b), succs.get(b)));
        }
        return new ControlFlowGraph(insns, blocks);
    }
}
