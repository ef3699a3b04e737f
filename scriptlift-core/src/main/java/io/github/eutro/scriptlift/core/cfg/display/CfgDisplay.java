package io.github.eutro.scriptlift.core.cfg.display;

import io.github.eutro.scriptlift.core.cfg.BasicBlock;
import io.github.eutro.scriptlift.core.cfg.ControlFlowGraph;
import io.github.eutro.scriptlift.core.cfg.DataFlowInfo;
import io.github.eutro.scriptlift.core.insn.Instruction;

/**
 * Text renderings of a {@link ControlFlowGraph}, for the command line and for debugging.
 */
public final class CfgDisplay {
    private CfgDisplay() {
    }

    /**
     * List the blocks of a graph with their instructions and edges.
     *
     * @param cfg The graph.
     * @return The listing.
     */
    public static String listing(ControlFlowGraph cfg) {
        StringBuilder sb = new StringBuilder();
        for (BasicBlock block : cfg.getBlocks()) {
            sb.append(block.toTargetString())
                    .append(String.format(" [%04x-%04x]", block.getStartAddress(), block.getEndAddress()));
            if (block == cfg.getEntry()) sb.append(" entry");
            if (block.isExit()) sb.append(" exit");
            sb.append(" -> ");
            appendTargets(sb, block);
            sb.append('\n');
            for (Instruction insn : block.getInstructions()) {
                sb.append("    ").append(insn).append('\n');
            }
        }
        return sb.toString();
    }

    private static void appendTargets(StringBuilder sb, BasicBlock block) {
        if (block.getSuccessors().isEmpty()) {
            sb.append("(none)");
            return;
        }
        boolean first = true;
        for (int succ : block.getSuccessors()) {
            if (!first) sb.append(", ");
            sb.append('B').append(succ);
            first = false;
        }
    }

    /**
     * Render a graph in the Graphviz dot language, one node per block.
     *
     * @param cfg The graph.
     * @return The dot source.
     */
    public static String toDot(ControlFlowGraph cfg) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph cfg {\n");
        sb.append("  node [shape=box, fontname=monospace];\n");
        for (BasicBlock block : cfg.getBlocks()) {
            sb.append("  ").append(block.toTargetString()).append(" [label=\"");
            for (Instruction insn : block.getInstructions()) {
                sb.append(escape(insn.toString())).append("\\l");
            }
            sb.append("\"];\n");
        }
        for (BasicBlock block : cfg.getBlocks()) {
            for (int succ : block.getSuccessors()) {
                sb.append("  ").append(block.toTargetString()).append(" -> B").append(succ).append(";\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * List the live slots of each block.
     *
     * @param info The liveness data.
     * @return The listing.
     */
    public static String liveness(DataFlowInfo info) {
        StringBuilder sb = new StringBuilder();
        for (DataFlowInfo.BlockData data : info.getBlocks()) {
            sb.append(data).append('\n');
        }
        if (!info.isConverged()) {
            sb.append("(incomplete after ").append(info.getIterations()).append(" iterations)\n");
        }
        return sb.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
