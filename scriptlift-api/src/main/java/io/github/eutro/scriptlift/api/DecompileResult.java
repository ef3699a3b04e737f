package io.github.eutro.scriptlift.api;

import io.github.eutro.scriptlift.core.cfg.ControlFlowGraph;
import io.github.eutro.scriptlift.core.cfg.DataFlowInfo;
import io.github.eutro.scriptlift.core.extract.ExtractionStrategy;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Everything {@link Decompiler#decompile(ScriptObject)} recovered from a script.
 */
public final class DecompileResult {
    private final ScriptObject script;
    private final ScriptMetadata metadata;
    private final List<Instruction> instructions;
    private final ControlFlowGraph cfg;
    private final DataFlowInfo dataFlow;
    private final String source;
    @Nullable
    private final ExtractionStrategy.Kind strategy;
    private final boolean fromCache;

    public DecompileResult(ScriptObject script,
                           ScriptMetadata metadata,
                           List<Instruction> instructions,
                           ControlFlowGraph cfg,
                           DataFlowInfo dataFlow,
                           String source,
                           @Nullable ExtractionStrategy.Kind strategy,
                           boolean fromCache) {
        this.script = script;
        this.metadata = metadata;
        this.instructions = instructions;
        this.cfg = cfg;
        this.dataFlow = dataFlow;
        this.source = source;
        this.strategy = strategy;
        this.fromCache = fromCache;
    }

    public ScriptObject getScript() {
        return script;
    }

    public ScriptMetadata getMetadata() {
        return metadata;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public ControlFlowGraph getCfg() {
        return cfg;
    }

    public DataFlowInfo getDataFlow() {
        return dataFlow;
    }

    /**
     * Get the reconstructed source.
     *
     * @return The source, empty if nothing could be extracted.
     */
    public String getSource() {
        return source;
    }

    /**
     * Get the kind of strategy that extracted the instructions.
     *
     * @return The kind, or null if no strategy succeeded.
     */
    @Nullable
    public ExtractionStrategy.Kind getStrategy() {
        return strategy;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    /**
     * Get whether any instructions could be recovered.
     *
     * @return Whether the result has anything in it.
     */
    public boolean isAvailable() {
        return !instructions.isEmpty();
    }

    @Override
    public String toString() {
        return metadata.getIdentity() + ": " + instructions.size() + " instructions, "
                + cfg.getBlocks().size() + " blocks"
                + (strategy == null ? "" : " via " + strategy.getDisplayName())
                + (fromCache ? " (cached)" : "");
    }
}
