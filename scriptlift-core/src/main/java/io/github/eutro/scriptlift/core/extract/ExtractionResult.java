package io.github.eutro.scriptlift.core.extract;

import io.github.eutro.scriptlift.core.insn.Instruction;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The outcome of running an {@link ExtractionCascade} on a script.
 */
public final class ExtractionResult {
    private final String hash;
    private final AnalysisCache.Entry entry;
    private final boolean fromCache;

    public ExtractionResult(String hash, AnalysisCache.Entry entry, boolean fromCache) {
        this.hash = hash;
        this.entry = entry;
        this.fromCache = fromCache;
    }

    public String getHash() {
        return hash;
    }

    public AnalysisCache.Entry getEntry() {
        return entry;
    }

    /**
     * Get the instructions, gap-free from address 0.
     *
     * @return The instructions, empty if every strategy failed.
     */
    public List<Instruction> getInstructions() {
        return entry.getInstructions();
    }

    /**
     * Get the kind of strategy that produced the instructions.
     *
     * @return The kind, or null if no strategy succeeded.
     */
    @Nullable
    public ExtractionStrategy.Kind getStrategy() {
        return entry.getStrategy();
    }

    /**
     * Get whether no strategy ran for this result, because it was already cached.
     *
     * @return Whether this was a cache hit.
     */
    public boolean isFromCache() {
        return fromCache;
    }

    public boolean isEmpty() {
        return entry.getInstructions().isEmpty();
    }
}
