package io.github.eutro.scriptlift.core.extract;

import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.passes.convert.ReconstructSource;
import io.github.eutro.scriptlift.core.util.Lazy;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Extraction results by {@link ContentHash content hash}.
 * <p>
 * At most one entry is ever computed per key. Failed extractions are cached like any other.
 * Entries are only removed by {@link #clear()}.
 */
public class AnalysisCache {
    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Get the entry for a key, computing it if absent.
     *
     * @param hash    The key.
     * @param compute The function to compute the entry, called at most once per key.
     * @return The entry.
     */
    public Entry computeIfAbsent(String hash, Function<String, Entry> compute) {
        return entries.computeIfAbsent(hash, compute);
    }

    @Nullable
    public Entry get(String hash) {
        return entries.get(hash);
    }

    public boolean contains(String hash) {
        return entries.containsKey(hash);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    /**
     * A cached extraction: the instructions and the source reconstructed from them on demand.
     */
    public static final class Entry {
        private final List<Instruction> instructions;
        @Nullable
        private final ExtractionStrategy.Kind strategy;
        private final Lazy<String> source;

        /**
         * Construct an entry.
         *
         * @param instructions The normalized instructions, possibly empty.
         * @param strategy     The kind of strategy that produced them, or null if all failed.
         */
        public Entry(List<Instruction> instructions, @Nullable ExtractionStrategy.Kind strategy) {
            this.instructions = instructions;
            this.strategy = strategy;
            this.source = Lazy.lazy(() -> ReconstructSource.INSTANCE.run(instructions));
        }

        public List<Instruction> getInstructions() {
            return instructions;
        }

        @Nullable
        public ExtractionStrategy.Kind getStrategy() {
            return strategy;
        }

        /**
         * Get the reconstructed source, computing it on first call.
         *
         * @return The source.
         */
        public String getSource() {
            return source.get();
        }

        public boolean isSourceComputed() {
            return source.isComputed();
        }
    }
}
