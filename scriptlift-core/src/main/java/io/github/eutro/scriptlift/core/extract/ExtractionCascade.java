package io.github.eutro.scriptlift.core.extract;

import io.github.eutro.scriptlift.core.insn.InsnMetadata;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.insn.Instructions;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runs {@link ExtractionStrategy extraction strategies} in order until one produces instructions.
 * <p>
 * A strategy that throws is logged, reported to the {@link ExtractionMonitor}, and skipped.
 * The first non-empty result is normalized (addresses {@code 0, 4, 8, ...}, and the strategy name
 * stamped as {@link InsnMetadata#STRATEGY}) and cached by content hash, so a script with the same text
 * is never extracted twice. If every strategy fails, the empty result is cached too.
 */
public class ExtractionCascade {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionCascade.class);

    /**
     * The identity used for scripts whose identity cannot be read.
     */
    public static final String UNKNOWN_IDENTITY = "<unknown>";

    private final List<ExtractionStrategy> strategies;
    private final AnalysisCache cache;
    private final ExtractionMonitor monitor;

    /**
     * Construct a cascade.
     *
     * @param strategies The strategies, in the order they should be tried.
     * @param cache      The cache to memoize results in.
     * @param monitor    The monitor to report failures to.
     */
    public ExtractionCascade(List<? extends ExtractionStrategy> strategies, AnalysisCache cache, ExtractionMonitor monitor) {
        this.strategies = Collections.unmodifiableList(new ArrayList<>(strategies));
        this.cache = Objects.requireNonNull(cache, "cache");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
    }

    /**
     * Get the default strategies, in their default order.
     *
     * @param trace The execution trace strategy to use, which may be disabled.
     * @return The strategies.
     */
    public static List<ExtractionStrategy> defaultStrategies(ExecutionTrace trace) {
        return Arrays.asList(
                PatternTagging.INSTANCE,
                trace,
                SignatureScan.INSTANCE,
                TokenSynthesis.INSTANCE
        );
    }

    public List<ExtractionStrategy> getStrategies() {
        return strategies;
    }

    public AnalysisCache getCache() {
        return cache;
    }

    /**
     * Read the text of a script, treating an accessor that throws as no text.
     *
     * @param script The script.
     * @return The text, or null.
     */
    @Nullable
    public static String readSource(ScriptObject script) {
        try {
            return script.getSource();
        } catch (RuntimeException e) {
            logger.debug("Could not read source of {}", identityOf(script), e);
            return null;
        }
    }

    /**
     * Read the identity of a script, treating an accessor that throws as {@link #UNKNOWN_IDENTITY}.
     *
     * @param script The script.
     * @return The identity.
     */
    public static String identityOf(ScriptObject script) {
        try {
            return script.getIdentity();
        } catch (RuntimeException e) {
            logger.debug("Could not read identity of a script", e);
            return UNKNOWN_IDENTITY;
        }
    }

    /**
     * Extract the instructions of a script, reading its text.
     *
     * @param script The script.
     * @return The result.
     */
    public ExtractionResult extract(ScriptObject script) {
        return extract(script, readSource(script));
    }

    /**
     * Extract the instructions of a script whose text has already been read.
     *
     * @param script The script.
     * @param text   Its text, or null if it has none.
     * @return The result.
     */
    public ExtractionResult extract(ScriptObject script, @Nullable String text) {
        String identity = identityOf(script);
        String hash = ContentHash.of(identity, text);
        boolean[] computed = {false};
        AnalysisCache.Entry entry = cache.computeIfAbsent(hash, $ -> {
            computed[0] = true;
            return runStrategies(script, identity, text);
        });
        if (!computed[0]) {
            logger.debug("Cache hit for {} ({})", identity, hash);
        }
        return new ExtractionResult(hash, entry, !computed[0]);
    }

    private AnalysisCache.Entry runStrategies(ScriptObject script, String identity, @Nullable String text) {
        for (ExtractionStrategy strategy : strategies) {
            ExtractionStrategy.Kind kind = strategy.getKind();
            List<Instruction> insns;
            Exception failure;
            try {
                insns = strategy.extract(script, text);
                failure = null;
            } catch (Exception e) {
                insns = null;
                failure = e;
            } catch (StackOverflowError e) {
                insns = null;
                failure = new ExtractionException("strategy overflowed the stack", e);
            }
            if (failure != null) {
                logger.warn("Strategy {} failed on {}: {}", kind.getDisplayName(), identity, failure.toString());
                logger.debug("Strategy failure trace", failure);
                monitor.strategyFailed(script, kind, failure);
                continue;
            }
            if (insns == null || insns.isEmpty()) {
                logger.debug("Strategy {} found nothing in {}", kind.getDisplayName(), identity);
                continue;
            }
            logger.debug("Strategy {} extracted {} instructions from {}",
                    kind.getDisplayName(), insns.size(), identity);
            return new AnalysisCache.Entry(
                    Instructions.normalize(insns, InsnMetadata.STRATEGY, kind.getDisplayName()),
                    kind);
        }
        logger.debug("No strategy could extract {}", identity);
        return new AnalysisCache.Entry(Collections.emptyList(), null);
    }
}
