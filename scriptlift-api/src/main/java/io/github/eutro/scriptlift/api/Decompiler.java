package io.github.eutro.scriptlift.api;

import io.github.eutro.scriptlift.api.events.DataFlowIncompleteEvent;
import io.github.eutro.scriptlift.api.events.DecompiledEvent;
import io.github.eutro.scriptlift.api.events.DecompilerEvent;
import io.github.eutro.scriptlift.api.events.EventSupplier;
import io.github.eutro.scriptlift.api.events.InstructionsExtractedEvent;
import io.github.eutro.scriptlift.api.events.StrategyFailedEvent;
import io.github.eutro.scriptlift.core.cfg.ControlFlowGraph;
import io.github.eutro.scriptlift.core.cfg.DataFlowInfo;
import io.github.eutro.scriptlift.core.extract.AnalysisCache;
import io.github.eutro.scriptlift.core.extract.ExecutionTrace;
import io.github.eutro.scriptlift.core.extract.ExtractionCascade;
import io.github.eutro.scriptlift.core.extract.ExtractionResult;
import io.github.eutro.scriptlift.core.extract.ExtractionStrategy;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.passes.AnalysisPass;
import io.github.eutro.scriptlift.core.passes.convert.BuildCfg;
import io.github.eutro.scriptlift.core.passes.meta.ComputeLiveVars;
import io.github.eutro.scriptlift.core.script.ReflectionHost;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The entry point to decompiling scripts.
 * <p>
 * A decompiler owns an {@link AnalysisCache}, so scripts with the same text are only extracted once
 * per decompiler. Listeners can be attached for the {@link DecompilerEvent events} of each decompilation.
 * <p>
 * Bad input never makes a decompiler throw: scripts that cannot be read
 * produce results that are not {@link DecompileResult#isAvailable() available}.
 */
public class Decompiler extends EventSupplier<DecompilerEvent> {
    private static final Logger logger = LoggerFactory.getLogger(Decompiler.class);

    private final DecompilerConfig config;
    private final AnalysisCache cache = new AnalysisCache();
    private final ExtractionCascade cascade;
    private final AnalysisPass<List<Instruction>, DataFlowInfo> analysis;

    /**
     * Construct a decompiler with the {@link DecompilerConfig#defaults() default configuration} and no host.
     */
    public Decompiler() {
        this(DecompilerConfig.defaults());
    }

    /**
     * Construct a decompiler with no host.
     *
     * @param config The configuration.
     */
    public Decompiler(DecompilerConfig config) {
        this(config, (ReflectionHost) null);
    }

    /**
     * Construct a decompiler.
     *
     * @param config The configuration.
     * @param host   The host to sample execution traces from, if deep analysis is enabled, or null.
     */
    public Decompiler(DecompilerConfig config, @Nullable ReflectionHost host) {
        this(config, ExtractionCascade.defaultStrategies(new ExecutionTrace(
                host,
                config.isDeepAnalysis(),
                config.getTraceTimeoutMillis(),
                config.getMaxTraceSamples())));
    }

    /**
     * Construct a decompiler with a custom list of strategies.
     *
     * @param config     The configuration.
     * @param strategies The strategies, in the order they should be tried.
     */
    public Decompiler(DecompilerConfig config, List<? extends ExtractionStrategy> strategies) {
        this.config = config;
        this.cascade = new ExtractionCascade(strategies, cache,
                (script, kind, cause) -> dispatch(StrategyFailedEvent.class, new StrategyFailedEvent(script, kind, cause)));
        this.analysis = BuildCfg.INSTANCE.then(new ComputeLiveVars(config.getIterationCap()));
    }

    public DecompilerConfig getConfig() {
        return config;
    }

    public AnalysisCache getCache() {
        return cache;
    }

    /**
     * Decompile a single script.
     *
     * @param script The script.
     * @return The result.
     */
    @NotNull
    public DecompileResult decompile(ScriptObject script) {
        ScriptMetadata metadata = ScriptMetadata.snapshot(script);
        String text = ExtractionCascade.readSource(script);

        ExtractionResult extraction = cascade.extract(script, text);
        dispatch(InstructionsExtractedEvent.class, new InstructionsExtractedEvent(script, extraction));

        DataFlowInfo dataFlow = analysis.run(extraction.getInstructions());
        ControlFlowGraph cfg = dataFlow.getGraph();
        if (!dataFlow.isConverged()) {
            logger.warn("Live slots of {} are incomplete after {} iterations",
                    metadata.getIdentity(), dataFlow.getIterations());
            dispatch(DataFlowIncompleteEvent.class, new DataFlowIncompleteEvent(script, dataFlow));
        }

        DecompileResult result = new DecompileResult(
                script,
                metadata,
                extraction.getInstructions(),
                cfg,
                dataFlow,
                extraction.getEntry().getSource(),
                extraction.getStrategy(),
                extraction.isFromCache());
        logger.debug("Decompiled {}", result);
        return dispatch(DecompiledEvent.class, new DecompiledEvent(result)).result;
    }

    /**
     * Decompile every script in a tree, depth-first and parents first,
     * descending at most {@link DecompilerConfig#getMaxDepth()} levels below the root.
     *
     * @param root The root of the tree.
     * @return The results, in visiting order.
     */
    @NotNull
    public List<DecompileResult> decompileTree(ScriptObject root) {
        List<DecompileResult> results = new ArrayList<>();
        walk(root, 0, results);
        return results;
    }

    private void walk(ScriptObject node, int depth, List<DecompileResult> results) {
        if (isScript(node)) {
            results.add(decompile(node));
        }
        if (depth >= config.getMaxDepth()) return;
        for (ScriptObject child : childrenOf(node)) {
            walk(child, depth + 1, results);
        }
    }

    private static boolean isScript(ScriptObject node) {
        try {
            return node.isScript();
        } catch (RuntimeException e) {
            logger.debug("Could not tell whether {} is a script", node, e);
            return false;
        }
    }

    private static List<? extends ScriptObject> childrenOf(ScriptObject node) {
        try {
            return node.getChildren();
        } catch (RuntimeException e) {
            logger.debug("Could not list children of {}", node, e);
            return Collections.emptyList();
        }
    }
}
