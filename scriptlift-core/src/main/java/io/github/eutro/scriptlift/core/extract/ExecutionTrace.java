package io.github.eutro.scriptlift.core.extract;

import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.script.ReflectionHost;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import io.github.eutro.scriptlift.core.script.TraceSample;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asks a {@link ReflectionHost} for the instructions a script runs.
 * <p>
 * The host is only consulted when this strategy is enabled, and each call runs on its own worker thread,
 * bounded by a timeout. A host that fails, or does not answer in time, fails the strategy.
 */
public class ExecutionTrace implements ExtractionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionTrace.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    @Nullable
    private final ReflectionHost host;
    private final boolean enabled;
    private final long timeoutMillis;
    private final int maxSamples;

    /**
     * Construct the strategy.
     *
     * @param host          The host to sample with, or null if there is none.
     * @param enabled       Whether to consult the host at all.
     * @param timeoutMillis How long to wait for the host, in milliseconds.
     * @param maxSamples    The most instructions to take from the host.
     */
    public ExecutionTrace(@Nullable ReflectionHost host, boolean enabled, long timeoutMillis, int maxSamples) {
        if (timeoutMillis <= 0) throw new IllegalArgumentException("timeout must be positive: " + timeoutMillis);
        if (maxSamples <= 0) throw new IllegalArgumentException("max samples must be positive: " + maxSamples);
        this.host = host;
        this.enabled = enabled;
        this.timeoutMillis = timeoutMillis;
        this.maxSamples = maxSamples;
    }

    /**
     * Get a strategy that never finds anything.
     *
     * @return The disabled strategy.
     */
    public static ExecutionTrace disabled() {
        return new ExecutionTrace(null, false, 1, 1);
    }

    @Override
    public Kind getKind() {
        return Kind.EXECUTION_TRACE;
    }

    public boolean isEnabled() {
        return enabled && host != null;
    }

    @Override
    public List<Instruction> extract(ScriptObject script, @Nullable String text) {
        ReflectionHost host = this.host;
        if (!enabled || host == null) return Collections.emptyList();
        if (!host.supports(script)) {
            logger.debug("Host does not support {}", ExtractionCascade.identityOf(script));
            return Collections.emptyList();
        }

        List<TraceSample> samples = sampleWithTimeout(host, script);
        List<Instruction> insns = new ArrayList<>(Math.min(samples.size(), maxSamples));
        for (TraceSample sample : samples) {
            if (insns.size() >= maxSamples) break;
            int[] operands = sample.getOperands();
            if (operands.length < Instruction.ARITY) operands = Instruction.fixedArity(operands);
            insns.add(new Instruction(sample.getOpcode(),
                    operands,
                    insns.size() * Instruction.STRIDE,
                    Instruction.STRIDE,
                    sample.getDetail()));
        }
        return insns;
    }

    private List<TraceSample> sampleWithTimeout(ReflectionHost host, ScriptObject script) {
        ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "scriptlift-trace-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            Future<List<TraceSample>> future = worker.submit(() -> host.sample(script, maxSamples));
            try {
                List<TraceSample> samples = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
                return samples == null ? Collections.emptyList() : samples;
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new ExtractionException("host did not answer within " + timeoutMillis + "ms", e);
            } catch (ExecutionException e) {
                throw new ExtractionException("host failed to sample " + ExtractionCascade.identityOf(script), e.getCause());
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new ExtractionException("interrupted while sampling " + ExtractionCascade.identityOf(script), e);
            }
        } finally {
            worker.shutdownNow();
        }
    }
}
