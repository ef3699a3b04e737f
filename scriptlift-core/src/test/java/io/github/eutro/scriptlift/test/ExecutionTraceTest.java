package io.github.eutro.scriptlift.test;

import io.github.eutro.scriptlift.core.extract.AnalysisCache;
import io.github.eutro.scriptlift.core.extract.ExecutionTrace;
import io.github.eutro.scriptlift.core.extract.ExtractionCascade;
import io.github.eutro.scriptlift.core.extract.ExtractionException;
import io.github.eutro.scriptlift.core.extract.ExtractionResult;
import io.github.eutro.scriptlift.core.extract.ExtractionStrategy;
import io.github.eutro.scriptlift.core.insn.InsnMetadata;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.insn.Opcode;
import io.github.eutro.scriptlift.core.script.ReflectionHost;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import io.github.eutro.scriptlift.core.script.SimpleScriptObject;
import io.github.eutro.scriptlift.core.script.TraceSample;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutionTraceTest {
    static final ScriptObject SCRIPT = SimpleScriptObject.ofSource("traced", "x = 1");

    interface Sampler {
        List<TraceSample> sample(int maxSamples) throws Exception;
    }

    static class TestHost implements ReflectionHost {
        final AtomicInteger calls = new AtomicInteger();
        final boolean supported;
        final Sampler sampler;

        TestHost(boolean supported, Sampler sampler) {
            this.supported = supported;
            this.sampler = sampler;
        }

        @Override
        public boolean supports(ScriptObject script) {
            return supported;
        }

        @Override
        public List<TraceSample> sample(ScriptObject script, int maxSamples) throws Exception {
            calls.incrementAndGet();
            return sampler.sample(maxSamples);
        }
    }

    static List<TraceSample> samples(int count) {
        List<TraceSample> ls = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ls.add(new TraceSample(Opcode.MOVE, new int[]{i, i + 1}, Collections.singletonMap(InsnMetadata.LINE, i)));
        }
        return ls;
    }

    @Test
    void testSamples() {
        TestHost host = new TestHost(true, max -> samples(3));
        List<Instruction> insns = new ExecutionTrace(host, true, 2000, 1000).extract(SCRIPT, null);
        assertEquals(3, insns.size());
        assertArrayEquals(new int[]{2, 3, 0}, insns.get(2).getOperands());
        assertEquals(2, insns.get(2).getMeta(InsnMetadata.LINE));
        assertEquals(8, insns.get(2).getAddress());
    }

    @Test
    void testMaxSamples() {
        TestHost host = new TestHost(true, max -> samples(10));
        assertEquals(4, new ExecutionTrace(host, true, 2000, 4).extract(SCRIPT, null).size());
    }

    @Test
    void testDisabled() {
        TestHost host = new TestHost(true, max -> samples(3));
        ExecutionTrace trace = new ExecutionTrace(host, false, 2000, 1000);
        assertFalse(trace.isEnabled());
        assertTrue(trace.extract(SCRIPT, null).isEmpty());
        assertEquals(0, host.calls.get());
        assertTrue(ExecutionTrace.disabled().extract(SCRIPT, null).isEmpty());
    }

    @Test
    void testUnsupported() {
        TestHost host = new TestHost(false, max -> samples(3));
        assertTrue(new ExecutionTrace(host, true, 2000, 1000).extract(SCRIPT, null).isEmpty());
        assertEquals(0, host.calls.get());
    }

    @Test
    void testTimeout() {
        TestHost host = new TestHost(true, max -> {
            Thread.sleep(10_000);
            return samples(1);
        });
        ExecutionTrace trace = new ExecutionTrace(host, true, 50, 1000);
        long start = System.nanoTime();
        ExtractionException e = assertThrows(ExtractionException.class, () -> trace.extract(SCRIPT, null));
        assertInstanceOf(TimeoutException.class, e.getCause());
        assertTrue(System.nanoTime() - start < 5_000_000_000L);
    }

    @Test
    void testHostFailure() {
        TestHost host = new TestHost(true, max -> {
            throw new IOException("host went away");
        });
        ExtractionException e = assertThrows(ExtractionException.class,
                () -> new ExecutionTrace(host, true, 2000, 1000).extract(SCRIPT, null));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void testFailureFallsThroughCascade() {
        TestHost host = new TestHost(true, max -> {
            throw new IOException("host went away");
        });
        List<ExtractionStrategy.Kind> failed = new ArrayList<>();
        ExtractionCascade cascade = new ExtractionCascade(
                ExtractionCascade.defaultStrategies(new ExecutionTrace(host, true, 2000, 1000)),
                new AnalysisCache(),
                (script, kind, cause) -> failed.add(kind));
        ExtractionResult result = cascade.extract(SCRIPT);
        assertEquals(ExtractionStrategy.Kind.TOKEN_SYNTHESIS, result.getStrategy());
        assertEquals(Collections.singletonList(ExtractionStrategy.Kind.EXECUTION_TRACE), failed);
        assertEquals(1, host.calls.get());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutionTrace(null, true, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new ExecutionTrace(null, true, 1, 0));
    }
}
