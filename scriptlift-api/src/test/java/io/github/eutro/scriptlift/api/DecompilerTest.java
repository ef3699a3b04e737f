package io.github.eutro.scriptlift.api;

import io.github.eutro.scriptlift.api.events.DataFlowIncompleteEvent;
import io.github.eutro.scriptlift.api.events.DecompiledEvent;
import io.github.eutro.scriptlift.api.events.InstructionsExtractedEvent;
import io.github.eutro.scriptlift.api.events.StrategyFailedEvent;
import io.github.eutro.scriptlift.core.extract.ExtractionException;
import io.github.eutro.scriptlift.core.extract.ExtractionStrategy;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.insn.Opcode;
import io.github.eutro.scriptlift.core.script.ReflectionHost;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import io.github.eutro.scriptlift.core.script.SimpleScriptObject;
import io.github.eutro.scriptlift.core.script.TraceSample;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DecompilerTest {
    static DecompilerConfig config() {
        return DecompilerConfig.builder().build();
    }

    @Test
    void testDecompile() {
        Decompiler decompiler = new Decompiler(config());
        List<DecompileResult> seen = new ArrayList<>();
        decompiler.listen(DecompiledEvent.class, evt -> seen.add(evt.result));

        DecompileResult result = decompiler.decompile(SimpleScriptObject.ofSource("Main",
                "local x = 1\nif x then\n  print(\"big\")\nend\nreturn x"));
        assertTrue(result.isAvailable());
        assertEquals(ExtractionStrategy.Kind.PATTERN_TAGGING, result.getStrategy());
        assertFalse(result.isFromCache());
        assertFalse(result.getCfg().isEmpty());
        assertTrue(result.getDataFlow().isConverged());
        assertTrue(result.getSource().contains("func()"), result.getSource());
        assertEquals(Collections.singletonList(result), seen);
    }

    @Test
    void testCacheAcrossScripts() {
        Decompiler decompiler = new Decompiler(config());
        List<Boolean> cached = new ArrayList<>();
        decompiler.listen(InstructionsExtractedEvent.class, evt -> cached.add(evt.extraction.isFromCache()));

        DecompileResult first = decompiler.decompile(SimpleScriptObject.ofSource("A", "print(1)"));
        DecompileResult second = decompiler.decompile(SimpleScriptObject.ofSource("B", "print(1)"));
        assertEquals(first.getInstructions(), second.getInstructions());
        assertEquals(first.getSource(), second.getSource());
        assertTrue(second.isFromCache());
        assertEquals(Arrays.asList(false, true), cached);
        assertEquals(1, decompiler.getCache().size());
    }

    @Test
    void testEmptyInput() {
        DecompileResult result = new Decompiler(config()).decompile(SimpleScriptObject.ofSource("e", ""));
        assertFalse(result.isAvailable());
        assertTrue(result.getInstructions().isEmpty());
        assertTrue(result.getCfg().getBlocks().isEmpty());
        assertNull(result.getCfg().getEntry());
        assertTrue(result.getDataFlow().getBlocks().isEmpty());
        assertSame(result.getCfg(), result.getDataFlow().getGraph());
        assertEquals("", result.getSource());
    }

    @Test
    void testLongStringLiteral() {
        StringBuilder sb = new StringBuilder("print(\"");
        for (int i = 0; i < 50000; i++) {
            sb.append('a');
        }
        sb.append("\")");
        DecompileResult result = new Decompiler(config()).decompile(SimpleScriptObject.ofSource("big", sb.toString()));
        assertEquals(ExtractionStrategy.Kind.PATTERN_TAGGING, result.getStrategy());
        assertEquals(Arrays.asList(Opcode.CALL, Opcode.LOADK), opcodesOf(result));
    }

    @Test
    void testUnreadableIdentity() {
        ScriptObject locked = new ScriptObject() {
            @Override
            public String getIdentity() {
                throw new SecurityException("identity locked");
            }

            @Override
            public String getSource() {
                return "print(1)";
            }

            @Override
            public String getClassName() {
                return "ModuleScript";
            }

            @Override
            public String getName() {
                return "locked";
            }

            @Override
            public boolean isScript() {
                return true;
            }
        };
        DecompileResult result = new Decompiler(config()).decompile(locked);
        assertTrue(result.isAvailable());
        assertEquals(ScriptMetadata.UNKNOWN, result.getMetadata().getIdentity());
        assertEquals("func()", result.getSource());
    }

    static List<Opcode> opcodesOf(DecompileResult result) {
        List<Opcode> opcodes = new ArrayList<>();
        for (Instruction insn : result.getInstructions()) {
            opcodes.add(insn.getOpcode());
        }
        return opcodes;
    }

    @Test
    void testUnavailable() {
        Decompiler decompiler = new Decompiler(config());
        DecompileResult result = decompiler.decompile(SimpleScriptObject.builder("Locked")
                .source(() -> {
                    throw new SecurityException("cannot read");
                })
                .build());
        assertFalse(result.isAvailable());
        assertEquals("", result.getSource());
        assertNull(result.getStrategy());
        assertTrue(result.getCfg().isEmpty());
        assertNull(result.getCfg().getEntry());
    }

    @Test
    void testStrategyFailureEvent() {
        ExtractionStrategy broken = new ExtractionStrategy() {
            @Override
            public Kind getKind() {
                return Kind.PATTERN_TAGGING;
            }

            @Override
            public List<Instruction> extract(ScriptObject script, @Nullable String text) {
                throw new ExtractionException("broken");
            }
        };
        Decompiler decompiler = new Decompiler(config(), Collections.singletonList(broken));
        List<StrategyFailedEvent> failures = new ArrayList<>();
        decompiler.listen(StrategyFailedEvent.class, failures::add);

        ScriptObject script = SimpleScriptObject.ofSource("A", "print(1)");
        DecompileResult result = decompiler.decompile(script);
        assertFalse(result.isAvailable());
        assertEquals(1, failures.size());
        assertSame(script, failures.get(0).script);
        assertEquals(ExtractionStrategy.Kind.PATTERN_TAGGING, failures.get(0).strategy);
        assertEquals("broken", failures.get(0).cause.getMessage());
    }

    @Test
    void testDataFlowIncomplete() {
        ExtractionStrategy loop = new ExtractionStrategy() {
            @Override
            public Kind getKind() {
                return Kind.SIGNATURE_SCAN;
            }

            @Override
            public List<Instruction> extract(ScriptObject script, @Nullable String text) {
                return Arrays.asList(
                        Instruction.of(Opcode.MOVE, 0, 0, 1),
                        Instruction.of(Opcode.JUMPBACK, 4, 0, 2)
                );
            }
        };
        Decompiler decompiler = new Decompiler(
                DecompilerConfig.builder().setIterationCap(1).build(),
                Collections.singletonList(loop));
        List<DataFlowIncompleteEvent> incomplete = new ArrayList<>();
        decompiler.listen(DataFlowIncompleteEvent.class, incomplete::add);

        DecompileResult result = decompiler.decompile(SimpleScriptObject.ofSource("A", "loop"));
        assertFalse(result.getDataFlow().isConverged());
        assertEquals(1, incomplete.size());
        assertSame(result.getDataFlow(), incomplete.get(0).dataFlow);
    }

    @Test
    void testMetadata() {
        SimpleScriptObject root = SimpleScriptObject.builder("Workspace")
                .className("Folder")
                .script(false)
                .child(SimpleScriptObject.builder("Main")
                        .source("print(1)")
                        .property("Disabled", false)
                        .computedProperty("Secret", () -> {
                            throw new SecurityException("no");
                        })
                        .property("RunContext", "Server"))
                .build();
        List<DecompileResult> results = new Decompiler(config()).decompileTree(root);
        assertEquals(1, results.size());

        ScriptMetadata metadata = results.get(0).getMetadata();
        assertEquals("Main", metadata.getName());
        assertEquals("ModuleScript", metadata.getClassName());
        assertEquals("Workspace", metadata.getParentName());
        assertEquals("Workspace.Main", metadata.getIdentity());
        assertEquals(Arrays.asList("Disabled", "RunContext"), new ArrayList<>(metadata.getProperties().keySet()));
        assertEquals("Server", metadata.getProperties().get("RunContext"));
    }

    static SimpleScriptObject.Builder chain(int depth) {
        SimpleScriptObject.Builder node = SimpleScriptObject.builder("Level" + depth).source("print(" + depth + ")");
        if (depth < 30) node.child(chain(depth + 1));
        return node;
    }

    @Test
    void testTreeDepthLimit() {
        SimpleScriptObject root = chain(0).build();
        List<DecompileResult> results = new Decompiler(config()).decompileTree(root);
        assertEquals(21, results.size());
        assertEquals("Level0", results.get(0).getMetadata().getName());
        assertEquals("Level20", results.get(20).getMetadata().getName());

        List<DecompileResult> shallow = new Decompiler(DecompilerConfig.builder().setMaxDepth(0).build())
                .decompileTree(root);
        assertEquals(1, shallow.size());
    }

    @Test
    void testTreeOrder() {
        SimpleScriptObject root = SimpleScriptObject.builder("Root").script(false)
                .child(SimpleScriptObject.builder("A").source("a()")
                        .child(SimpleScriptObject.builder("A1").source("a1()")))
                .child(SimpleScriptObject.builder("B").source("b()"))
                .build();
        List<String> names = new ArrayList<>();
        for (DecompileResult result : new Decompiler(config()).decompileTree(root)) {
            names.add(result.getMetadata().getName());
        }
        assertEquals(Arrays.asList("A", "A1", "B"), names);
    }

    @Test
    void testDeepAnalysisUsesHost() {
        ReflectionHost host = new ReflectionHost() {
            @Override
            public boolean supports(ScriptObject script) {
                return true;
            }

            @Override
            public List<TraceSample> sample(ScriptObject script, int maxSamples) {
                return Collections.singletonList(new TraceSample(Opcode.RETURN, new int[0], Collections.emptyMap()));
            }
        };
        DecompileResult shallow = new Decompiler(config(), host)
                .decompile(SimpleScriptObject.ofSource("A", "x = 1"));
        assertEquals(ExtractionStrategy.Kind.TOKEN_SYNTHESIS, shallow.getStrategy());

        DecompileResult deep = new Decompiler(DecompilerConfig.builder().setDeepAnalysis(true).build(), host)
                .decompile(SimpleScriptObject.ofSource("A", "x = 1"));
        assertEquals(ExtractionStrategy.Kind.EXECUTION_TRACE, deep.getStrategy());
        assertEquals("return result", deep.getSource());
    }
}
