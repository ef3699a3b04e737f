package io.github.eutro.scriptlift.test;

import io.github.eutro.scriptlift.core.cfg.BasicBlock;
import io.github.eutro.scriptlift.core.cfg.ControlFlowGraph;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.insn.Instructions;
import io.github.eutro.scriptlift.core.insn.Opcode;
import io.github.eutro.scriptlift.core.passes.convert.BuildCfg;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.scriptlift.test.Utils.insn;
import static io.github.eutro.scriptlift.test.Utils.program;
import static org.junit.jupiter.api.Assertions.*;

public class BuildCfgTest {
    static void assertPartition(List<Instruction> insns, ControlFlowGraph cfg) {
        int next = 0;
        for (BasicBlock block : cfg.getBlocks()) {
            assertEquals(next, block.getFirstIndex());
            assertFalse(block.getInstructions().isEmpty());
            for (int i = block.getFirstIndex(); i <= block.getLastIndex(); i++) {
                assertSame(block, cfg.blockOfIndex(i));
                assertEquals(insns.get(i), block.getInstructions().get(i - block.getFirstIndex()));
            }
            next = block.getLastIndex() + 1;
        }
        assertEquals(insns.size(), next);
    }

    @Test
    void testJumpOverCall() {
        List<Instruction> insns = Utils.jumpOverCall();
        ControlFlowGraph cfg = BuildCfg.INSTANCE.run(insns);

        assertEquals(3, cfg.getBlocks().size());
        assertEquals(Arrays.asList(
                Arrays.asList(0, 1, 2, 3),
                Collections.singletonList(4),
                Collections.singletonList(5)
        ), Utils.blockIndices(cfg));

        BasicBlock entry = cfg.getEntry();
        assertNotNull(entry);
        assertEquals(0, entry.getStartAddress());
        assertEquals(Arrays.asList(2, 1), entry.getSuccessors());
        assertEquals(Collections.singletonList(2), cfg.getBlock(1).getSuccessors());
        assertTrue(cfg.getBlock(2).isExit());
        assertEquals(Arrays.asList(0, 1), cfg.getBlock(2).getPredecessors());
        assertEquals(Collections.singletonList(cfg.getBlock(2)), cfg.getExits());
        assertPartition(insns, cfg);
    }

    @Test
    void testEmpty() {
        ControlFlowGraph cfg = BuildCfg.INSTANCE.run(Collections.emptyList());
        assertTrue(cfg.isEmpty());
        assertNull(cfg.getEntry());
        assertTrue(cfg.getExits().isEmpty());
        assertTrue(cfg.getReachable().isEmpty());
        assertNull(cfg.blockAt(0));
    }

    @Test
    void testStraightLine() {
        List<Instruction> insns = program(
                insn(Opcode.LOADN, 0, 1, 0),
                insn(Opcode.MOVE, 1, 0, 0),
                insn(Opcode.RETURN, 1, 0, 0)
        );
        ControlFlowGraph cfg = BuildCfg.INSTANCE.run(insns);
        assertEquals(1, cfg.getBlocks().size());
        assertTrue(cfg.getBlock(0).isExit());
        assertPartition(insns, cfg);
    }

    @Test
    void testTargetsStartBlocks() {
        List<Instruction> insns = program(
                insn(Opcode.LOADN, 0, 0, 0),
                insn(Opcode.LOADN, 1, 10, 0),
                insn(Opcode.ADD, 0, 0, 1),
                insn(Opcode.SUB, 1, 1, 0),
                insn(Opcode.JUMPIFNOT, -2, 0, 0),
                insn(Opcode.RETURN, 0, 0, 0)
        );
        ControlFlowGraph cfg = BuildCfg.INSTANCE.run(insns);
        int target = Instructions.jumpTarget(insns, 4);
        assertEquals(2, target);
        BasicBlock loop = cfg.blockStartingAt(target * Instruction.STRIDE);
        assertNotNull(loop);
        assertEquals(Arrays.asList(loop.getId(), loop.getId() + 1), loop.getSuccessors());
        assertTrue(loop.getPredecessors().contains(loop.getId()));
        assertSame(cfg.getEntry(), cfg.blockAt(0));
        assertPartition(insns, cfg);
    }

    @Test
    void testOutOfRangeTarget() {
        List<Instruction> insns = program(
                insn(Opcode.LOADN, 0, 0, 0),
                insn(Opcode.JUMP, 10, 0, 0),
                insn(Opcode.RETURN, 0, 0, 0)
        );
        ControlFlowGraph cfg = BuildCfg.INSTANCE.run(insns);
        assertEquals(2, cfg.getBlocks().size());
        assertTrue(cfg.getBlock(0).getSuccessors().isEmpty());
        assertTrue(cfg.getBlock(1).getPredecessors().isEmpty());
        assertEquals(Collections.singleton(cfg.getBlock(0)), cfg.getReachable());
        assertPartition(insns, cfg);
    }

    @Test
    void testJumpToFallThroughStoredOnce() {
        List<Instruction> insns = program(
                insn(Opcode.JUMPIF, 1, 0, 0),
                insn(Opcode.RETURN, 0, 0, 0)
        );
        ControlFlowGraph cfg = BuildCfg.INSTANCE.run(insns);
        assertEquals(Collections.singletonList(1), cfg.getBlock(0).getSuccessors());
        assertEquals(Collections.singletonList(0), cfg.getBlock(1).getPredecessors());
    }

    @Test
    void testMissingOperandJumpsToItself() {
        List<Instruction> insns = program(
                insn(Opcode.LOADNIL, 0),
                insn(Opcode.JUMPBACK)
        );
        ControlFlowGraph cfg = BuildCfg.INSTANCE.run(insns);
        assertEquals(2, cfg.getBlocks().size());
        assertEquals(Collections.singletonList(1), cfg.getBlock(1).getSuccessors());
        assertEquals(Collections.singletonList(1), cfg.getBlock(0).getSuccessors());
    }

    @Test
    void testLookups() {
        ControlFlowGraph cfg = BuildCfg.INSTANCE.run(Utils.jumpOverCall());
        assertSame(cfg.getBlock(0), cfg.blockAt(8));
        assertNull(cfg.blockStartingAt(8));
        assertSame(cfg.getBlock(1), cfg.blockStartingAt(16));
        assertNull(cfg.blockAt(2));
        assertNull(cfg.blockAt(24));
        assertNull(cfg.blockOfIndex(-1));
        assertEquals(3, cfg.getReachable().size());
    }
}
