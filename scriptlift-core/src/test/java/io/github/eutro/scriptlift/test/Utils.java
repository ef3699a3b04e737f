package io.github.eutro.scriptlift.test;

import io.github.eutro.scriptlift.core.cfg.BasicBlock;
import io.github.eutro.scriptlift.core.cfg.ControlFlowGraph;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.insn.Instructions;
import io.github.eutro.scriptlift.core.insn.Opcode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class Utils {
    public static Instruction insn(Opcode opcode, int... operands) {
        return Instruction.of(opcode, 0, operands);
    }

    public static List<Instruction> program(Instruction... insns) {
        return Instructions.normalize(Arrays.asList(insns), null, null);
    }

    /**
     * The six instruction program with one conditional jump over a call.
     */
    public static List<Instruction> jumpOverCall() {
        return program(
                insn(Opcode.LOADK, 0, 1, 0),
                insn(Opcode.LOADK, 1, 2, 0),
                insn(Opcode.ADD, 2, 0, 1),
                insn(Opcode.JUMPIF, 2, 0, 0),
                insn(Opcode.CALL, 0, 2, 0),
                insn(Opcode.RETURN, 0, 0, 0)
        );
    }

    public static List<List<Integer>> blockIndices(ControlFlowGraph cfg) {
        List<List<Integer>> ls = new ArrayList<>();
        for (BasicBlock block : cfg.getBlocks()) {
            List<Integer> indices = new ArrayList<>();
            for (int i = block.getFirstIndex(); i <= block.getLastIndex(); i++) {
                indices.add(i);
            }
            ls.add(indices);
        }
        return ls;
    }
}
