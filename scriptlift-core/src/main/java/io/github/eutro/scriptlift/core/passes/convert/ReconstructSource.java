package io.github.eutro.scriptlift.core.passes.convert;

import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.insn.Instructions;
import io.github.eutro.scriptlift.core.insn.Opcode;
import io.github.eutro.scriptlift.core.passes.AnalysisPass;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Linearizes an instruction sequence back into indented pseudo-source.
 * <p>
 * The output is a readable skeleton, not source that can be compiled again. Every resolvable jump target
 * gets a label {@code label_1}, {@code label_2}, ... in address order, printed unindented on its own line.
 * Indentation is four spaces per level: it decreases before a {@link Opcode#isBlockEnd() block end}
 * and increases after a {@link Opcode#isBlockStart() block start}.
 */
public class ReconstructSource implements AnalysisPass<List<Instruction>, String> {
    /**
     * A singleton instance of this pass.
     */
    public static final ReconstructSource INSTANCE = new ReconstructSource();

    /**
     * The most arguments a call is printed with.
     */
    public static final int MAX_CALL_ARGS = 8;

    private static final String INDENT = "    ";

    @Override
    public String run(List<Instruction> insns) {
        Map<Integer, String> labels = assignLabels(insns);

        List<String> lines = new ArrayList<>();
        int indentLevel = 0;
        for (int i = 0; i < insns.size(); i++) {
            Instruction insn = insns.get(i);
            String label = labels.get(insn.getAddress());
            if (label != null) {
                lines.add(label + ":");
            }

            if (insn.getOpcode().isBlockEnd()) {
                indentLevel = Math.max(0, indentLevel - 1);
            }
            String line = render(insns, i, labels);
            if (line != null) {
                StringBuilder sb = new StringBuilder();
                for (int j = 0; j < indentLevel; j++) {
                    sb.append(INDENT);
                }
                lines.add(sb.append(line).toString());
            }
            if (insn.getOpcode().isBlockStart()) {
                indentLevel++;
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Assign labels to every address that a jump in the sequence resolvably targets.
     *
     * @param insns The instructions.
     * @return The labels, by address.
     */
    public static Map<Integer, String> assignLabels(List<Instruction> insns) {
        TreeSet<Integer> targets = new TreeSet<>();
        for (int i = 0; i < insns.size(); i++) {
            int target = Instructions.jumpTarget(insns, i);
            if (target != Instructions.NO_TARGET) {
                targets.add(insns.get(target).getAddress());
            }
        }
        Map<Integer, String> labels = new HashMap<>();
        int counter = 1;
        for (int address : targets) {
            labels.put(address, "label_" + counter++);
        }
        return labels;
    }

    private static String jumpLabel(List<Instruction> insns, int index, Map<Integer, String> labels) {
        int target = Instructions.jumpTarget(insns, index);
        if (target != Instructions.NO_TARGET) {
            return labels.get(insns.get(target).getAddress());
        }
        return "address_" + Instructions.rawTargetAddress(index, insns.get(index));
    }

    @Nullable
    private static String render(List<Instruction> insns, int index, Map<Integer, String> labels) {
        Instruction insn = insns.get(index);
        Opcode op = insn.getOpcode();
        int a = insn.getOperandOr(0, 0);
        int b = insn.getOperandOr(1, 0);
        int c = insn.getOperandOr(2, 0);

        if (op.isCall()) {
            int argc = Math.max(0, Math.min(MAX_CALL_ARGS, b));
            StringBuilder sb = new StringBuilder("func(");
            for (int i = 1; i <= argc; i++) {
                if (i != 1) sb.append(", ");
                sb.append("arg").append(i);
            }
            return sb.append(')').toString();
        }
        if (op.isJump()) {
            String label = jumpLabel(insns, index, labels);
            return op.isUnconditional()
                    ? "goto " + label
                    : "if condition then goto " + label + " end";
        }
        if (op.getOperator() != null) {
            return op.isUnary()
                    ? "var" + a + " = " + op.getOperator() + "var" + b
                    : "var" + a + " = var" + b + " " + op.getOperator() + " var" + c;
        }

        switch (op) {
            case NOP:
                return null;
            case LOADK:
            case LOADKX:
                return "local var" + a + " = constant" + b;
            case LOADN:
                return "local var" + a + " = " + b;
            case LOADNIL:
                return "local var" + a + " = nil";
            case LOADB:
                return "local var" + a + " = " + (b != 0);
            case MOVE:
                return "var" + a + " = var" + b;
            case GETGLOBAL:
            case GETIMPORT:
                return "local var" + a + " = _G[\"global" + b + "\"]";
            case SETGLOBAL:
                return "_G[\"global" + b + "\"] = var" + a;
            case GETTABLE:
                return "var" + a + " = var" + b + "[var" + c + "]";
            case SETTABLE:
                return "var" + b + "[var" + c + "] = var" + a;
            case GETTABLEKS:
                return "var" + a + " = var" + b + ".field" + c;
            case SETTABLEKS:
                return "var" + b + ".field" + c + " = var" + a;
            case GETTABLEN:
                return "var" + a + " = var" + b + "[" + c + "]";
            case SETTABLEN:
                return "var" + b + "[" + c + "] = var" + a;
            case RETURN:
                return "return result";
            case NEWCLOSURE:
            case DUPCLOSURE:
                return "local function closure" + a + "()";
            case FORNPREP:
            case FORGPREP_INEXT:
            case FORGPREP_NEXT:
                return "for var" + a + " = start, limit do";
            case FORNLOOP:
            case FORGLOOP:
            case FORGLOOP_INEXT:
            case FORGLOOP_NEXT:
                return "end";
            case NEWTABLE:
            case DUPTABLE:
                return "local var" + a + " = {}";
            default:
                StringBuilder sb = new StringBuilder("-- ").append(op.getMnemonic());
                for (int i = 0; i < insn.getOperandCount(); i++) {
                    sb.append(i == 0 ? " " : ", ").append(insn.getOperand(i));
                }
                return sb.toString();
        }
    }
}
