package io.github.eutro.scriptlift.jvm;

import io.github.eutro.scriptlift.core.insn.InsnMetadata;
import io.github.eutro.scriptlift.core.insn.Opcode;
import io.github.eutro.scriptlift.core.script.ReflectionHost;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import io.github.eutro.scriptlift.core.script.TraceSample;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link ReflectionHost} that reads the bytecode of {@link ClassScriptObject classes}.
 * <p>
 * Every real instruction of every concrete method is sampled, in declaration order,
 * and mapped onto the closest {@link Opcode}. Local variables keep their slot numbers,
 * while values on the operand stack all share {@link #STACK_SLOT}.
 * Branch operands are offsets in samples, so they stay valid once the samples are numbered.
 */
public class JvmReflectionHost implements ReflectionHost {
    private static final Logger logger = LoggerFactory.getLogger(JvmReflectionHost.class);

    /**
     * The slot that stands for the operand stack.
     */
    public static final int STACK_SLOT = 255;

    @Override
    public boolean supports(ScriptObject script) {
        return script instanceof ClassScriptObject;
    }

    @Override
    public List<TraceSample> sample(ScriptObject script, int maxSamples) throws InterruptedException {
        if (!supports(script)) {
            throw new IllegalArgumentException("not a class: " + script.getIdentity());
        }
        ClassNode node = ClassBytes.getClassNodeFor(((ClassScriptObject) script).getType());
        Sampler sampler = new Sampler(maxSamples);
        for (MethodNode method : node.methods) {
            if ((method.access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0) continue;
            if (sampler.isFull()) break;
            sampler.sampleMethod(method);
        }
        logger.debug("Sampled {} instructions from {}", sampler.samples.size(), node.name);
        return sampler.samples;
    }

    private static class Sampler {
        final List<TraceSample> samples = new ArrayList<>();
        final Map<Object, Integer> constants = new HashMap<>();
        final int maxSamples;

        final Map<LabelNode, Integer> labelIndices = new HashMap<>();
        String methodName;
        Integer line;

        Sampler(int maxSamples) {
            this.maxSamples = maxSamples;
        }

        boolean isFull() {
            return samples.size() >= maxSamples;
        }

        void sampleMethod(MethodNode method) throws InterruptedException {
            methodName = method.name + method.desc;
            line = null;
            labelIndices.clear();

            // labels resolve to the index of the next real instruction
            int index = samples.size();
            List<LabelNode> pending = new ArrayList<>();
            for (AbstractInsnNode insn : method.instructions) {
                if (insn instanceof LabelNode) {
                    pending.add((LabelNode) insn);
                } else if (insn.getOpcode() >= 0) {
                    for (LabelNode label : pending) labelIndices.put(label, index);
                    pending.clear();
                    index++;
                }
            }
            for (LabelNode label : pending) labelIndices.put(label, index);

            for (AbstractInsnNode insn : method.instructions) {
                if (Thread.interrupted()) throw new InterruptedException();
                if (insn instanceof LineNumberNode) {
                    line = ((LineNumberNode) insn).line;
                } else if (insn.getOpcode() >= 0) {
                    if (isFull()) return;
                    execute(insn);
                }
            }
        }

        private int constant(Object key) {
            return constants.computeIfAbsent(key, $ -> constants.size());
        }

        private int offsetTo(LabelNode label) {
            return labelIndices.get(label) - samples.size();
        }

        private void emit(Opcode opcode, int... operands) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put(InsnMetadata.METHOD, methodName);
            if (line != null) detail.put(InsnMetadata.LINE, line);
            samples.add(new TraceSample(opcode, operands, detail));
        }

        private void execute(AbstractInsnNode insn) {
            int opcode = insn.getOpcode();
            switch (opcode) {
                case Opcodes.ACONST_NULL:
                    emit(Opcode.LOADNIL, STACK_SLOT, 0, 0);
                    break;
                case Opcodes.ICONST_M1:
                case Opcodes.ICONST_0:
                case Opcodes.ICONST_1:
                case Opcodes.ICONST_2:
                case Opcodes.ICONST_3:
                case Opcodes.ICONST_4:
                case Opcodes.ICONST_5:
                    emit(Opcode.LOADN, STACK_SLOT, opcode - Opcodes.ICONST_0, 0);
                    break;
                case Opcodes.LCONST_0:
                case Opcodes.LCONST_1:
                    emit(Opcode.LOADN, STACK_SLOT, opcode - Opcodes.LCONST_0, 0);
                    break;
                case Opcodes.FCONST_0:
                case Opcodes.FCONST_1:
                case Opcodes.FCONST_2:
                    emit(Opcode.LOADN, STACK_SLOT, opcode - Opcodes.FCONST_0, 0);
                    break;
                case Opcodes.DCONST_0:
                case Opcodes.DCONST_1:
                    emit(Opcode.LOADN, STACK_SLOT, opcode - Opcodes.DCONST_0, 0);
                    break;
                case Opcodes.BIPUSH:
                case Opcodes.SIPUSH:
                    emit(Opcode.LOADN, STACK_SLOT, ((IntInsnNode) insn).operand, 0);
                    break;
                case Opcodes.LDC:
                    emit(Opcode.LOADK, STACK_SLOT, constant(((LdcInsnNode) insn).cst), 0);
                    break;

                case Opcodes.ILOAD:
                case Opcodes.LLOAD:
                case Opcodes.FLOAD:
                case Opcodes.DLOAD:
                case Opcodes.ALOAD:
                    emit(Opcode.MOVE, STACK_SLOT, ((VarInsnNode) insn).var, 0);
                    break;
                case Opcodes.ISTORE:
                case Opcodes.LSTORE:
                case Opcodes.FSTORE:
                case Opcodes.DSTORE:
                case Opcodes.ASTORE:
                    emit(Opcode.MOVE, ((VarInsnNode) insn).var, STACK_SLOT, 0);
                    break;
                case Opcodes.IINC: {
                    IincInsnNode iinc = (IincInsnNode) insn;
                    emit(Opcode.ADDK, iinc.var, iinc.var, iinc.incr);
                    break;
                }

                case Opcodes.IADD:
                case Opcodes.LADD:
                case Opcodes.FADD:
                case Opcodes.DADD:
                    binary(Opcode.ADD);
                    break;
                case Opcodes.ISUB:
                case Opcodes.LSUB:
                case Opcodes.FSUB:
                case Opcodes.DSUB:
                    binary(Opcode.SUB);
                    break;
                case Opcodes.IMUL:
                case Opcodes.LMUL:
                case Opcodes.FMUL:
                case Opcodes.DMUL:
                    binary(Opcode.MUL);
                    break;
                case Opcodes.IDIV:
                case Opcodes.LDIV:
                case Opcodes.FDIV:
                case Opcodes.DDIV:
                    binary(Opcode.DIV);
                    break;
                case Opcodes.IREM:
                case Opcodes.LREM:
                case Opcodes.FREM:
                case Opcodes.DREM:
                    binary(Opcode.MOD);
                    break;
                case Opcodes.IAND:
                case Opcodes.LAND:
                    binary(Opcode.AND);
                    break;
                case Opcodes.IOR:
                case Opcodes.LOR:
                    binary(Opcode.OR);
                    break;
                case Opcodes.INEG:
                case Opcodes.LNEG:
                case Opcodes.FNEG:
                case Opcodes.DNEG:
                    emit(Opcode.MINUS, STACK_SLOT, STACK_SLOT, 0);
                    break;

                case Opcodes.IFEQ:
                case Opcodes.IFNULL:
                    jump(Opcode.JUMPIFNOT, insn);
                    break;
                case Opcodes.IFNE:
                case Opcodes.IFNONNULL:
                    jump(Opcode.JUMPIF, insn);
                    break;
                case Opcodes.IF_ICMPEQ:
                case Opcodes.IF_ACMPEQ:
                    jump(Opcode.JUMPIFEQ, insn);
                    break;
                case Opcodes.IF_ICMPNE:
                case Opcodes.IF_ACMPNE:
                    jump(Opcode.JUMPIFNOTEQ, insn);
                    break;
                case Opcodes.IFLT:
                case Opcodes.IF_ICMPLT:
                    jump(Opcode.JUMPIFLT, insn);
                    break;
                case Opcodes.IFGE:
                case Opcodes.IF_ICMPGE:
                    jump(Opcode.JUMPIFNOTLT, insn);
                    break;
                case Opcodes.IFLE:
                case Opcodes.IF_ICMPLE:
                    jump(Opcode.JUMPIFLE, insn);
                    break;
                case Opcodes.IFGT:
                case Opcodes.IF_ICMPGT:
                    jump(Opcode.JUMPIFNOTLE, insn);
                    break;
                case Opcodes.GOTO: {
                    int offset = offsetTo(((JumpInsnNode) insn).label);
                    emit(offset <= 0 ? Opcode.JUMPBACK : Opcode.JUMP, offset, 0, 0);
                    break;
                }
                case Opcodes.TABLESWITCH:
                    emit(Opcode.JUMPX, offsetTo(((TableSwitchInsnNode) insn).dflt), STACK_SLOT, 0);
                    break;
                case Opcodes.LOOKUPSWITCH:
                    emit(Opcode.JUMPX, offsetTo(((LookupSwitchInsnNode) insn).dflt), STACK_SLOT, 0);
                    break;

                case Opcodes.INVOKEVIRTUAL:
                case Opcodes.INVOKEINTERFACE:
                    emit(Opcode.NAMECALL, STACK_SLOT, argumentCount(((MethodInsnNode) insn).desc), 0);
                    break;
                case Opcodes.INVOKESTATIC:
                case Opcodes.INVOKESPECIAL:
                    emit(Opcode.CALL, STACK_SLOT, argumentCount(((MethodInsnNode) insn).desc), 0);
                    break;
                case Opcodes.INVOKEDYNAMIC:
                    emit(Opcode.NEWCLOSURE, STACK_SLOT, constant(((InvokeDynamicInsnNode) insn).name), 0);
                    break;

                case Opcodes.IRETURN:
                case Opcodes.LRETURN:
                case Opcodes.FRETURN:
                case Opcodes.DRETURN:
                case Opcodes.ARETURN:
                case Opcodes.ATHROW:
                    emit(Opcode.RETURN, 0, STACK_SLOT, 0);
                    break;
                case Opcodes.RETURN:
                    emit(Opcode.RETURN, 0, 0, 0);
                    break;

                case Opcodes.GETSTATIC:
                    emit(Opcode.GETGLOBAL, STACK_SLOT, field(insn), 0);
                    break;
                case Opcodes.PUTSTATIC:
                    emit(Opcode.SETGLOBAL, STACK_SLOT, field(insn), 0);
                    break;
                case Opcodes.GETFIELD:
                    emit(Opcode.GETTABLEKS, STACK_SLOT, STACK_SLOT, field(insn));
                    break;
                case Opcodes.PUTFIELD:
                    emit(Opcode.SETTABLEKS, STACK_SLOT, STACK_SLOT, field(insn));
                    break;

                case Opcodes.IALOAD:
                case Opcodes.LALOAD:
                case Opcodes.FALOAD:
                case Opcodes.DALOAD:
                case Opcodes.AALOAD:
                case Opcodes.BALOAD:
                case Opcodes.CALOAD:
                case Opcodes.SALOAD:
                    emit(Opcode.GETTABLE, STACK_SLOT, STACK_SLOT, STACK_SLOT);
                    break;
                case Opcodes.IASTORE:
                case Opcodes.LASTORE:
                case Opcodes.FASTORE:
                case Opcodes.DASTORE:
                case Opcodes.AASTORE:
                case Opcodes.BASTORE:
                case Opcodes.CASTORE:
                case Opcodes.SASTORE:
                    emit(Opcode.SETTABLE, STACK_SLOT, STACK_SLOT, STACK_SLOT);
                    break;
                case Opcodes.ARRAYLENGTH:
                    emit(Opcode.LENGTH, STACK_SLOT, STACK_SLOT, 0);
                    break;

                case Opcodes.NEW:
                case Opcodes.NEWARRAY:
                case Opcodes.ANEWARRAY:
                case Opcodes.MULTIANEWARRAY:
                    emit(Opcode.NEWTABLE, STACK_SLOT, 0, 0);
                    break;

                default:
                    emit(Opcode.NOP, 0, 0, 0);
                    break;
            }
        }

        private void binary(Opcode op) {
            emit(op, STACK_SLOT, STACK_SLOT, STACK_SLOT);
        }

        private void jump(Opcode op, AbstractInsnNode insn) {
            emit(op, offsetTo(((JumpInsnNode) insn).label), STACK_SLOT, 0);
        }

        private int field(AbstractInsnNode insn) {
            FieldInsnNode fieldInsn = (FieldInsnNode) insn;
            return constant(fieldInsn.owner + "." + fieldInsn.name);
        }

        private static int argumentCount(String desc) {
            return Type.getArgumentTypes(desc).length;
        }
    }
}
