package io.github.eutro.scriptlift.core.insn;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * The fixed table of symbolic operation codes an {@link Instruction} may carry.
 * <p>
 * Each opcode has a numeric code, a mnemonic (its name), and a set of class flags
 * that the control flow graph builder and the source reconstructor dispatch on.
 */
public enum Opcode {
    NOP(0, Flags.NONE),
    BREAK(1, Flags.NONE),
    LOADNIL(2, Flags.NONE),
    LOADB(3, Flags.NONE),
    LOADN(4, Flags.NONE),
    LOADK(5, Flags.NONE),
    MOVE(6, Flags.NONE),
    GETGLOBAL(7, Flags.NONE),
    SETGLOBAL(8, Flags.NONE),
    GETUPVAL(9, Flags.NONE),
    SETUPVAL(10, Flags.NONE),
    CLOSEUPVALS(11, Flags.NONE),
    GETIMPORT(12, Flags.NONE),
    GETTABLE(13, Flags.NONE),
    SETTABLE(14, Flags.NONE),
    GETTABLEKS(15, Flags.NONE),
    SETTABLEKS(16, Flags.NONE),
    GETTABLEN(17, Flags.NONE),
    SETTABLEN(18, Flags.NONE),
    NEWCLOSURE(19, Flags.BLOCK_START),
    NAMECALL(20, Flags.CALL),
    CALL(21, Flags.CALL),
    RETURN(22, Flags.NO_FALLTHROUGH | Flags.BLOCK_END),
    JUMP(23, Flags.JUMP | Flags.NO_FALLTHROUGH | Flags.BLOCK_END),
    JUMPBACK(24, Flags.JUMP | Flags.NO_FALLTHROUGH),
    JUMPIF(25, Flags.JUMP | Flags.BLOCK_START),
    JUMPIFNOT(26, Flags.JUMP),
    JUMPIFEQ(27, Flags.JUMP),
    JUMPIFLE(28, Flags.JUMP),
    JUMPIFLT(29, Flags.JUMP),
    JUMPIFNOTEQ(30, Flags.JUMP),
    JUMPIFNOTLE(31, Flags.JUMP),
    JUMPIFNOTLT(32, Flags.JUMP),
    ADD(33, Flags.NONE, "+"),
    SUB(34, Flags.NONE, "-"),
    MUL(35, Flags.NONE, "*"),
    DIV(36, Flags.NONE, "/"),
    MOD(37, Flags.NONE, "%"),
    POW(38, Flags.NONE, "^"),
    ADDK(39, Flags.NONE, "+"),
    SUBK(40, Flags.NONE, "-"),
    MULK(41, Flags.NONE, "*"),
    DIVK(42, Flags.NONE, "/"),
    MODK(43, Flags.NONE, "%"),
    POWK(44, Flags.NONE, "^"),
    AND(45, Flags.NONE, "and"),
    OR(46, Flags.NONE, "or"),
    ANDK(47, Flags.NONE, "and"),
    ORK(48, Flags.NONE, "or"),
    CONCAT(49, Flags.NONE, ".."),
    NOT(50, Flags.UNARY, "not "),
    MINUS(51, Flags.UNARY, "-"),
    LENGTH(52, Flags.UNARY, "#"),
    NEWTABLE(53, Flags.NONE),
    DUPTABLE(54, Flags.NONE),
    SETLIST(55, Flags.NONE),
    FORNPREP(56, Flags.BLOCK_START),
    FORNLOOP(57, Flags.BLOCK_END),
    FORGLOOP(58, Flags.BLOCK_START),
    FORGPREP_INEXT(59, Flags.NONE),
    FORGLOOP_INEXT(60, Flags.BLOCK_END),
    FORGPREP_NEXT(61, Flags.NONE),
    FORGLOOP_NEXT(62, Flags.NONE),
    GETVARARGS(63, Flags.NONE),
    DUPCLOSURE(64, Flags.NONE),
    PREPVARARGS(65, Flags.NONE),
    LOADKX(66, Flags.NONE),
    JUMPX(67, Flags.JUMP | Flags.NO_FALLTHROUGH),
    FASTCALL(68, Flags.CALL),
    COVERAGE(69, Flags.NONE),
    CAPTURE(70, Flags.NONE),
    SUBRK(71, Flags.NONE, "-"),
    DIVRK(72, Flags.NONE, "/"),
    FASTCALL1(73, Flags.CALL),
    FASTCALL2(74, Flags.CALL),
    FASTCALL2K(75, Flags.CALL),
    ;

    private static final class Flags {
        static final int NONE = 0;
        static final int JUMP = 1;
        static final int NO_FALLTHROUGH = 1 << 1;
        static final int BLOCK_START = 1 << 2;
        static final int BLOCK_END = 1 << 3;
        static final int CALL = 1 << 4;
        static final int UNARY = 1 << 5;
    }

    private static final Map<Integer, Opcode> BY_CODE = new HashMap<>();
    private static final Map<String, Opcode> BY_MNEMONIC = new HashMap<>();

    static {
        for (Opcode op : values()) {
            BY_CODE.put(op.code, op);
            BY_MNEMONIC.put(op.name(), op);
        }
    }

    /**
     * The numeric code of the opcode.
     */
    public final int code;
    private final int flags;
    @Nullable
    private final String operator;

    Opcode(int code, int flags) {
        this(code, flags, null);
    }

    Opcode(int code, int flags, @Nullable String operator) {
        this.code = code;
        this.flags = flags;
        this.operator = operator;
    }

    /**
     * Look up an opcode by its numeric code.
     *
     * @param code The code.
     * @return The opcode, or null if there is none with that code.
     */
    @Nullable
    public static Opcode byCode(int code) {
        return BY_CODE.get(code);
    }

    /**
     * Look up an opcode by its mnemonic. The lookup is case-sensitive.
     *
     * @param mnemonic The mnemonic, e.g. {@code "LOADK"}.
     * @return The opcode, or null if there is none with that mnemonic.
     */
    @Nullable
    public static Opcode byMnemonic(String mnemonic) {
        return BY_MNEMONIC.get(mnemonic);
    }

    /**
     * Get the mnemonic of this opcode.
     *
     * @return The mnemonic.
     */
    public String getMnemonic() {
        return name();
    }

    /**
     * Get whether this opcode transfers control to a target computed from its first operand.
     *
     * @return Whether this is a jump-class opcode.
     */
    public boolean isJump() {
        return (flags & Flags.JUMP) != 0;
    }

    /**
     * Get whether control never continues to the following instruction after this one,
     * i.e. whether this is a return or an unconditional jump.
     *
     * @return Whether this opcode has no fall-through.
     */
    public boolean isUnconditional() {
        return (flags & Flags.NO_FALLTHROUGH) != 0;
    }

    /**
     * Get whether this is a jump that may also fall through.
     *
     * @return Whether this is a conditional jump.
     */
    public boolean isConditionalJump() {
        return isJump() && !isUnconditional();
    }

    /**
     * Get whether reconstructed source should be indented after this opcode.
     *
     * @return Whether this opcode opens a block.
     */
    public boolean isBlockStart() {
        return (flags & Flags.BLOCK_START) != 0;
    }

    /**
     * Get whether reconstructed source should be dedented before this opcode.
     *
     * @return Whether this opcode closes a block.
     */
    public boolean isBlockEnd() {
        return (flags & Flags.BLOCK_END) != 0;
    }

    /**
     * Get whether this is a call-class opcode.
     *
     * @return Whether this opcode calls a function.
     */
    public boolean isCall() {
        return (flags & Flags.CALL) != 0;
    }

    /**
     * Get whether this is a unary operator.
     *
     * @return Whether this opcode reads only one operand.
     */
    public boolean isUnary() {
        return (flags & Flags.UNARY) != 0;
    }

    /**
     * Get the source-level operator this opcode computes, for arithmetic and logic opcodes.
     *
     * @return The operator, or null if this opcode is not an operator.
     */
    @Nullable
    public String getOperator() {
        return operator;
    }

    @Override
    public String toString() {
        return name();
    }
}
