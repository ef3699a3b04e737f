package io.github.eutro.scriptlift.core.insn;

/**
 * Well-known {@link Instruction#getMetadata() metadata} keys.
 */
public final class InsnMetadata {
    private InsnMetadata() {
    }

    /**
     * The name of the extraction strategy that produced the instruction.
     */
    public static final String STRATEGY = "strategy";
    /**
     * The offset in the source text where the construct the instruction came from starts.
     */
    public static final String SOURCE_START = "sourceStart";
    /**
     * The offset in the source text just after the construct the instruction came from.
     */
    public static final String SOURCE_END = "sourceEnd";
    /**
     * The pattern (or signature) that matched.
     */
    public static final String PATTERN = "pattern";
    /**
     * The token the instruction was synthesized from.
     */
    public static final String TOKEN = "token";
    /**
     * Present (and true) if the instruction does not correspond to any real instruction.
     */
    public static final String SYNTHETIC = "synthetic";
    /**
     * The source line the instruction came from, where known.
     */
    public static final String LINE = "line";
    /**
     * The method (or function) the instruction came from, where known.
     */
    public static final String METHOD = "method";
}
