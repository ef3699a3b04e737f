package io.github.eutro.scriptlift.core.extract;

import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * A way of deriving an instruction sequence from a script.
 * <p>
 * A strategy signals "nothing found" by returning an empty list, and internal failure by throwing.
 * Both make the {@link ExtractionCascade} move on to the next strategy.
 */
public interface ExtractionStrategy {
    /**
     * The kinds of strategy there are.
     */
    enum Kind {
        /**
         * Regex tags over readable source.
         */
        PATTERN_TAGGING,
        /**
         * Sampling through a host {@link io.github.eutro.scriptlift.core.script.ReflectionHost}.
         */
        EXECUTION_TRACE,
        /**
         * Recognition of disassembly-like listings by known opcode fragments.
         */
        SIGNATURE_SCAN,
        /**
         * Derivation from a tokenized parse of the text.
         */
        TOKEN_SYNTHESIS,
        ;

        /**
         * Get the name stamped on instructions this kind of strategy produces.
         *
         * @return The name, e.g. {@code "pattern-tagging"}.
         */
        public String getDisplayName() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }
    }

    Kind getKind();

    /**
     * Derive instructions from a script.
     *
     * @param script The script.
     * @param text   The text of the script, or null if it has none.
     * @return The instructions, which need not be normalized, or an empty list if nothing was found.
     * @throws Exception if the strategy fails.
     */
    List<Instruction> extract(ScriptObject script, @Nullable String text) throws Exception;
}
