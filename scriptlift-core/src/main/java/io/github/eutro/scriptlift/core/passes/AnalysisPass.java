package io.github.eutro.scriptlift.core.passes;

import io.github.eutro.scriptlift.core.passes.misc.ChainedPass;

/**
 * A pass over some stage of the analysis (e.g. an instruction sequence, a
 * {@link io.github.eutro.scriptlift.core.cfg.ControlFlowGraph control flow graph}),
 * which derives the next stage from it.
 * <p>
 * Passes never modify their input, and must give equal results for equal inputs.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
@FunctionalInterface
public interface AnalysisPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> AnalysisPass<A, C> then(AnalysisPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
