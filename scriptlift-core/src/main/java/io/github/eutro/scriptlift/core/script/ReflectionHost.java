package io.github.eutro.scriptlift.core.script;

import java.util.List;

/**
 * A host capability to observe the instructions a script actually runs.
 * <p>
 * Implementations may be slow, or block. Callers bound them with a timeout.
 */
public interface ReflectionHost {
    /**
     * Get whether this host can sample the given script at all.
     *
     * @param script The script.
     * @return Whether {@link #sample(ScriptObject, int)} may succeed.
     */
    boolean supports(ScriptObject script);

    /**
     * Sample the instructions of a script.
     *
     * @param script     The script.
     * @param maxSamples The most samples to return.
     * @return The samples, in execution or declaration order.
     * @throws Exception if the host fails to sample the script.
     */
    List<TraceSample> sample(ScriptObject script, int maxSamples) throws Exception;
}
