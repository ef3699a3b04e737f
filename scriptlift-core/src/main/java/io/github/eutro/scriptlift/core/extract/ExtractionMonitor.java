package io.github.eutro.scriptlift.core.extract;

import io.github.eutro.scriptlift.core.script.ScriptObject;

/**
 * Receives the soft failures of an {@link ExtractionCascade}.
 */
@FunctionalInterface
public interface ExtractionMonitor {
    /**
     * A monitor that ignores everything.
     */
    ExtractionMonitor NONE = (script, kind, cause) -> {
    };

    /**
     * Called when a strategy threw, before the next one is tried.
     *
     * @param script The script being extracted.
     * @param kind   The kind of the strategy that failed.
     * @param cause  What it threw.
     */
    void strategyFailed(ScriptObject script, ExtractionStrategy.Kind kind, Exception cause);
}
