package io.github.eutro.scriptlift.api.events;

import io.github.eutro.scriptlift.core.extract.ExtractionStrategy;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when an extraction strategy throws, before the next strategy is tried.
 */
public class StrategyFailedEvent implements DecompilerEvent {
    @NotNull
    public final ScriptObject script;
    @NotNull
    public final ExtractionStrategy.Kind strategy;
    @NotNull
    public final Exception cause;

    public StrategyFailedEvent(@NotNull ScriptObject script, @NotNull ExtractionStrategy.Kind strategy, @NotNull Exception cause) {
        this.script = script;
        this.strategy = strategy;
        this.cause = cause;
    }
}
