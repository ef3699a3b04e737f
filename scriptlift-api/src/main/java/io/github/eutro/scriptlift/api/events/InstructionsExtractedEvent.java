package io.github.eutro.scriptlift.api.events;

import io.github.eutro.scriptlift.core.extract.ExtractionResult;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once the extraction cascade has run for a script, whether or not it found anything.
 */
public class InstructionsExtractedEvent implements DecompilerEvent {
    @NotNull
    public final ScriptObject script;
    @NotNull
    public final ExtractionResult extraction;

    public InstructionsExtractedEvent(@NotNull ScriptObject script, @NotNull ExtractionResult extraction) {
        this.script = script;
        this.extraction = extraction;
    }
}
