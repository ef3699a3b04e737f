package io.github.eutro.scriptlift.api.events;

import io.github.eutro.scriptlift.api.DecompileResult;
import org.jetbrains.annotations.NotNull;

/**
 * Fired with the result of each decompilation, for displays and scanners to consume.
 */
public class DecompiledEvent implements DecompilerEvent {
    @NotNull
    public final DecompileResult result;

    public DecompiledEvent(@NotNull DecompileResult result) {
        this.result = result;
    }
}
