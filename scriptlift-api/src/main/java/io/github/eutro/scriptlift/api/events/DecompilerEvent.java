package io.github.eutro.scriptlift.api.events;

/**
 * The supertype of events a {@link io.github.eutro.scriptlift.api.Decompiler} dispatches.
 */
public interface DecompilerEvent {
}
