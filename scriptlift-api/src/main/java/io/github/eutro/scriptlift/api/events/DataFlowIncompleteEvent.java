package io.github.eutro.scriptlift.api.events;

import io.github.eutro.scriptlift.core.cfg.DataFlowInfo;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when liveness analysis hit its iteration cap, so the live sets of the script are incomplete.
 */
public class DataFlowIncompleteEvent implements DecompilerEvent {
    @NotNull
    public final ScriptObject script;
    @NotNull
    public final DataFlowInfo dataFlow;

    public DataFlowIncompleteEvent(@NotNull ScriptObject script, @NotNull DataFlowInfo dataFlow) {
        this.script = script;
        this.dataFlow = dataFlow;
    }
}
