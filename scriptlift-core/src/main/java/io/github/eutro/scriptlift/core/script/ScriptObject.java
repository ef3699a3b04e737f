package io.github.eutro.scriptlift.core.script;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * An opaque script-bearing object, as exposed by a host.
 * <p>
 * Any accessor may throw if the host refuses access; callers treat such failures as missing data.
 */
public interface ScriptObject {
    /**
     * Get a string that identifies this object within its host, e.g. its full path.
     *
     * @return The identity.
     */
    @NotNull
    String getIdentity();

    /**
     * Get the readable source text of this object.
     *
     * @return The text, or null if the host exposes none.
     */
    @Nullable
    String getSource();

    /**
     * Get the host class name of this object, e.g. {@code "ModuleScript"}.
     *
     * @return The class name.
     */
    @NotNull
    String getClassName();

    @NotNull
    String getName();

    @Nullable
    default ScriptObject getParent() {
        return null;
    }

    /**
     * Get the names of the properties a metadata snapshot should try to read.
     *
     * @return The property names.
     */
    default List<String> getPropertyNames() {
        return Collections.emptyList();
    }

    /**
     * Read a property.
     *
     * @param name The name of the property.
     * @return The value of the property.
     * @throws RuntimeException if the property cannot be read.
     */
    @Nullable
    default Object getProperty(String name) {
        throw new IllegalArgumentException("no property " + name);
    }

    default List<? extends ScriptObject> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Get whether this object holds a script, as opposed to being a plain container.
     *
     * @return Whether this object should be decompiled.
     */
    boolean isScript();
}
