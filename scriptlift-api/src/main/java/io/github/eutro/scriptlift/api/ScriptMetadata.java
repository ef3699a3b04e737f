package io.github.eutro.scriptlift.api;

import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A snapshot of what the host reveals about a script, taken before decompiling it.
 */
public final class ScriptMetadata {
    private static final Logger logger = LoggerFactory.getLogger(ScriptMetadata.class);

    /**
     * What an accessor that throws is recorded as.
     */
    public static final String UNKNOWN = "<unknown>";

    private final String identity;
    private final String className;
    private final String name;
    @Nullable
    private final String parentName;
    private final Map<String, Object> properties;

    public ScriptMetadata(String identity,
                          String className,
                          String name,
                          @Nullable String parentName,
                          Map<String, Object> properties) {
        this.identity = identity;
        this.className = className;
        this.name = name;
        this.parentName = parentName;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Take a snapshot of a script. Accessors that throw are recorded as {@link #UNKNOWN},
     * and properties that throw are left out.
     *
     * @param script The script.
     * @return The snapshot.
     */
    @NotNull
    public static ScriptMetadata snapshot(ScriptObject script) {
        String identity = guard(script, "identity", script::getIdentity);
        String className = guard(script, "class name", script::getClassName);
        String name = guard(script, "name", script::getName);
        String parentName;
        try {
            ScriptObject parent = script.getParent();
            parentName = parent == null ? null : parent.getName();
        } catch (RuntimeException e) {
            logger.debug("Could not read parent of {}", identity, e);
            parentName = UNKNOWN;
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> names;
        try {
            names = script.getPropertyNames();
        } catch (RuntimeException e) {
            logger.debug("Could not list properties of {}", identity, e);
            names = Collections.emptyList();
        }
        for (String property : names) {
            try {
                properties.put(property, script.getProperty(property));
            } catch (RuntimeException e) {
                logger.debug("Skipping property {} of {}: {}", property, identity, e.toString());
            }
        }
        return new ScriptMetadata(identity, className, name, parentName, properties);
    }

    private interface Accessor {
        String get();
    }

    private static String guard(ScriptObject script, String what, Accessor accessor) {
        try {
            return accessor.get();
        } catch (RuntimeException e) {
            logger.debug("Could not read {} of {}", what, script, e);
            return UNKNOWN;
        }
    }

    public String getIdentity() {
        return identity;
    }

    public String getClassName() {
        return className;
    }

    public String getName() {
        return name;
    }

    /**
     * Get the name of the parent of the script.
     *
     * @return The name, or null if it has no parent.
     */
    @Nullable
    public String getParentName() {
        return parentName;
    }

    /**
     * Get the properties that could be read, in the order the host listed them.
     *
     * @return The properties. Values may be null.
     */
    public Map<String, Object> getProperties() {
        return properties;
    }

    @Override
    public String toString() {
        return className + " " + identity + (properties.isEmpty() ? "" : " " + properties);
    }
}
