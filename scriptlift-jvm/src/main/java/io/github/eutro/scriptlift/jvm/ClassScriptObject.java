package io.github.eutro.scriptlift.jvm;

import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A compiled JVM class, seen as a script.
 * <p>
 * The identity of the script is the binary name of the class. Nested classes are its children.
 */
public class ClassScriptObject implements ScriptObject {
    public static final String CLASS_NAME = "JvmClass";

    private static final List<String> PROPERTY_NAMES = Collections.unmodifiableList(Arrays.asList(
            "Modifiers",
            "Superclass"
    ));

    private final Class<?> type;
    @Nullable
    private final String source;

    public ClassScriptObject(Class<?> type) {
        this(type, null);
    }

    /**
     * Wrap a class, along with source text it was compiled from.
     *
     * @param type   The class.
     * @param source The source text, or null if none is known.
     */
    public ClassScriptObject(Class<?> type, @Nullable String source) {
        this.type = type;
        this.source = source;
    }

    public Class<?> getType() {
        return type;
    }

    @Override
    public @NotNull String getIdentity() {
        return type.getName();
    }

    @Override
    public @Nullable String getSource() {
        return source;
    }

    @Override
    public @NotNull String getClassName() {
        return CLASS_NAME;
    }

    @Override
    public @NotNull String getName() {
        String name = type.getName();
        return name.substring(name.lastIndexOf('.') + 1);
    }

    @Override
    public @Nullable ScriptObject getParent() {
        Class<?> outer = type.getDeclaringClass();
        return outer == null ? null : new ClassScriptObject(outer);
    }

    @Override
    public List<String> getPropertyNames() {
        return PROPERTY_NAMES;
    }

    @Override
    public @Nullable Object getProperty(String name) {
        switch (name) {
            case "Modifiers":
                return Modifier.toString(type.getModifiers());
            case "Superclass":
                Class<?> superclass = type.getSuperclass();
                return superclass == null ? null : superclass.getName();
            default:
                return ScriptObject.super.getProperty(name);
        }
    }

    @Override
    public List<? extends ScriptObject> getChildren() {
        List<ClassScriptObject> children = new ArrayList<>();
        for (Class<?> nested : type.getDeclaredClasses()) {
            children.add(new ClassScriptObject(nested));
        }
        return children;
    }

    @Override
    public boolean isScript() {
        return !type.isPrimitive() && !type.isArray();
    }

    @Override
    public String toString() {
        return "ClassScriptObject{" + type.getName() + "}";
    }
}
