package io.github.eutro.scriptlift.core.script;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A plain in-memory {@link ScriptObject}, built with {@link #builder(String)}.
 * <p>
 * Children built with {@link Builder#child(SimpleScriptObject.Builder)} get this object as their parent.
 */
public final class SimpleScriptObject implements ScriptObject {
    private final String name;
    private final String className;
    private final boolean script;
    private final Supplier<String> source;
    private final Map<String, Supplier<?>> properties;
    private final List<SimpleScriptObject> children;
    @Nullable
    private SimpleScriptObject parent;

    private SimpleScriptObject(Builder builder) {
        name = builder.name;
        className = builder.className;
        script = builder.script;
        source = builder.source;
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        List<SimpleScriptObject> kids = new ArrayList<>();
        for (Builder child : builder.children) {
            SimpleScriptObject built = child.build();
            built.parent = this;
            kids.add(built);
        }
        children = Collections.unmodifiableList(kids);
    }

    /**
     * Create a builder for a script object.
     *
     * @param name The name of the object.
     * @return The builder.
     */
    @Contract(pure = true)
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Create a script with the given text, of class {@code "ModuleScript"}.
     *
     * @param name   The name.
     * @param source The text.
     * @return The script.
     */
    public static SimpleScriptObject ofSource(String name, @Nullable String source) {
        return builder(name).source(source).build();
    }

    @Override
    public @NotNull String getIdentity() {
        StringBuilder sb = new StringBuilder(name);
        for (SimpleScriptObject p = parent; p != null; p = p.parent) {
            sb.insert(0, '.').insert(0, p.name);
        }
        return sb.toString();
    }

    @Override
    public @Nullable String getSource() {
        return source.get();
    }

    @Override
    public @NotNull String getClassName() {
        return className;
    }

    @Override
    public @NotNull String getName() {
        return name;
    }

    @Override
    public @Nullable ScriptObject getParent() {
        return parent;
    }

    @Override
    public List<String> getPropertyNames() {
        return new ArrayList<>(properties.keySet());
    }

    @Override
    public @Nullable Object getProperty(String name) {
        Supplier<?> getter = properties.get(name);
        if (getter == null) throw new IllegalArgumentException("no property " + name);
        return getter.get();
    }

    @Override
    public List<SimpleScriptObject> getChildren() {
        return children;
    }

    @Override
    public boolean isScript() {
        return script;
    }

    @Override
    public String toString() {
        return className + " " + getIdentity();
    }

    /**
     * A builder for {@link SimpleScriptObject}s.
     */
    public static final class Builder {
        private final String name;
        private String className = "ModuleScript";
        private boolean script = true;
        private Supplier<String> source = () -> null;
        private final Map<String, Supplier<?>> properties = new LinkedHashMap<>();
        private final List<Builder> children = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder className(String className) {
            this.className = Objects.requireNonNull(className, "className");
            return this;
        }

        /**
         * Set whether the object is a script. Objects are scripts by default.
         *
         * @param script Whether the object is a script.
         * @return This builder.
         */
        public Builder script(boolean script) {
            this.script = script;
            return this;
        }

        public Builder source(@Nullable String source) {
            this.source = () -> source;
            return this;
        }

        /**
         * Set a computed source accessor, which may throw to simulate a host refusing access.
         *
         * @param source The accessor.
         * @return This builder.
         */
        public Builder source(Supplier<String> source) {
            this.source = Objects.requireNonNull(source, "source");
            return this;
        }

        public Builder property(String name, @Nullable Object value) {
            properties.put(name, () -> value);
            return this;
        }

        /**
         * Add a computed property, which may throw.
         *
         * @param name   The name of the property.
         * @param getter The getter.
         * @return This builder.
         */
        public Builder computedProperty(String name, Supplier<?> getter) {
            properties.put(name, Objects.requireNonNull(getter, "getter"));
            return this;
        }

        public Builder child(Builder child) {
            children.add(child);
            return this;
        }

        public SimpleScriptObject build() {
            return new SimpleScriptObject(this);
        }
    }
}
