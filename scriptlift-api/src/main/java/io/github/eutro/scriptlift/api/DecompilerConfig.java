package io.github.eutro.scriptlift.api;

import io.github.eutro.scriptlift.core.passes.meta.ComputeLiveVars;

import java.util.Locale;
import java.util.Properties;

/**
 * Options for a {@link Decompiler}.
 * <p>
 * Instances are immutable, and created with {@link #builder()}, {@link #defaults()}
 * or {@link #fromProperties(Properties)}.
 */
public final class DecompilerConfig {
    /**
     * Setting this environment variable, to any value, enables deep analysis in {@link #defaults()}.
     */
    public static final String DEEP_ANALYSIS_ENV = "SCRIPTLIFT_DEEP_ANALYSIS";
    /**
     * The prefix of the keys {@link #fromProperties(Properties)} reads.
     */
    public static final String PROPERTY_PREFIX = "scriptlift.";

    private final int maxDepth;
    private final boolean deepAnalysis;
    private final int iterationCap;
    private final long traceTimeoutMillis;
    private final int maxTraceSamples;

    private DecompilerConfig(Builder builder) {
        maxDepth = builder.maxDepth;
        deepAnalysis = builder.deepAnalysis;
        iterationCap = builder.iterationCap;
        traceTimeoutMillis = builder.traceTimeoutMillis;
        maxTraceSamples = builder.maxTraceSamples;
    }

    /**
     * Create a builder, with every option at its default.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the default configuration, taking deep analysis from the {@link #DEEP_ANALYSIS_ENV environment}.
     *
     * @return The configuration.
     */
    public static DecompilerConfig defaults() {
        return builder()
                .setDeepAnalysis(System.getenv(DEEP_ANALYSIS_ENV) != null)
                .build();
    }

    /**
     * Read a configuration from properties. Missing keys keep their defaults.
     *
     * @param props The properties, with keys like {@code scriptlift.maxDepth}.
     * @return The configuration.
     * @throws IllegalArgumentException if a value is malformed or out of range.
     */
    public static DecompilerConfig fromProperties(Properties props) {
        Builder builder = builder();
        String value;
        if ((value = get(props, "maxDepth")) != null) {
            builder.setMaxDepth(parseInt("maxDepth", value));
        }
        if ((value = get(props, "deepAnalysis")) != null) {
            builder.setDeepAnalysis(parseBoolean("deepAnalysis", value));
        }
        if ((value = get(props, "iterationCap")) != null) {
            builder.setIterationCap(parseInt("iterationCap", value));
        }
        if ((value = get(props, "traceTimeoutMillis")) != null) {
            builder.setTraceTimeoutMillis(parseLong("traceTimeoutMillis", value));
        }
        if ((value = get(props, "maxTraceSamples")) != null) {
            builder.setMaxTraceSamples(parseInt("maxTraceSamples", value));
        }
        return builder.build();
    }

    private static String get(Properties props, String key) {
        String value = props.getProperty(PROPERTY_PREFIX + key);
        return value == null ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PROPERTY_PREFIX + key + ": not an integer: " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PROPERTY_PREFIX + key + ": not an integer: " + value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new IllegalArgumentException(PROPERTY_PREFIX + key + ": not a boolean: " + value);
        }
    }

    /**
     * Get how deep {@link Decompiler#decompileTree} descends below its root.
     *
     * @return The maximum depth.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Get whether the host may be asked for execution traces.
     *
     * @return Whether deep analysis is enabled.
     */
    public boolean isDeepAnalysis() {
        return deepAnalysis;
    }

    public int getIterationCap() {
        return iterationCap;
    }

    public long getTraceTimeoutMillis() {
        return traceTimeoutMillis;
    }

    public int getMaxTraceSamples() {
        return maxTraceSamples;
    }

    /**
     * Create a builder initialized from this configuration.
     *
     * @return The builder.
     */
    public Builder toBuilder() {
        return builder()
                .setMaxDepth(maxDepth)
                .setDeepAnalysis(deepAnalysis)
                .setIterationCap(iterationCap)
                .setTraceTimeoutMillis(traceTimeoutMillis)
                .setMaxTraceSamples(maxTraceSamples);
    }

    @Override
    public String toString() {
        return "DecompilerConfig{" +
                "maxDepth=" + maxDepth +
                ", deepAnalysis=" + deepAnalysis +
                ", iterationCap=" + iterationCap +
                ", traceTimeoutMillis=" + traceTimeoutMillis +
                ", maxTraceSamples=" + maxTraceSamples +
                '}';
    }

    /**
     * A builder for {@link DecompilerConfig}s.
     */
    public static final class Builder {
        private int maxDepth = 20;
        private boolean deepAnalysis = false;
        private int iterationCap = ComputeLiveVars.DEFAULT_ITERATION_CAP;
        private long traceTimeoutMillis = 2000;
        private int maxTraceSamples = 1000;

        private Builder() {
        }

        /**
         * Set how deep tree decompilation descends. 0 decompiles only the root. Defaults to 20.
         *
         * @param maxDepth The depth, non-negative.
         * @return This builder, for convenience.
         */
        public Builder setMaxDepth(int maxDepth) {
            if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
            this.maxDepth = maxDepth;
            return this;
        }

        /**
         * Set whether the host may be asked for execution traces. Off by default.
         *
         * @param deepAnalysis Whether to enable deep analysis.
         * @return This builder, for convenience.
         */
        public Builder setDeepAnalysis(boolean deepAnalysis) {
            this.deepAnalysis = deepAnalysis;
            return this;
        }

        /**
         * Set the most rounds liveness analysis may run. Defaults to 100.
         *
         * @param iterationCap The cap, positive.
         * @return This builder, for convenience.
         */
        public Builder setIterationCap(int iterationCap) {
            if (iterationCap < 1) throw new IllegalArgumentException("iterationCap must be positive: " + iterationCap);
            this.iterationCap = iterationCap;
            return this;
        }

        public Builder setTraceTimeoutMillis(long traceTimeoutMillis) {
            if (traceTimeoutMillis < 1) {
                throw new IllegalArgumentException("traceTimeoutMillis must be positive: " + traceTimeoutMillis);
            }
            this.traceTimeoutMillis = traceTimeoutMillis;
            return this;
        }

        public Builder setMaxTraceSamples(int maxTraceSamples) {
            if (maxTraceSamples < 1) {
                throw new IllegalArgumentException("maxTraceSamples must be positive: " + maxTraceSamples);
            }
            this.maxTraceSamples = maxTraceSamples;
            return this;
        }

        public DecompilerConfig build() {
            return new DecompilerConfig(this);
        }
    }
}
