package io.github.eutro.scriptlift.core.util;

import java.util.function.Supplier;

/**
 * A lazily-initialized value, computed at most once.
 * <p>
 * Unlike a plain memoizing supplier, this may be shared between threads:
 * concurrent first calls to {@link #get()} block until one of them has computed the value.
 *
 * @param <T> The type of the value.
 */
public final class Lazy<T> implements Supplier<T> {
    private Supplier<? extends T> thunk;
    private T value;

    private Lazy(Supplier<? extends T> thunk) {
        this.thunk = thunk;
    }

    /**
     * Create a lazily-initialized value.
     *
     * @param thunk The function that produces the value.
     * @param <T>   The type of the value.
     * @return The lazily-initialized value.
     */
    public static <T> Lazy<T> lazy(Supplier<? extends T> thunk) {
        return new Lazy<>(thunk);
    }

    /**
     * Get the value, possibly initializing it.
     *
     * @return The value.
     */
    @Override
    public synchronized T get() {
        if (thunk != null) {
            value = thunk.get();
            thunk = null;
        }
        return value;
    }

    /**
     * Get whether the value has already been computed.
     *
     * @return Whether the value has been computed.
     */
    public synchronized boolean isComputed() {
        return thunk == null;
    }
}
