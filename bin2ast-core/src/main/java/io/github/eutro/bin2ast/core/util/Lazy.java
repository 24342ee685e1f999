package io.github.eutro.bin2ast.core.util;

import java.util.function.Supplier;

/**
 * A lazily-initialized value.
 *
 * @param <T> The type of the value.
 */
public final class Lazy<T> implements Supplier<T> {
    private Supplier<T> thunk;
    private T value;

    private Lazy(Supplier<T> thunk) {
        this.thunk = thunk;
    }

    /**
     * Create a lazily-initialized value.
     *
     * @param thunk The function that produces the value.
     * @param <T>   The type of the value.
     * @return The lazily-initialized value.
     */
    public static <T> Lazy<T> lazy(Supplier<T> thunk) {
        return new Lazy<>(thunk);
    }

    /**
     * Get the value, possibly initializing it.
     *
     * @return The value.
     */
    @Override
    public T get() {
        if (thunk != null) {
            value = thunk.get();
            thunk = null;
        }
        return value;
    }

    /**
     * Get whether the value has already been computed.
     *
     * @return Whether the thunk has run.
     */
    public boolean isForced() {
        return thunk == null;
    }
}
