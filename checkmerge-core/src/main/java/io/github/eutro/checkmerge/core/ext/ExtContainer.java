package io.github.eutro.checkmerge.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * Something that values can be attached to by {@link Ext}.
 * <p>
 * At most one value is attached per key. Attaching again replaces the value.
 */
public interface ExtContainer {
    /**
     * Attach a value, replacing any already attached under the same key.
     *
     * @param ext   The key.
     * @param value The value.
     * @param <T>   The type of the value.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value attached under a key, if any.
     *
     * @param ext The key.
     * @param <T> The type of the value.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value attached under a key.
     *
     * @param ext The key.
     * @param <T> The type of the value.
     * @return The value, or null if there is none.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value attached under a key, which must be present.
     *
     * @param ext The key.
     * @param <T> The type of the value.
     * @return The value.
     * @throws IllegalStateException If there is none.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException(ext + " is not attached to " + this);
        }
        return value;
    }

    /**
     * Get the value attached under a key, or a default.
     *
     * @param ext     The key.
     * @param orElse  The default.
     * @param <T>     The type of the value.
     * @return The value, or {@code orElse} if there is none.
     */
    default <T> T getExtOrDefault(Ext<T> ext, T orElse) {
        T value = getNullable(ext);
        return value == null ? orElse : value;
    }
}
