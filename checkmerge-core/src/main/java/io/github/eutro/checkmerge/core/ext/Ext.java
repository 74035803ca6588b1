package io.github.eutro.checkmerge.core.ext;

/**
 * A key under which a value of type {@code T} can be attached to an {@link ExtContainer}.
 * <p>
 * Keys are compared by identity, so each should be created once and kept in a
 * static field, as in {@link MemoryExts} and {@link DebugExts}.
 *
 * @param <T> The type of the attached values.
 */
public final class Ext<T> {
    private final String name;
    private final Class<?> type;

    private Ext(String name, Class<?> type) {
        this.name = name;
        this.type = type;
    }

    /**
     * Create a new key.
     *
     * @param type The class of the values, which may be the raw class of a generic type.
     * @param name The name of the key, for debugging.
     * @param <T>  The type of the values.
     * @return The key.
     */
    public static <T> Ext<T> create(Class<? super T> type, String name) {
        return new Ext<>(name, type);
    }

    @Override
    public String toString() {
        return name + " (" + type.getSimpleName() + ")";
    }
}
