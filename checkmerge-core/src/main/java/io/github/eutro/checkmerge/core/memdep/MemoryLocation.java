package io.github.eutro.checkmerge.core.memdep;

import io.github.eutro.checkmerge.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A description of the memory an instruction touches.
 * <p>
 * Stack slots are only reachable through the address their {@code alloca} returns,
 * so they never alias anything but the same slot. Everything else is on the heap,
 * and is only told apart by field name, or by identical base and index variables.
 */
public final class MemoryLocation {
    /**
     * The kind of memory.
     */
    public enum Kind {
        /**
         * A stack slot, keyed by its address.
         */
        SLOT,
        /**
         * An instance field, keyed by its object and name.
         */
        FIELD,
        /**
         * A static field, keyed by its name.
         */
        STATIC,
        /**
         * An array element, keyed by its array and index.
         */
        ARRAY,
    }

    public final Kind kind;
    public final @Nullable Var base;
    public final @Nullable String key;
    public final @Nullable Var index;

    private MemoryLocation(Kind kind, @Nullable Var base, @Nullable String key, @Nullable Var index) {
        this.kind = kind;
        this.base = base;
        this.key = key;
        this.index = index;
    }

    /**
     * The stack slot at an address.
     *
     * @param address The result of the slot's {@code alloca}.
     * @return The location.
     */
    public static MemoryLocation slot(Var address) {
        return new MemoryLocation(Kind.SLOT, address, null, null);
    }

    /**
     * A field of an object.
     *
     * @param object The object.
     * @param key    The owner, name and descriptor of the field.
     * @return The location.
     */
    public static MemoryLocation field(Var object, String key) {
        return new MemoryLocation(Kind.FIELD, object, key, null);
    }

    /**
     * A static field.
     *
     * @param key The owner, name and descriptor of the field.
     * @return The location.
     */
    public static MemoryLocation staticField(String key) {
        return new MemoryLocation(Kind.STATIC, null, key, null);
    }

    /**
     * An element of an array.
     *
     * @param array The array.
     * @param index The index.
     * @return The location.
     */
    public static MemoryLocation arrayElement(Var array, Var index) {
        return new MemoryLocation(Kind.ARRAY, array, null, index);
    }

    /**
     * Check whether this location may be the same memory as another.
     *
     * @param other The other location, or null if it is unknown.
     * @return The alias result.
     */
    public AliasResult alias(@Nullable MemoryLocation other) {
        if (other == null) {
            return kind == Kind.SLOT ? AliasResult.NO : AliasResult.MAY;
        }
        if (kind != other.kind) return AliasResult.NO;
        switch (kind) {
            case SLOT:
                return base == other.base ? AliasResult.MUST : AliasResult.NO;
            case STATIC:
                return Objects.equals(key, other.key) ? AliasResult.MUST : AliasResult.NO;
            case FIELD:
                if (!Objects.equals(key, other.key)) return AliasResult.NO;
                return base == other.base ? AliasResult.MUST : AliasResult.MAY;
            case ARRAY:
                return base == other.base && index == other.index ? AliasResult.MUST : AliasResult.MAY;
            default:
                throw new IllegalStateException();
        }
    }

    /**
     * Check whether two locations may be the same memory.
     *
     * @param a The first location, or null if it is unknown.
     * @param b The second location, or null if it is unknown.
     * @return The alias result.
     */
    public static AliasResult alias(@Nullable MemoryLocation a, @Nullable MemoryLocation b) {
        if (a == null) {
            return b == null ? AliasResult.MAY : b.alias(null);
        }
        return a.alias(b);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SLOT:
                return "slot " + base;
            case FIELD:
                return base + "." + key;
            case STATIC:
                return "static " + key;
            default:
                return base + "[" + index + "]";
        }
    }
}
