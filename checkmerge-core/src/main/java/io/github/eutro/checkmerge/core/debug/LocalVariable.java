package io.github.eutro.checkmerge.core.debug;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A variable of the source program, as named in its debug information.
 */
public final class LocalVariable {
    /**
     * The name of the variable in the source.
     */
    public final String name;
    /**
     * The file the variable is declared in.
     */
    public final String file;
    /**
     * The line the variable is declared on, or 0 if unknown.
     */
    public final int line;
    /**
     * The local variable slot holding the variable.
     */
    public final int slot;
    /**
     * The type descriptor of the variable, if known.
     */
    public final @Nullable String desc;

    /**
     * Construct a source variable.
     *
     * @param name The name.
     * @param file The declaring file.
     * @param line The declaring line, or 0.
     * @param slot The local variable slot.
     * @param desc The type descriptor, or null.
     */
    public LocalVariable(String name, String file, int line, int slot, @Nullable String desc) {
        this.name = name;
        this.file = file;
        this.line = line;
        this.slot = slot;
        this.desc = desc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocalVariable)) return false;
        LocalVariable that = (LocalVariable) o;
        return line == that.line
                && slot == that.slot
                && name.equals(that.name)
                && file.equals(that.file)
                && Objects.equals(desc, that.desc);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, file, line, slot, desc);
    }

    @Override
    public String toString() {
        return name + "@" + file + ":" + line;
    }
}
