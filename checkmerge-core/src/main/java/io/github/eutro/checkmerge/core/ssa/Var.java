package io.github.eutro.checkmerge.core.ssa;

import io.github.eutro.checkmerge.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

/**
 * A variable, holding the result of an instruction.
 * <p>
 * Variables are compared by identity, and names need not be unique. IR built from
 * bytecode may assign the same variable in more than one place (see {@link Function}).
 */
public final class Var extends ExtHolder {
    /**
     * The name of the variable, for display only.
     */
    public final String name;
    @Nullable Effect definition;

    Var(String name) {
        this.name = name;
    }

    /**
     * Get the effect that assigns this variable. If several do, this is the one created last.
     *
     * @return The effect, or null if nothing assigns it.
     */
    public @Nullable Effect getDefinition() {
        return definition;
    }

    @Override
    public String toString() {
        return "$" + name;
    }
}
