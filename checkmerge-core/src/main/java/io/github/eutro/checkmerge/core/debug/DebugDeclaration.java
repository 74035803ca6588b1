package io.github.eutro.checkmerge.core.debug;

import io.github.eutro.checkmerge.core.ssa.Var;

/**
 * What a debug intrinsic says about a source variable.
 */
public final class DebugDeclaration {
    /**
     * The source variable.
     */
    public final LocalVariable variable;
    /**
     * The value the intrinsic tracks.
     */
    public final Var trackedValue;
    /**
     * Whether {@link #trackedValue} is the address of the variable,
     * rather than its current value.
     */
    public final boolean addressOf;

    /**
     * Construct a declaration.
     *
     * @param variable     The source variable.
     * @param trackedValue The tracked value.
     * @param addressOf    Whether the tracked value is the variable's address.
     */
    public DebugDeclaration(LocalVariable variable, Var trackedValue, boolean addressOf) {
        this.variable = variable;
        this.trackedValue = trackedValue;
        this.addressOf = addressOf;
    }

    @Override
    public String toString() {
        return (addressOf ? "declare " : "value ") + variable.name + " = " + trackedValue;
    }
}
