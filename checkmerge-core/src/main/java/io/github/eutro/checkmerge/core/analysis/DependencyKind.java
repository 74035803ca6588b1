package io.github.eutro.checkmerge.core.analysis;

import io.github.eutro.checkmerge.core.memdep.MemDepResult;

/**
 * How strong, and how local, a memory dependency is.
 */
public enum DependencyKind {
    /**
     * The target may have changed the memory, but it is not known how.
     */
    CLOBBER("clobber"),
    /**
     * The target exactly defines the memory.
     */
    DEF("def"),
    /**
     * The dependency lies outside the function.
     */
    NON_FUNC_LOCAL("non-local"),
    /**
     * Nothing conclusive is known.
     */
    UNKNOWN("unknown"),
    ;

    /**
     * The name of this kind in reports.
     */
    public final String label;

    DependencyKind(String label) {
        this.label = label;
    }

    /**
     * Classify an oracle result. If more than one flag is set,
     * clobber is checked first, then def, then non-func-local.
     *
     * @param result The result.
     * @return The kind.
     */
    public static DependencyKind classify(MemDepResult result) {
        if (result.isClobber()) return CLOBBER;
        if (result.isDef()) return DEF;
        if (result.isNonFuncLocal()) return NON_FUNC_LOCAL;
        return UNKNOWN;
    }
}
