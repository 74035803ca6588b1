package io.github.eutro.checkmerge.core.ext;

import io.github.eutro.checkmerge.core.debug.DebugSubprogram;
import io.github.eutro.checkmerge.core.debug.SourceLocation;
import io.github.eutro.checkmerge.core.ssa.Function;
import io.github.eutro.checkmerge.core.ssa.Insn;

/**
 * A collection of {@link Ext}s carrying source-level debug information.
 */
public class DebugExts {
    /**
     * Attached to an {@link Insn}. The source location the instruction was generated from.
     */
    public static final Ext<SourceLocation> LOCATION = Ext.create(SourceLocation.class, "LOCATION");

    /**
     * Attached to a {@link Function}. The source-level description of the function.
     */
    public static final Ext<DebugSubprogram> SUBPROGRAM = Ext.create(DebugSubprogram.class, "SUBPROGRAM");
}
