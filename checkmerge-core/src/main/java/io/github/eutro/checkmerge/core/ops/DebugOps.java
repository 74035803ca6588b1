package io.github.eutro.checkmerge.core.ops;

import io.github.eutro.checkmerge.core.debug.LocalVariable;

/**
 * Debug intrinsics, which describe the program for the reader and have no effect on its execution.
 */
public class DebugOps {
    /**
     * Effect: declares that its argument is the address of the given source variable.
     */
    public static final UnaryOpKey<LocalVariable> DECLARE = new UnaryOpKey<>("dbg.declare");
    /**
     * Effect: declares that the source variable currently holds its argument.
     */
    public static final UnaryOpKey<LocalVariable> VALUE = new UnaryOpKey<>("dbg.value");
}
