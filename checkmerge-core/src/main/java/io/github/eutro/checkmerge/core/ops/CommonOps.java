package io.github.eutro.checkmerge.core.ops;

import io.github.eutro.checkmerge.core.ssa.Insn;

/**
 * Ops that any front end needs, independent of the bytecode they come from.
 */
public class CommonOps {
    /**
     * Control: jump to the only target.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Control: leave the function, returning the argument if there is one. No targets.
     */
    public static final Op RETURN = new SimpleOpKey("ret").create();

    /**
     * Effect: copy the argument. Used to merge stack values at block boundaries.
     */
    public static final Op IDENTITY = new SimpleOpKey("id").create();

    /**
     * Effect: the incoming parameter at the given index, {@code this} being 0 in instance methods.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg");
    /**
     * Effect: a literal value. {@code null} is allowed, for {@code aconst_null}.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const").nullable();

    public static Insn constant(Object value) {
        return CONST.create(value).insn();
    }
}
