package io.github.eutro.checkmerge.core.ops;

import io.github.eutro.checkmerge.core.ext.DelegatingExtHolder;
import io.github.eutro.checkmerge.core.ext.ExtContainer;
import io.github.eutro.checkmerge.core.ssa.Insn;
import io.github.eutro.checkmerge.core.ssa.Var;

import java.util.Arrays;
import java.util.List;

/**
 * What an {@link Insn} does: its {@link OpKey} plus any immediate operands.
 * <p>
 * Exts not attached to the op itself are looked up on its key, which is where
 * {@link io.github.eutro.checkmerge.core.ext.MemoryExts#MEMORY_ACCESS} lives.
 */
public class Op extends DelegatingExtHolder {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    /**
     * Apply this op to some variables.
     *
     * @param args The arguments.
     * @return A new instruction, in no block yet.
     */
    public Insn insn(Var... args) {
        return insn(Arrays.asList(args));
    }

    public Insn insn(List<Var> args) {
        return new Insn(this, args);
    }

    @Override
    public String toString() {
        return key.mnemonic;
    }
}
