package io.github.eutro.checkmerge.core.ssa;

import io.github.eutro.checkmerge.core.ext.DelegatingExtHolder;
import io.github.eutro.checkmerge.core.ext.ExtContainer;
import org.jetbrains.annotations.Nullable;

/**
 * The place of an {@link Insn} in a {@link BasicBlock}: one of its {@link Effect effects},
 * or its {@link Control control}.
 * <p>
 * Exts not attached to the member itself are looked up on its instruction.
 */
public abstract class BlockMember extends DelegatingExtHolder {
    private Insn insn;
    @Nullable BasicBlock block;

    BlockMember(Insn insn) {
        setInsn(insn);
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    /**
     * Get the instruction in this place.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Put another instruction in this place. The old instruction is left without a block.
     *
     * @param insn The new instruction.
     */
    public void setInsn(Insn insn) {
        if (this.insn != null && this.insn.member == this) {
            this.insn.member = null;
        }
        insn.member = this;
        this.insn = insn;
    }

    /**
     * Get the block this is part of.
     *
     * @return The block, or null if it has not been added to one.
     */
    public @Nullable BasicBlock getBlock() {
        return block;
    }
}
