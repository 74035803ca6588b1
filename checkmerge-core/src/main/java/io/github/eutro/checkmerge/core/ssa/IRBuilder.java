package io.github.eutro.checkmerge.core.ssa;

import io.github.eutro.checkmerge.core.debug.SourceLocation;
import io.github.eutro.checkmerge.core.ext.DebugExts;
import org.jetbrains.annotations.Nullable;

/**
 * Appends instructions to a block of a function, stamping each with the current
 * source line as it goes.
 * <p>
 * An instruction that already has a {@link DebugExts#LOCATION} keeps it.
 */
public class IRBuilder {
    public final Function func;
    private BasicBlock block;
    private @Nullable SourceLocation location;

    public IRBuilder(Function func, BasicBlock block) {
        this.func = func;
        this.block = block;
    }

    public BasicBlock getBlock() {
        return block;
    }

    /**
     * Move to the end of another block of the same function.
     *
     * @param block The block.
     */
    public void setBlock(BasicBlock block) {
        this.block = block;
    }

    public @Nullable SourceLocation getLocation() {
        return location;
    }

    /**
     * Change the location given to instructions appended from now on.
     *
     * @param location The location, or null for none.
     */
    public void setLocation(@Nullable SourceLocation location) {
        this.location = location;
    }

    private void stamp(Insn insn) {
        if (location != null && insn.getNullable(DebugExts.LOCATION) == null) {
            insn.attachExt(DebugExts.LOCATION, location);
        }
    }

    public Effect insert(Effect effect) {
        stamp(effect.insn());
        block.addEffect(effect);
        return effect;
    }

    /**
     * Append an instruction whose result, if any, is unused.
     *
     * @param insn The instruction.
     * @return The instruction.
     */
    public Insn insert(Insn insn) {
        insert(insn.assignTo());
        return insn;
    }

    /**
     * Append an instruction, binding its result.
     *
     * @param insn The instruction.
     * @param into The variable to bind.
     * @return {@code into}.
     */
    public Var insert(Insn insn, Var into) {
        insert(insn.assignTo(into));
        return into;
    }

    /**
     * Append an instruction, binding its result to a fresh variable.
     *
     * @param insn The instruction.
     * @param name The name of the variable.
     * @return The variable.
     */
    public Var insert(Insn insn, String name) {
        return insert(insn, func.newVar(name));
    }

    /**
     * Terminate the current block.
     *
     * @param ctrl The control.
     */
    public void insertCtrl(Control ctrl) {
        stamp(ctrl.insn());
        block.setControl(ctrl);
    }
}
