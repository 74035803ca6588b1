package io.github.eutro.checkmerge.core.ssa;

import io.github.eutro.checkmerge.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block: a run of {@link Effect effects} ended by one {@link Control}.
 * <p>
 * A block knows the {@link Function} it was added to, and its members know the block.
 * Replacing the control of a block in a function invalidates that function's metadata.
 */
public final class BasicBlock extends ExtHolder {
    private final @Nullable String name;
    private final TrackedList<Effect> effects = new TrackedList<Effect>() {
        @Override
        protected void onAdded(Effect elt) {
            elt.block = BasicBlock.this;
        }

        @Override
        protected void onRemoved(Effect elt) {
            if (elt.block == BasicBlock.this) elt.block = null;
        }
    };
    private @Nullable Control control;
    @Nullable Function function;

    BasicBlock(@Nullable String name) {
        this.name = name;
    }

    public @Nullable String getName() {
        return name;
    }

    /**
     * Get the function this block belongs to.
     *
     * @return The function, or null if the block was removed from it.
     */
    public @Nullable Function getFunction() {
        return function;
    }

    /**
     * Render this block as a jump target: {@code %name}, or its identity hash if unnamed.
     *
     * @return The target string.
     */
    public String toTargetString() {
        return name != null ? "%" + name : String.format("@%08x", System.identityHashCode(this));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(toTargetString()).append(" {\n");
        for (Effect effect : effects) {
            sb.append("  ").append(effect).append('\n');
        }
        sb.append("  ").append(control == null ? "<unterminated>" : control).append("\n}");
        return sb.toString();
    }

    /**
     * Get the effects of this block. Adding to or removing from the list updates
     * the block of the effect.
     *
     * @return The live list.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    /**
     * Get the control at the end of this block.
     *
     * @return The control, null while the block is still being built.
     */
    public @Nullable Control getControl() {
        return control;
    }

    /**
     * Terminate this block, replacing any previous control.
     *
     * @param control The new control.
     */
    public void setControl(Control control) {
        if (this.control != null && this.control.block == this) {
            this.control.block = null;
        }
        this.control = control;
        control.block = this;
        if (function != null) {
            function.getMetadataState().graphChanged();
        }
    }

    /**
     * Get the instructions of this block in program order, the control's last.
     *
     * @return A fresh list.
     */
    public List<Insn> getInsns() {
        List<Insn> insns = new ArrayList<>(effects.size() + 1);
        for (Effect effect : effects) {
            insns.add(effect.insn());
        }
        if (control != null) {
            insns.add(control.insn());
        }
        return insns;
    }
}
