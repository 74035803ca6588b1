package io.github.eutro.checkmerge.core.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An instruction whose results, if any, are assigned to variables, and which falls
 * through to the next instruction of its block.
 */
public final class Effect extends BlockMember {
    private final List<Var> assignsTo;

    Effect(List<Var> assignsTo, Insn insn) {
        super(insn);
        this.assignsTo = Collections.unmodifiableList(new ArrayList<>(assignsTo));
        for (Var var : this.assignsTo) {
            var.definition = this;
        }
    }

    /**
     * Get the variables this effect assigns to.
     *
     * @return The variables, unmodifiable.
     */
    public List<Var> getAssignsTo() {
        return assignsTo;
    }

    @Override
    public String toString() {
        if (assignsTo.isEmpty()) return insn().toString();
        StringBuilder sb = new StringBuilder();
        for (Var var : assignsTo) {
            if (sb.length() != 0) sb.append(", ");
            sb.append(var);
        }
        return sb.append(" = ").append(insn()).toString();
    }
}
