package io.github.eutro.checkmerge.core.ssa;

import io.github.eutro.checkmerge.core.ops.CommonOps;

import java.util.Collections;
import java.util.List;

/**
 * The instruction that ends a {@link BasicBlock}, and the blocks it may jump to.
 * <p>
 * How the targets are chosen depends on the operation: a conditional branch lists the
 * taken target first, a switch lists its cases and then its default.
 */
public final class Control extends BlockMember {
    /**
     * The blocks this may jump to, unmodifiable.
     */
    public final List<BasicBlock> targets;

    Control(Insn insn, List<BasicBlock> targets) {
        super(insn);
        this.targets = Collections.unmodifiableList(targets);
    }

    /**
     * Create an unconditional jump.
     *
     * @param target The block to jump to.
     * @return The control.
     */
    public static Control br(BasicBlock target) {
        return CommonOps.BR.insn().jumpsTo(target);
    }

    @Override
    public String toString() {
        if (targets.isEmpty()) return insn().toString();
        StringBuilder sb = new StringBuilder(insn().toString()).append(" ->");
        for (BasicBlock target : targets) {
            sb.append(' ').append(target.toTargetString());
        }
        return sb.toString();
    }
}
