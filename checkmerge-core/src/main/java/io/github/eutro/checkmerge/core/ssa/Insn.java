package io.github.eutro.checkmerge.core.ssa;

import io.github.eutro.checkmerge.core.ext.DelegatingExtHolder;
import io.github.eutro.checkmerge.core.ext.ExtContainer;
import io.github.eutro.checkmerge.core.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An instruction: an {@link Op operation} applied to a list of argument {@link Var variables}.
 * <p>
 * Instructions are compared by identity. They only become part of a {@link BasicBlock}
 * once wrapped in an {@link Effect} or {@link Control}.
 */
public final class Insn extends DelegatingExtHolder implements Iterable<Var> {
    /**
     * The operation of this instruction.
     */
    public Op op;
    private final List<Var> args;
    @Nullable BlockMember member;

    /**
     * Construct an instruction.
     *
     * @param op   The operation.
     * @param args The arguments. The list is copied.
     */
    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    /**
     * Construct an instruction.
     *
     * @param op   The operation.
     * @param args The arguments.
     */
    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    /**
     * Assign the results of this instruction to some variables.
     *
     * @param vars The variables.
     * @return The effect.
     */
    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    /**
     * Assign the results of this instruction to some variables.
     *
     * @param vars The variables.
     * @return The effect.
     */
    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    /**
     * Make this instruction the control instruction for a block, jumping to the given targets.
     *
     * @param targets The jump targets.
     * @return The control instruction.
     */
    public Control jumpsTo(BasicBlock... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    /**
     * Make this instruction the control instruction for a block, jumping to the given targets.
     *
     * @param targets The jump targets.
     * @return The control instruction.
     */
    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, new ArrayList<>(targets));
    }

    /**
     * Get the arguments of this instruction.
     *
     * @return The arguments, as a mutable list.
     */
    public List<Var> args() {
        return args;
    }

    /**
     * Get the variables this instruction's results are assigned to.
     *
     * @return The variables, empty if this is not part of an effect.
     */
    public List<Var> getAssignsTo() {
        return member instanceof Effect ? ((Effect) member).getAssignsTo() : Collections.emptyList();
    }

    /**
     * Get the basic block this instruction is in.
     *
     * @return The block, or null if this is not (yet) in one.
     */
    public @Nullable BasicBlock getBlock() {
        return member == null ? null : member.getBlock();
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args.iterator();
    }
}
