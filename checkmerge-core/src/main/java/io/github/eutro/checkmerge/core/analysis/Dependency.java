package io.github.eutro.checkmerge.core.analysis;

import io.github.eutro.checkmerge.core.ssa.Insn;
import org.jetbrains.annotations.Nullable;

/**
 * A classified dependency on an instruction, which may be absent
 * if the dependency is on something outside the IR, such as a function argument.
 */
public final class Dependency {
    public final @Nullable Insn target;
    public final DependencyKind kind;

    public Dependency(@Nullable Insn target, DependencyKind kind) {
        this.target = target;
        this.kind = kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dependency)) return false;
        Dependency that = (Dependency) o;
        return target == that.target && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(target) + kind.hashCode();
    }

    @Override
    public String toString() {
        return kind.label + " " + target;
    }
}
