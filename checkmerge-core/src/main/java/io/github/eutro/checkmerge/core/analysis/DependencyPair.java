package io.github.eutro.checkmerge.core.analysis;

import io.github.eutro.checkmerge.core.ssa.BasicBlock;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link Dependency}, with the block it was found in if it was found by a non-local query.
 */
public final class DependencyPair {
    public final Dependency dependency;
    public final @Nullable BasicBlock block;

    public DependencyPair(Dependency dependency, @Nullable BasicBlock block) {
        this.dependency = dependency;
        this.block = block;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencyPair)) return false;
        DependencyPair that = (DependencyPair) o;
        return dependency.equals(that.dependency) && block == that.block;
    }

    @Override
    public int hashCode() {
        return 31 * dependency.hashCode() + System.identityHashCode(block);
    }

    @Override
    public String toString() {
        return block == null ? dependency.toString() : dependency + " in " + block.toTargetString();
    }
}
