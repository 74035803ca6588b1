package io.github.eutro.checkmerge.core.memdep;

import io.github.eutro.checkmerge.core.ssa.BasicBlock;

/**
 * One answer of a non-local query: what the instruction depends on
 * along the paths through a given block.
 */
public final class NonLocalDepEntry {
    public final MemDepResult result;
    public final BasicBlock block;

    public NonLocalDepEntry(MemDepResult result, BasicBlock block) {
        this.result = result;
        this.block = block;
    }

    @Override
    public String toString() {
        return block.toTargetString() + ": " + result;
    }
}
