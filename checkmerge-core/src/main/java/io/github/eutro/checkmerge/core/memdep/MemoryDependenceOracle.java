package io.github.eutro.checkmerge.core.memdep;

import io.github.eutro.checkmerge.core.ssa.Insn;

import java.util.List;

/**
 * Answers which earlier instructions a memory-touching instruction may depend on.
 * <p>
 * An oracle is obtained for one function, through an {@link OracleProvider}, and may
 * only be asked about that function's instructions. Any method may throw
 * {@link OracleUnavailableException} if the analysis cannot be done after all.
 */
public interface MemoryDependenceOracle {
    /**
     * Find the dependency of an instruction within its own block.
     *
     * @param insn The instruction.
     * @return The dependency, which is {@link MemDepResult#isNonLocal() non-local} if
     * it lies outside the block.
     */
    MemDepResult getDependency(Insn insn);

    /**
     * Find the dependencies of a call-like instruction in the blocks before its own.
     *
     * @param insn The instruction.
     * @return One entry per block where a dependency was found.
     */
    List<NonLocalDepEntry> getNonLocalCallDependency(Insn insn);

    /**
     * Find the dependencies of a load, store or similar instruction in the blocks before its own.
     *
     * @param insn The instruction.
     * @return One entry per block where a dependency was found.
     */
    List<NonLocalDepEntry> getNonLocalPointerDependency(Insn insn);
}
