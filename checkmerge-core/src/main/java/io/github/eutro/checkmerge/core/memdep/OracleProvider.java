package io.github.eutro.checkmerge.core.memdep;

import io.github.eutro.checkmerge.core.ssa.Function;
import org.jetbrains.annotations.Nullable;

/**
 * Obtains a {@link MemoryDependenceOracle} for a function.
 */
@FunctionalInterface
public interface OracleProvider {
    /**
     * Get the oracle for a function.
     *
     * @param func The function.
     * @return The oracle, or null if none is available for the function.
     */
    @Nullable MemoryDependenceOracle getOracle(Function func);
}
