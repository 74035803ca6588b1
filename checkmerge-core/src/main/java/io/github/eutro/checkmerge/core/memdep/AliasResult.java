package io.github.eutro.checkmerge.core.memdep;

/**
 * Whether two {@link MemoryLocation}s may refer to the same memory.
 */
public enum AliasResult {
    /**
     * Never the same memory.
     */
    NO,
    /**
     * Possibly the same memory.
     */
    MAY,
    /**
     * Always the same memory.
     */
    MUST,
}
