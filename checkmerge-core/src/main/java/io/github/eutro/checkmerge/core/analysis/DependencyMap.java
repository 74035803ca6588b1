package io.github.eutro.checkmerge.core.analysis;

import io.github.eutro.checkmerge.core.ssa.Insn;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The dependencies of every instruction the oracle was asked about, in program order.
 * <p>
 * An instruction that is not a key was not asked about, which is not the same as
 * having no dependencies. Only the collector adds entries.
 */
public final class DependencyMap {
    private final Map<Insn, DependencySet> map = new LinkedHashMap<>();

    /**
     * Get the dependencies of an instruction, creating an empty set if there are none.
     *
     * @param insn The instruction.
     * @return The set.
     */
    DependencySet getOrCreate(Insn insn) {
        return map.computeIfAbsent(insn, $ -> new DependencySet());
    }

    /**
     * Get the dependencies of an instruction.
     *
     * @param insn The instruction.
     * @return The set, or null if the instruction was not asked about.
     */
    public @Nullable DependencySet get(Insn insn) {
        return map.get(insn);
    }

    /**
     * Get whether an instruction was asked about.
     *
     * @param insn The instruction.
     * @return Whether it is a key.
     */
    public boolean containsKey(Insn insn) {
        return map.containsKey(insn);
    }

    /**
     * Get the instructions that were asked about.
     *
     * @return The instructions, in program order.
     */
    public Set<Insn> keySet() {
        return Collections.unmodifiableSet(map.keySet());
    }

    /**
     * Get the number of instructions that were asked about.
     *
     * @return The count.
     */
    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    /**
     * Get the number of instructions with at least one dependency.
     *
     * @return The count.
     */
    public int dependentInstructions() {
        int count = 0;
        for (DependencySet set : map.values()) {
            if (!set.isEmpty()) count++;
        }
        return count;
    }

    /**
     * Get the number of dependencies across all instructions.
     *
     * @return The sum of the sizes of all sets.
     */
    public int totalDependencies() {
        int total = 0;
        for (DependencySet set : map.values()) {
            total += set.size();
        }
        return total;
    }
}
