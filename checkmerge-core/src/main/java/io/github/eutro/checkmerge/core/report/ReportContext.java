package io.github.eutro.checkmerge.core.report;

import io.github.eutro.checkmerge.core.ssa.BasicBlock;
import io.github.eutro.checkmerge.core.ssa.Function;
import io.github.eutro.checkmerge.core.ssa.Insn;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The identifiers of the blocks and instructions of one function, for one rendering.
 * <p>
 * Instructions are numbered from zero in program order. Blocks are identified by name,
 * or by their position in the function if they have none. Named blocks claim their
 * identifiers first, and a clash gets a {@code ~n} suffix. Blocks of other functions
 * have no identifier.
 */
final class ReportContext {
    private final Map<Insn, Integer> insnIds = new IdentityHashMap<>();
    private final Map<BasicBlock, String> blockIds = new IdentityHashMap<>();

    ReportContext(Function func) {
        Set<String> taken = new HashSet<>();
        for (BasicBlock block : func.blocks) {
            String name = block.getName();
            if (name != null) blockIds.put(block, unique(taken, "block." + name));
        }
        int blockIdx = 0;
        for (BasicBlock block : func.blocks) {
            if (block.getName() == null) {
                blockIds.put(block, unique(taken, "block." + blockIdx));
            }
            blockIdx++;
            for (Insn insn : block.getInsns()) {
                insnIds.put(insn, insnIds.size());
            }
        }
    }

    private static String unique(Set<String> taken, String id) {
        String candidate = id;
        for (int n = 1; !taken.add(candidate); n++) {
            candidate = id + "~" + n;
        }
        return candidate;
    }

    int instructionCount() {
        return insnIds.size();
    }

    @Nullable String identify(Insn insn) {
        Integer idx = insnIds.get(insn);
        return idx == null ? null : "instruction." + idx;
    }

    @Nullable String identify(BasicBlock block) {
        return blockIds.get(block);
    }
}
