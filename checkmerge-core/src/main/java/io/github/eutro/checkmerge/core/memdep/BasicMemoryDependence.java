package io.github.eutro.checkmerge.core.memdep;

import io.github.eutro.checkmerge.core.ext.CommonExts;
import io.github.eutro.checkmerge.core.ext.MemoryExts;
import io.github.eutro.checkmerge.core.ext.MetadataState;
import io.github.eutro.checkmerge.core.ops.MemoryOps;
import io.github.eutro.checkmerge.core.ssa.BasicBlock;
import io.github.eutro.checkmerge.core.ssa.Function;
import io.github.eutro.checkmerge.core.ssa.Insn;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A simple {@link MemoryDependenceOracle}, which scans blocks backwards from the queried
 * instruction, comparing {@link MemoryExts#MEMORY_LOCATION memory locations}.
 * <p>
 * Working backwards, the first instruction found is the dependency if it:
 * <ul>
 *     <li>is the {@link MemoryOps#ALLOCA alloca} of the queried slot ({@code Def});</li>
 *     <li>is a call, and the query is not of a stack slot ({@code Clobber});</li>
 *     <li>may write memory that must alias ({@code Def}) or may alias ({@code Clobber});</li>
 *     <li>may read memory that must alias ({@code Def}), or may alias when the query
 *     writes ({@code Clobber}).</li>
 * </ul>
 * Reaching the start of the entry block gives {@code NonFuncLocal}.
 */
public class BasicMemoryDependence implements MemoryDependenceOracle {
    /**
     * A provider of this oracle, for any function.
     */
    public static final OracleProvider PROVIDER = BasicMemoryDependence::new;

    private final Function func;

    /**
     * Construct an oracle for a function.
     *
     * @param func The function.
     */
    public BasicMemoryDependence(Function func) {
        this.func = func;
    }

    private BasicBlock blockOf(Insn insn) {
        BasicBlock block = insn.getBlock();
        if (block == null || block.getFunction() != func) {
            throw new IllegalArgumentException("Instruction not in " + func.name + ": " + insn);
        }
        return block;
    }

    @Override
    public MemDepResult getDependency(Insn insn) {
        BasicBlock block = blockOf(insn);
        List<Insn> insns = block.getInsns();
        int idx = -1;
        for (int i = 0; i < insns.size(); i++) {
            if (insns.get(i) == insn) {
                idx = i;
                break;
            }
        }
        MemDepResult found = scan(insn, insns, idx);
        if (found != null) return found;
        return block == func.getEntry() ? MemDepResult.nonFuncLocal() : MemDepResult.nonLocal();
    }

    @Override
    public List<NonLocalDepEntry> getNonLocalCallDependency(Insn insn) {
        if (!MemoryExts.isCall(insn)) {
            throw new IllegalArgumentException("Not a call: " + insn);
        }
        return walkPreds(insn);
    }

    @Override
    public List<NonLocalDepEntry> getNonLocalPointerDependency(Insn insn) {
        return walkPreds(insn);
    }

    private List<NonLocalDepEntry> walkPreds(Insn insn) {
        BasicBlock start = blockOf(insn);
        func.getMetadataState().ensureValid(func, MetadataState.PREDS);

        Map<BasicBlock, MemDepResult> results = new HashMap<>();
        Set<BasicBlock> visited = new HashSet<>();
        Deque<BasicBlock> queue = new ArrayDeque<>(start.getExtOrThrow(CommonExts.PREDS));
        while (!queue.isEmpty()) {
            BasicBlock block = queue.removeFirst();
            if (!visited.add(block)) continue;
            List<Insn> insns = block.getInsns();
            MemDepResult found = scan(insn, insns, insns.size());
            if (found != null) {
                results.put(block, found);
            } else if (block == func.getEntry()) {
                results.put(block, MemDepResult.nonFuncLocal());
            } else {
                queue.addAll(block.getExtOrThrow(CommonExts.PREDS));
            }
        }

        List<NonLocalDepEntry> entries = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            MemDepResult result = results.get(block);
            if (result != null) {
                entries.add(new NonLocalDepEntry(result, block));
            }
        }
        return entries;
    }

    private static @Nullable MemDepResult scan(Insn query, List<Insn> insns, int end) {
        for (int i = end - 1; i >= 0; i--) {
            MemDepResult found = check(query, insns.get(i));
            if (found != null) return found;
        }
        return null;
    }

    private static @Nullable MemDepResult check(Insn query, Insn candidate) {
        MemoryLocation loc = query.getNullable(MemoryExts.MEMORY_LOCATION);
        if (loc != null
                && loc.kind == MemoryLocation.Kind.SLOT
                && MemoryOps.ALLOCA.checkNullable(candidate.op) != null
                && candidate.getAssignsTo().contains(loc.base)) {
            return MemDepResult.def(candidate);
        }

        MemoryAccess access = MemoryExts.accessOf(candidate);
        if (!access.mayReadOrWrite()) return null;
        if (MemoryExts.isCall(candidate)) {
            return loc == null || loc.kind != MemoryLocation.Kind.SLOT
                    ? MemDepResult.clobber(candidate)
                    : null;
        }

        AliasResult ar = MemoryLocation.alias(loc, candidate.getNullable(MemoryExts.MEMORY_LOCATION));
        switch (ar) {
            case MUST:
                return MemDepResult.def(candidate);
            case MAY:
                if (access.mayWrite() || MemoryExts.accessOf(query).mayWrite()) {
                    return MemDepResult.clobber(candidate);
                }
                return null;
            default:
                return null;
        }
    }
}
