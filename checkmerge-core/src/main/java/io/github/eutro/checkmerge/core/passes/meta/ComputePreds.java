package io.github.eutro.checkmerge.core.passes.meta;

import io.github.eutro.checkmerge.core.ext.CommonExts;
import io.github.eutro.checkmerge.core.ext.MetadataState;
import io.github.eutro.checkmerge.core.passes.IRPass;
import io.github.eutro.checkmerge.core.ssa.BasicBlock;
import io.github.eutro.checkmerge.core.ssa.Control;
import io.github.eutro.checkmerge.core.ssa.Function;

import java.util.*;

/**
 * Attaches {@link CommonExts#PREDS} to every block of a function, and marks them valid.
 * <p>
 * Predecessors are listed in function order, each once, however many edges it has to the block.
 */
public final class ComputePreds implements IRPass<Function, Function> {
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public Function run(Function func) {
        Map<BasicBlock, Set<BasicBlock>> preds = new IdentityHashMap<>();
        for (BasicBlock block : func.blocks) {
            preds.put(block, new LinkedHashSet<>());
        }
        for (BasicBlock from : func.blocks) {
            Control ctrl = from.getControl();
            if (ctrl == null) continue;
            for (BasicBlock to : ctrl.targets) {
                Set<BasicBlock> set = preds.get(to);
                // jumps out of the function are ignored
                if (set != null) set.add(from);
            }
        }
        for (Map.Entry<BasicBlock, Set<BasicBlock>> entry : preds.entrySet()) {
            entry.getKey().attachExt(CommonExts.PREDS, new ArrayList<>(entry.getValue()));
        }
        func.getMetadataState().validate(MetadataState.PREDS);
        return func;
    }
}
