package io.github.eutro.checkmerge.core.ext;

import io.github.eutro.checkmerge.core.ssa.BasicBlock;

import java.util.List;

/**
 * {@link Ext}s on the control flow graph.
 */
public class CommonExts {
    /**
     * Attached to a {@link BasicBlock}. The blocks that may jump to it, in function order.
     * Only present while {@link MetadataState#PREDS} is valid.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");
}
