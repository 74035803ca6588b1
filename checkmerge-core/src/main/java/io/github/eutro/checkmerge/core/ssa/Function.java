package io.github.eutro.checkmerge.core.ssa;

import io.github.eutro.checkmerge.core.ext.ExtHolder;
import io.github.eutro.checkmerge.core.ext.MetadataState;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A function: a control flow graph of {@link BasicBlock basic blocks}, entered at the first.
 */
public final class Function extends ExtHolder {
    /**
     * The name of the function, unique within its {@link Module}.
     */
    public final String name;

    private final MetadataState metaState = new MetadataState();
    @Nullable Module module;

    /**
     * The blocks of this function, the entry block first.
     * Adding or removing a block invalidates all metadata of the function.
     */
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>() {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.function = Function.this;
            metaState.graphChanged();
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            if (elt.function == Function.this) elt.function = null;
            metaState.graphChanged();
        }
    };

    public Function(String name) {
        this.name = name;
    }

    /**
     * Get the module this function was added to.
     *
     * @return The module, or null for a free-standing function.
     */
    public @Nullable Module getModule() {
        return module;
    }

    /**
     * Get the tracker of which derived data of this function is up to date.
     *
     * @return The metadata state.
     */
    public MetadataState getMetadataState() {
        return metaState;
    }

    public Var newVar(String name) {
        return new Var(name);
    }

    public BasicBlock newBb() {
        return newBb(null);
    }

    /**
     * Append a new block to this function.
     *
     * @param name The name of the block, or null.
     * @return The block.
     */
    public BasicBlock newBb(@Nullable String name) {
        BasicBlock bb = new BasicBlock(name);
        blocks.add(bb);
        return bb;
    }

    public BasicBlock getEntry() {
        return blocks.get(0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("fn ").append(name).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        return sb.append('}').toString();
    }
}
