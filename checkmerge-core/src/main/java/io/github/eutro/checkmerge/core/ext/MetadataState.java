package io.github.eutro.checkmerge.core.ext;

import io.github.eutro.checkmerge.core.passes.IRPass;
import io.github.eutro.checkmerge.core.passes.meta.ComputePreds;
import io.github.eutro.checkmerge.core.ssa.Function;

import java.util.HashSet;
import java.util.Set;

/**
 * Tracks which derived metadata of a {@link Function} is up to date with its control flow graph.
 * <p>
 * Metadata is computed lazily, by {@link #ensureValid(Object, MetaKind)}, and thrown away
 * whenever a block or a jump is added or replaced.
 */
public class MetadataState {
    /**
     * A kind of derived metadata, and the pass that computes it.
     *
     * @param <T> The type of IR the metadata is computed for.
     */
    public static final class MetaKind<T> {
        private final String name;
        private final IRPass<T, ?> compute;

        MetaKind(String name, IRPass<T, ?> compute) {
            this.name = name;
            this.compute = compute;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * {@link CommonExts#PREDS} on every block.
     */
    public static final MetaKind<Function> PREDS = new MetaKind<>("PREDS", ComputePreds.INSTANCE);

    private final Set<MetaKind<?>> valid = new HashSet<>();

    /**
     * Get whether some metadata is up to date.
     *
     * @param kind The kind of metadata.
     * @return Whether it is valid.
     */
    public boolean isValid(MetaKind<?> kind) {
        return valid.contains(kind);
    }

    /**
     * Compute some metadata, unless it is already up to date.
     *
     * @param t    The IR to compute it for.
     * @param kind The kind of metadata.
     * @param <T>  The type of the IR.
     */
    public <T> void ensureValid(T t, MetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.compute.run(t);
            validate(kind);
        }
    }

    /**
     * Mark some metadata as up to date.
     *
     * @param kind The kind of metadata.
     */
    public void validate(MetaKind<?> kind) {
        valid.add(kind);
    }

    /**
     * Mark all metadata that depends on the control flow graph as out of date.
     */
    public void graphChanged() {
        valid.clear();
    }
}
