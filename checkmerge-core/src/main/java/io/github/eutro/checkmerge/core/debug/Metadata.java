package io.github.eutro.checkmerge.core.debug;

/**
 * One piece of metadata attached to an instruction: its kind, such as
 * {@link DebugInfoProvider#KIND_DBG}, and the node it refers to.
 */
public final class Metadata {
    public final String kind;
    public final Object node;

    public Metadata(String kind, Object node) {
        this.kind = kind;
        this.node = node;
    }

    @Override
    public String toString() {
        return "!" + kind + " " + node;
    }
}
