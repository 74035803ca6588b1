package io.github.eutro.checkmerge.core.analysis;

import org.jetbrains.annotations.NotNull;

import java.util.AbstractSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The dependencies of one instruction, without duplicates, in the order they were found.
 * <p>
 * Only the collector adds to a set; to everyone else it is read-only.
 */
public final class DependencySet extends AbstractSet<DependencyPair> {
    private final Set<DependencyPair> pairs = new LinkedHashSet<>(4);

    boolean insert(DependencyPair pair) {
        return pairs.add(pair);
    }

    @NotNull
    @Override
    public Iterator<DependencyPair> iterator() {
        return Collections.unmodifiableSet(pairs).iterator();
    }

    @Override
    public int size() {
        return pairs.size();
    }
}
