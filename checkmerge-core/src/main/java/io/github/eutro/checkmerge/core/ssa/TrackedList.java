package io.github.eutro.checkmerge.core.ssa;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * An array list that tells its owner about every element entering or leaving it,
 * so IR objects always know which block, function or module holds them.
 * <p>
 * All mutation, including through iterators and {@code subList}, funnels into
 * {@link #set}, {@link #add(int, Object)} and {@link #remove(int)}.
 *
 * @param <E> The element type.
 */
abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> backing = new ArrayList<>();

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return backing.get(index);
    }

    @Override
    public int size() {
        return backing.size();
    }

    @Override
    public void add(int index, E element) {
        backing.add(index, element);
        onAdded(element);
    }

    @Override
    public E set(int index, E element) {
        E old = backing.set(index, element);
        if (old != element) {
            onRemoved(old);
            onAdded(element);
        }
        return old;
    }

    @Override
    public E remove(int index) {
        E old = backing.remove(index);
        onRemoved(old);
        return old;
    }
}
