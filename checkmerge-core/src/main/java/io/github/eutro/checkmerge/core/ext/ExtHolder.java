package io.github.eutro.checkmerge.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * An {@link ExtContainer} that keeps its values in a map, created on the first attach.
 */
public class ExtHolder implements ExtContainer {
    private @Nullable Map<Ext<?>, Object> exts;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (exts == null) {
            // most IR objects never have any
            exts = new IdentityHashMap<>(4);
        }
        exts.put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (exts != null && exts.remove(ext) != null && exts.isEmpty()) {
            exts = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return exts == null ? null : (T) exts.get(ext);
    }
}
