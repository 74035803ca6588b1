package io.github.eutro.checkmerge.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another container for keys it has no value for.
 * <p>
 * Attaching and removing only ever affect this holder, never the delegate.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to look in when this holder has no value.
     *
     * @return The delegate, or null to look nowhere else.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T own = super.getNullable(ext);
        if (own != null) return own;
        ExtContainer delegate = getDelegate();
        return delegate == null ? null : delegate.getNullable(ext);
    }
}
