package io.github.eutro.checkmerge.core.ops;

import io.github.eutro.checkmerge.core.ext.ExtHolder;

/**
 * The kind of an {@link Op}, shared by every op of that kind whatever its immediates.
 * Keys are singletons, compared by identity.
 */
public abstract class OpKey extends ExtHolder {
    /**
     * The name reported as the opcode of every instruction of this kind.
     */
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
