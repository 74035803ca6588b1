package io.github.eutro.checkmerge.core.ops;

/**
 * A key without immediates. All its instructions share one {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op only;

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
        only = new Op(this);
    }

    public Op create() {
        return only;
    }
}
