package io.github.eutro.checkmerge.core.ops;

import org.jetbrains.annotations.Nullable;

import java.util.function.Function;

/**
 * A key whose ops carry one immediate, such as a slot index or a field name.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<? super T, String> show;
    private boolean nullable;

    /**
     * @param mnemonic The opcode name.
     * @param show     Renders the immediate after the mnemonic.
     */
    public UnaryOpKey(String mnemonic, Function<? super T, String> show) {
        super(mnemonic);
        this.show = show;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, String::valueOf);
    }

    /**
     * Permit null immediates, which are rejected by default.
     *
     * @return This key.
     */
    public UnaryOpKey<T> nullable() {
        nullable = true;
        return this;
    }

    public class UnaryOp extends Op {
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return mnemonic + " " + show.apply(arg);
        }
    }

    public UnaryOp create(T arg) {
        if (arg == null && !nullable) {
            throw new IllegalArgumentException(mnemonic + " needs an immediate");
        }
        return new UnaryOp(arg);
    }

    /**
     * Narrow an op to this key.
     *
     * @param op The op.
     * @return The op, or null if it has a different key.
     */
    @SuppressWarnings("unchecked")
    public @Nullable UnaryOp checkNullable(Op op) {
        return op.key != this ? null : (UnaryOp) op;
    }

    /**
     * Get the immediate of an op of this key.
     *
     * @param op The op.
     * @return The immediate, or null if the op has a different key.
     */
    public @Nullable T argNullable(Op op) {
        UnaryOp unary = checkNullable(op);
        return unary == null ? null : unary.arg;
    }
}
