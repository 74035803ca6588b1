package io.github.eutro.checkmerge.core.memdep;

import io.github.eutro.checkmerge.core.ssa.Insn;
import org.jetbrains.annotations.Nullable;

/**
 * The answer of a {@link MemoryDependenceOracle} for one instruction.
 */
public final class MemDepResult {
    private static final MemDepResult NON_LOCAL = new MemDepResult(null, false, false, false, true);
    private static final MemDepResult NON_FUNC_LOCAL = new MemDepResult(null, false, false, true, false);
    private static final MemDepResult UNKNOWN = new MemDepResult(null, false, false, false, false);

    private final @Nullable Insn inst;
    private final boolean clobber;
    private final boolean def;
    private final boolean nonFuncLocal;
    private final boolean nonLocal;

    /**
     * Construct a result from its raw flags. Oracles should prefer the factory methods.
     *
     * @param inst         The instruction depended on, if any.
     * @param clobber      Whether {@code inst} may clobber the memory.
     * @param def          Whether {@code inst} defines exactly the memory.
     * @param nonFuncLocal Whether the dependency is outside the function.
     * @param nonLocal     Whether the dependency is outside the block.
     */
    public MemDepResult(@Nullable Insn inst, boolean clobber, boolean def, boolean nonFuncLocal, boolean nonLocal) {
        this.inst = inst;
        this.clobber = clobber;
        this.def = def;
        this.nonFuncLocal = nonFuncLocal;
        this.nonLocal = nonLocal;
    }

    public static MemDepResult clobber(Insn inst) {
        return new MemDepResult(inst, true, false, false, false);
    }

    public static MemDepResult def(Insn inst) {
        return new MemDepResult(inst, false, true, false, false);
    }

    public static MemDepResult nonLocal() {
        return NON_LOCAL;
    }

    public static MemDepResult nonFuncLocal() {
        return NON_FUNC_LOCAL;
    }

    public static MemDepResult unknown() {
        return UNKNOWN;
    }

    public @Nullable Insn getInst() {
        return inst;
    }

    public boolean isClobber() {
        return clobber;
    }

    public boolean isDef() {
        return def;
    }

    public boolean isNonFuncLocal() {
        return nonFuncLocal;
    }

    public boolean isNonLocal() {
        return nonLocal;
    }

    @Override
    public String toString() {
        String what = clobber ? "Clobber" : def ? "Def" : nonFuncLocal ? "NonFuncLocal" : nonLocal ? "NonLocal" : "Unknown";
        return inst == null ? what : what + " " + inst;
    }
}
