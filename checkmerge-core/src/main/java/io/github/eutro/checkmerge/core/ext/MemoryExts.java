package io.github.eutro.checkmerge.core.ext;

import io.github.eutro.checkmerge.core.memdep.MemoryAccess;
import io.github.eutro.checkmerge.core.memdep.MemoryLocation;
import io.github.eutro.checkmerge.core.ops.Op;
import io.github.eutro.checkmerge.core.ops.OpKey;
import io.github.eutro.checkmerge.core.ssa.Insn;

/**
 * A collection of {@link Ext}s describing how instructions touch memory.
 */
public class MemoryExts {
    /**
     * Attached to an {@link Insn}, {@link Op} or {@link OpKey}.
     * Whether the instruction may read and/or write memory. Absent means {@link MemoryAccess#NONE}.
     */
    public static final Ext<MemoryAccess> MEMORY_ACCESS = Ext.create(MemoryAccess.class, "MEMORY_ACCESS");

    /**
     * Attached to an {@link Insn}, {@link Op} or {@link OpKey}.
     * Whether the instruction transfers control to another function and back.
     */
    public static final Ext<Boolean> IS_CALL = Ext.create(Boolean.class, "IS_CALL");

    /**
     * Attached to an {@link Insn}. The memory the instruction reads or writes, if it is known.
     */
    public static final Ext<MemoryLocation> MEMORY_LOCATION = Ext.create(MemoryLocation.class, "MEMORY_LOCATION");

    /**
     * Get the memory access of an instruction.
     *
     * @param ec The instruction.
     * @return The memory access, {@link MemoryAccess#NONE} if none is attached.
     */
    public static MemoryAccess accessOf(ExtContainer ec) {
        return ec.getExtOrDefault(MEMORY_ACCESS, MemoryAccess.NONE);
    }

    /**
     * Check whether an instruction is call-like.
     *
     * @param ec The instruction.
     * @return Whether {@link #IS_CALL} is attached and true.
     */
    public static boolean isCall(ExtContainer ec) {
        return ec.getExtOrDefault(IS_CALL, false);
    }

    /**
     * Attach a memory access to something, typically an {@link OpKey}.
     *
     * @param t      The thing to attach to.
     * @param access The access.
     * @param <T>    The type of {@code t}.
     * @return {@code t}.
     */
    public static <T extends ExtContainer> T withAccess(T t, MemoryAccess access) {
        t.attachExt(MEMORY_ACCESS, access);
        return t;
    }

    /**
     * Mark something as call-like, by attaching {@link #IS_CALL} {@code = true} and
     * {@link MemoryAccess#READ_WRITE} to it.
     *
     * @param t   The thing to mark.
     * @param <T> The type of {@code t}.
     * @return {@code t}.
     */
    public static <T extends ExtContainer> T markCall(T t) {
        t.attachExt(IS_CALL, true);
        return withAccess(t, MemoryAccess.READ_WRITE);
    }
}
