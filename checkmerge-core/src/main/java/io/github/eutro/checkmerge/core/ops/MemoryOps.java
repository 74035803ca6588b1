package io.github.eutro.checkmerge.core.ops;

import io.github.eutro.checkmerge.core.ext.MemoryExts;
import io.github.eutro.checkmerge.core.memdep.MemoryAccess;
import io.github.eutro.checkmerge.core.memdep.MemoryLocation;

/**
 * A collection of {@link Op}s and {@link OpKey}s that touch memory.
 * <p>
 * Each key has its {@link MemoryExts#MEMORY_ACCESS} attached, and instructions whose
 * memory is known also carry a {@link MemoryExts#MEMORY_LOCATION}.
 *
 * @see MemoryLocation
 */
public class MemoryOps {
    /**
     * Effect: reserves the stack slot with the given index, returning its address.
     * Does not itself touch memory.
     */
    public static final UnaryOpKey<Integer> ALLOCA = new UnaryOpKey<>("alloca");

    /**
     * Effect: loads from the address in its argument.
     */
    public static final Op LOAD = MemoryExts.withAccess(new SimpleOpKey("load"), MemoryAccess.READ).create();
    /**
     * Effect: stores the first argument to the address in the second.
     */
    public static final Op STORE = MemoryExts.withAccess(new SimpleOpKey("store"), MemoryAccess.WRITE).create();

    /**
     * Effect: reads the named field of its argument.
     */
    public static final UnaryOpKey<String> GET_FIELD = MemoryExts.withAccess(new UnaryOpKey<>("getfield"), MemoryAccess.READ);
    /**
     * Effect: writes the second argument to the named field of the first.
     */
    public static final UnaryOpKey<String> PUT_FIELD = MemoryExts.withAccess(new UnaryOpKey<>("putfield"), MemoryAccess.WRITE);
    /**
     * Effect: reads the named static field.
     */
    public static final UnaryOpKey<String> GET_STATIC = MemoryExts.withAccess(new UnaryOpKey<>("getstatic"), MemoryAccess.READ);
    /**
     * Effect: writes its argument to the named static field.
     */
    public static final UnaryOpKey<String> PUT_STATIC = MemoryExts.withAccess(new UnaryOpKey<>("putstatic"), MemoryAccess.WRITE);

    /**
     * Effect: get an {@code array}'s {@code n}th element. Arguments in that order.
     */
    public static final Op ARRAY_LOAD = MemoryExts.withAccess(new SimpleOpKey("array_load"), MemoryAccess.READ).create();
    /**
     * Effect: set an {@code array}'s {@code n}th element to a {@code value}. Arguments in that order.
     */
    public static final Op ARRAY_STORE = MemoryExts.withAccess(new SimpleOpKey("array_store"), MemoryAccess.WRITE).create();

    /**
     * Effect: calls the named method with its arguments. May read and write any memory
     * other than stack slots.
     */
    public static final UnaryOpKey<String> CALL = MemoryExts.markCall(new UnaryOpKey<>("call"));

    /**
     * Effect: acquires the monitor of its argument.
     */
    public static final Op MONITOR_ENTER = MemoryExts.withAccess(new SimpleOpKey("monitorenter"), MemoryAccess.READ_WRITE).create();
    /**
     * Effect: releases the monitor of its argument.
     */
    public static final Op MONITOR_EXIT = MemoryExts.withAccess(new SimpleOpKey("monitorexit"), MemoryAccess.READ_WRITE).create();
}
