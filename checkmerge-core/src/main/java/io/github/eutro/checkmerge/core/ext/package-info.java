/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.checkmerge.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * Insn load = MemoryOps.LOAD.insn(slot);
 * load.attachExt(DebugExts.LOCATION, new SourceLocation("Fib.java", 4, 0));
 *
 * load.getExtOrThrow(DebugExts.LOCATION); // => Fib.java:4:0
 * load.getExtOrThrow(MemoryExts.MEMORY_ACCESS); // => READ, found on the op key
 * }</pre>
 * <p>
 * Instructions delegate to their {@link io.github.eutro.checkmerge.core.ops.Op op}, which
 * delegates to its {@link io.github.eutro.checkmerge.core.ops.OpKey key}, so properties shared by
 * every instruction of an opcode (such as its memory access) are attached once, to the key,
 * while per-instruction data (such as debug locations) is attached to the instruction itself.
 * <p>
 * Ownership in the IR (which block an instruction is in, which function a block is in)
 * is structural, and has plain getters instead of exts; exts are for everything
 * analyses attach on top.
 */
package io.github.eutro.checkmerge.core.ext;
