/**
 * This package defines the intermediate representation (IR) analysed by CheckMerge.
 * <p>
 * A {@link io.github.eutro.checkmerge.core.ssa.Module} is the IR of one source file.
 * It aggregates {@link io.github.eutro.checkmerge.core.ssa.Function functions}, which are
 * lists of {@link io.github.eutro.checkmerge.core.ssa.BasicBlock basic blocks}, the first of
 * which is the entry. Each block is a list of
 * {@link io.github.eutro.checkmerge.core.ssa.Effect effects} followed by one
 * {@link io.github.eutro.checkmerge.core.ssa.Control control} instruction, and both wrap
 * an {@link io.github.eutro.checkmerge.core.ssa.Insn}. "Program order" throughout the code base
 * is the order of blocks in the function, then the order of instructions in each block, with the
 * control instruction last.
 * <p>
 * IR built from bytecode is deliberately unoptimised: every local variable lives in a stack slot
 * created by an {@link io.github.eutro.checkmerge.core.ops.MemoryOps#ALLOCA alloca}, and is accessed
 * through loads and stores, so that it is not in SSA form despite the name of the package.
 * <p>
 * Ownership goes both ways: an instruction knows its block, a block its function and a function
 * its module, kept current by the lists that hold them. Anything else an analysis needs is
 * attached through an {@link io.github.eutro.checkmerge.core.ext.Ext}.
 */
package io.github.eutro.checkmerge.core.ssa;
