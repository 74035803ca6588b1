package io.github.eutro.checkmerge.core.analysis;

import io.github.eutro.checkmerge.core.debug.DebugInfoProvider;
import io.github.eutro.checkmerge.core.debug.SourceLocation;
import io.github.eutro.checkmerge.core.ext.MemoryExts;
import io.github.eutro.checkmerge.core.memdep.*;
import io.github.eutro.checkmerge.core.passes.IRPass;
import io.github.eutro.checkmerge.core.ssa.BasicBlock;
import io.github.eutro.checkmerge.core.ssa.Function;
import io.github.eutro.checkmerge.core.ssa.Insn;
import io.github.eutro.checkmerge.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.io.PrintStream;
import java.util.List;

/**
 * Asks a {@link MemoryDependenceOracle} about every instruction of a function that
 * may touch memory, and collects the answers into a {@link DependencyMap}.
 * <p>
 * If no oracle is available for the function, a warning is logged and the map is empty.
 */
public class DependenceCollector implements IRPass<Function, DependencyMap> {
    private final OracleProvider oracles;
    private final PrintStream log;

    /**
     * Construct a collector.
     *
     * @param oracles Where to get the oracle for each function.
     * @param log     Where to print warnings.
     */
    public DependenceCollector(OracleProvider oracles, PrintStream log) {
        this.oracles = oracles;
        this.log = log;
    }

    /**
     * Construct a collector that prints warnings to {@link System#err}.
     *
     * @param oracles Where to get the oracle for each function.
     */
    public DependenceCollector(OracleProvider oracles) {
        this(oracles, System.err);
    }

    @Override
    public DependencyMap run(Function func) {
        MemoryDependenceOracle oracle = oracles.getOracle(func);
        if (oracle == null) {
            log.println("warning: no memory dependence analysis for " + func.name);
            return new DependencyMap();
        }
        try {
            return collect(func, oracle);
        } catch (OracleUnavailableException e) {
            log.println("warning: memory dependence analysis unavailable for " + func.name + ": " + e.getMessage());
            return new DependencyMap();
        }
    }

    private static DependencyMap collect(Function func, MemoryDependenceOracle oracle) {
        DependencyMap deps = new DependencyMap();
        for (BasicBlock block : func.blocks) {
            for (Insn insn : block.getInsns()) {
                if (!MemoryExts.accessOf(insn).mayReadOrWrite()) continue;

                MemDepResult result = oracle.getDependency(insn);
                DependencySet set = deps.getOrCreate(insn);
                if (!result.isNonLocal()) {
                    set.insert(new DependencyPair(build(result), null));
                    continue;
                }

                List<NonLocalDepEntry> entries = MemoryExts.isCall(insn)
                        ? oracle.getNonLocalCallDependency(insn)
                        : oracle.getNonLocalPointerDependency(insn);
                for (NonLocalDepEntry entry : entries) {
                    set.insert(new DependencyPair(build(entry.result), entry.block));
                }
            }
        }
        return deps;
    }

    private static Dependency build(MemDepResult result) {
        return new Dependency(result.getInst(), DependencyKind.classify(result));
    }

    /**
     * Print the dependencies of a function, instruction by instruction, for debugging.
     *
     * @param out   Where to print.
     * @param func  The function.
     * @param deps  The dependencies found by {@link #run(Function)}.
     * @param debug Where to find source locations.
     */
    public static void print(PrintStream out, Function func, DependencyMap deps, DebugInfoProvider debug) {
        out.println("Function [" + func.name + "]");
        for (BasicBlock block : func.blocks) {
            out.println("  Block [" + blockName(block) + "]");
            for (Insn insn : block.getInsns()) {
                out.println("    Instruction " + formatInsn(insn, debug));
                DependencySet set = deps.get(insn);
                if (set == null) continue;
                for (DependencyPair pair : set) {
                    Insn target = pair.dependency.target;
                    if (target == null && pair.block == null) continue;
                    StringBuilder sb = new StringBuilder("      Depends (")
                            .append(pair.dependency.kind.label)
                            .append(") on ");
                    if (target != null) {
                        sb.append("Instruction ").append(formatInsn(target, debug));
                        if (pair.block != null) sb.append(" in ");
                    }
                    if (pair.block != null) {
                        sb.append("Block [").append(blockName(pair.block)).append(']');
                        List<Insn> insns = pair.block.getInsns();
                        SourceLocation loc = insns.isEmpty() ? null : debug.getLocation(insns.get(0));
                        if (loc != null) sb.append(" ~@ ").append(loc);
                    }
                    out.println(sb);
                }
            }
        }
    }

    private static String blockName(BasicBlock block) {
        String name = block.getName();
        return name == null ? "" : name;
    }

    private static String formatInsn(Insn insn, DebugInfoProvider debug) {
        List<Var> assigns = insn.getAssignsTo();
        String name = assigns.isEmpty() ? "" : assigns.get(0).name;
        String id = "[" + name + "] " + insn.op.key.mnemonic;
        @Nullable SourceLocation loc = debug.getLocation(insn);
        return loc == null ? id : id + " @ " + loc;
    }
}
