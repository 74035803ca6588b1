package io.github.eutro.checkmerge.core.analysis;

import io.github.eutro.checkmerge.core.debug.DebugDeclaration;
import io.github.eutro.checkmerge.core.debug.DebugInfoProvider;
import io.github.eutro.checkmerge.core.passes.IRPass;
import io.github.eutro.checkmerge.core.ssa.BasicBlock;
import io.github.eutro.checkmerge.core.ssa.Function;
import io.github.eutro.checkmerge.core.ssa.Insn;
import io.github.eutro.checkmerge.core.ssa.Var;

import java.io.PrintStream;
import java.util.Map;

/**
 * Finds which source variable each address in a function belongs to, from its
 * address-of debug intrinsics.
 * <p>
 * A binding takes the location of the intrinsic itself, not the declared location of the
 * variable. When a value is declared more than once, the last declaration wins.
 */
public class SourceVariableMapper implements IRPass<Function, SourceVariableMap> {
    private final DebugInfoProvider debug;

    /**
     * Construct a mapper.
     *
     * @param debug Where to find the debug information.
     */
    public SourceVariableMapper(DebugInfoProvider debug) {
        this.debug = debug;
    }

    @Override
    public SourceVariableMap run(Function func) {
        SourceVariableMap vars = new SourceVariableMap();
        for (BasicBlock block : func.blocks) {
            for (Insn insn : block.getInsns()) {
                DebugDeclaration decl = debug.getDeclaration(insn);
                if (decl == null || !decl.addressOf) continue;
                vars.put(decl.trackedValue, new SourceVariableMap.Binding(decl.variable, debug.getLocation(insn)));
            }
        }
        return vars;
    }

    /**
     * Print the bindings of a function, for debugging.
     *
     * @param out  Where to print.
     * @param vars The bindings found by {@link #run(Function)}.
     */
    public static void print(PrintStream out, SourceVariableMap vars) {
        out.println("Found " + vars.size() + " mappings");
        for (Map.Entry<Var, SourceVariableMap.Binding> entry : vars.asMap().entrySet()) {
            out.println(entry.getKey() + " => " + entry.getValue());
        }
    }
}
