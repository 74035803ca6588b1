package io.github.eutro.checkmerge.core.report;

import io.github.eutro.checkmerge.core.analysis.*;
import io.github.eutro.checkmerge.core.debug.DebugInfoProvider;
import io.github.eutro.checkmerge.core.debug.DebugSubprogram;
import io.github.eutro.checkmerge.core.debug.SourceLocation;
import io.github.eutro.checkmerge.core.ext.MemoryExts;
import io.github.eutro.checkmerge.core.memdep.MemoryAccess;
import io.github.eutro.checkmerge.core.ssa.*;
import io.github.eutro.checkmerge.core.ssa.Module;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the dependencies and source variables of every function in a module
 * to a report file, named after the module's source file.
 * <p>
 * The lifecycle is: {@link #doInitialization(Module)} once, then {@link #runOnFunction(Function, DependencyMap, SourceVariableMap)}
 * for each function in order, then {@link #doFinalization(Module)} once. {@link #printSummary(PrintStream)}
 * describes the function most recently run.
 * <p>
 * A report is a nested, indented listing, for example:
 * <pre>
 * function.Fib.fib(I)I:
 *   name: "fib"
 *   module: "io/github/Fib.java"
 *   location: "Fib.java:4"
 *   block.0:
 *     - instruction.0:
 *         opcode: alloca
 *         location: ""
 *         variable:
 *           name: "n"
 *           location: "Fib.java:4:0"
 *     - instruction.1:
 *         opcode: arg
 *         location: "Fib.java:4:0"
 *     - instruction.2:
 *         opcode: store
 *         location: "Fib.java:4:0"
 *         dependencies:
 *           "*instruction.0": "WAU"
 *     - instruction.3:
 *         opcode: dbg.declare
 *         location: "Fib.java:4:0"
 *     - instruction.4:
 *         opcode: load
 *         location: "Fib.java:4:0"
 *         dependencies:
 *           "*instruction.2": "RAW"
 * </pre>
 */
public class CheckMergePrinter {
    /**
     * The suffix of report files.
     */
    public static final String SUFFIX = ".jir.cm";
    private static final String INDENT = "  ";

    private final Path outputDir;
    private final DebugInfoProvider debug;
    private final ReportOptions options;

    private @Nullable Writer writer;
    private @Nullable Path file;

    private int instructions;
    private int variables;
    private int dependentInstructions;
    private int totalDependencies;

    /**
     * Construct a printer.
     *
     * @param outputDir The directory to write reports to.
     * @param debug     Where to find the debug information.
     * @param options   How to render reports.
     */
    public CheckMergePrinter(Path outputDir, DebugInfoProvider debug, ReportOptions options) {
        this.outputDir = outputDir;
        this.debug = debug;
        this.options = options;
    }

    /**
     * Get the name of the report file for a module: its source file name, without directories
     * or the last extension, followed by {@link #SUFFIX}.
     *
     * @param module The module.
     * @return The file name.
     */
    public static String reportFileName(Module module) {
        String name = module.sourceFileName;
        name = name.substring(Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        return (dot < 0 ? name : name.substring(0, dot)) + SUFFIX;
    }

    /**
     * Open the report file for a module.
     *
     * @param module The module.
     * @throws UncheckedIOException If the file cannot be opened.
     */
    public void doInitialization(Module module) {
        if (writer != null) {
            throw new IllegalStateException("Report already open: " + file);
        }
        Path path = outputDir.resolve(reportFileName(module));
        try {
            Files.createDirectories(outputDir);
            writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not open report file " + path, e);
        }
        file = path;
    }

    /**
     * Write the report of a function.
     *
     * @param func The function.
     * @param deps Its dependencies.
     * @param vars Its source variables.
     */
    public void runOnFunction(Function func, DependencyMap deps, SourceVariableMap vars) {
        if (writer == null) {
            throw new IllegalStateException("Report not open");
        }
        ReportContext ctx = new ReportContext(func);
        instructions = ctx.instructionCount();
        variables = vars.size();
        dependentInstructions = deps.dependentInstructions();
        totalDependencies = deps.totalDependencies();
        try {
            writer.write(render(ctx, func, deps, vars, debug, options));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write report file " + file, e);
        }
    }

    /**
     * Print the counts of the function most recently run, and the report file.
     *
     * @param out Where to print.
     */
    public void printSummary(PrintStream out) {
        out.println(INDENT + "Instructions:    " + instructions);
        out.println(INDENT + "Variables:       " + variables);
        out.println(INDENT + "Dependencies:");
        out.println(INDENT + INDENT + "Instructions:  " + dependentInstructions);
        out.println(INDENT + INDENT + "Total:         " + totalDependencies);
        out.println();
        out.println(INDENT + "Written CheckMerge analysis data to file " + file);
    }

    /**
     * Close the report file.
     *
     * @param module The module.
     * @throws UncheckedIOException If the file cannot be flushed or closed.
     */
    public void doFinalization(Module module) {
        if (writer == null) return;
        try {
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not close report file " + file, e);
        } finally {
            writer = null;
        }
    }

    /**
     * Get the report file, once {@link #doInitialization(Module)} has been called.
     *
     * @return The path to the file, or null.
     */
    public @Nullable Path getFile() {
        return file;
    }

    /**
     * Render the report of a function, as it would be written to the report file.
     *
     * @param func    The function.
     * @param deps    Its dependencies.
     * @param vars    Its source variables.
     * @param debug   Where to find the debug information.
     * @param options How to render.
     * @return The report.
     */
    public static String render(
            Function func,
            DependencyMap deps,
            SourceVariableMap vars,
            DebugInfoProvider debug,
            ReportOptions options
    ) {
        return render(new ReportContext(func), func, deps, vars, debug, options);
    }

    private static String render(
            ReportContext ctx,
            Function func,
            DependencyMap deps,
            SourceVariableMap vars,
            DebugInfoProvider debug,
            ReportOptions options
    ) {
        StringBuilder sb = new StringBuilder();
        DebugSubprogram sp = debug.getSubprogram(func);
        Module module = func.getModule();

        sb.append("function.").append(func.name).append(":\n");
        line(sb, 1, "name: " + quote(sp == null ? func.name : sp.name));
        line(sb, 1, "module: " + quote(module == null ? "" : module.name));
        line(sb, 1, "location: " + quote(sp == null || sp.file == null ? "~" : sp.file + ":" + sp.line));

        for (BasicBlock block : func.blocks) {
            line(sb, 1, ctx.identify(block) + ":");
            for (Insn insn : block.getInsns()) {
                renderInsn(sb, ctx, insn, deps, vars, debug, options);
            }
        }
        sb.append('\n');
        return sb.toString();
    }

    private static void renderInsn(
            StringBuilder sb,
            ReportContext ctx,
            Insn insn,
            DependencyMap deps,
            SourceVariableMap vars,
            DebugInfoProvider debug,
            ReportOptions options
    ) {
        line(sb, 2, "- " + ctx.identify(insn) + ":");
        line(sb, 4, "opcode: " + insn.op.key.mnemonic);
        line(sb, 4, "location: " + quote(formatLocation(debug.getLocation(insn))));

        SourceVariableMap.Binding binding = null;
        for (Var v : insn.getAssignsTo()) {
            binding = vars.get(v);
            if (binding != null) break;
        }
        if (binding != null) {
            line(sb, 4, "variable:");
            line(sb, 5, "name: " + quote(binding.variable.name));
            line(sb, 5, "location: " + quote(formatLocation(binding.location)));
        }

        DependencySet set = deps.get(insn);
        if (set == null || set.isEmpty()) return;
        StringBuilder lines = new StringBuilder();
        for (DependencyPair pair : set) {
            Insn target = pair.dependency.target;
            String ref;
            String code;
            if (target != null) {
                // an instruction outside this function cannot be referred to
                ref = ctx.identify(target);
                if (ref == null) continue;
                code = directionCode(insn, target);
            } else {
                ref = pair.block == null ? null : ctx.identify(pair.block);
                if (ref == null) continue;
                code = "Unknown";
            }
            if (options.renderKinds) {
                code += " " + pair.dependency.kind.label;
            }
            line(lines, 5, quote("*" + ref) + ": " + quote(code));
        }
        if (lines.length() != 0) {
            line(sb, 4, "dependencies:");
            sb.append(lines);
        }
    }

    /**
     * Summarise the direction of a dependency, as {@code <after>A<before>}. After is
     * {@code R} if the dependent instruction may read, else {@code W} if it may write,
     * else {@code U}; before is {@code W} if the target may write, else {@code R} if it
     * may read, else {@code U}.
     *
     * @param dependent The dependent instruction.
     * @param target    The instruction it depends on.
     * @return The code, for example {@code RAW} for a load depending on a store.
     */
    public static String directionCode(Insn dependent, Insn target) {
        MemoryAccess after = MemoryExts.accessOf(dependent);
        MemoryAccess before = MemoryExts.accessOf(target);
        char a = after.mayRead() ? 'R' : after.mayWrite() ? 'W' : 'U';
        char b = before.mayWrite() ? 'W' : before.mayRead() ? 'R' : 'U';
        return a + "A" + b;
    }

    private static String formatLocation(@Nullable SourceLocation loc) {
        return loc == null ? "" : loc.file + ":" + loc.line + ":" + loc.column;
    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    private static void line(StringBuilder sb, int depth, String text) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
        sb.append(text).append('\n');
    }
}
