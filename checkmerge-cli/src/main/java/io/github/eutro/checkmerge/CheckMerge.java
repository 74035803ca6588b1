package io.github.eutro.checkmerge;

import io.github.eutro.checkmerge.core.analysis.DependenceCollector;
import io.github.eutro.checkmerge.core.analysis.DependencyMap;
import io.github.eutro.checkmerge.core.analysis.SourceVariableMap;
import io.github.eutro.checkmerge.core.analysis.SourceVariableMapper;
import io.github.eutro.checkmerge.core.debug.DebugInfoProvider;
import io.github.eutro.checkmerge.core.debug.ExtDebugInfoProvider;
import io.github.eutro.checkmerge.core.memdep.BasicMemoryDependence;
import io.github.eutro.checkmerge.core.memdep.OracleProvider;
import io.github.eutro.checkmerge.core.passes.convert.JavaToJir;
import io.github.eutro.checkmerge.core.report.CheckMergePrinter;
import io.github.eutro.checkmerge.core.report.ReportOptions;
import io.github.eutro.checkmerge.core.ssa.Function;
import io.github.eutro.checkmerge.core.ssa.Module;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.tree.ClassNode;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Runs the analyses over class files, and writes a report per source file.
 * <p>
 * Classes are grouped into one {@link Module} per package and source file, so that
 * nested and other classes compiled from the same file share a report.
 */
public class CheckMerge {
    private final Path outputDir;
    private final ReportOptions options;
    private final PrintStream out;
    private final PrintStream err;
    private final Map<String, Module> modules = new TreeMap<>();

    private OracleProvider oracles = BasicMemoryDependence.PROVIDER;
    private DebugInfoProvider debug = ExtDebugInfoProvider.INSTANCE;
    private boolean quiet = false;
    private boolean dump = false;

    /**
     * Construct a driver.
     *
     * @param outputDir The directory to write reports to, under directories named after their packages.
     * @param options   How to render reports.
     * @param out       Where to print summaries.
     * @param err       Where to print warnings.
     */
    public CheckMerge(Path outputDir, ReportOptions options, PrintStream out, PrintStream err) {
        this.outputDir = outputDir;
        this.options = options;
        this.out = out;
        this.err = err;
    }

    /**
     * Set whether to skip printing the per-function summaries.
     *
     * @param quiet Whether to be quiet.
     * @return This.
     */
    public CheckMerge setQuiet(boolean quiet) {
        this.quiet = quiet;
        return this;
    }

    /**
     * Set whether to print the raw dependencies and variables of each function as well.
     *
     * @param dump Whether to dump.
     * @return This.
     */
    public CheckMerge setDump(boolean dump) {
        this.dump = dump;
        return this;
    }

    /**
     * Set where memory dependence oracles come from.
     *
     * @param oracles The oracle provider.
     * @return This.
     */
    public CheckMerge setOracles(OracleProvider oracles) {
        this.oracles = oracles;
        return this;
    }

    /**
     * Set where debug information comes from.
     *
     * @param debug The debug information provider.
     * @return This.
     */
    public CheckMerge setDebugInfo(DebugInfoProvider debug) {
        this.debug = debug;
        return this;
    }

    /**
     * Read a class file and add its methods.
     *
     * @param file The class file.
     * @throws IOException If the file could not be read, or is not a well-formed class file.
     */
    public void addClassFile(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        ClassNode node = new ClassNode();
        try {
            new ClassReader(bytes).accept(node, 0);
        } catch (RuntimeException e) {
            // truncated input surfaces as ArrayIndexOutOfBoundsException
            throw new IOException("malformed class file", e);
        }
        addClass(node);
    }

    /**
     * Add the methods of a class.
     *
     * @param node The class.
     * @throws IllegalArgumentException If a method cannot be converted.
     */
    public void addClass(ClassNode node) {
        List<Function> funcs = JavaToJir.INSTANCE.run(node);
        String sourceFile = node.sourceFile != null ? node.sourceFile : outerName(node.name) + ".java";
        int slash = node.name.lastIndexOf('/');
        String name = slash < 0 ? sourceFile : node.name.substring(0, slash + 1) + sourceFile;
        modules.computeIfAbsent(name, $ -> new Module(name, sourceFile)).functions.addAll(funcs);
    }

    private static String outerName(String internalName) {
        String simple = internalName.substring(internalName.lastIndexOf('/') + 1);
        int dollar = simple.indexOf('$');
        return dollar <= 0 ? simple : simple.substring(0, dollar);
    }

    /**
     * Get the modules added so far.
     *
     * @return The modules, by name.
     */
    public Collection<Module> getModules() {
        return Collections.unmodifiableCollection(modules.values());
    }

    /**
     * Analyse every module and write its report.
     *
     * @return The report files written.
     */
    public List<Path> run() {
        List<Path> reports = new ArrayList<>();
        for (Module module : modules.values()) {
            reports.add(analyse(module));
        }
        return reports;
    }

    /**
     * Analyse one module and write its report.
     *
     * @param module The module.
     * @return The report file.
     */
    public Path analyse(Module module) {
        Path dir = outputDir.resolve(module.name).getParent();
        CheckMergePrinter printer = new CheckMergePrinter(dir == null ? outputDir : dir, debug, options);
        DependenceCollector collector = new DependenceCollector(oracles, err);
        SourceVariableMapper mapper = new SourceVariableMapper(debug);

        printer.doInitialization(module);
        try {
            for (Function func : module.functions) {
                try {
                    DependencyMap deps = collector.run(func);
                    SourceVariableMap vars = mapper.run(func);
                    if (dump) {
                        DependenceCollector.print(out, func, deps, debug);
                        SourceVariableMapper.print(out, vars);
                    }
                    printer.runOnFunction(func, deps, vars);
                } catch (RuntimeException e) {
                    e.addSuppressed(new RuntimeException("in function " + func.name + " of " + module.name));
                    throw e;
                }
                if (!quiet) {
                    out.println("Printing analysis 'CheckMerge Processing' for function '" + func.name + "':");
                    printer.printSummary(out);
                }
            }
        } finally {
            printer.doFinalization(module);
        }
        return Objects.requireNonNull(printer.getFile());
    }
}
