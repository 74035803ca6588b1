package io.github.eutro.checkmerge;

import io.github.eutro.checkmerge.core.report.ReportOptions;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class Cli {
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) System.exit(status);
    }

    /**
     * Run the command line.
     *
     * @param args The arguments.
     * @param out  Where to print output.
     * @param err  Where to print errors.
     * @return The exit status.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> paths = new ArrayList<>();
        boolean setOutput = false;
        Path outputDir = Paths.get(".");
        boolean renderKinds = ReportOptions.RENDER_KINDS;
        boolean quiet = false;
        boolean dump = false;
        boolean suppressFlags = false;
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp(out);
                        return 0;
                    case "-o":
                    case "--output":
                        if (i == args.length) {
                            err.printf("%s: expected directory%n", arg);
                            return 1;
                        }
                        if (setOutput) {
                            err.printf("%s: output already specified%n", arg);
                            return 1;
                        }
                        setOutput = true;
                        outputDir = Paths.get(args[i++]);
                        break;
                    case "-k":
                    case "--kinds":
                        renderKinds = true;
                        break;
                    case "-q":
                    case "--quiet":
                        quiet = true;
                        break;
                    case "-d":
                    case "--dump":
                        dump = true;
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        err.printf("%s: unknown flag%n", arg);
                        return 1;
                }
                continue;
            }
            paths.add(arg);
        }
        if (paths.isEmpty()) {
            printHelp(err);
            return 1;
        }

        CheckMerge cm = new CheckMerge(outputDir, new ReportOptions(renderKinds), out, err)
                .setQuiet(quiet)
                .setDump(dump);
        boolean failed = false;
        for (String path : paths) {
            List<Path> files;
            try {
                files = classFiles(Paths.get(path));
            } catch (IOException | UncheckedIOException e) {
                err.printf("could not read %s: %s%n", path, e);
                failed = true;
                continue;
            }
            for (Path file : files) {
                try {
                    cm.addClassFile(file);
                } catch (IOException e) {
                    err.printf("could not read file %s: %s%n", file, e);
                    failed = true;
                } catch (IllegalArgumentException e) {
                    err.printf("could not convert file %s: %s%n", file, e.getMessage());
                    failed = true;
                }
            }
        }
        try {
            cm.run();
        } catch (UncheckedIOException e) {
            err.printf("could not write report: %s%n", e.getMessage());
            return 1;
        }
        return failed ? 1 : 0;
    }

    private static List<Path> classFiles(Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            if (!Files.exists(path)) throw new IOException("no such file");
            List<Path> single = new ArrayList<>();
            single.add(path);
            return single;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(p -> p.getFileName().toString().endsWith(".class"))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static void printHelp(PrintStream out) {
        out.println(
                "usage: checkmerge [-h|--help] [-o|--output <dir>] [-k|--kinds] [-q|--quiet] [-d|--dump] <path> ...\n" +
                        "\n" +
                        "  <path> : a class file, or a directory to search for class files\n" +
                        "  -o|--output <dir> : write reports to <dir>/name/of/package/Source.jir.cm\n" +
                        "  -k|--kinds : also render the kind of each dependency\n" +
                        "                (also enabled by the CHECKMERGE_RENDER_KINDS environment variable)\n" +
                        "  -q|--quiet : do not print a summary for each function\n" +
                        "  -d|--dump : print the raw dependencies and variables of each function\n" +
                        "  -h|--help : show this help"
        );
    }
}
