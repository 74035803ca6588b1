package io.github.eutro.checkmerge;

import io.github.eutro.checkmerge.core.report.ReportOptions;
import io.github.eutro.checkmerge.core.ssa.Module;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CliTest {
    @SuppressWarnings("unused")
    static class Sample {
        int value;

        void add(int n) {
            value = value + n;
        }
    }

    private static Path copyClass(Class<?> clazz, Path dir) throws IOException {
        String name = clazz.getName();
        String simple = name.substring(name.lastIndexOf('.') + 1);
        Path file = dir.resolve(simple + ".class");
        try (InputStream is = clazz.getResourceAsStream(simple + ".class")) {
            assertNotNull(is);
            Files.createDirectories(dir);
            Files.copy(is, file);
        }
        return file;
    }

    private static class Run {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final ByteArrayOutputStream err = new ByteArrayOutputStream();
        final int status;

        Run(String... args) {
            status = Cli.run(args, new PrintStream(out, true), new PrintStream(err, true));
        }

        String out() {
            return out.toString();
        }

        String err() {
            return err.toString();
        }
    }

    @Test
    void testReport(@TempDir Path tmp) throws IOException {
        copyClass(Sample.class, tmp.resolve("in"));
        Path outDir = tmp.resolve("out");

        Run run = new Run("-o", outDir.toString(), tmp.resolve("in").toString());
        assertEquals(0, run.status, run::err);

        Path report = outDir.resolve("io/github/eutro/checkmerge/CliTest.jir.cm");
        assertTrue(Files.isRegularFile(report), run::out);
        String text = new String(Files.readAllBytes(report), StandardCharsets.UTF_8);
        assertTrue(text.contains("function.CliTest$Sample.add(I)V:\n"), text);
        assertTrue(text.contains("  module: \"io/github/eutro/checkmerge/CliTest.java\"\n"), text);
        assertTrue(text.contains("          name: \"n\"\n"), text);
        assertTrue(text.contains("\": \"RAW\"\n"), text);

        String out = run.out();
        assertTrue(out.contains("Printing analysis 'CheckMerge Processing' for function 'CliTest$Sample.add(I)V':"), out);
        assertTrue(out.contains("Written CheckMerge analysis data to file " + report), out);
    }

    @Test
    void testQuietWithKinds(@TempDir Path tmp) throws IOException {
        Path file = copyClass(Sample.class, tmp);
        Path outDir = tmp.resolve("out");

        Run run = new Run("-q", "-k", "-o", outDir.toString(), "--", file.toString());
        assertEquals(0, run.status, run::err);
        assertEquals("", run.out());

        String text = new String(Files.readAllBytes(outDir.resolve("io/github/eutro/checkmerge/CliTest.jir.cm")), StandardCharsets.UTF_8);
        assertTrue(text.contains("\": \"RAW def\"\n"), text);
    }

    @Test
    void testDump(@TempDir Path tmp) throws IOException {
        Path file = copyClass(Sample.class, tmp);
        Run run = new Run("-q", "-d", "-o", tmp.resolve("out").toString(), file.toString());
        assertEquals(0, run.status, run::err);
        assertTrue(run.out().contains("Function [CliTest$Sample.add(I)V]"), run::out);
        assertTrue(run.out().contains("Found 2 mappings"), run::out);
    }

    @Test
    void testFlags() {
        Run help = new Run("--help");
        assertEquals(0, help.status);
        assertTrue(help.out().startsWith("usage: checkmerge"));

        Run unknown = new Run("--frobnicate", "x");
        assertEquals(1, unknown.status);
        assertTrue(unknown.err().contains("--frobnicate: unknown flag"));

        Run noPaths = new Run();
        assertEquals(1, noPaths.status);
        assertTrue(noPaths.err().startsWith("usage: checkmerge"));

        Run noDir = new Run("-o");
        assertEquals(1, noDir.status);

        Run twice = new Run("-o", "a", "-o", "b", "x");
        assertEquals(1, twice.status);
    }

    @Test
    void testBadInputs(@TempDir Path tmp) throws IOException {
        Run missing = new Run("-o", tmp.toString(), tmp.resolve("nope").toString());
        assertEquals(1, missing.status);
        assertTrue(missing.err().contains("could not read"), missing::err);

        Path junk = tmp.resolve("Junk.class");
        Files.write(junk, "not a class".getBytes(StandardCharsets.UTF_8));
        Run bad = new Run("-o", tmp.resolve("out").toString(), junk.toString());
        assertEquals(1, bad.status);
        assertTrue(bad.err().contains("could not read file"), bad::err);
        assertTrue(bad.err().contains("malformed class file"), bad::err);
    }

    @Test
    void testTruncatedClassFileIsSkipped(@TempDir Path tmp) throws IOException {
        Path in = tmp.resolve("in");
        copyClass(Sample.class, in);
        Files.write(in.resolve("Tiny.class"), new byte[]{(byte) 0xCA, (byte) 0xFE, 0x00});
        Path out = tmp.resolve("out");

        Run run = new Run("-q", "-o", out.toString(), in.toString());
        assertEquals(1, run.status);
        assertTrue(run.err().contains("could not read file"), run::err);
        assertTrue(run.err().contains("Tiny.class"), run::err);
        assertTrue(Files.exists(out.resolve("io/github/eutro/checkmerge/CliTest.jir.cm")), run::err);
    }

    @Test
    void testModulesBySourceFile(@TempDir Path tmp) throws IOException {
        CheckMerge cm = new CheckMerge(tmp, new ReportOptions(false), System.out, System.err).setQuiet(true);
        cm.addClassFile(copyClass(Sample.class, tmp));
        cm.addClassFile(copyClass(CliTest.class, tmp));
        assertEquals(1, cm.getModules().size());
        Module module = cm.getModules().iterator().next();
        assertEquals("io/github/eutro/checkmerge/CliTest.java", module.name);
        assertEquals("CliTest.java", module.sourceFileName);

        List<Path> reports = new ArrayList<>(cm.run());
        assertEquals(1, reports.size());
        assertEquals(tmp.resolve("io/github/eutro/checkmerge/CliTest.jir.cm"), reports.get(0));
    }
}
