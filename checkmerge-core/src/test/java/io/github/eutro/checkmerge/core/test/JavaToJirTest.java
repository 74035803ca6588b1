package io.github.eutro.checkmerge.core.test;

import io.github.eutro.checkmerge.core.analysis.*;
import io.github.eutro.checkmerge.core.debug.DebugDeclaration;
import io.github.eutro.checkmerge.core.debug.DebugSubprogram;
import io.github.eutro.checkmerge.core.debug.ExtDebugInfoProvider;
import io.github.eutro.checkmerge.core.debug.SourceLocation;
import io.github.eutro.checkmerge.core.ext.MemoryExts;
import io.github.eutro.checkmerge.core.memdep.BasicMemoryDependence;
import io.github.eutro.checkmerge.core.memdep.MemoryLocation;
import io.github.eutro.checkmerge.core.ops.CommonOps;
import io.github.eutro.checkmerge.core.ops.MemoryOps;
import io.github.eutro.checkmerge.core.passes.convert.JavaToJir;
import io.github.eutro.checkmerge.core.ssa.BasicBlock;
import io.github.eutro.checkmerge.core.ssa.Function;
import io.github.eutro.checkmerge.core.ssa.Insn;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

public class JavaToJirTest {
    private static final PrintStream NULL_LOG = new PrintStream(new ByteArrayOutputStream());

    @SuppressWarnings("unused")
    private static class Counter {
        static int total;
        int count;

        int bump(int by) {
            int next = count + by;
            count = next;
            total++;
            return twice(next);
        }

        static int twice(int x) {
            return x * 2;
        }

        static int max(int a, int b) {
            if (a > b) return a;
            return b;
        }
    }

    private static Function convert(String name) {
        ClassNode node = Utils.readClass(Counter.class);
        for (MethodNode method : node.methods) {
            if (method.name.equals(name)) {
                return JavaToJir.INSTANCE.convert(node, method);
            }
        }
        throw new AssertionError("no method " + name);
    }

    private static List<Insn> insns(Function func) {
        List<Insn> insns = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            insns.addAll(block.getInsns());
        }
        return insns;
    }

    private static Insn find(Function func, Object key) {
        for (Insn insn : insns(func)) {
            if (insn.op.key == key) return insn;
        }
        throw new AssertionError("no " + key + " in " + func);
    }

    @Test
    void testConvertClass() {
        List<Function> funcs = JavaToJir.INSTANCE.run(Utils.readClass(Counter.class));
        Set<String> names = new TreeSet<>();
        for (Function func : funcs) names.add(func.name);
        assertTrue(names.contains("JavaToJirTest$Counter.bump(I)I"), names::toString);
        assertTrue(names.contains("JavaToJirTest$Counter.twice(I)I"), names::toString);
        assertTrue(names.contains("JavaToJirTest$Counter.<init>()V"), names::toString);
    }

    @Test
    void testSlotsAndParams() {
        Function func = convert("bump");
        List<Insn> entry = func.getEntry().getInsns();
        for (int i = 0; i < 3; i++) {
            assertSame(MemoryOps.ALLOCA, entry.get(i).op.key, entry::toString);
            assertEquals(i, MemoryOps.ALLOCA.argNullable(entry.get(i).op));
        }
        assertSame(CommonOps.ARG, entry.get(3).op.key);
        assertSame(MemoryOps.STORE.key, entry.get(4).op.key);
        assertSame(CommonOps.ARG, entry.get(5).op.key);
        assertSame(MemoryOps.STORE.key, entry.get(6).op.key);

        Set<String> declared = new TreeSet<>();
        for (Insn insn : insns(func)) {
            DebugDeclaration decl = ExtDebugInfoProvider.INSTANCE.getDeclaration(insn);
            if (decl != null) {
                assertTrue(decl.addressOf);
                assertSame(MemoryOps.ALLOCA, decl.trackedValue.getDefinition().insn().op.key);
                declared.add(decl.variable.name);
            }
        }
        assertEquals(new TreeSet<>(Arrays.asList("this", "by", "next")), declared);
    }

    @Test
    void testDebugInfo() {
        Function func = convert("bump");
        DebugSubprogram sp = ExtDebugInfoProvider.INSTANCE.getSubprogram(func);
        assertNotNull(sp);
        assertEquals("bump", sp.name);
        assertEquals("JavaToJirTest.java", sp.file);
        assertTrue(sp.line > 0);

        for (Insn insn : insns(func)) {
            if (!MemoryExts.accessOf(insn).mayReadOrWrite()) continue;
            SourceLocation loc = ExtDebugInfoProvider.INSTANCE.getLocation(insn);
            assertNotNull(loc, insn::toString);
            assertEquals("JavaToJirTest.java", loc.file);
            assertTrue(loc.line >= sp.line);
        }

        SourceVariableMap vars = new SourceVariableMapper(ExtDebugInfoProvider.INSTANCE).run(func);
        assertEquals(3, vars.size());
    }

    @Test
    void testMemoryLocations() {
        Function func = convert("bump");
        MemoryLocation field = find(func, MemoryOps.GET_FIELD).getNullable(MemoryExts.MEMORY_LOCATION);
        assertNotNull(field);
        assertEquals(MemoryLocation.Kind.FIELD, field.kind);
        assertTrue(field.key.endsWith("JavaToJirTest$Counter.count:I"), field.key);

        MemoryLocation stat = find(func, MemoryOps.PUT_STATIC).getNullable(MemoryExts.MEMORY_LOCATION);
        assertNotNull(stat);
        assertEquals(MemoryLocation.Kind.STATIC, stat.kind);

        Insn call = find(func, MemoryOps.CALL);
        assertTrue(MemoryExts.isCall(call));
        assertTrue(MemoryOps.CALL.argNullable(call.op).contains(".twice(I)I"));
    }

    @Test
    void testDependencies() {
        Function func = convert("bump");
        DependencyMap deps = new DependenceCollector(BasicMemoryDependence.PROVIDER, NULL_LOG).run(func);

        for (Insn insn : insns(func)) {
            if (insn.op.key != MemoryOps.LOAD.key) continue;
            DependencySet set = deps.get(insn);
            assertNotNull(set);
            assertEquals(1, set.size());
            Dependency dep = set.iterator().next().dependency;
            assertEquals(DependencyKind.DEF, dep.kind);
            assertNotNull(dep.target);
            // the last store of the slot, or a load of it since
            assertTrue(dep.target.op.key == MemoryOps.STORE.key || dep.target.op.key == MemoryOps.LOAD.key, dep::toString);
        }

        Insn getStatic = find(func, MemoryOps.GET_STATIC);
        assertEquals(DependencyKind.NON_FUNC_LOCAL, deps.get(getStatic).iterator().next().dependency.kind);

        Insn putStatic = find(func, MemoryOps.PUT_STATIC);
        Dependency onGet = deps.get(putStatic).iterator().next().dependency;
        assertEquals(DependencyKind.DEF, onGet.kind);
        assertSame(getStatic, onGet.target);

        Dependency onPut = deps.get(find(func, MemoryOps.CALL)).iterator().next().dependency;
        assertEquals(DependencyKind.CLOBBER, onPut.kind);
        assertSame(putStatic, onPut.target);
    }

    @Test
    void testBranches() {
        Function func = convert("max");
        assertTrue(func.blocks.size() > 1);
        for (BasicBlock block : func.blocks) {
            assertNotNull(block.getControl(), block::toString);
        }

        DependencyMap deps = new DependenceCollector(BasicMemoryDependence.PROVIDER, NULL_LOG).run(func);
        boolean sawNonLocal = false;
        for (BasicBlock block : func.blocks) {
            if (block == func.getEntry()) continue;
            for (Insn insn : block.getInsns()) {
                if (insn.op.key != MemoryOps.LOAD.key) continue;
                for (DependencyPair pair : deps.get(insn)) {
                    assertSame(func.getEntry(), pair.block);
                    assertEquals(DependencyKind.DEF, pair.dependency.kind);
                    sawNonLocal = true;
                }
            }
        }
        assertTrue(sawNonLocal);
    }

    @Test
    void testRejectsSubroutines() {
        ClassNode node = new ClassNode();
        node.name = "Old";
        MethodNode method = new MethodNode(Opcodes.ACC_STATIC, "m", "()V", null, null);
        LabelNode sub = new LabelNode();
        method.instructions.add(new JumpInsnNode(Opcodes.JSR, sub));
        method.instructions.add(new InsnNode(Opcodes.RETURN));
        method.instructions.add(sub);
        method.instructions.add(new VarInsnNode(Opcodes.ASTORE, 0));
        method.instructions.add(new VarInsnNode(Opcodes.RET, 0));
        node.methods.add(method);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> JavaToJir.INSTANCE.run(node));
        assertEquals(1, e.getSuppressed().length);
    }
}
