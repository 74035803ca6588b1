package io.github.eutro.checkmerge.core.test;

import io.github.eutro.checkmerge.core.analysis.SourceVariableMap;
import io.github.eutro.checkmerge.core.analysis.SourceVariableMapper;
import io.github.eutro.checkmerge.core.debug.ExtDebugInfoProvider;
import io.github.eutro.checkmerge.core.debug.LocalVariable;
import io.github.eutro.checkmerge.core.debug.SourceLocation;
import io.github.eutro.checkmerge.core.ops.DebugOps;
import io.github.eutro.checkmerge.core.ssa.Function;
import io.github.eutro.checkmerge.core.ssa.IRBuilder;
import io.github.eutro.checkmerge.core.ssa.Var;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

public class SourceVariableMapperTest {
    private static final LocalVariable X = new LocalVariable("x", "A.java", 3, 1, "I");
    private static final LocalVariable Y = new LocalVariable("y", "A.java", 7, 1, "I");

    @Test
    void testDeclarationsBind() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var slot = Utils.alloca(ib, 1);
        ib.setLocation(new SourceLocation("A.java", 3, 0));
        ib.insert(DebugOps.DECLARE.create(X).insn(slot));
        Utils.ret(ib);

        SourceVariableMap vars = new SourceVariableMapper(ExtDebugInfoProvider.INSTANCE).run(func);
        assertEquals(1, vars.size());
        SourceVariableMap.Binding binding = vars.get(slot);
        assertNotNull(binding);
        assertSame(X, binding.variable);
        assertEquals(new SourceLocation("A.java", 3, 0), binding.location);
    }

    @Test
    void testLastDeclarationWins() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var slot = Utils.alloca(ib, 1);
        ib.setLocation(new SourceLocation("A.java", 3, 0));
        ib.insert(DebugOps.DECLARE.create(X).insn(slot));
        ib.setLocation(new SourceLocation("A.java", 7, 0));
        ib.insert(DebugOps.DECLARE.create(Y).insn(slot));
        Utils.ret(ib);

        SourceVariableMap vars = new SourceVariableMapper(ExtDebugInfoProvider.INSTANCE).run(func);
        SourceVariableMap.Binding binding = vars.get(slot);
        assertNotNull(binding);
        assertEquals("y", binding.variable.name);
        assertEquals(7, binding.location.line);
    }

    @Test
    void testValueIntrinsicsAreIgnored() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var c = Utils.constant(ib, 5);
        ib.insert(DebugOps.VALUE.create(X).insn(c));
        Utils.ret(ib);

        SourceVariableMap vars = new SourceVariableMapper(ExtDebugInfoProvider.INSTANCE).run(func);
        assertEquals(0, vars.size());
        assertNull(vars.get(c));
    }

    @Test
    void testMissingLocation() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var slot = Utils.alloca(ib, 0);
        ib.insert(DebugOps.DECLARE.create(X).insn(slot));
        Utils.ret(ib);

        SourceVariableMap vars = new SourceVariableMapper(ExtDebugInfoProvider.INSTANCE).run(func);
        SourceVariableMap.Binding binding = vars.get(slot);
        assertNotNull(binding);
        assertNull(binding.location);

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        SourceVariableMapper.print(new PrintStream(baos, true), vars);
        String[] lines = baos.toString().split("\\R");
        assertEquals("Found 1 mappings", lines[0]);
        assertEquals(slot + " => x @ ?", lines[1]);
    }
}
