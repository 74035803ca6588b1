package io.github.eutro.checkmerge.core.test;

import io.github.eutro.checkmerge.core.ext.MemoryExts;
import io.github.eutro.checkmerge.core.memdep.*;
import io.github.eutro.checkmerge.core.ops.JavaOps;
import io.github.eutro.checkmerge.core.ops.MemoryOps;
import io.github.eutro.checkmerge.core.ssa.*;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BasicMemoryDependenceTest {
    @Test
    void testAlias() {
        Function func = new Function("f");
        Var a = func.newVar("a");
        Var b = func.newVar("b");
        Var i = func.newVar("i");

        assertEquals(AliasResult.MUST, MemoryLocation.slot(a).alias(MemoryLocation.slot(a)));
        assertEquals(AliasResult.NO, MemoryLocation.slot(a).alias(MemoryLocation.slot(b)));
        assertEquals(AliasResult.NO, MemoryLocation.slot(a).alias(null));
        assertEquals(AliasResult.NO, MemoryLocation.slot(a).alias(MemoryLocation.field(a, "A.x:I")));

        assertEquals(AliasResult.MUST, MemoryLocation.field(a, "A.x:I").alias(MemoryLocation.field(a, "A.x:I")));
        assertEquals(AliasResult.MAY, MemoryLocation.field(a, "A.x:I").alias(MemoryLocation.field(b, "A.x:I")));
        assertEquals(AliasResult.NO, MemoryLocation.field(a, "A.x:I").alias(MemoryLocation.field(a, "A.y:I")));

        assertEquals(AliasResult.MUST, MemoryLocation.staticField("A.s:I").alias(MemoryLocation.staticField("A.s:I")));
        assertEquals(AliasResult.NO, MemoryLocation.staticField("A.s:I").alias(MemoryLocation.staticField("A.t:I")));

        assertEquals(AliasResult.MUST, MemoryLocation.arrayElement(a, i).alias(MemoryLocation.arrayElement(a, i)));
        assertEquals(AliasResult.MAY, MemoryLocation.arrayElement(a, i).alias(MemoryLocation.arrayElement(b, i)));

        assertEquals(AliasResult.MAY, MemoryLocation.alias(null, null));
        assertEquals(AliasResult.MAY, MemoryLocation.alias(null, MemoryLocation.staticField("A.s:I")));
        assertEquals(AliasResult.NO, MemoryLocation.alias(null, MemoryLocation.slot(a)));
    }

    @Test
    void testLocalDependencies() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var slot = Utils.alloca(ib, 0);
        Var other = Utils.alloca(ib, 1);
        Insn allocaInsn = func.getEntry().getInsns().get(0);
        Insn firstLoad = Utils.load(ib, slot);
        Insn store = Utils.store(ib, Utils.constant(ib, 1), slot);
        Utils.store(ib, Utils.constant(ib, 2), other);
        Insn call = ib.insert(MemoryOps.CALL.create("g").insn());
        Insn load = Utils.load(ib, slot);
        Utils.ret(ib);

        BasicMemoryDependence oracle = new BasicMemoryDependence(func);
        MemDepResult first = oracle.getDependency(firstLoad);
        assertTrue(first.isDef());
        assertSame(allocaInsn, first.getInst());

        // calls cannot touch stack slots
        MemDepResult result = oracle.getDependency(load);
        assertTrue(result.isDef());
        assertSame(store, result.getInst());

        MemDepResult callResult = oracle.getDependency(call);
        assertTrue(callResult.isNonFuncLocal());
        assertNull(callResult.getInst());
    }

    @Test
    void testHeapDependencies() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var obj = Utils.constant(ib, "o");
        Var obj2 = Utils.constant(ib, "p");
        Var v = Utils.constant(ib, 1);

        Insn put = MemoryOps.PUT_FIELD.create("A.x:I").insn(obj, v);
        put.attachExt(MemoryExts.MEMORY_LOCATION, MemoryLocation.field(obj, "A.x:I"));
        ib.insert(put);
        Insn call = ib.insert(MemoryOps.CALL.create("g").insn());
        Insn get = MemoryOps.GET_FIELD.create("A.x:I").insn(obj2);
        get.attachExt(MemoryExts.MEMORY_LOCATION, MemoryLocation.field(obj2, "A.x:I"));
        ib.insert(get, "x");
        Utils.ret(ib);

        BasicMemoryDependence oracle = new BasicMemoryDependence(func);
        MemDepResult getResult = oracle.getDependency(get);
        assertTrue(getResult.isClobber());
        assertSame(call, getResult.getInst());

        MemDepResult callResult = oracle.getDependency(call);
        assertTrue(callResult.isClobber());
        assertSame(put, callResult.getInst());
    }

    @Test
    void testNonLocalDependencies() {
        Function func = new Function("f");
        BasicBlock entry = func.newBb("entry");
        BasicBlock left = func.newBb("left");
        BasicBlock right = func.newBb("right");
        BasicBlock join = func.newBb("join");
        IRBuilder ib = new IRBuilder(func, entry);
        Var slot = Utils.alloca(ib, 0);
        Var cond = Utils.constant(ib, true);
        ib.insertCtrl(JavaOps.BR_COND.create(Opcodes.IFEQ).insn(cond).jumpsTo(left, right));
        ib.setBlock(left);
        Insn leftStore = Utils.store(ib, Utils.constant(ib, 1), slot);
        ib.insertCtrl(Control.br(join));
        ib.setBlock(right);
        ib.insertCtrl(Control.br(join));
        ib.setBlock(join);
        Insn load = Utils.load(ib, slot);
        Utils.ret(ib);

        BasicMemoryDependence oracle = new BasicMemoryDependence(func);
        assertTrue(oracle.getDependency(load).isNonLocal());
        List<NonLocalDepEntry> entries = oracle.getNonLocalPointerDependency(load);
        assertEquals(2, entries.size());

        assertSame(entry, entries.get(0).block);
        assertTrue(entries.get(0).result.isDef());
        assertSame(entry.getInsns().get(0), entries.get(0).result.getInst());

        assertSame(left, entries.get(1).block);
        assertTrue(entries.get(1).result.isDef());
        assertSame(leftStore, entries.get(1).result.getInst());

        assertThrows(IllegalArgumentException.class, () -> oracle.getNonLocalCallDependency(load));
    }

    @Test
    void testForeignInstruction() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Utils.ret(ib);

        Function other = new Function("g");
        IRBuilder oib = new IRBuilder(other, other.newBb());
        Insn load = Utils.load(oib, Utils.alloca(oib, 0));
        Utils.ret(oib);

        assertThrows(IllegalArgumentException.class, () -> new BasicMemoryDependence(func).getDependency(load));
    }
}
