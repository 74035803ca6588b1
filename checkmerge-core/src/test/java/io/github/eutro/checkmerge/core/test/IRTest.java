package io.github.eutro.checkmerge.core.test;

import io.github.eutro.checkmerge.core.ext.CommonExts;
import io.github.eutro.checkmerge.core.ext.MetadataState;
import io.github.eutro.checkmerge.core.ops.JavaOps;
import io.github.eutro.checkmerge.core.ops.MemoryOps;
import io.github.eutro.checkmerge.core.ssa.*;
import io.github.eutro.checkmerge.core.ssa.Module;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.checkmerge.core.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class IRTest {
    @Test
    void testOwnership() {
        Module module = new Module("pkg/A", "A.java");
        Function func = new Function("f");
        module.functions.add(func);
        BasicBlock entry = func.newBb("entry");
        IRBuilder ib = new IRBuilder(func, entry);
        Var slot = alloca(ib, 0);
        Insn store = store(ib, constant(ib, 1), slot);
        ret(ib);

        assertSame(module, func.getModule());
        assertSame(func, entry.getFunction());
        assertSame(entry, store.getBlock());
        assertSame(entry, entry.getControl().getBlock());
        assertSame(MemoryOps.ALLOCA, slot.getDefinition().insn().op.key);

        Effect removed = entry.getEffects().remove(2);
        assertSame(store, removed.insn());
        assertNull(store.getBlock());

        func.blocks.remove(entry);
        assertNull(entry.getFunction());
        module.functions.remove(func);
        assertNull(func.getModule());
    }

    @Test
    void testPredsFollowTheGraph() {
        Function func = new Function("f");
        BasicBlock entry = func.newBb("entry");
        BasicBlock a = func.newBb("a");
        IRBuilder ib = new IRBuilder(func, entry);
        Var cond = constant(ib, 0);
        ib.insertCtrl(JavaOps.BR_COND.create(Opcodes.IFEQ).insn(cond).jumpsTo(a, a));
        ib.setBlock(a);
        ret(ib);

        MetadataState state = func.getMetadataState();
        assertFalse(state.isValid(MetadataState.PREDS));
        state.ensureValid(func, MetadataState.PREDS);
        assertTrue(state.isValid(MetadataState.PREDS));
        assertEquals(Collections.emptyList(), entry.getExtOrThrow(CommonExts.PREDS));
        assertEquals(Collections.singletonList(entry), a.getExtOrThrow(CommonExts.PREDS));

        BasicBlock b = func.newBb("b");
        assertFalse(state.isValid(MetadataState.PREDS));
        ib.setBlock(b);
        ib.insertCtrl(Control.br(a));
        state.ensureValid(func, MetadataState.PREDS);
        assertEquals(Arrays.asList(entry, b), a.getExtOrThrow(CommonExts.PREDS));

        entry.setControl(Control.br(b));
        assertFalse(state.isValid(MetadataState.PREDS));
        state.ensureValid(func, MetadataState.PREDS);
        assertEquals(Collections.singletonList(b), a.getExtOrThrow(CommonExts.PREDS));
        assertEquals(Collections.singletonList(entry), b.getExtOrThrow(CommonExts.PREDS));
    }
}
