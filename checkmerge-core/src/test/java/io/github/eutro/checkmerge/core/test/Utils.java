package io.github.eutro.checkmerge.core.test;

import io.github.eutro.checkmerge.core.ext.MemoryExts;
import io.github.eutro.checkmerge.core.memdep.*;
import io.github.eutro.checkmerge.core.ops.CommonOps;
import io.github.eutro.checkmerge.core.ops.MemoryOps;
import io.github.eutro.checkmerge.core.ssa.*;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.tree.ClassNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

class Utils {
    static ClassNode readClass(Class<?> clazz) {
        String resource = "/" + clazz.getName().replace('.', '/') + ".class";
        try (InputStream is = clazz.getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException("class file not found: " + resource);
            ClassNode node = new ClassNode();
            new ClassReader(is).accept(node, 0);
            return node;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Var alloca(IRBuilder ib, int slot) {
        return ib.insert(MemoryOps.ALLOCA.create(slot).insn(), "slot" + slot);
    }

    static Insn store(IRBuilder ib, Var value, Var addr) {
        Insn insn = MemoryOps.STORE.insn(value, addr);
        insn.attachExt(MemoryExts.MEMORY_LOCATION, MemoryLocation.slot(addr));
        return ib.insert(insn);
    }

    static Insn load(IRBuilder ib, Var addr) {
        Insn insn = MemoryOps.LOAD.insn(addr);
        insn.attachExt(MemoryExts.MEMORY_LOCATION, MemoryLocation.slot(addr));
        ib.insert(insn, "v");
        return insn;
    }

    static Var constant(IRBuilder ib, Object value) {
        return ib.insert(CommonOps.constant(value), "c");
    }

    static void ret(IRBuilder ib) {
        ib.insertCtrl(CommonOps.RETURN.insn().jumpsTo());
    }

    /**
     * An oracle that answers from tables, and {@link MemDepResult#unknown()} otherwise.
     */
    static class FakeOracle implements MemoryDependenceOracle {
        final Map<Insn, MemDepResult> local = new HashMap<>();
        final Map<Insn, List<NonLocalDepEntry>> nonLocal = new HashMap<>();
        final List<Insn> callQueries = new ArrayList<>();
        final List<Insn> pointerQueries = new ArrayList<>();

        @Override
        public MemDepResult getDependency(Insn insn) {
            return local.getOrDefault(insn, MemDepResult.unknown());
        }

        @Override
        public List<NonLocalDepEntry> getNonLocalCallDependency(Insn insn) {
            callQueries.add(insn);
            return nonLocal.getOrDefault(insn, Collections.emptyList());
        }

        @Override
        public List<NonLocalDepEntry> getNonLocalPointerDependency(Insn insn) {
            pointerQueries.add(insn);
            return nonLocal.getOrDefault(insn, Collections.emptyList());
        }
    }
}
