package io.github.eutro.checkmerge.core.passes.convert;

import io.github.eutro.checkmerge.core.debug.DebugSubprogram;
import io.github.eutro.checkmerge.core.debug.LocalVariable;
import io.github.eutro.checkmerge.core.debug.SourceLocation;
import io.github.eutro.checkmerge.core.ext.DebugExts;
import io.github.eutro.checkmerge.core.ext.MemoryExts;
import io.github.eutro.checkmerge.core.memdep.MemoryLocation;
import io.github.eutro.checkmerge.core.ops.*;
import io.github.eutro.checkmerge.core.passes.IRPass;
import io.github.eutro.checkmerge.core.ssa.*;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.*;
import org.objectweb.asm.tree.analysis.Analyzer;
import org.objectweb.asm.tree.analysis.AnalyzerException;
import org.objectweb.asm.tree.analysis.BasicInterpreter;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Frame;
import org.objectweb.asm.util.Printer;

import java.util.*;

/**
 * Converts the methods of a class into functions in the IR, without any optimisation.
 * <p>
 * Every local variable slot gets an {@link MemoryOps#ALLOCA alloca} at the start of the entry
 * block, and every access of a local is a {@link MemoryOps#LOAD load} or {@link MemoryOps#STORE store}
 * of its slot. Parameters are stored into their slots on entry. Each entry of the local variable
 * table becomes a {@link DebugOps#DECLARE dbg.declare} of its slot where its scope starts, and line
 * numbers become the {@link DebugExts#LOCATION locations} of the instructions that follow them.
 * <p>
 * Operand stack values are fresh variables; values left on the stack at the end of a block are
 * copied into one variable per stack depth, which the next block starts from.
 * <p>
 * Methods without code are skipped. {@link Opcodes#JSR} and {@link Opcodes#RET} are not supported.
 * Exception handlers become blocks with no predecessors, which begin with a {@link JavaOps#CATCH catch}.
 */
public class JavaToJir implements IRPass<ClassNode, List<Function>> {
    /**
     * A singleton instance of this pass.
     */
    public static final JavaToJir INSTANCE = new JavaToJir();

    @Override
    public List<Function> run(ClassNode node) {
        List<Function> funcs = new ArrayList<>();
        for (MethodNode method : node.methods) {
            if (method.instructions.size() == 0) continue;
            try {
                funcs.add(convert(node, method));
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("converting " + node.name + "." + method.name + method.desc));
                throw e;
            }
        }
        return funcs;
    }

    /**
     * Get the name of the function a method is converted to: the simple name of the class,
     * then the method's name and descriptor.
     *
     * @param owner  The internal name of the class.
     * @param method The method.
     * @return The function name.
     */
    public static String functionName(String owner, MethodNode method) {
        return owner.substring(owner.lastIndexOf('/') + 1) + "." + method.name + method.desc;
    }

    /**
     * Convert one method.
     *
     * @param owner  The class the method is in.
     * @param method The method.
     * @return The function.
     */
    public Function convert(ClassNode owner, MethodNode method) {
        for (AbstractInsnNode insn : method.instructions) {
            if (insn.getOpcode() == Opcodes.JSR || insn.getOpcode() == Opcodes.RET) {
                throw new IllegalArgumentException("JSR/RET are not supported");
            }
        }
        Frame<BasicValue>[] frames;
        try {
            frames = new Analyzer<>(new BasicInterpreter()).analyze(owner.name, method);
        } catch (AnalyzerException e) {
            throw new IllegalArgumentException("Invalid method " + method.name + method.desc, e);
        }

        Function func = new Function(functionName(owner.name, method));
        int firstLine = 0;
        for (AbstractInsnNode insn : method.instructions) {
            if (insn instanceof LineNumberNode) {
                firstLine = ((LineNumberNode) insn).line;
                break;
            }
        }
        func.attachExt(DebugExts.SUBPROGRAM, new DebugSubprogram(method.name, owner.sourceFile, firstLine));
        new Converter(func, owner.sourceFile, firstLine, method, frames).convert();
        return func;
    }

    private static class Converter {
        private final Function func;
        private final IRBuilder ib;
        private final @Nullable String sourceFile;
        private final int firstLine;
        private final MethodNode method;
        private final Frame<BasicValue>[] frames;

        private final Map<LabelNode, BasicBlock> labelMap = new HashMap<>();
        private final Set<LabelNode> blockStarts = new HashSet<>();
        private final Set<LabelNode> handlers = new HashSet<>();
        private final Map<LabelNode, List<LocalVariableNode>> declarations = new HashMap<>();

        private final List<Var> slots = new ArrayList<>();
        private int allocaCount = 0;

        private final List<Var> stack = new ArrayList<>();
        private final List<Var> stackVars = new ArrayList<>();

        private Converter(Function func, @Nullable String sourceFile, int firstLine, MethodNode method, Frame<BasicValue>[] frames) {
            this.func = func;
            this.sourceFile = sourceFile;
            this.firstLine = firstLine;
            this.method = method;
            this.frames = frames;
            ib = new IRBuilder(func, func.newBb());
        }

        void convert() {
            for (AbstractInsnNode insn : method.instructions) {
                if (insn instanceof JumpInsnNode) {
                    blockStarts.add(((JumpInsnNode) insn).label);
                } else if (insn instanceof TableSwitchInsnNode) {
                    blockStarts.addAll(((TableSwitchInsnNode) insn).labels);
                    blockStarts.add(((TableSwitchInsnNode) insn).dflt);
                } else if (insn instanceof LookupSwitchInsnNode) {
                    blockStarts.addAll(((LookupSwitchInsnNode) insn).labels);
                    blockStarts.add(((LookupSwitchInsnNode) insn).dflt);
                }
            }
            for (TryCatchBlockNode tcb : method.tryCatchBlocks) {
                blockStarts.add(tcb.handler);
                handlers.add(tcb.handler);
            }
            if (method.localVariables != null) {
                for (LocalVariableNode lv : method.localVariables) {
                    declarations.computeIfAbsent(lv.start, $ -> new ArrayList<>()).add(lv);
                }
            }

            if (sourceFile != null && firstLine > 0) {
                ib.setLocation(new SourceLocation(sourceFile, firstLine, 0));
            }
            storeParams();

            AbstractInsnNode[] insns = method.instructions.toArray();
            for (int i = 0; i < insns.length; i++) {
                AbstractInsnNode insn = insns[i];
                Frame<BasicValue> frame = frames[i];
                if (insn instanceof LabelNode) {
                    visitLabel((LabelNode) insn, frame);
                } else if (insn instanceof LineNumberNode) {
                    if (sourceFile != null) {
                        ib.setLocation(new SourceLocation(sourceFile, ((LineNumberNode) insn).line, 0));
                    }
                } else if (insn.getOpcode() != -1 && frame != null) {
                    ensureOpen(frame);
                    execute(insn, frame);
                }
            }
            if (ib.getBlock().getControl() == null) {
                // a declaration after the last instruction
                ib.insertCtrl(CommonOps.RETURN.insn().jumpsTo());
            }
        }

        private void storeParams() {
            int slot = 0;
            int arg = 0;
            if ((method.access & Opcodes.ACC_STATIC) == 0) {
                store(ib.insert(CommonOps.ARG.create(arg++).insn(), "this"), slot++);
            }
            for (Type type : Type.getArgumentTypes(method.desc)) {
                store(ib.insert(CommonOps.ARG.create(arg).insn(), "arg" + arg), slot);
                arg++;
                slot += type.getSize();
            }
        }

        private void visitLabel(LabelNode label, @Nullable Frame<BasicValue> frame) {
            if (frame == null) return;
            if (blockStarts.contains(label)) {
                BasicBlock target = getBlock(label);
                if (ib.getBlock().getControl() == null) {
                    spillStack();
                    ib.insertCtrl(Control.br(target));
                }
                ib.setBlock(target);
                resetStack(frame);
                if (handlers.contains(label)) {
                    ib.insert(JavaOps.CATCH.insn(), stackVar(0));
                }
            }

            List<LocalVariableNode> declared = declarations.get(label);
            if (declared != null) {
                ensureOpen(frame);
                SourceLocation loc = ib.getLocation();
                for (LocalVariableNode lv : declared) {
                    LocalVariable var = new LocalVariable(
                            lv.name,
                            sourceFile == null ? "" : sourceFile,
                            loc == null ? 0 : loc.line,
                            lv.index,
                            lv.desc
                    );
                    ib.insert(DebugOps.DECLARE.create(var).insn(slot(lv.index)));
                }
            }
        }

        private void ensureOpen(Frame<BasicValue> frame) {
            if (ib.getBlock().getControl() != null) {
                ib.setBlock(func.newBb());
                resetStack(frame);
            }
        }

        private BasicBlock getBlock(LabelNode label) {
            return labelMap.computeIfAbsent(label, $ -> func.newBb());
        }

        private Var stackVar(int depth) {
            while (stackVars.size() <= depth) {
                stackVars.add(func.newVar("stack" + stackVars.size()));
            }
            return stackVars.get(depth);
        }

        private void resetStack(Frame<BasicValue> frame) {
            stack.clear();
            int height = frame.getStackSize();
            for (int i = 0; i < height; i++) {
                stack.add(stackVar(i));
            }
        }

        private void spillStack() {
            for (int i = 0; i < stack.size(); i++) {
                Var canonical = stackVar(i);
                if (stack.get(i) != canonical) {
                    ib.insert(CommonOps.IDENTITY.insn(stack.get(i)), canonical);
                    stack.set(i, canonical);
                }
            }
        }

        private Var slot(int index) {
            while (slots.size() <= index) {
                slots.add(null);
            }
            Var addr = slots.get(index);
            if (addr == null) {
                addr = func.newVar("slot" + index);
                slots.set(index, addr);
                func.getEntry()
                        .getEffects()
                        .add(allocaCount++, MemoryOps.ALLOCA.create(index).insn().assignTo(addr));
            }
            return addr;
        }

        private void push(Var v) {
            stack.add(v);
        }

        private Var pop() {
            return stack.remove(stack.size() - 1);
        }

        private Var[] pop(int n) {
            Var[] vars = new Var[n];
            for (int i = n - 1; i >= 0; i--) {
                vars[i] = pop();
            }
            return vars;
        }

        private static int sizeAt(Frame<BasicValue> frame, int depth) {
            return frame.getStack(frame.getStackSize() - depth - 1).getSize();
        }

        private Insn located(Insn insn, MemoryLocation loc) {
            insn.attachExt(MemoryExts.MEMORY_LOCATION, loc);
            return insn;
        }

        private Var load(int index) {
            Var addr = slot(index);
            return ib.insert(located(MemoryOps.LOAD.insn(addr), MemoryLocation.slot(addr)), "tmp");
        }

        private void store(Var value, int index) {
            Var addr = slot(index);
            ib.insert(located(MemoryOps.STORE.insn(value, addr), MemoryLocation.slot(addr)));
        }

        private Var constant(Object value) {
            return ib.insert(CommonOps.constant(value), "tmp");
        }

        private void emit(Op op, int pops, boolean pushes) {
            Insn insn = op.insn(pop(pops));
            if (pushes) {
                push(ib.insert(insn, "tmp"));
            } else {
                ib.insert(insn);
            }
        }

        private void jump(Insn insn, List<BasicBlock> targets) {
            spillStack();
            ib.insertCtrl(insn.jumpsTo(targets));
        }

        private void execute(AbstractInsnNode insn, Frame<BasicValue> frame) {
            int opcode = insn.getOpcode();
            switch (opcode) {
                case Opcodes.NOP:
                    break;
                case Opcodes.ACONST_NULL:
                    push(ib.insert(CommonOps.CONST.create(null).insn(), "tmp"));
                    break;
                case Opcodes.ICONST_M1:
                case Opcodes.ICONST_0:
                case Opcodes.ICONST_1:
                case Opcodes.ICONST_2:
                case Opcodes.ICONST_3:
                case Opcodes.ICONST_4:
                case Opcodes.ICONST_5:
                    push(constant(opcode - Opcodes.ICONST_0));
                    break;
                case Opcodes.LCONST_0:
                case Opcodes.LCONST_1:
                    push(constant((long) (opcode - Opcodes.LCONST_0)));
                    break;
                case Opcodes.FCONST_0:
                case Opcodes.FCONST_1:
                case Opcodes.FCONST_2:
                    push(constant((float) (opcode - Opcodes.FCONST_0)));
                    break;
                case Opcodes.DCONST_0:
                case Opcodes.DCONST_1:
                    push(constant((double) (opcode - Opcodes.DCONST_0)));
                    break;
                case Opcodes.BIPUSH:
                case Opcodes.SIPUSH:
                    push(constant(((IntInsnNode) insn).operand));
                    break;
                case Opcodes.LDC:
                    push(constant(((LdcInsnNode) insn).cst));
                    break;

                case Opcodes.ILOAD:
                case Opcodes.LLOAD:
                case Opcodes.FLOAD:
                case Opcodes.DLOAD:
                case Opcodes.ALOAD:
                    push(load(((VarInsnNode) insn).var));
                    break;
                case Opcodes.ISTORE:
                case Opcodes.LSTORE:
                case Opcodes.FSTORE:
                case Opcodes.DSTORE:
                case Opcodes.ASTORE:
                    store(pop(), ((VarInsnNode) insn).var);
                    break;
                case Opcodes.IINC: {
                    IincInsnNode iinc = (IincInsnNode) insn;
                    Var sum = ib.insert(JavaOps.insn(Opcodes.IADD).insn(load(iinc.var), constant(iinc.incr)), "tmp");
                    store(sum, iinc.var);
                    break;
                }

                case Opcodes.IALOAD:
                case Opcodes.LALOAD:
                case Opcodes.FALOAD:
                case Opcodes.DALOAD:
                case Opcodes.AALOAD:
                case Opcodes.BALOAD:
                case Opcodes.CALOAD:
                case Opcodes.SALOAD: {
                    Var index = pop();
                    Var array = pop();
                    Insn get = MemoryOps.ARRAY_LOAD.insn(array, index);
                    push(ib.insert(located(get, MemoryLocation.arrayElement(array, index)), "tmp"));
                    break;
                }
                case Opcodes.IASTORE:
                case Opcodes.LASTORE:
                case Opcodes.FASTORE:
                case Opcodes.DASTORE:
                case Opcodes.AASTORE:
                case Opcodes.BASTORE:
                case Opcodes.CASTORE:
                case Opcodes.SASTORE: {
                    Var value = pop();
                    Var index = pop();
                    Var array = pop();
                    Insn set = MemoryOps.ARRAY_STORE.insn(array, index, value);
                    ib.insert(located(set, MemoryLocation.arrayElement(array, index)));
                    break;
                }

                case Opcodes.GETFIELD: {
                    String key = fieldKey((FieldInsnNode) insn);
                    Var obj = pop();
                    Insn get = MemoryOps.GET_FIELD.create(key).insn(obj);
                    push(ib.insert(located(get, MemoryLocation.field(obj, key)), "tmp"));
                    break;
                }
                case Opcodes.PUTFIELD: {
                    String key = fieldKey((FieldInsnNode) insn);
                    Var value = pop();
                    Var obj = pop();
                    Insn put = MemoryOps.PUT_FIELD.create(key).insn(obj, value);
                    ib.insert(located(put, MemoryLocation.field(obj, key)));
                    break;
                }
                case Opcodes.GETSTATIC: {
                    String key = fieldKey((FieldInsnNode) insn);
                    Insn get = MemoryOps.GET_STATIC.create(key).insn();
                    push(ib.insert(located(get, MemoryLocation.staticField(key)), "tmp"));
                    break;
                }
                case Opcodes.PUTSTATIC: {
                    String key = fieldKey((FieldInsnNode) insn);
                    Insn put = MemoryOps.PUT_STATIC.create(key).insn(pop());
                    ib.insert(located(put, MemoryLocation.staticField(key)));
                    break;
                }

                case Opcodes.INVOKEVIRTUAL:
                case Opcodes.INVOKESPECIAL:
                case Opcodes.INVOKESTATIC:
                case Opcodes.INVOKEINTERFACE:
                case Opcodes.INVOKEDYNAMIC: {
                    String target;
                    String desc;
                    if (insn instanceof MethodInsnNode) {
                        MethodInsnNode min = (MethodInsnNode) insn;
                        target = min.owner + "." + min.name + min.desc;
                        desc = min.desc;
                    } else {
                        InvokeDynamicInsnNode indy = (InvokeDynamicInsnNode) insn;
                        target = "indy " + indy.name + indy.desc;
                        desc = indy.desc;
                    }
                    int argc = Type.getArgumentTypes(desc).length;
                    if (opcode != Opcodes.INVOKESTATIC && opcode != Opcodes.INVOKEDYNAMIC) argc++;
                    emit(MemoryOps.CALL.create(target), argc, Type.getReturnType(desc) != Type.VOID_TYPE);
                    break;
                }

                case Opcodes.MONITORENTER:
                    emit(MemoryOps.MONITOR_ENTER, 1, false);
                    break;
                case Opcodes.MONITOREXIT:
                    emit(MemoryOps.MONITOR_EXIT, 1, false);
                    break;

                case Opcodes.NEW:
                    emit(JavaOps.typed(opcode, ((TypeInsnNode) insn).desc), 0, true);
                    break;
                case Opcodes.ANEWARRAY:
                case Opcodes.CHECKCAST:
                case Opcodes.INSTANCEOF:
                    emit(JavaOps.typed(opcode, ((TypeInsnNode) insn).desc), 1, true);
                    break;
                case Opcodes.NEWARRAY:
                    emit(JavaOps.typed(opcode, Printer.TYPES[((IntInsnNode) insn).operand]), 1, true);
                    break;
                case Opcodes.MULTIANEWARRAY: {
                    MultiANewArrayInsnNode mna = (MultiANewArrayInsnNode) insn;
                    emit(JavaOps.typed(opcode, mna.desc), mna.dims, true);
                    break;
                }

                case Opcodes.INEG:
                case Opcodes.LNEG:
                case Opcodes.FNEG:
                case Opcodes.DNEG:
                case Opcodes.I2L:
                case Opcodes.I2F:
                case Opcodes.I2D:
                case Opcodes.L2I:
                case Opcodes.L2F:
                case Opcodes.L2D:
                case Opcodes.F2I:
                case Opcodes.F2L:
                case Opcodes.F2D:
                case Opcodes.D2I:
                case Opcodes.D2L:
                case Opcodes.D2F:
                case Opcodes.I2B:
                case Opcodes.I2C:
                case Opcodes.I2S:
                case Opcodes.ARRAYLENGTH:
                    emit(JavaOps.insn(opcode), 1, true);
                    break;
                case Opcodes.IADD:
                case Opcodes.LADD:
                case Opcodes.FADD:
                case Opcodes.DADD:
                case Opcodes.ISUB:
                case Opcodes.LSUB:
                case Opcodes.FSUB:
                case Opcodes.DSUB:
                case Opcodes.IMUL:
                case Opcodes.LMUL:
                case Opcodes.FMUL:
                case Opcodes.DMUL:
                case Opcodes.IDIV:
                case Opcodes.LDIV:
                case Opcodes.FDIV:
                case Opcodes.DDIV:
                case Opcodes.IREM:
                case Opcodes.LREM:
                case Opcodes.FREM:
                case Opcodes.DREM:
                case Opcodes.ISHL:
                case Opcodes.LSHL:
                case Opcodes.ISHR:
                case Opcodes.LSHR:
                case Opcodes.IUSHR:
                case Opcodes.LUSHR:
                case Opcodes.IAND:
                case Opcodes.LAND:
                case Opcodes.IOR:
                case Opcodes.LOR:
                case Opcodes.IXOR:
                case Opcodes.LXOR:
                case Opcodes.LCMP:
                case Opcodes.FCMPL:
                case Opcodes.FCMPG:
                case Opcodes.DCMPL:
                case Opcodes.DCMPG:
                    emit(JavaOps.insn(opcode), 2, true);
                    break;

                case Opcodes.POP:
                    pop();
                    break;
                case Opcodes.POP2:
                    pop(sizeAt(frame, 0) == 2 ? 1 : 2);
                    break;
                case Opcodes.DUP:
                    push(stack.get(stack.size() - 1));
                    break;
                case Opcodes.DUP_X1: {
                    Var[] vs = pop(2);
                    push(vs[1]);
                    push(vs[0]);
                    push(vs[1]);
                    break;
                }
                case Opcodes.DUP_X2:
                    if (sizeAt(frame, 1) == 2) {
                        Var[] vs = pop(2);
                        push(vs[1]);
                        push(vs[0]);
                        push(vs[1]);
                    } else {
                        Var[] vs = pop(3);
                        push(vs[2]);
                        push(vs[0]);
                        push(vs[1]);
                        push(vs[2]);
                    }
                    break;
                case Opcodes.DUP2:
                    if (sizeAt(frame, 0) == 2) {
                        push(stack.get(stack.size() - 1));
                    } else {
                        Var[] vs = pop(2);
                        push(vs[0]);
                        push(vs[1]);
                        push(vs[0]);
                        push(vs[1]);
                    }
                    break;
                case Opcodes.DUP2_X1:
                    if (sizeAt(frame, 0) == 2) {
                        Var[] vs = pop(2);
                        push(vs[1]);
                        push(vs[0]);
                        push(vs[1]);
                    } else {
                        Var[] vs = pop(3);
                        push(vs[1]);
                        push(vs[2]);
                        push(vs[0]);
                        push(vs[1]);
                        push(vs[2]);
                    }
                    break;
                case Opcodes.DUP2_X2:
                    dup2x2(frame);
                    break;
                case Opcodes.SWAP: {
                    Var[] vs = pop(2);
                    push(vs[1]);
                    push(vs[0]);
                    break;
                }

                case Opcodes.IFEQ:
                case Opcodes.IFNE:
                case Opcodes.IFLT:
                case Opcodes.IFGE:
                case Opcodes.IFGT:
                case Opcodes.IFLE:
                case Opcodes.IFNULL:
                case Opcodes.IFNONNULL:
                case Opcodes.IF_ICMPEQ:
                case Opcodes.IF_ICMPNE:
                case Opcodes.IF_ICMPLT:
                case Opcodes.IF_ICMPGE:
                case Opcodes.IF_ICMPGT:
                case Opcodes.IF_ICMPLE:
                case Opcodes.IF_ACMPEQ:
                case Opcodes.IF_ACMPNE: {
                    int count = Opcodes.IF_ICMPEQ <= opcode && opcode <= Opcodes.IF_ACMPNE ? 2 : 1;
                    Insn cond = JavaOps.BR_COND.create(opcode).insn(pop(count));
                    BasicBlock elseB = func.newBb();
                    jump(cond, Arrays.asList(getBlock(((JumpInsnNode) insn).label), elseB));
                    ib.setBlock(elseB);
                    break;
                }
                case Opcodes.GOTO:
                    jump(CommonOps.BR.insn(), Collections.singletonList(getBlock(((JumpInsnNode) insn).label)));
                    break;
                case Opcodes.TABLESWITCH: {
                    TableSwitchInsnNode ts = (TableSwitchInsnNode) insn;
                    List<BasicBlock> targets = new ArrayList<>();
                    for (LabelNode label : ts.labels) targets.add(getBlock(label));
                    targets.add(getBlock(ts.dflt));
                    jump(JavaOps.TABLESWITCH.create(ts.min).insn(pop()), targets);
                    break;
                }
                case Opcodes.LOOKUPSWITCH: {
                    LookupSwitchInsnNode ls = (LookupSwitchInsnNode) insn;
                    List<BasicBlock> targets = new ArrayList<>();
                    for (LabelNode label : ls.labels) targets.add(getBlock(label));
                    targets.add(getBlock(ls.dflt));
                    int[] keys = new int[ls.keys.size()];
                    for (int i = 0; i < keys.length; i++) keys[i] = ls.keys.get(i);
                    jump(JavaOps.LOOKUPSWITCH.create(keys).insn(pop()), targets);
                    break;
                }
                case Opcodes.RETURN:
                    ib.insertCtrl(CommonOps.RETURN.insn().jumpsTo());
                    break;
                case Opcodes.IRETURN:
                case Opcodes.LRETURN:
                case Opcodes.FRETURN:
                case Opcodes.DRETURN:
                case Opcodes.ARETURN:
                    ib.insertCtrl(CommonOps.RETURN.insn(pop()).jumpsTo());
                    break;
                case Opcodes.ATHROW:
                    ib.insertCtrl(JavaOps.THROW.insn(pop()).jumpsTo());
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported opcode: " + opcode);
            }
        }

        private void dup2x2(Frame<BasicValue> frame) {
            boolean topWide = sizeAt(frame, 0) == 2;
            if (topWide) {
                if (sizeAt(frame, 1) == 2) {
                    // long, long
                    Var[] vs = pop(2);
                    push(vs[1]);
                    push(vs[0]);
                    push(vs[1]);
                } else {
                    // int, int, long
                    Var[] vs = pop(3);
                    push(vs[2]);
                    push(vs[0]);
                    push(vs[1]);
                    push(vs[2]);
                }
            } else if (sizeAt(frame, 2) == 2) {
                // long, int, int
                Var[] vs = pop(3);
                push(vs[1]);
                push(vs[2]);
                push(vs[0]);
                push(vs[1]);
                push(vs[2]);
            } else {
                Var[] vs = pop(4);
                push(vs[2]);
                push(vs[3]);
                push(vs[0]);
                push(vs[1]);
                push(vs[2]);
                push(vs[3]);
            }
        }

        private static String fieldKey(FieldInsnNode fin) {
            return fin.owner + "." + fin.name + ":" + fin.desc;
        }
    }
}
