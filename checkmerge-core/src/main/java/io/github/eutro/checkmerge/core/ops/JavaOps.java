package io.github.eutro.checkmerge.core.ops;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.util.Printer;

import java.util.Arrays;
import java.util.Locale;

/**
 * A collection of {@link Op}s and {@link OpKey}s for JVM instructions that
 * do not touch memory.
 * <p>
 * Plain instructions are named after their opcode, so an {@link Opcodes#IADD} is an {@code iadd}.
 */
public class JavaOps {
    private static final SimpleOpKey[] PLAIN = new SimpleOpKey[Printer.OPCODES.length];
    @SuppressWarnings("unchecked")
    private static final UnaryOpKey<String>[] TYPED = new UnaryOpKey[Printer.OPCODES.length];

    /**
     * Control: jump conditionally, on the given opcode. The first target is the one taken
     * if the condition holds, the second is the fallthrough.
     */
    public static final UnaryOpKey<Integer> BR_COND = new UnaryOpKey<>("br_cond", JavaOps::opcodeName);

    /**
     * Control: an {@link Opcodes#TABLESWITCH} instruction.
     * With n jump targets, the first n-1 correspond to the keys from the intermediate upwards.
     * The last is the default branch.
     */
    public static final UnaryOpKey<Integer> TABLESWITCH = new UnaryOpKey<>("tableswitch");
    /**
     * Control: an {@link Opcodes#LOOKUPSWITCH} instruction.
     * The argument corresponds to each jump target's key, with the last block the
     * default branch.
     */
    public static final UnaryOpKey<int[]> LOOKUPSWITCH = new UnaryOpKey<>("lookupswitch", Arrays::toString);

    /**
     * Control: throws its argument.
     */
    public static final Op THROW = new SimpleOpKey("throw").create();

    /**
     * Effect: pops the exception from the stack. Must be the first instruction in its block.
     */
    public static final Op CATCH = new SimpleOpKey("catch").create();

    /**
     * Get the name of an opcode, in lower case.
     *
     * @param opcode The opcode.
     * @return The name.
     */
    public static String opcodeName(int opcode) {
        return Printer.OPCODES[opcode].toLowerCase(Locale.ROOT);
    }

    /**
     * Get the operation for a JVM instruction without intermediates.
     *
     * @param opcode The opcode.
     * @return The operation.
     */
    public static Op insn(int opcode) {
        SimpleOpKey key = PLAIN[opcode];
        if (key == null) {
            key = PLAIN[opcode] = new SimpleOpKey(opcodeName(opcode));
        }
        return key.create();
    }

    /**
     * Get the operation for a JVM instruction with a type or descriptor operand,
     * such as {@link Opcodes#NEW} or {@link Opcodes#CHECKCAST}.
     *
     * @param opcode  The opcode.
     * @param operand The operand.
     * @return The operation.
     */
    public static Op typed(int opcode, String operand) {
        UnaryOpKey<String> key = TYPED[opcode];
        if (key == null) {
            key = TYPED[opcode] = new UnaryOpKey<>(opcodeName(opcode));
        }
        return key.create(operand);
    }
}
