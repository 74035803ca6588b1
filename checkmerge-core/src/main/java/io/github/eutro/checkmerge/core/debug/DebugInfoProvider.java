package io.github.eutro.checkmerge.core.debug;

import io.github.eutro.checkmerge.core.ssa.Function;
import io.github.eutro.checkmerge.core.ssa.Insn;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Answers questions about the debug metadata of a program.
 */
public interface DebugInfoProvider {
    /**
     * The metadata kind of an instruction's source location.
     */
    String KIND_DBG = "dbg";

    /**
     * Get all the metadata attached to an instruction.
     *
     * @param insn The instruction.
     * @return The metadata, in attachment order.
     */
    List<Metadata> getAllMetadata(Insn insn);

    /**
     * Get the source location of an instruction, which is the first
     * {@link SourceLocation} among its metadata.
     *
     * @param insn The instruction.
     * @return The location, or null if it has none.
     */
    default @Nullable SourceLocation getLocation(Insn insn) {
        for (Metadata md : getAllMetadata(insn)) {
            if (md.node instanceof SourceLocation) {
                return (SourceLocation) md.node;
            }
        }
        return null;
    }

    /**
     * Get what an instruction declares about a source variable, if it is a debug intrinsic.
     *
     * @param insn The instruction.
     * @return The declaration, or null if the instruction is not a debug intrinsic.
     */
    @Nullable DebugDeclaration getDeclaration(Insn insn);

    /**
     * Get the debug descriptor of a function.
     *
     * @param func The function.
     * @return The descriptor, or null if it has none.
     */
    @Nullable DebugSubprogram getSubprogram(Function func);
}
