package io.github.eutro.checkmerge.core.debug;

import io.github.eutro.checkmerge.core.ext.DebugExts;
import io.github.eutro.checkmerge.core.ops.DebugOps;
import io.github.eutro.checkmerge.core.ops.UnaryOpKey;
import io.github.eutro.checkmerge.core.ssa.Function;
import io.github.eutro.checkmerge.core.ssa.Insn;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A {@link DebugInfoProvider} that reads {@link DebugExts} and {@link DebugOps} in the IR.
 */
public class ExtDebugInfoProvider implements DebugInfoProvider {
    /**
     * A singleton instance of this provider.
     */
    public static final ExtDebugInfoProvider INSTANCE = new ExtDebugInfoProvider();

    @Override
    public List<Metadata> getAllMetadata(Insn insn) {
        SourceLocation loc = insn.getNullable(DebugExts.LOCATION);
        if (loc == null) return Collections.emptyList();
        return Collections.singletonList(new Metadata(KIND_DBG, loc));
    }

    @Override
    public @Nullable SourceLocation getLocation(Insn insn) {
        return insn.getNullable(DebugExts.LOCATION);
    }

    @Override
    public @Nullable DebugDeclaration getDeclaration(Insn insn) {
        UnaryOpKey<LocalVariable>.UnaryOp declare = DebugOps.DECLARE.checkNullable(insn.op);
        if (declare != null) {
            return new DebugDeclaration(declare.arg, insn.args().get(0), true);
        }
        UnaryOpKey<LocalVariable>.UnaryOp value = DebugOps.VALUE.checkNullable(insn.op);
        if (value != null) {
            return new DebugDeclaration(value.arg, insn.args().get(0), false);
        }
        return null;
    }

    @Override
    public @Nullable DebugSubprogram getSubprogram(Function func) {
        return func.getNullable(DebugExts.SUBPROGRAM);
    }
}
