package io.github.eutro.checkmerge.core.ssa;

import io.github.eutro.checkmerge.core.ext.ExtHolder;

import java.util.List;

/**
 * A module, the IR of one source file, aggregating the {@link Function functions} compiled from it.
 */
public final class Module extends ExtHolder {
    /**
     * The name of the module.
     */
    public final String name;
    /**
     * The name of the source file the module was compiled from, as declared by the module.
     */
    public final String sourceFileName;

    /**
     * The functions in this module, in declaration order.
     */
    public final List<Function> functions = new TrackedList<Function>() {
        @Override
        protected void onAdded(Function elt) {
            elt.module = Module.this;
        }

        @Override
        protected void onRemoved(Function elt) {
            if (elt.module == Module.this) elt.module = null;
        }
    };

    /**
     * Construct a module.
     *
     * @param name           The name of the module.
     * @param sourceFileName The name of its source file.
     */
    public Module(String name, String sourceFileName) {
        this.name = name;
        this.sourceFileName = sourceFileName;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(name).append(" (").append(sourceFileName).append(") {\n");
        for (Function function : functions) {
            sb.append(function).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
