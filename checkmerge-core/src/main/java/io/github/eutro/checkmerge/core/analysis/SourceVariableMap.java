package io.github.eutro.checkmerge.core.analysis;

import io.github.eutro.checkmerge.core.debug.LocalVariable;
import io.github.eutro.checkmerge.core.debug.SourceLocation;
import io.github.eutro.checkmerge.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The source variable each tracked value is the address of, in the order the values were first bound.
 * Only the mapper adds bindings.
 */
public final class SourceVariableMap {
    /**
     * A source variable, and where it was last bound.
     */
    public static final class Binding {
        public final LocalVariable variable;
        public final @Nullable SourceLocation location;

        public Binding(LocalVariable variable, @Nullable SourceLocation location) {
            this.variable = variable;
            this.location = location;
        }

        @Override
        public String toString() {
            return variable.name + " @ " + (location == null ? "?" : location.line + ":" + location.column);
        }
    }

    private final Map<Var, Binding> map = new LinkedHashMap<>();

    /**
     * Bind a value, replacing any earlier binding.
     *
     * @param value   The tracked value.
     * @param binding The binding.
     */
    void put(Var value, Binding binding) {
        map.put(value, binding);
    }

    /**
     * Get the binding of a value.
     *
     * @param value The value.
     * @return The binding, or null if it has none.
     */
    public @Nullable Binding get(Var value) {
        return map.get(value);
    }

    /**
     * Get every binding.
     *
     * @return The bindings, as an unmodifiable map.
     */
    public Map<Var, Binding> asMap() {
        return Collections.unmodifiableMap(map);
    }

    public int size() {
        return map.size();
    }
}
