package io.github.eutro.checkmerge.core.debug;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The debug descriptor of a function: its name in the source, and where it is declared.
 */
public final class DebugSubprogram {
    /**
     * The name of the function in the source.
     */
    public final String name;
    /**
     * The declaring file, if known.
     */
    public final @Nullable String file;
    /**
     * The declaring line, or 0 if unknown.
     */
    public final int line;

    /**
     * Construct a subprogram descriptor.
     *
     * @param name The source name.
     * @param file The declaring file, or null.
     * @param line The declaring line, or 0.
     */
    public DebugSubprogram(String name, @Nullable String file, int line) {
        this.name = name;
        this.file = file;
        this.line = line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DebugSubprogram)) return false;
        DebugSubprogram that = (DebugSubprogram) o;
        return line == that.line && name.equals(that.name) && Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, file, line);
    }

    @Override
    public String toString() {
        return name + "@" + file + ":" + line;
    }
}
