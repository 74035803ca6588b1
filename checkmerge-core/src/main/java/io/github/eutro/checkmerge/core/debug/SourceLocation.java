package io.github.eutro.checkmerge.core.debug;

import java.util.Objects;

/**
 * A position in a source file. Lines and columns start at 1; a column of 0 means unknown.
 */
public final class SourceLocation {
    /**
     * The name of the source file.
     */
    public final String file;
    /**
     * The line.
     */
    public final int line;
    /**
     * The column, or 0.
     */
    public final int column;

    /**
     * Construct a source location.
     *
     * @param file   The name of the source file.
     * @param line   The line.
     * @param column The column, or 0.
     */
    public SourceLocation(String file, int line, int column) {
        this.file = Objects.requireNonNull(file, "file");
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
