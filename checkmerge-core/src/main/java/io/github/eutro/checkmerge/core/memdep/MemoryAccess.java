package io.github.eutro.checkmerge.core.memdep;

/**
 * Whether an instruction may read and/or write memory.
 */
public enum MemoryAccess {
    /**
     * Touches no memory.
     */
    NONE(false, false),
    /**
     * May read memory.
     */
    READ(true, false),
    /**
     * May write memory.
     */
    WRITE(false, true),
    /**
     * May both read and write memory.
     */
    READ_WRITE(true, true),
    ;

    private final boolean read;
    private final boolean write;

    MemoryAccess(boolean read, boolean write) {
        this.read = read;
        this.write = write;
    }

    public boolean mayRead() {
        return read;
    }

    public boolean mayWrite() {
        return write;
    }

    public boolean mayReadOrWrite() {
        return read || write;
    }
}
