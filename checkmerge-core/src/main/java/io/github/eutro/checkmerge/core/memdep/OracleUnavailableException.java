package io.github.eutro.checkmerge.core.memdep;

/**
 * Thrown by a {@link MemoryDependenceOracle} that cannot analyse a function.
 */
public class OracleUnavailableException extends RuntimeException {
    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
