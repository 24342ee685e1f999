package io.github.eutro.bin2ast.core.cfg;

/**
 * Thrown when a control flow graph violates a structural invariant that lowering depends on.
 * <p>
 * This aborts the lowering of one function; callers lowering several functions should
 * record it and carry on with the next one.
 */
public class CfgStructureException extends RuntimeException {
    /**
     * Construct an exception with the given message.
     *
     * @param message The message.
     */
    public CfgStructureException(String message) {
        super(message);
    }

    /**
     * Construct an exception with the given message and cause.
     *
     * @param message The message.
     * @param cause   The cause.
     */
    public CfgStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
