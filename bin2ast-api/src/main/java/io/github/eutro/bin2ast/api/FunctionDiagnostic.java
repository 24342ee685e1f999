package io.github.eutro.bin2ast.api;

import io.github.eutro.bin2ast.core.cfg.CfgStructureException;
import io.github.eutro.bin2ast.core.graph.NodeId;
import org.jetbrains.annotations.NotNull;

/**
 * A record of a function that could not be decompiled.
 */
public final class FunctionDiagnostic {
    private final NodeId faddr;
    private final RuntimeException cause;

    /**
     * Construct a diagnostic.
     *
     * @param faddr The address of the function.
     * @param cause The exception that stopped its decompilation.
     */
    public FunctionDiagnostic(@NotNull NodeId faddr, @NotNull RuntimeException cause) {
        this.faddr = faddr;
        this.cause = cause;
    }

    public NodeId faddr() {
        return faddr;
    }

    public RuntimeException cause() {
        return cause;
    }

    /**
     * Get whether the function was rejected because its control flow graph is malformed,
     * rather than because of a bug.
     *
     * @return Whether the cause is a {@link CfgStructureException}.
     */
    public boolean isStructural() {
        return cause instanceof CfgStructureException;
    }

    public String message() {
        return cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
    }

    @Override
    public String toString() {
        return "function " + faddr + ": " + message();
    }
}
