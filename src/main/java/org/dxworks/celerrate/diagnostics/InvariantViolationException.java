package org.dxworks.celerrate.diagnostics;

/**
 * Raised when the concrete tree breaks the engine's own contract, or when a built tree
 * breaks the AST invariants. Never downgraded to a diagnostic.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
