package io.stringxform.core.error;

/**
 * Abstract base for all string-xform exceptions. Never thrown directly; use the concrete
 * subclasses under {@link DslLoadException} or {@link DslEvalException}.
 */
public abstract class DslException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION
    }

    private final Phase phase;

    protected DslException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected DslException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
