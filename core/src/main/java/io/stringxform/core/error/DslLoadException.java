package io.stringxform.core.error;

/**
 * Abstract parent for load-time errors. Thrown by {@code ProgramParser} when a program document
 * cannot be turned into an AST. Carries a {@code source} field identifying the file or resource
 * that caused the error.
 */
public abstract class DslLoadException extends DslException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected DslLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected DslLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} for in-memory input. */
    public String source() {
        return source;
    }
}
