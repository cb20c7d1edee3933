package io.stringxform.core.error;

/**
 * Thrown when a program document is malformed: invalid YAML/JSON, an unknown operator, or an
 * argument the model rejects.
 */
public final class ProgramParseException extends DslLoadException {

    private static final long serialVersionUID = 1L;

    public ProgramParseException(String message, String source) {
        super(message, source);
    }

    public ProgramParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
