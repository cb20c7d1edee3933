package io.stringxform.core.error;

import java.util.List;

/** Thrown when a program document does not conform to the bundled program JSON schema. */
public final class ProgramSchemaException extends DslLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public ProgramSchemaException(String message, List<String> violations, String source) {
        super(message, source);
        this.violations = List.copyOf(violations);
    }

    /** Individual schema violation messages, in validator order. */
    public List<String> violations() {
        return violations;
    }
}
