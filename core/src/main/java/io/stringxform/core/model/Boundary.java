package io.stringxform.core.model;

/** Which end of a matched {@link Span} a {@code GetSpan} endpoint resolves to. */
public enum Boundary {
    START,
    END
}
