package io.stringxform.core.error;

import io.stringxform.core.model.Operator;

/** Thrown when {@code GetFirst} is evaluated with a negative count. */
public final class NegativeIndexException extends DslEvalException {

    private static final long serialVersionUID = 1L;

    private final int index;

    public NegativeIndexException(int index, String input) {
        super("get_first index must not be negative, got: " + index, Kind.NEGATIVE_INDEX, Operator.GET_FIRST, input);
        this.index = index;
    }

    public int index() {
        return index;
    }
}
