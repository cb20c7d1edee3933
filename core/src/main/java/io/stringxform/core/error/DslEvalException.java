package io.stringxform.core.error;

import io.stringxform.core.model.Operator;

/**
 * Abstract parent for evaluation errors. Thrown by {@code Expression.evaluate()} for the two
 * operations that fail instead of clamping. {@code ProgramEvaluator} catches these and turns them
 * into an error {@code EvalResult}.
 */
public abstract class DslEvalException extends DslException {

    private static final long serialVersionUID = 1L;

    /** Failure category, stable across messages. */
    public enum Kind {
        NEGATIVE_INDEX,
        INDEX_OUT_OF_BOUNDS
    }

    private final Kind kind;
    private final Operator operator;
    private final String input;

    protected DslEvalException(String message, Kind kind, Operator operator, String input) {
        super(message, Phase.EVALUATION);
        this.kind = kind;
        this.operator = operator;
        this.input = input;
    }

    public Kind kind() {
        return kind;
    }

    /** The operator whose evaluation failed. */
    public Operator operator() {
        return operator;
    }

    /** The string the failing operator was applied to. */
    public String input() {
        return input;
    }
}
