package io.stringxform.core.model;

import io.stringxform.core.error.DslEvalException;
import java.util.Objects;

/**
 * Outcome of evaluating a program or expression. Exactly one of two states:
 *
 * <ul>
 *   <li>{@link Type#SUCCESS}: {@code output} holds the produced string.
 *   <li>{@link Type#ERROR}: evaluation failed; {@code errorKind}, {@code operator} and {@code
 *       errorDetail} describe the failure.
 * </ul>
 *
 * <p>The {@code input} is kept in both states so that callers can report which example failed.
 */
public final class EvalResult {

    /** The type of evaluation outcome. */
    public enum Type {
        SUCCESS,
        ERROR
    }

    private final Type type;
    private final String input;
    private final String output;
    private final DslEvalException.Kind errorKind;
    private final Operator operator;
    private final String errorDetail;

    private EvalResult(
            Type type,
            String input,
            String output,
            DslEvalException.Kind errorKind,
            Operator operator,
            String errorDetail) {
        this.type = type;
        this.input = input;
        this.output = output;
        this.errorKind = errorKind;
        this.operator = operator;
        this.errorDetail = errorDetail;
    }

    /** Creates a SUCCESS result. */
    public static EvalResult success(String input, String output) {
        Objects.requireNonNull(output, "output must not be null for SUCCESS");
        return new EvalResult(Type.SUCCESS, input, output, null, null, null);
    }

    /** Creates an ERROR result from the exception that aborted evaluation. */
    public static EvalResult error(String input, DslEvalException failure) {
        Objects.requireNonNull(failure, "failure must not be null for ERROR");
        return new EvalResult(Type.ERROR, input, null, failure.kind(), failure.operator(), failure.detail());
    }

    public Type type() {
        return type;
    }

    /** The program input this result belongs to. */
    public String input() {
        return input;
    }

    /** Returns the output. Only valid when {@code type() == SUCCESS}. */
    public String output() {
        return output;
    }

    /** Returns the failure kind. Only valid when {@code type() == ERROR}. */
    public DslEvalException.Kind errorKind() {
        return errorKind;
    }

    /** Returns the operator that failed. Only valid when {@code type() == ERROR}. */
    public Operator operator() {
        return operator;
    }

    /** Returns the failure description. Only valid when {@code type() == ERROR}. */
    public String errorDetail() {
        return errorDetail;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "EvalResult[SUCCESS]";
            case ERROR -> "EvalResult[ERROR, kind=" + errorKind + ", operator=" + operator.key() + "]";
        };
    }
}
