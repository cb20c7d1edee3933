package io.stringxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A DSL program: an ordered, non-empty list of expressions whose outputs are concatenated.
 *
 * <p>Immutable and thread-safe. The same program may be evaluated concurrently against any number
 * of inputs.
 *
 * @param expressions the expressions, in evaluation order
 */
public record Program(List<Expression> expressions) {

    public Program {
        Objects.requireNonNull(expressions, "expressions must not be null");
        if (expressions.isEmpty()) {
            throw new IllegalArgumentException("Program requires at least one expression");
        }
        expressions = List.copyOf(expressions);
    }

    /** Creates a program from the given expressions. */
    public static Program of(Expression... expressions) {
        return new Program(List.of(expressions));
    }

    /**
     * Evaluates every expression against {@code value} and concatenates the results.
     *
     * @throws io.stringxform.core.error.DslEvalException if any expression fails
     */
    public String evaluate(String value) {
        Objects.requireNonNull(value, "value must not be null");
        StringBuilder output = new StringBuilder();
        for (Expression expression : expressions) {
            output.append(expression.evaluate(value));
        }
        return output.toString();
    }

    public int size() {
        return expressions.size();
    }
}
