package io.stringxform.core.engine;

import io.stringxform.core.error.DslEvalException;
import io.stringxform.core.model.EvalResult;
import io.stringxform.core.model.Expression;
import io.stringxform.core.model.Program;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluation entry point for programs and expressions.
 *
 * <p>{@code evaluate} propagates {@link DslEvalException}; {@code tryEvaluate} catches it and
 * returns an error {@link EvalResult} instead, which is what samplers use when they screen randomly
 * generated programs.
 *
 * <p>Stateless and thread-safe: one instance can be shared by any number of threads.
 */
public final class ProgramEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramEvaluator.class);

    /**
     * Evaluates {@code program} against {@code input}.
     *
     * @throws DslEvalException if an expression fails
     */
    public String evaluate(Program program, String input) {
        Objects.requireNonNull(program, "program must not be null");
        Objects.requireNonNull(input, "input must not be null");
        return program.evaluate(input);
    }

    /**
     * Evaluates a single expression against {@code input}.
     *
     * @throws DslEvalException if the expression fails
     */
    public String evaluate(Expression expression, String input) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(input, "input must not be null");
        return expression.evaluate(input);
    }

    /** Evaluates {@code program} against {@code input}, capturing failures in the result. */
    public EvalResult tryEvaluate(Program program, String input) {
        try {
            return EvalResult.success(input, evaluate(program, input));
        } catch (DslEvalException e) {
            logFailure(e, program.size());
            return EvalResult.error(input, e);
        }
    }

    /** Evaluates a single expression against {@code input}, capturing failures in the result. */
    public EvalResult tryEvaluate(Expression expression, String input) {
        try {
            return EvalResult.success(input, evaluate(expression, input));
        } catch (DslEvalException e) {
            logFailure(e, 1);
            return EvalResult.error(input, e);
        }
    }

    /**
     * Evaluates {@code program} against every input, in order. A failing input yields an error
     * result and does not stop the remaining inputs.
     *
     * @return unmodifiable list with one result per input
     */
    public List<EvalResult> evaluateAll(Program program, List<String> inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        List<EvalResult> results = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            results.add(tryEvaluate(program, input));
        }
        return Collections.unmodifiableList(results);
    }

    private static void logFailure(DslEvalException e, int expressions) {
        LOG.debug(
                "program.eval_failed kind={} operator={} expressions={} detail={}",
                e.kind(),
                e.operator().key(),
                expressions,
                e.detail());
    }
}
