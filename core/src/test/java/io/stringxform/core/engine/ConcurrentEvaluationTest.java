package io.stringxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.stringxform.core.model.Boundary;
import io.stringxform.core.model.Case;
import io.stringxform.core.model.Category;
import io.stringxform.core.model.DslRegex;
import io.stringxform.core.model.Expression;
import io.stringxform.core.model.Program;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** One shared program and evaluator under concurrent use. */
@DisplayName("Concurrent evaluation")
class ConcurrentEvaluationTest {

    private static final int THREADS = 8;
    private static final int ITERATIONS = 500;

    @Test
    @DisplayName("shared program yields the same output on every thread")
    void sharedProgram() throws Exception {
        var program = Program.of(
                new Expression.Compose(
                        new Expression.ToCase(Case.ALL_CAPS),
                        new Expression.GetSpan(
                                DslRegex.of(Category.WORD), 1, Boundary.START, DslRegex.delimiter("@"), 1,
                                Boundary.START)),
                new Expression.ConstStr("#"),
                new Expression.GetAll(Category.NUMBER));
        var evaluator = new ProgramEvaluator();

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                int thread = t;
                tasks.add(() -> {
                    for (int i = 0; i < ITERATIONS; i++) {
                        String input = "user" + thread + "@host" + i;
                        String expected = "USER" + thread + "#" + thread + " " + i;
                        if (!expected.equals(evaluator.evaluate(program, input))) {
                            return false;
                        }
                    }
                    return true;
                });
            }
            for (Future<Boolean> future : pool.invokeAll(tasks)) {
                assertThat(future.get()).isTrue();
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
    }
}
