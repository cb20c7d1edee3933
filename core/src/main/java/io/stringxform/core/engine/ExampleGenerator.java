package io.stringxform.core.engine;

import io.stringxform.core.model.EvalResult;
import io.stringxform.core.model.Example;
import io.stringxform.core.model.ExampleSet;
import io.stringxform.core.model.Program;
import io.stringxform.core.spi.ProgramSampler;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs sampled programs with the outputs they produce on sampled inputs.
 *
 * <p>Each attempt draws one program and {@link GeneratorConfig#examplesPerProgram()} inputs. If
 * the program fails on any input the whole draw is rejected and a new program is sampled, up to
 * {@link GeneratorConfig#maxAttempts()} draws.
 *
 * <p>Not thread-safe: the sampler is called without synchronization. Use one generator per
 * thread.
 */
public final class ExampleGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ExampleGenerator.class);

    private final ProgramSampler sampler;
    private final ProgramEvaluator evaluator;
    private final GeneratorConfig config;

    public ExampleGenerator(ProgramSampler sampler, GeneratorConfig config) {
        this(sampler, new ProgramEvaluator(), config);
    }

    public ExampleGenerator(ProgramSampler sampler, ProgramEvaluator evaluator, GeneratorConfig config) {
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Draws programs until one evaluates cleanly on all of its sampled inputs.
     *
     * @return the accepted example set, or empty if every attempt was rejected
     */
    public Optional<ExampleSet> generate() {
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            Program program = sampler.sampleProgram();
            List<String> inputs = new ArrayList<>(config.examplesPerProgram());
            for (int i = 0; i < config.examplesPerProgram(); i++) {
                inputs.add(sampler.sampleInput());
            }

            Optional<List<Example>> examples = collect(evaluator.evaluateAll(program, inputs));
            if (examples.isPresent()) {
                return Optional.of(new ExampleSet(program, examples.get()));
            }
            LOG.debug("sample.rejected attempt={} expressions={}", attempt, program.size());
        }
        LOG.warn("sample.exhausted max_attempts={}", config.maxAttempts());
        return Optional.empty();
    }

    /**
     * Generates up to {@code count} example sets. Stops early if an attempt budget is exhausted.
     *
     * @return the generated sets, in generation order
     */
    public List<ExampleSet> generate(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got: " + count);
        }
        List<ExampleSet> sets = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Optional<ExampleSet> set = generate();
            if (set.isEmpty()) {
                break;
            }
            sets.add(set.get());
        }
        return sets;
    }

    private static Optional<List<Example>> collect(List<EvalResult> results) {
        List<Example> examples = new ArrayList<>(results.size());
        for (EvalResult result : results) {
            if (result.isError()) {
                return Optional.empty();
            }
            examples.add(new Example(result.input(), result.output()));
        }
        return Optional.of(examples);
    }
}
