package io.stringxform.core.spi;

import io.stringxform.core.model.Program;

/**
 * Source of random programs and input strings. Implementations live with the training pipeline;
 * the core only consumes them through {@code ExampleGenerator}.
 *
 * <p>Implementations should draw arguments from {@link io.stringxform.core.model.Vocabulary} only.
 * They need not be thread-safe; a generator calls its sampler from one thread.
 */
public interface ProgramSampler {

    /** Returns a freshly sampled program. */
    Program sampleProgram();

    /** Returns a freshly sampled input string. */
    String sampleInput();
}
