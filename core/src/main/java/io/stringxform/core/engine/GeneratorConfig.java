package io.stringxform.core.engine;

/**
 * Settings for {@link ExampleGenerator}.
 *
 * <p>Immutable and thread-safe.
 *
 * @param examplesPerProgram number of inputs sampled and evaluated per program (default: 4)
 * @param maxAttempts number of programs drawn before giving up (default: 100)
 */
public record GeneratorConfig(int examplesPerProgram, int maxAttempts) {

    /** Default config: 4 examples per program, 100 attempts. */
    public static final GeneratorConfig DEFAULT = new GeneratorConfig(4, 100);

    public GeneratorConfig {
        if (examplesPerProgram <= 0) {
            throw new IllegalArgumentException("examplesPerProgram must be positive, got: " + examplesPerProgram);
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got: " + maxAttempts);
        }
    }
}
