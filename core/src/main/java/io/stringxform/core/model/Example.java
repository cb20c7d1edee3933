package io.stringxform.core.model;

import java.util.Objects;

/**
 * One input/output pair produced by running a program.
 *
 * @param input the string the program was evaluated against
 * @param output the program's output for {@code input}
 */
public record Example(String input, String output) {

    public Example {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(output, "output must not be null");
    }
}
