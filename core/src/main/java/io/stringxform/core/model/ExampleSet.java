package io.stringxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A program together with the examples it produced. This is the unit handed to a training
 * pipeline: the examples are the model input, the program is the supervision target.
 *
 * @param program the evaluated program
 * @param examples input/output pairs, in sampling order
 */
public record ExampleSet(Program program, List<Example> examples) {

    public ExampleSet {
        Objects.requireNonNull(program, "program must not be null");
        Objects.requireNonNull(examples, "examples must not be null");
        examples = List.copyOf(examples);
    }
}
