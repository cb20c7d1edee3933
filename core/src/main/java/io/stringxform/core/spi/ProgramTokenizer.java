package io.stringxform.core.spi;

import io.stringxform.core.model.Program;
import java.util.List;

/**
 * Maps programs and strings to integer token ids for a trainable model. The token vocabulary is
 * owned by the implementation; the core provides structural access through {@code
 * Expression.operator()} and {@code Expression.arguments()}.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface ProgramTokenizer {

    /**
     * Flattens a program into op-token ids.
     *
     * @throws IllegalArgumentException if the program contains a symbol with no token
     */
    List<Integer> tokenize(Program program);

    /**
     * Maps each character of {@code value} to a string-token id.
     *
     * @throws IllegalArgumentException if {@code value} contains a character with no token
     */
    List<Integer> tokenizeString(String value);

    /** Number of distinct op tokens. */
    int programVocabularySize();

    /** Number of distinct string tokens. */
    int stringVocabularySize();
}
