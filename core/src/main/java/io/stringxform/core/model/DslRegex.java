package io.stringxform.core.model;

import java.util.Objects;

/**
 * Pattern argument of the DSL: either a {@link Category} or a single literal delimiter character.
 *
 * <p>Sealed: both variants are known at compile time. Thread-safe and immutable.
 */
public sealed interface DslRegex {

    /** Wraps a category. */
    static DslRegex of(Category category) {
        return new OfCategory(category);
    }

    /**
     * Wraps a delimiter character.
     *
     * @throws IllegalArgumentException if {@code delimiter} is not a single {@link Vocabulary#DELIMITER}
     *     character
     */
    static DslRegex delimiter(String delimiter) {
        return new Delimiter(delimiter);
    }

    /** Document form: the category name, or the delimiter character itself. */
    String symbol();

    /** Matches the spans of a {@link Category}. */
    record OfCategory(Category category) implements DslRegex {
        public OfCategory {
            Objects.requireNonNull(category, "category must not be null");
        }

        @Override
        public String symbol() {
            return category.name();
        }
    }

    /** Matches every literal occurrence of one delimiter character. */
    record Delimiter(String character) implements DslRegex {
        public Delimiter {
            Objects.requireNonNull(character, "character must not be null");
            if (!Vocabulary.isDelimiter(character)) {
                throw new IllegalArgumentException(
                        "Delimiter must be a single punctuation or whitespace character, got: '" + character + "'");
            }
        }

        /** The delimiter as a {@code char}. */
        public char value() {
            return character.charAt(0);
        }

        @Override
        public String symbol() {
            return character;
        }
    }
}
