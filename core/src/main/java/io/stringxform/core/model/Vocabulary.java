package io.stringxform.core.model;

import java.util.List;

/**
 * Fixed argument vocabulary of the DSL. Samplers draw arguments only from these sets; the model
 * records use them to validate arguments at construction time.
 *
 * <p>Process-wide, immutable, thread-safe.
 */
public final class Vocabulary {

    /** Smallest legal {@code SubStr} position (inclusive). */
    public static final int POSITION_MIN = -100;

    /** Largest legal {@code SubStr} position (inclusive). */
    public static final int POSITION_MAX = 100;

    /** Legal 1-based, signed match indices. Zero is not a member. */
    public static final List<Integer> INDEX = List.of(-5, -4, -3, -2, -1, 1, 2, 3, 4, 5);

    /** ASCII punctuation, in code-point order. */
    public static final String PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    /** ASCII whitespace: space, tab, newline, carriage return, vertical tab, form feed. */
    public static final String WHITESPACE = " \t\n\r\u000B\f";

    /** Characters usable as a delimiter: punctuation followed by whitespace. */
    public static final String DELIMITER = PUNCTUATION + WHITESPACE;

    /** Literal alphabet: ASCII letters, digits, then {@link #DELIMITER}. */
    public static final String CHARACTER =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ" + "0123456789" + DELIMITER;

    private Vocabulary() {}

    /** Returns {@code true} if {@code value} is exactly one character and a member of {@link #DELIMITER}. */
    public static boolean isDelimiter(String value) {
        return value != null && value.length() == 1 && DELIMITER.indexOf(value.charAt(0)) >= 0;
    }

    /** Returns {@code true} if {@code value} is exactly one character and a member of {@link #CHARACTER}. */
    public static boolean isCharacter(String value) {
        return value != null && value.length() == 1 && CHARACTER.indexOf(value.charAt(0)) >= 0;
    }

    /** Returns {@code true} if {@code index} is a member of {@link #INDEX}. */
    public static boolean isIndex(int index) {
        return index != 0 && index >= -5 && index <= 5;
    }

    /** Returns {@code true} if {@code position} lies in [{@link #POSITION_MIN}, {@link #POSITION_MAX}]. */
    public static boolean isPosition(int position) {
        return position >= POSITION_MIN && position <= POSITION_MAX;
    }
}
