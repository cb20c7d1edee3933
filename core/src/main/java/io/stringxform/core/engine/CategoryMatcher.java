package io.stringxform.core.engine;

import io.stringxform.core.model.Category;
import io.stringxform.core.model.DslRegex;
import io.stringxform.core.model.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Finds category and delimiter matches in a string.
 *
 * <p>Matches are non-overlapping and reported left to right. Repeating categories are greedy, so
 * each match is the longest run starting at the leftmost unmatched position. Character classes are
 * plain ASCII range checks; no locale or Unicode classes are consulted.
 *
 * <p>Thread-safe and stateless: all methods are static.
 */
public final class CategoryMatcher {

    private CategoryMatcher() {}

    /**
     * Returns the spans of every match of {@code category} in {@code value}.
     *
     * @return unmodifiable list, possibly empty
     */
    public static List<Span> spans(Category category, String value) {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(value, "value must not be null");
        return switch (category) {
            case NUMBER -> runs(value, CategoryMatcher::isDigit);
            case WORD -> runs(value, CategoryMatcher::isLetter);
            case ALPHANUM -> runs(value, CategoryMatcher::isAlphanumeric);
            case ALL_CAPS -> runs(value, CategoryMatcher::isUpper);
            case PROP_CASE -> properCaseRuns(value);
            case LOWER -> runs(value, CategoryMatcher::isLower);
            case DIGIT -> singles(value, CategoryMatcher::isDigit);
            case CHAR -> singles(value, CategoryMatcher::isAlphanumeric);
        };
    }

    /** Returns the matched substrings of {@code category} in {@code value}, in match order. */
    public static List<String> substrings(Category category, String value) {
        List<Span> spans = spans(category, value);
        List<String> result = new ArrayList<>(spans.size());
        for (Span span : spans) {
            result.add(span.slice(value));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the spans matched by a DSL regex. A category delegates to {@link #spans(Category,
     * String)}; a delimiter matches each literal occurrence of its single character.
     */
    public static List<Span> spans(DslRegex regex, String value) {
        Objects.requireNonNull(regex, "regex must not be null");
        if (regex instanceof DslRegex.OfCategory ofCategory) {
            return spans(ofCategory.category(), value);
        }
        char delimiter = ((DslRegex.Delimiter) regex).value();
        return singles(value, c -> c == delimiter);
    }

    private static List<Span> runs(String value, IntPredicate member) {
        List<Span> spans = new ArrayList<>();
        int i = 0;
        int length = value.length();
        while (i < length) {
            if (!member.test(value.charAt(i))) {
                i++;
                continue;
            }
            int start = i;
            while (i < length && member.test(value.charAt(i))) {
                i++;
            }
            spans.add(new Span(start, i));
        }
        return Collections.unmodifiableList(spans);
    }

    private static List<Span> singles(String value, IntPredicate member) {
        List<Span> spans = new ArrayList<>();
        for (int i = 0; i < value.length(); i++) {
            if (member.test(value.charAt(i))) {
                spans.add(new Span(i, i + 1));
            }
        }
        return Collections.unmodifiableList(spans);
    }

    // One uppercase letter followed by at least one lowercase letter.
    private static List<Span> properCaseRuns(String value) {
        List<Span> spans = new ArrayList<>();
        int i = 0;
        int length = value.length();
        while (i < length - 1) {
            if (!isUpper(value.charAt(i)) || !isLower(value.charAt(i + 1))) {
                i++;
                continue;
            }
            int start = i;
            i += 2;
            while (i < length && isLower(value.charAt(i))) {
                i++;
            }
            spans.add(new Span(start, i));
        }
        return Collections.unmodifiableList(spans);
    }

    static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    static boolean isUpper(int c) {
        return c >= 'A' && c <= 'Z';
    }

    static boolean isLower(int c) {
        return c >= 'a' && c <= 'z';
    }

    static boolean isLetter(int c) {
        return isUpper(c) || isLower(c);
    }

    static boolean isAlphanumeric(int c) {
        return isLetter(c) || isDigit(c);
    }
}
