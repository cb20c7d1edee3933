package io.stringxform.core.engine;

import io.stringxform.core.model.Boundary;
import io.stringxform.core.model.DslRegex;
import io.stringxform.core.model.Span;
import java.util.List;

/**
 * Index arithmetic shared by the substring operators.
 *
 * <p>Resolved offsets follow slice conventions: a negative offset counts from the end of the
 * string, and {@link #slice(String, int, int)} clamps both ends into range instead of failing.
 *
 * <p>Thread-safe and stateless: all methods are static.
 */
public final class PositionResolver {

    private PositionResolver() {}

    /**
     * Resolves a {@code SubStr} position. Positive positions are 1-based from the start; negative
     * positions count from the end ({@code -1} is the last character) and are returned unchanged.
     * A negative position reaching before the start clamps to {@code 0}.
     */
    public static int substrIndex(int position, String value) {
        if (position > 0) {
            return position - 1;
        }
        if (Math.abs(position) > value.length()) {
            return 0;
        }
        return position;
    }

    /**
     * Resolves a {@code GetSpan} endpoint to an offset.
     *
     * <p>{@code index} is 1-based when positive and a from-the-end offset into the match list when
     * negative. An index past the last match selects the last match; one before the first selects
     * the first. With no match at all the clamped index itself is returned ({@code -1} for a
     * positive index, {@code 0} for a negative one) and later read as a slice offset.
     */
    public static int spanIndex(DslRegex regex, int index, Boundary boundary, String value) {
        List<Span> matches = CategoryMatcher.spans(regex, value);
        int count = matches.size();
        int selected = index < 0 ? index : index - 1;

        if (selected >= count) {
            selected = count - 1;
        } else if (selected < -count) {
            selected = 0;
        }
        if (count == 0) {
            return selected;
        }
        Span span = matches.get(selected < 0 ? count + selected : selected);
        return span.offset(boundary);
    }

    /**
     * Returns {@code value[start:end]} with slice semantics: negative offsets count from the end,
     * both offsets are clamped to {@code [0, length]}, and an empty string is returned when {@code
     * end <= start}.
     */
    public static String slice(String value, int start, int end) {
        int from = normalize(start, value.length());
        int to = normalize(end, value.length());
        return to <= from ? "" : value.substring(from, to);
    }

    /** Returns {@code value[start:]} with slice semantics. */
    public static String suffix(String value, int start) {
        return value.substring(normalize(start, value.length()));
    }

    private static int normalize(int offset, int length) {
        int resolved = offset < 0 ? offset + length : offset;
        return Math.max(0, Math.min(resolved, length));
    }
}
