package io.stringxform.core.model;

/**
 * Half-open {@code [start, end)} offset pair locating a match inside a string.
 *
 * @param start offset of the first matched character
 * @param end offset one past the last matched character
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /** Returns the start or end offset, depending on {@code boundary}. */
    public int offset(Boundary boundary) {
        return boundary == Boundary.START ? start : end;
    }

    /** Returns the substring of {@code value} covered by this span. */
    public String slice(String value) {
        return value.substring(start, end);
    }
}
