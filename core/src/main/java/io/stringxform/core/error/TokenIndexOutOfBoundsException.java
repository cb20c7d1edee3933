package io.stringxform.core.error;

import io.stringxform.core.model.Category;
import io.stringxform.core.model.Operator;

/** Thrown when {@code GetToken} selects a match that does not exist. */
public final class TokenIndexOutOfBoundsException extends DslEvalException {

    private static final long serialVersionUID = 1L;

    private final Category category;
    private final int index;
    private final int matchCount;

    public TokenIndexOutOfBoundsException(Category category, int index, int matchCount, String input) {
        super(
                String.format("get_token index %d out of bounds for %d %s match(es)", index, matchCount, category),
                Kind.INDEX_OUT_OF_BOUNDS,
                Operator.GET_TOKEN,
                input);
        this.category = category;
        this.index = index;
        this.matchCount = matchCount;
    }

    public Category category() {
        return category;
    }

    public int index() {
        return index;
    }

    /** Number of matches found in the input. */
    public int matchCount() {
        return matchCount;
    }
}
