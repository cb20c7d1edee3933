package io.stringxform.core.model;

import io.stringxform.core.engine.CategoryMatcher;
import io.stringxform.core.engine.PositionResolver;
import io.stringxform.core.error.NegativeIndexException;
import io.stringxform.core.error.TokenIndexOutOfBoundsException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One expression of a {@link Program}. Every expression maps an input string to an output string.
 *
 * <p>The hierarchy is sealed: {@link ConstStr}, the {@link Substring} family (extract directly from
 * the input) and the {@link Nesting} family (transform a string that is already extracted). Use
 * {@link #accept(ExpressionVisitor)} for exhaustive dispatch, or {@link #operator()} and {@link
 * #arguments()} for structural access.
 *
 * <p>Thread-safe and immutable. Evaluation is pure.
 */
public sealed interface Expression {

    /**
     * Evaluates this expression against {@code value}.
     *
     * @throws NegativeIndexException if a {@link GetFirst} count is negative
     * @throws TokenIndexOutOfBoundsException if a {@link GetToken} index selects no match
     */
    String evaluate(String value);

    /** Variant tag. */
    Operator operator();

    /**
     * Ordered constructor arguments. Elements are {@link Integer}, {@link String}, {@link Category},
     * {@link Case}, {@link Boundary}, {@link DslRegex} or nested {@link Expression} values.
     */
    List<Object> arguments();

    <R> R accept(ExpressionVisitor<R> visitor);

    /** Expressions that extract a substring of the input. */
    sealed interface Substring extends Expression {}

    /** Expressions that transform an already-extracted string. */
    sealed interface Nesting extends Expression {}

    // ── Constant ──

    /**
     * Emits one literal character, ignoring the input.
     *
     * @param character a single {@link Vocabulary#CHARACTER} character
     */
    record ConstStr(String character) implements Expression {
        public ConstStr {
            Objects.requireNonNull(character, "character must not be null");
            if (!Vocabulary.isCharacter(character)) {
                throw new IllegalArgumentException("ConstStr requires a single DSL character, got: '" + character + "'");
            }
        }

        @Override
        public String evaluate(String value) {
            return character;
        }

        @Override
        public Operator operator() {
            return Operator.CONST_STR;
        }

        @Override
        public List<Object> arguments() {
            return List.of(character);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitConstStr(this);
        }
    }

    // ── Substring ──

    /**
     * Extracts the characters from {@code pos1} through {@code pos2}, both inclusive. Positions are
     * 1-based when positive and count from the end when negative.
     *
     * <p>When {@code pos2} resolves to {@code -1} (the last character) the whole suffix from {@code
     * pos1} is returned. Out-of-range positions clamp; this operator never fails.
     */
    record SubStr(int pos1, int pos2) implements Substring {
        public SubStr {
            requirePosition(pos1, "pos1");
            requirePosition(pos2, "pos2");
        }

        @Override
        public String evaluate(String value) {
            int p1 = PositionResolver.substrIndex(pos1, value);
            int p2 = PositionResolver.substrIndex(pos2, value);
            if (p2 == -1) {
                return PositionResolver.suffix(value, p1);
            }
            return PositionResolver.slice(value, p1, p2 + 1);
        }

        @Override
        public Operator operator() {
            return Operator.SUB_STR;
        }

        @Override
        public List<Object> arguments() {
            return List.of(pos1, pos2);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitSubStr(this);
        }
    }

    /**
     * Extracts the text between two match boundaries, end-exclusive. Each endpoint selects the
     * {@code index}-th match of its regex and takes the {@code bound} offset of that match. Indices
     * past either end of the match list clamp to the first or last match.
     */
    record GetSpan(
            DslRegex regex1, int index1, Boundary bound1, DslRegex regex2, int index2, Boundary bound2)
            implements Substring {
        public GetSpan {
            Objects.requireNonNull(regex1, "regex1 must not be null");
            Objects.requireNonNull(bound1, "bound1 must not be null");
            Objects.requireNonNull(regex2, "regex2 must not be null");
            Objects.requireNonNull(bound2, "bound2 must not be null");
            requireIndex(index1, "index1");
            requireIndex(index2, "index2");
        }

        @Override
        public String evaluate(String value) {
            int p1 = PositionResolver.spanIndex(regex1, index1, bound1, value);
            int p2 = PositionResolver.spanIndex(regex2, index2, bound2, value);
            return PositionResolver.slice(value, p1, p2);
        }

        @Override
        public Operator operator() {
            return Operator.GET_SPAN;
        }

        @Override
        public List<Object> arguments() {
            return List.of(regex1, index1, bound1, regex2, index2, bound2);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitGetSpan(this);
        }
    }

    // ── Nesting ──

    /** Applies {@code outer} to the result of {@code inner}. */
    record Compose(Nesting outer, Expression inner) implements Nesting {
        public Compose {
            Objects.requireNonNull(outer, "outer must not be null");
            Objects.requireNonNull(inner, "inner must not be null");
        }

        @Override
        public String evaluate(String value) {
            return outer.evaluate(inner.evaluate(value));
        }

        @Override
        public Operator operator() {
            return Operator.COMPOSE;
        }

        @Override
        public List<Object> arguments() {
            return List.of(outer, inner);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitCompose(this);
        }
    }

    /**
     * Converts the case of the whole string. {@link Case#PROPER} uppercases only the first character
     * of the string and lowercases the rest; it is not per-word title casing.
     */
    record ToCase(Case letterCase) implements Nesting {
        public ToCase {
            Objects.requireNonNull(letterCase, "letterCase must not be null");
        }

        @Override
        public String evaluate(String value) {
            return switch (letterCase) {
                case PROPER -> properCase(value);
                case ALL_CAPS -> value.toUpperCase(Locale.ROOT);
                case LOWER -> value.toLowerCase(Locale.ROOT);
            };
        }

        @Override
        public Operator operator() {
            return Operator.TO_CASE;
        }

        // Splits after the first code point so a surrogate pair is never cut.
        private static String properCase(String value) {
            if (value.isEmpty()) {
                return value;
            }
            int split = value.offsetByCodePoints(0, 1);
            return value.substring(0, split).toUpperCase(Locale.ROOT)
                    + value.substring(split).toLowerCase(Locale.ROOT);
        }

        @Override
        public List<Object> arguments() {
            return List.of(letterCase);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitToCase(this);
        }
    }

    /** Replaces every occurrence of {@code delimiter1} with {@code delimiter2}. */
    record Replace(String delimiter1, String delimiter2) implements Nesting {
        public Replace {
            requireDelimiter(delimiter1, "delimiter1");
            requireDelimiter(delimiter2, "delimiter2");
        }

        @Override
        public String evaluate(String value) {
            return value.replace(delimiter1, delimiter2);
        }

        @Override
        public Operator operator() {
            return Operator.REPLACE;
        }

        @Override
        public List<Object> arguments() {
            return List.of(delimiter1, delimiter2);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitReplace(this);
        }
    }

    /**
     * Strips leading and trailing whitespace as defined by {@link Character#isWhitespace(int)}.
     * No-break spaces such as U+00A0 are not whitespace and are kept.
     */
    record Trim() implements Nesting {
        @Override
        public String evaluate(String value) {
            return value.strip();
        }

        @Override
        public Operator operator() {
            return Operator.TRIM;
        }

        @Override
        public List<Object> arguments() {
            return List.of();
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitTrim(this);
        }
    }

    /** Returns everything up to and including the first match, or {@code ""} when nothing matches. */
    record GetUpto(DslRegex regex) implements Nesting {
        public GetUpto {
            Objects.requireNonNull(regex, "regex must not be null");
        }

        @Override
        public String evaluate(String value) {
            List<Span> matches = CategoryMatcher.spans(regex, value);
            return matches.isEmpty() ? "" : value.substring(0, matches.get(0).end());
        }

        @Override
        public Operator operator() {
            return Operator.GET_UPTO;
        }

        @Override
        public List<Object> arguments() {
            return List.of(regex);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitGetUpto(this);
        }
    }

    /** Returns everything after the first match, or {@code ""} when nothing matches. */
    record GetFrom(DslRegex regex) implements Nesting {
        public GetFrom {
            Objects.requireNonNull(regex, "regex must not be null");
        }

        @Override
        public String evaluate(String value) {
            List<Span> matches = CategoryMatcher.spans(regex, value);
            return matches.isEmpty() ? "" : value.substring(matches.get(0).end());
        }

        @Override
        public Operator operator() {
            return Operator.GET_FROM;
        }

        @Override
        public List<Object> arguments() {
            return List.of(regex);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitGetFrom(this);
        }
    }

    /**
     * Concatenates the first {@code index} matches of {@code category}, without separator. Fewer
     * matches than {@code index} yields all of them. A negative {@code index} fails at evaluation.
     */
    record GetFirst(Category category, int index) implements Nesting {
        public GetFirst {
            Objects.requireNonNull(category, "category must not be null");
        }

        @Override
        public String evaluate(String value) {
            if (index < 0) {
                throw new NegativeIndexException(index, value);
            }
            List<String> matches = CategoryMatcher.substrings(category, value);
            return String.join("", matches.subList(0, Math.min(index, matches.size())));
        }

        @Override
        public Operator operator() {
            return Operator.GET_FIRST;
        }

        @Override
        public List<Object> arguments() {
            return List.of(category, index);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitGetFirst(this);
        }
    }

    /** Joins every match of {@code category} with a single space. */
    record GetAll(Category category) implements Nesting {
        public GetAll {
            Objects.requireNonNull(category, "category must not be null");
        }

        @Override
        public String evaluate(String value) {
            return String.join(" ", CategoryMatcher.substrings(category, value));
        }

        @Override
        public Operator operator() {
            return Operator.GET_ALL;
        }

        @Override
        public List<Object> arguments() {
            return List.of(category);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitGetAll(this);
        }
    }

    /**
     * Selects one match of {@code category}: 1-based when {@code index} is positive, counted from the
     * end when negative. Never clamps; a missing match fails at evaluation.
     */
    record GetToken(Category category, int index) implements Nesting {
        public GetToken {
            Objects.requireNonNull(category, "category must not be null");
            requireIndex(index, "index");
        }

        @Override
        public String evaluate(String value) {
            List<String> matches = CategoryMatcher.substrings(category, value);
            int count = matches.size();
            int selected = index > 0 ? index - 1 : index;
            if (selected >= count || selected < -count) {
                throw new TokenIndexOutOfBoundsException(category, index, count, value);
            }
            return matches.get(selected < 0 ? count + selected : selected);
        }

        @Override
        public Operator operator() {
            return Operator.GET_TOKEN;
        }

        @Override
        public List<Object> arguments() {
            return List.of(category, index);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitGetToken(this);
        }
    }

    // ── Argument checks ──

    private static void requirePosition(int position, String name) {
        if (!Vocabulary.isPosition(position)) {
            throw new IllegalArgumentException(String.format(
                    "%s must be between %d and %d, got: %d",
                    name, Vocabulary.POSITION_MIN, Vocabulary.POSITION_MAX, position));
        }
    }

    private static void requireIndex(int index, String name) {
        if (!Vocabulary.isIndex(index)) {
            throw new IllegalArgumentException(name + " must be one of " + Vocabulary.INDEX + ", got: " + index);
        }
    }

    private static void requireDelimiter(String delimiter, String name) {
        Objects.requireNonNull(delimiter, name + " must not be null");
        if (!Vocabulary.isDelimiter(delimiter)) {
            throw new IllegalArgumentException(
                    name + " must be a single punctuation or whitespace character, got: '" + delimiter + "'");
        }
    }
}
