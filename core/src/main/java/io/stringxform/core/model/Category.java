package io.stringxform.core.model;

/**
 * Character categories a DSL regex can name. Every category is an ASCII-only class; see {@link
 * io.stringxform.core.engine.CategoryMatcher} for the matching rules.
 *
 * <ul>
 *   <li>{@link #NUMBER}: one or more digits.
 *   <li>{@link #WORD}: one or more letters.
 *   <li>{@link #ALPHANUM}: one or more letters or digits.
 *   <li>{@link #ALL_CAPS}: one or more uppercase letters.
 *   <li>{@link #PROP_CASE}: one uppercase letter followed by one or more lowercase letters.
 *   <li>{@link #LOWER}: one or more lowercase letters.
 *   <li>{@link #DIGIT}: exactly one digit.
 *   <li>{@link #CHAR}: exactly one letter or digit.
 * </ul>
 */
public enum Category {
    NUMBER,
    WORD,
    ALPHANUM,
    ALL_CAPS,
    PROP_CASE,
    LOWER,
    DIGIT,
    CHAR
}
