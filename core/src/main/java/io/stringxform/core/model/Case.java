package io.stringxform.core.model;

/**
 * Case conversion applied by {@code ToCase} to a whole string.
 *
 * <ul>
 *   <li>{@link #PROPER}: first character uppercased, every other character lowercased.
 *   <li>{@link #ALL_CAPS}: every character uppercased.
 *   <li>{@link #LOWER}: every character lowercased.
 * </ul>
 */
public enum Case {
    PROPER,
    ALL_CAPS,
    LOWER
}
