package io.stringxform.core.token;

import io.stringxform.core.model.Boundary;
import io.stringxform.core.model.Case;
import io.stringxform.core.model.Category;
import io.stringxform.core.model.Operator;
import io.stringxform.core.model.Vocabulary;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable token tables for programs and strings.
 *
 * <p>The op table assigns ids, in this order, to every {@link Operator}, {@link Category}, {@link
 * Case} and {@link Boundary} constant, every integer in [{@link Vocabulary#POSITION_MIN}, {@link
 * Vocabulary#POSITION_MAX}] (which covers {@link Vocabulary#INDEX}), and every {@link
 * Vocabulary#CHARACTER} character as a one-character {@link String}. The string table assigns ids
 * to the {@link Vocabulary#CHARACTER} characters.
 *
 * @param opTokens symbol to op-token id
 * @param stringTokens character to string-token id
 */
public record TokenTables(Map<Object, Integer> opTokens, Map<Character, Integer> stringTokens) {

    public TokenTables {
        opTokens = Collections.unmodifiableMap(new LinkedHashMap<>(opTokens));
        stringTokens = Collections.unmodifiableMap(new LinkedHashMap<>(stringTokens));
    }

    /** Builds the tables from the DSL vocabulary. Ids are dense and stable across builds. */
    public static TokenTables build() {
        Map<Object, Integer> ops = new LinkedHashMap<>();
        for (Operator operator : Operator.values()) {
            ops.put(operator, ops.size());
        }
        for (Category category : Category.values()) {
            ops.put(category, ops.size());
        }
        for (Case letterCase : Case.values()) {
            ops.put(letterCase, ops.size());
        }
        for (Boundary boundary : Boundary.values()) {
            ops.put(boundary, ops.size());
        }
        for (int position = Vocabulary.POSITION_MIN; position <= Vocabulary.POSITION_MAX; position++) {
            ops.put(position, ops.size());
        }
        for (char c : Vocabulary.CHARACTER.toCharArray()) {
            ops.put(String.valueOf(c), ops.size());
        }

        Map<Character, Integer> strings = new LinkedHashMap<>();
        for (char c : Vocabulary.CHARACTER.toCharArray()) {
            strings.put(c, strings.size());
        }
        return new TokenTables(ops, strings);
    }
}
