package io.stringxform.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Variant tag of an {@link Expression}. The {@link #key()} is the stable name used in program
 * documents and token tables.
 */
public enum Operator {
    CONST_STR("const_str"),
    SUB_STR("sub_str"),
    GET_SPAN("get_span"),
    COMPOSE("compose"),
    TO_CASE("to_case"),
    REPLACE("replace"),
    TRIM("trim"),
    GET_UPTO("get_upto"),
    GET_FROM("get_from"),
    GET_FIRST("get_first"),
    GET_ALL("get_all"),
    GET_TOKEN("get_token");

    private static final Map<String, Operator> BY_KEY =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(Operator::key, Function.identity()));

    private final String key;

    Operator(String key) {
        this.key = key;
    }

    /** Document key, e.g. {@code "get_span"}. */
    public String key() {
        return key;
    }

    /** Looks up an operator by its document key. */
    public static Optional<Operator> fromKey(String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }
}
