package io.stringxform.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.stringxform.core.model.Category;
import io.stringxform.core.model.Operator;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Exception hierarchy")
class ExceptionHierarchyTest {

    @Test
    @DisplayName("load errors are DslLoadException with phase LOAD")
    void loadErrors() {
        var parse = new ProgramParseException("bad", "a.yaml");
        var schema = new ProgramSchemaException("bad", List.of("v1", "v2"), null);

        assertThat(parse).isInstanceOf(DslLoadException.class).isInstanceOf(DslException.class);
        assertThat(parse.phase()).isEqualTo(DslException.Phase.LOAD);
        assertThat(parse.source()).isEqualTo("a.yaml");
        assertThat(schema.phase()).isEqualTo(DslException.Phase.LOAD);
        assertThat(schema.source()).isNull();
        assertThat(schema.violations()).containsExactly("v1", "v2");
    }

    @Test
    @DisplayName("evaluation errors are DslEvalException with phase EVALUATION")
    void evaluationErrors() {
        DslEvalException negative = new NegativeIndexException(-2, "abc");
        DslEvalException outOfBounds = new TokenIndexOutOfBoundsException(Category.WORD, 3, 1, "abc");

        assertThat(negative.phase()).isEqualTo(DslException.Phase.EVALUATION);
        assertThat(negative.kind()).isEqualTo(DslEvalException.Kind.NEGATIVE_INDEX);
        assertThat(negative.operator()).isEqualTo(Operator.GET_FIRST);
        assertThat(negative.detail()).isEqualTo("get_first index must not be negative, got: -2");

        assertThat(outOfBounds.phase()).isEqualTo(DslException.Phase.EVALUATION);
        assertThat(outOfBounds.kind()).isEqualTo(DslEvalException.Kind.INDEX_OUT_OF_BOUNDS);
        assertThat(outOfBounds.operator()).isEqualTo(Operator.GET_TOKEN);
        assertThat(outOfBounds.detail()).isEqualTo("get_token index 3 out of bounds for 1 WORD match(es)");
        assertThat(outOfBounds.input()).isEqualTo("abc");
    }

    @Test
    @DisplayName("all DSL errors are unchecked")
    void unchecked() {
        assertThat(RuntimeException.class).isAssignableFrom(DslException.class);
    }

    @Test
    @DisplayName("parse exception keeps its cause")
    void cause() {
        var cause = new IllegalArgumentException("index 0");
        assertThat(new ProgramParseException("wrapped", cause, null)).hasCause(cause);
    }
}
