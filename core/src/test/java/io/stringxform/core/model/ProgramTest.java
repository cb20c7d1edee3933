package io.stringxform.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stringxform.core.error.TokenIndexOutOfBoundsException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Program")
class ProgramTest {

    @Test
    @DisplayName("concatenates expression outputs in order")
    void concatenates() {
        var program = Program.of(new Expression.ConstStr("a"), new Expression.SubStr(1, 2));
        assertThat(program.evaluate("xy")).isEqualTo("axy");
    }

    @Test
    @DisplayName("applies every expression to the original input")
    void sameInputForEachExpression() {
        var program = Program.of(
                new Expression.ToCase(Case.ALL_CAPS), new Expression.ConstStr("-"), new Expression.ToCase(Case.LOWER));
        assertThat(program.evaluate("AbC")).isEqualTo("ABC-abc");
    }

    @Test
    @DisplayName("fails as a whole when any expression fails")
    void failsWhenAnyExpressionFails() {
        var program = Program.of(new Expression.ConstStr("a"), new Expression.GetToken(Category.NUMBER, 1));
        assertThatThrownBy(() -> program.evaluate("abc")).isInstanceOf(TokenIndexOutOfBoundsException.class);
    }

    @Test
    @DisplayName("rejects an empty expression list")
    void rejectsEmpty() {
        assertThatThrownBy(() -> new Program(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one expression");
        assertThatThrownBy(Program::of).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("copies and freezes the expression list")
    void defensiveCopy() {
        List<Expression> source = new ArrayList<>();
        source.add(new Expression.Trim());
        var program = new Program(source);
        source.add(new Expression.ConstStr("x"));

        assertThat(program.size()).isEqualTo(1);
        assertThatThrownBy(() -> program.expressions().add(new Expression.Trim()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("equal expression lists make equal programs")
    void valueEquality() {
        assertThat(Program.of(new Expression.SubStr(1, -1))).isEqualTo(Program.of(new Expression.SubStr(1, -1)));
    }
}
