package io.stringxform.core.token;

import io.stringxform.core.model.DslRegex;
import io.stringxform.core.model.Expression;
import io.stringxform.core.model.Program;
import io.stringxform.core.spi.ProgramTokenizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@link ProgramTokenizer} backed by {@link TokenTables}.
 *
 * <p>Programs are flattened in prefix order: each expression emits its operator token followed by
 * the tokens of its arguments, recursing into nested expressions. Operator arities are fixed, so
 * the sequence is unambiguous without separators. A {@link DslRegex} emits the token of its
 * category or of its delimiter character.
 *
 * <p>Stateless and thread-safe.
 */
public final class TableProgramTokenizer implements ProgramTokenizer {

    private final TokenTables tables;

    public TableProgramTokenizer() {
        this(TokenTables.build());
    }

    public TableProgramTokenizer(TokenTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
    }

    @Override
    public List<Integer> tokenize(Program program) {
        Objects.requireNonNull(program, "program must not be null");
        List<Integer> tokens = new ArrayList<>();
        for (Expression expression : program.expressions()) {
            flatten(expression, tokens);
        }
        return Collections.unmodifiableList(tokens);
    }

    @Override
    public List<Integer> tokenizeString(String value) {
        Objects.requireNonNull(value, "value must not be null");
        List<Integer> tokens = new ArrayList<>(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            Integer id = tables.stringTokens().get(c);
            if (id == null) {
                throw new IllegalArgumentException(
                        String.format("No string token for character U+%04X at offset %d", (int) c, i));
            }
            tokens.add(id);
        }
        return Collections.unmodifiableList(tokens);
    }

    @Override
    public int programVocabularySize() {
        return tables.opTokens().size();
    }

    @Override
    public int stringVocabularySize() {
        return tables.stringTokens().size();
    }

    private void flatten(Expression expression, List<Integer> tokens) {
        tokens.add(opToken(expression.operator()));
        for (Object argument : expression.arguments()) {
            if (argument instanceof Expression nested) {
                flatten(nested, tokens);
            } else if (argument instanceof DslRegex.OfCategory ofCategory) {
                tokens.add(opToken(ofCategory.category()));
            } else if (argument instanceof DslRegex.Delimiter delimiter) {
                tokens.add(opToken(delimiter.character()));
            } else {
                tokens.add(opToken(argument));
            }
        }
    }

    private int opToken(Object symbol) {
        Integer id = tables.opTokens().get(symbol);
        if (id == null) {
            throw new IllegalArgumentException("No op token for symbol: " + symbol);
        }
        return id;
    }
}
