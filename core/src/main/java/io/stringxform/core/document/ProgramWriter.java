package io.stringxform.core.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.stringxform.core.model.Expression;
import io.stringxform.core.model.ExpressionVisitor;
import io.stringxform.core.model.Program;
import java.util.Objects;

/**
 * Serializes programs into the document shape read by {@link ProgramParser}. Writing a program and
 * parsing the result yields an equal program.
 *
 * <p>Thread-safe and stateless.
 */
public final class ProgramWriter {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Builds the document tree for {@code program}; {@code id} is omitted when {@code null}. */
    public JsonNode toTree(Program program, String id) {
        Objects.requireNonNull(program, "program must not be null");
        ObjectNode root = NODES.objectNode();
        if (id != null) {
            root.put("id", id);
        }
        ArrayNode list = root.putArray("program");
        for (Expression expression : program.expressions()) {
            list.add(expression.accept(NodeBuilder.INSTANCE));
        }
        return root;
    }

    /** Renders {@code program} as a YAML document. */
    public String toYaml(Program program, String id) {
        return render(YAML_MAPPER, toTree(program, id));
    }

    /** Renders {@code program} as a compact JSON document. */
    public String toJson(Program program, String id) {
        return render(JSON_MAPPER, toTree(program, id));
    }

    private static String render(ObjectMapper mapper, JsonNode tree) {
        try {
            return mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize program document", e);
        }
    }

    /** Builds one single-key expression object per visited node. */
    private enum NodeBuilder implements ExpressionVisitor<ObjectNode> {
        INSTANCE;

        @Override
        public ObjectNode visitConstStr(Expression.ConstStr expression) {
            return wrap(expression, NODES.textNode(expression.character()));
        }

        @Override
        public ObjectNode visitSubStr(Expression.SubStr expression) {
            ObjectNode args = NODES.objectNode();
            args.put("pos1", expression.pos1());
            args.put("pos2", expression.pos2());
            return wrap(expression, args);
        }

        @Override
        public ObjectNode visitGetSpan(Expression.GetSpan expression) {
            ObjectNode args = NODES.objectNode();
            args.put("regex1", expression.regex1().symbol());
            args.put("index1", expression.index1());
            args.put("bound1", expression.bound1().name());
            args.put("regex2", expression.regex2().symbol());
            args.put("index2", expression.index2());
            args.put("bound2", expression.bound2().name());
            return wrap(expression, args);
        }

        @Override
        public ObjectNode visitCompose(Expression.Compose expression) {
            ObjectNode args = NODES.objectNode();
            args.set("outer", expression.outer().accept(this));
            args.set("inner", expression.inner().accept(this));
            return wrap(expression, args);
        }

        @Override
        public ObjectNode visitToCase(Expression.ToCase expression) {
            return wrap(expression, NODES.textNode(expression.letterCase().name()));
        }

        @Override
        public ObjectNode visitReplace(Expression.Replace expression) {
            ObjectNode args = NODES.objectNode();
            args.put("delimiter1", expression.delimiter1());
            args.put("delimiter2", expression.delimiter2());
            return wrap(expression, args);
        }

        @Override
        public ObjectNode visitTrim(Expression.Trim expression) {
            return wrap(expression, NODES.objectNode());
        }

        @Override
        public ObjectNode visitGetUpto(Expression.GetUpto expression) {
            return wrap(expression, NODES.textNode(expression.regex().symbol()));
        }

        @Override
        public ObjectNode visitGetFrom(Expression.GetFrom expression) {
            return wrap(expression, NODES.textNode(expression.regex().symbol()));
        }

        @Override
        public ObjectNode visitGetFirst(Expression.GetFirst expression) {
            return wrap(expression, categoryIndex(expression.category().name(), expression.index()));
        }

        @Override
        public ObjectNode visitGetAll(Expression.GetAll expression) {
            return wrap(expression, NODES.textNode(expression.category().name()));
        }

        @Override
        public ObjectNode visitGetToken(Expression.GetToken expression) {
            return wrap(expression, categoryIndex(expression.category().name(), expression.index()));
        }

        private static ObjectNode categoryIndex(String category, int index) {
            ObjectNode args = NODES.objectNode();
            args.put("category", category);
            args.put("index", index);
            return args;
        }

        private static ObjectNode wrap(Expression expression, JsonNode args) {
            ObjectNode node = NODES.objectNode();
            node.set(expression.operator().key(), args);
            return node;
        }
    }
}
