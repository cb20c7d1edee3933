package io.stringxform.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.stringxform.core.error.ProgramParseException;
import io.stringxform.core.error.ProgramSchemaException;
import io.stringxform.core.model.Boundary;
import io.stringxform.core.model.Case;
import io.stringxform.core.model.Category;
import io.stringxform.core.model.DslRegex;
import io.stringxform.core.model.Expression;
import io.stringxform.core.model.Operator;
import io.stringxform.core.model.Program;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses YAML or JSON program documents into {@link Program} instances.
 *
 * <p>A document has a required {@code program} list and optional {@code id} and {@code
 * description} strings. Each list element is a single-key object naming the operator:
 *
 * <pre>{@code
 * id: initials
 * program:
 *   - get_token: {category: WORD, index: 1}
 *   - const_str: "."
 *   - compose:
 *       outer: {to_case: ALL_CAPS}
 *       inner: {get_first: {category: CHAR, index: 1}}
 * }</pre>
 *
 * <p>Documents are validated against {@code schemas/program-schema.json} before any expression is
 * built; argument values the model rejects (an index outside the vocabulary, a non-delimiter
 * character) surface as {@link ProgramParseException} with the path of the offending node.
 *
 * <p>Thread-safe: the YAML mapper and the compiled schema are shared and immutable.
 */
public final class ProgramParser {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramParser.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String SCHEMA_RESOURCE = "/schemas/program-schema.json";
    private static final JsonSchema PROGRAM_SCHEMA = loadSchema();

    private static final Set<String> CATEGORY_NAMES =
            Arrays.stream(Category.values()).map(Category::name).collect(Collectors.toUnmodifiableSet());

    /**
     * Parses the program document at the given path.
     *
     * @throws ProgramParseException if the file cannot be read or holds an invalid program
     * @throws ProgramSchemaException if the document does not match the program schema
     */
    public Program parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new ProgramParseException("Failed to read or parse YAML: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    /**
     * Parses a program document held in memory. JSON is accepted as well, being a subset of YAML.
     *
     * @throws ProgramParseException if the text is not valid YAML or holds an invalid program
     * @throws ProgramSchemaException if the document does not match the program schema
     */
    public Program parseString(String document) {
        Objects.requireNonNull(document, "document must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(document);
        } catch (IOException e) {
            throw new ProgramParseException("Failed to parse YAML: " + e.getMessage(), e, null);
        }
        return parse(root, null);
    }

    /**
     * Builds a program from an already-parsed document tree.
     *
     * @param root the document root
     * @param source file path or resource name for error messages, or {@code null}
     */
    public Program parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ProgramParseException("Program document is empty", source);
        }
        validateSchema(root, source);

        JsonNode programNode = root.get("program");
        List<Expression> expressions = new ArrayList<>(programNode.size());
        for (int i = 0; i < programNode.size(); i++) {
            expressions.add(parseExpression(programNode.get(i), "program[" + i + "]", source));
        }
        Program program = new Program(expressions);

        JsonNode idNode = root.get("id");
        LOG.info(
                "program.loaded id={} source={} expressions={}",
                idNode != null ? idNode.asText() : null,
                source,
                program.size());
        return program;
    }

    private Expression parseExpression(JsonNode node, String path, String source) {
        Map.Entry<String, JsonNode> entry = node.fields().next();
        String key = entry.getKey();
        JsonNode args = entry.getValue();
        String argPath = path + "." + key;

        Operator operator = Operator.fromKey(key)
                .orElseThrow(() -> new ProgramParseException(path + ": unknown operator '" + key + "'", source));
        try {
            return switch (operator) {
                case CONST_STR -> new Expression.ConstStr(args.asText());
                case SUB_STR -> new Expression.SubStr(
                        intArg(args, "pos1", argPath, source), intArg(args, "pos2", argPath, source));
                case GET_SPAN -> new Expression.GetSpan(
                        parseRegex(args.get("regex1")),
                        intArg(args, "index1", argPath, source),
                        Boundary.valueOf(args.get("bound1").asText()),
                        parseRegex(args.get("regex2")),
                        intArg(args, "index2", argPath, source),
                        Boundary.valueOf(args.get("bound2").asText()));
                case COMPOSE -> new Expression.Compose(
                        parseNesting(args.get("outer"), argPath + ".outer", source),
                        parseExpression(args.get("inner"), argPath + ".inner", source));
                case TO_CASE -> new Expression.ToCase(Case.valueOf(args.asText()));
                case REPLACE -> new Expression.Replace(
                        args.get("delimiter1").asText(), args.get("delimiter2").asText());
                case TRIM -> new Expression.Trim();
                case GET_UPTO -> new Expression.GetUpto(parseRegex(args));
                case GET_FROM -> new Expression.GetFrom(parseRegex(args));
                case GET_FIRST -> new Expression.GetFirst(
                        Category.valueOf(args.get("category").asText()),
                        intArg(args, "index", argPath, source));
                case GET_ALL -> new Expression.GetAll(Category.valueOf(args.asText()));
                case GET_TOKEN -> new Expression.GetToken(
                        Category.valueOf(args.get("category").asText()),
                        intArg(args, "index", argPath, source));
            };
        } catch (IllegalArgumentException e) {
            throw new ProgramParseException(argPath + ": " + e.getMessage(), e, source);
        }
    }

    private Expression.Nesting parseNesting(JsonNode node, String path, String source) {
        Expression expression = parseExpression(node, path, source);
        if (expression instanceof Expression.Nesting nesting) {
            return nesting;
        }
        throw new ProgramParseException(
                path + ": compose.outer must be a nesting operator, got '" + expression.operator().key() + "'",
                source);
    }

    private static int intArg(JsonNode args, String field, String argPath, String source) {
        JsonNode node = args.get(field);
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ProgramParseException(
                    argPath + "." + field + ": expected a 32-bit integer, got: " + node.asText(), source);
        }
        return node.intValue();
    }

    private static DslRegex parseRegex(JsonNode node) {
        String symbol = node.asText();
        if (CATEGORY_NAMES.contains(symbol)) {
            return DslRegex.of(Category.valueOf(symbol));
        }
        return DslRegex.delimiter(symbol);
    }

    private static void validateSchema(JsonNode root, String source) {
        Set<ValidationMessage> errors = PROGRAM_SCHEMA.validate(root);
        if (errors.isEmpty()) {
            return;
        }
        List<String> violations =
                errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.toList());
        throw new ProgramSchemaException(
                "Program document does not match the program schema: " + violations, violations, source);
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = ProgramParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(new ObjectMapper().readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + SCHEMA_RESOURCE, e);
        }
    }
}
