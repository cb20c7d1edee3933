package io.stringxform.core.testkit;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stringxform.core.document.ProgramParser;
import io.stringxform.core.engine.ProgramEvaluator;
import io.stringxform.core.error.DslEvalException;
import io.stringxform.core.model.EvalResult;
import io.stringxform.core.model.Program;
import io.stringxform.core.testkit.ScenarioLoader.ScenarioCase;
import io.stringxform.core.testkit.ScenarioLoader.ScenarioDefinition;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Parameterized scenario suite. Loads every scenario from {@code docs/scenarios.md}, parses its
 * program through {@link ProgramParser} and checks each case against {@link ProgramEvaluator}.
 */
@DisplayName("Scenario Suite")
class ScenarioSuiteTest {

    /**
     * Path to scenarios.md, resolved relative to the project root. Maven runs tests from the module
     * root (core/), so we go up one level.
     */
    private static final Path SCENARIOS_MD = resolveScenariosMd();

    private static Path resolveScenariosMd() {
        Path fromModule = Path.of("../docs/scenarios.md");
        if (Files.exists(fromModule)) {
            return fromModule;
        }
        Path fromProject = Path.of("docs/scenarios.md");
        if (Files.exists(fromProject)) {
            return fromProject;
        }
        throw new IllegalStateException("Cannot find scenarios.md, tried " + fromModule.toAbsolutePath() + " and "
                + fromProject.toAbsolutePath());
    }

    private final ProgramParser parser = new ProgramParser();
    private final ProgramEvaluator evaluator = new ProgramEvaluator();

    @BeforeAll
    static void loadScenarios() throws IOException {
        List<ScenarioDefinition> scenarios = ScenarioLoader.loadAll(SCENARIOS_MD);
        assertThat(scenarios).as("Should load scenarios from scenarios.md").isNotEmpty();
        assertThat(scenarios.stream().map(ScenarioDefinition::id).distinct().count())
                .as("Scenario ids must be unique")
                .isEqualTo(scenarios.size());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("scenarioCases")
    @DisplayName("Scenario case")
    void scenarioCase(String displayName, ScenarioDefinition scenario, ScenarioCase scenarioCase) {
        Program program = parser.parse(wrap(scenario.program()), SCENARIOS_MD + "#" + scenario.id());

        EvalResult result = evaluator.tryEvaluate(program, scenarioCase.input());

        if (scenarioCase.isErrorCase()) {
            assertThat(result.isError())
                    .as("Scenario %s on '%s' should fail, got %s", scenario.id(), scenarioCase.input(), result)
                    .isTrue();
            assertThat(result.errorKind()).isEqualTo(DslEvalException.Kind.valueOf(scenarioCase.expectedError()));
        } else {
            assertThat(result.isSuccess())
                    .as("Scenario %s on '%s' should succeed, got %s", scenario.id(), scenarioCase.input(), result)
                    .isTrue();
            assertThat(result.output())
                    .as("Scenario %s output for '%s'", scenario.id(), scenarioCase.input())
                    .isEqualTo(scenarioCase.expectedOutput());
        }
    }

    static Stream<Arguments> scenarioCases() throws IOException {
        return ScenarioLoader.loadAll(SCENARIOS_MD).stream()
                .flatMap(scenario -> scenario.cases().stream()
                        .map(c -> Arguments.of(
                                scenario.displayName() + " ['" + c.input() + "']", scenario, c)));
    }

    private static JsonNode wrap(JsonNode program) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.set("program", program);
        return root;
    }
}
