package org.neuralchilli.hive.config;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for TaskDefinitionParser against the task batch schema.
 */
@QuarkusTest
class TaskDefinitionParserTest {

    @Inject
    TaskDefinitionParser parser;

    @Test
    void shouldParseCommandTask() {
        // Given: A single command task
        String yaml = """
                tasks:
                  - id: extract
                    description: Pull the daily orders
                    command: python
                    args:
                      - extract.py
                      - --day
                      - "2024-01-01"
                    env:
                      REGION: eu
                    timeout: 120
                    priority: 5
                    metadata:
                      owner: data-team
                """;

        // When: Parse
        List<TaskDefinition> definitions = parser.parse(yaml);

        // Then: Every field is mapped
        assertThat(definitions).hasSize(1);
        TaskDefinition extract = definitions.get(0);
        assertThat(extract.id()).isEqualTo("extract");
        assertThat(extract.description()).isEqualTo("Pull the daily orders");
        assertThat(extract.isCommand()).isTrue();
        assertThat(extract.command()).isEqualTo("python");
        assertThat(extract.args()).containsExactly("extract.py", "--day", "2024-01-01");
        assertThat(extract.env()).containsEntry("REGION", "eu");
        assertThat(extract.timeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(extract.priority()).isEqualTo(5);
        assertThat(extract.metadata()).containsEntry("owner", "data-team");
    }

    @Test
    void shouldParseExecutorTaskWithDependencies() {
        // Given: A registered executor referenced by name
        String yaml = """
                tasks:
                  - id: a
                    executor: noop
                  - id: b
                    executor: noop
                    depends_on: a
                  - id: c
                    executor: noop
                    depends_on: [a, b]
                """;

        // When: Parse
        List<TaskDefinition> definitions = parser.parse(yaml);

        // Then: Single dependency and list form are both accepted
        assertThat(definitions).extracting(TaskDefinition::id).containsExactly("a", "b", "c");
        assertThat(definitions.get(0).isCommand()).isFalse();
        assertThat(definitions.get(0).description()).isEmpty();
        assertThat(definitions.get(0).timeout()).isNull();
        assertThat(definitions.get(1).dependsOn()).containsExactly("a");
        assertThat(definitions.get(2).dependsOn()).containsExactly("a", "b");
    }

    @Test
    void shouldParseFromInputStream() {
        String yaml = """
                tasks:
                  - id: only
                    command: echo
                """;

        List<TaskDefinition> definitions =
                parser.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertThat(definitions).extracting(TaskDefinition::command).containsExactly("echo");
    }

    @Test
    void shouldRejectTaskWithBothCommandAndExecutor() {
        String yaml = """
                tasks:
                  - id: confused
                    command: echo
                    executor: noop
                """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly one of 'command' or 'executor'");
    }

    @Test
    void shouldRejectTaskWithNeitherCommandNorExecutor() {
        String yaml = """
                tasks:
                  - id: empty
                """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectMissingId() {
        String yaml = """
                tasks:
                  - command: echo
                """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing required field: id");
    }

    @Test
    void shouldRejectDuplicateIds() {
        String yaml = """
                tasks:
                  - id: twice
                    command: echo
                  - id: twice
                    command: echo
                """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate task id: twice");
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        String yaml = """
                tasks:
                  - id: instant
                    command: echo
                    timeout: 0
                """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeout must be positive");
    }

    @Test
    void shouldRejectDocumentWithoutTasks() {
        assertThatThrownBy(() -> parser.parse("name: nothing"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse("tasks: []"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one task");
        assertThatThrownBy(() -> parser.parse("- just a list"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNonMappingEnv() {
        String yaml = """
                tasks:
                  - id: bad-env
                    command: echo
                    env: [A, B]
                """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'env' must be a mapping");
    }
}
