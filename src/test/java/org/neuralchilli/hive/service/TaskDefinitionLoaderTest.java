package org.neuralchilli.hive.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.hive.core.Scheduler;
import org.neuralchilli.hive.domain.RunReport;
import org.neuralchilli.hive.domain.Task;
import org.neuralchilli.hive.worker.ExecutorRegistry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

@QuarkusTest
class TaskDefinitionLoaderTest {

    @Inject
    TaskDefinitionLoader loader;

    @Inject
    SchedulerFactory factory;

    @Inject
    ExecutorRegistry registry;

    private Path tempDir;
    private Scheduler scheduler;

    @BeforeEach
    void setup() throws IOException {
        tempDir = Files.createTempDirectory("hive-test-");
        scheduler = factory.create("loader-test");
        registry.register("answer", ctx -> 42);
    }

    @AfterEach
    void cleanup() throws IOException {
        scheduler.close();
        registry.names().forEach(registry::unregister);

        if (tempDir != null && Files.exists(tempDir)) {
            try (Stream<Path> paths = Files.walk(tempDir)) {
                paths.sorted(Comparator.reverseOrder()) // Delete files before directories
                        .forEach(path -> path.toFile().delete());
            }
        }
    }

    @Test
    void shouldLoadBatchInDependencyOrder() {
        // Given: a dependent declared before its dependency
        String yaml = """
                tasks:
                  - id: report
                    executor: answer
                    depends_on: [compute]
                  - id: compute
                    executor: answer
                """;

        // When: Loading the batch
        List<LoadResult> results = loader.load(scheduler, yaml);

        // Then: Both load, reported in declared order
        assertThat(results).extracting(LoadResult::name).containsExactly("report", "compute");
        assertThat(results).allMatch(LoadResult::isSuccess);
        assertThat(scheduler.graph().getDependencies("report")).containsExactly("compute");
    }

    @Test
    void shouldRunCommandTasksInTrialMode() {
        // Given: A command task, with trial runs enabled in test configuration
        String yaml = """
                tasks:
                  - id: cleanup
                    command: rm
                    args: [-rf, /tmp/never-touched]
                  - id: summary
                    executor: answer
                    depends_on: cleanup
                    priority: 3
                    metadata:
                      owner: ops
                """;
        loader.load(scheduler, yaml);

        // When: Running
        RunReport report = scheduler.run();

        // Then: The command was only described
        assertThat(report.isSuccessful()).isTrue();
        assertThat(scheduler.getTask("cleanup").orElseThrow().result())
                .isInstanceOf(Map.class)
                .asInstanceOf(MAP)
                .containsEntry("trial_run", true)
                .containsEntry("timeout", 30L);

        Task summary = scheduler.getTask("summary").orElseThrow();
        assertThat(summary.result()).isEqualTo(42);
        assertThat(summary.priority()).isEqualTo(3);
        assertThat(summary.metadata()).containsEntry("owner", "ops");
    }

    @Test
    void shouldFailDependentsOfUnloadableTask() {
        // Given: A task naming an executor nobody registered
        String yaml = """
                tasks:
                  - id: first
                    executor: unregistered
                  - id: second
                    executor: answer
                    depends_on: first
                  - id: independent
                    executor: answer
                """;

        // When
        List<LoadResult> results = loader.load(scheduler, yaml);

        // Then: The failure propagates, unrelated tasks still load
        assertThat(results.get(0).isSuccess()).isFalse();
        assertThat(results.get(0).error()).hasValueSatisfying(e -> assertThat(e).contains("unregistered"));
        assertThat(results.get(1).error()).hasValue("dependency 'first' was not loaded");
        assertThat(results.get(2).isSuccess()).isTrue();
        assertThat(scheduler.graph().contains("second")).isFalse();
    }

    @Test
    void shouldReportCircularBatch() {
        String yaml = """
                tasks:
                  - id: a
                    executor: answer
                    depends_on: b
                  - id: b
                    executor: answer
                    depends_on: a
                  - id: c
                    executor: answer
                """;

        List<LoadResult> results = loader.load(scheduler, yaml);

        assertThat(results.get(0).error()).hasValueSatisfying(e -> assertThat(e).contains("circular dependency"));
        assertThat(results.get(1).isSuccess()).isFalse();
        assertThat(results.get(2).isSuccess()).isTrue();
        assertThat(scheduler.graph().size()).isEqualTo(1);
    }

    @Test
    void shouldReportUnknownExternalDependency() {
        String yaml = """
                tasks:
                  - id: orphan
                    executor: answer
                    depends_on: elsewhere
                """;

        List<LoadResult> results = loader.load(scheduler, yaml);

        assertThat(results).singleElement()
                .satisfies(r -> assertThat(r.error()).hasValueSatisfying(e -> assertThat(e).contains("elsewhere")));
    }

    @Test
    void shouldReportParseFailureAsSingleResult() {
        List<LoadResult> results = loader.load(scheduler, "tasks: not-a-list");

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.isSuccess()).isFalse();
            assertThat(r.name()).isEqualTo("batch");
        });
    }

    @Test
    void shouldLoadAllFilesSortedByName() throws IOException {
        // Given: the second file depends on a task from the first
        Files.writeString(tempDir.resolve("b-publish.yaml"), """
                tasks:
                  - id: publish
                    executor: answer
                    depends_on: prepare
                """);
        Files.writeString(tempDir.resolve("a-prepare.yml"), """
                tasks:
                  - id: prepare
                    executor: answer
                """);
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        // When
        List<LoadResult> results = loader.loadAll(scheduler, tempDir);

        // Then
        assertThat(results).extracting(LoadResult::name).containsExactly("prepare", "publish");
        assertThat(results).allMatch(LoadResult::isSuccess);
        assertThat(scheduler.run().completed()).containsExactly("prepare", "publish");
    }

    @Test
    void shouldReportUnreadableFile() {
        List<LoadResult> results = loader.load(scheduler, tempDir.resolve("missing.yaml"));

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.isSuccess()).isFalse();
            assertThat(r.name()).isEqualTo("missing.yaml");
        });
    }

    @Test
    void shouldIgnoreMissingDirectory() {
        assertThat(loader.loadAll(scheduler, tempDir.resolve("absent"))).isEmpty();
    }

    @Test
    void shouldSkipConfiguredLoadWithoutPath() {
        assertThat(loader.loadConfigured(scheduler)).isEmpty();
    }
}
