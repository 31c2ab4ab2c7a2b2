package org.neuralchilli.hive.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.hive.core.FailurePolicy;
import org.neuralchilli.hive.core.Scheduler;
import org.neuralchilli.hive.domain.RunReport;
import org.neuralchilli.hive.monitoring.SchedulerMetrics;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class SchedulerFactoryTest {

    @Inject
    SchedulerFactory factory;

    @Inject
    SchedulerMetrics metrics;

    @BeforeEach
    void setup() {
        metrics.reset();
    }

    @Test
    void shouldApplyConfiguration() {
        try (Scheduler scheduler = factory.create()) {
            assertThat(scheduler.maxWorkers()).isEqualTo(2);
            assertThat(scheduler.workerId()).isEqualTo("test-worker");
            assertThat(scheduler.failurePolicy()).isEqualTo(FailurePolicy.BLOCK);
        }
    }

    @Test
    void shouldOverrideWorkerId() {
        try (Scheduler scheduler = factory.create("custom")) {
            assertThat(scheduler.workerId()).isEqualTo("custom");
        }
    }

    @Test
    void shouldAllowBuilderTweaks() {
        try (Scheduler scheduler = factory.builder().failurePolicy(FailurePolicy.CASCADE).maxWorkers(1).build()) {
            assertThat(scheduler.failurePolicy()).isEqualTo(FailurePolicy.CASCADE);
            assertThat(scheduler.maxWorkers()).isEqualTo(1);
        }
    }

    @Test
    void shouldInferDependenciesWhenSuggesterEnabled() {
        try (Scheduler scheduler = factory.create()) {
            scheduler.addTask("extract", "Pull raw orders", ctx -> "rows", List.of());
            scheduler.addTask("load", "Load warehouse after extract", ctx -> "loaded", List.of());

            assertThat(scheduler.graph().getDependencies("load")).containsExactly("extract");
        }
    }

    @Test
    void shouldFeedMetricsFromRuns() {
        // Given: A parent waiting on a spawned child
        try (Scheduler scheduler = factory.create()) {
            scheduler.addTask("parent", "parent", ctx -> {
                String child = ctx.spawnSubtask("child", c -> 1, true);
                return ctx.resultOf(child).orElseThrow();
            }, List.of());
            scheduler.addTask("broken", "broken", ctx -> {
                throw new IllegalStateException("boom");
            }, List.of());

            // When
            RunReport report = scheduler.run();

            // Then
            assertThat(report.failed()).containsExactly("broken");
            SchedulerMetrics.MetricsReport metricsReport = metrics.getReport();
            assertThat(metricsReport.tasksStarted()).isEqualTo(4);
            assertThat(metricsReport.tasksCompleted()).isEqualTo(2);
            assertThat(metricsReport.subtasksCompleted()).isEqualTo(1);
            assertThat(metricsReport.tasksBlocked()).isEqualTo(1);
            assertThat(metricsReport.tasksFailed()).isEqualTo(1);
        }
    }
}
