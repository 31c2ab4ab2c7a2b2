package org.neuralchilli.hive.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.hive.domain.DagStatistics;
import org.neuralchilli.hive.domain.GraphView;
import org.neuralchilli.hive.domain.Task;
import org.neuralchilli.hive.domain.TaskStatus;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    private Task add(String id, String... dependencies) {
        return graph.addTask(Task.builder(id).description("task " + id).dependsOn(dependencies).build());
    }

    private void run(String id, Object result) {
        graph.getReadyTasks();
        graph.markRunning(id).orElseThrow();
        graph.markCompleted(id, result);
    }

    @Test
    void shouldRegisterTasksWithBothEdgeSides() {
        // Given: A -> B
        add("a");
        add("b", "a");

        // Then: dependencies and dependents mirror each other
        assertThat(graph.getDependencies("b")).containsExactly("a");
        assertThat(graph.getDependents("a")).containsExactly("b");
        assertThat(graph.size()).isEqualTo(2);
    }

    @Test
    void shouldRejectDuplicateIds() {
        add("a");

        assertThatThrownBy(() -> add("a"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void shouldRejectUnknownDependencyWithoutMutation() {
        add("a");

        assertThatThrownBy(() -> add("b", "a", "ghost"))
                .isInstanceOf(UnknownDependencyException.class)
                .hasMessageContaining("ghost");

        assertThat(graph.contains("b")).isFalse();
        assertThat(graph.getDependents("a")).isEmpty();
    }

    @Test
    void shouldRejectCycleAndLeaveGraphUnchanged() {
        // Given: A -> B -> C
        add("a");
        add("b", "a");
        add("c", "b");
        GraphView before = graph.snapshot();

        // When/Then: closing C -> A is rejected
        assertThatThrownBy(() -> graph.addDependency("a", "c"))
                .isInstanceOf(CircularDependencyException.class)
                .hasMessageContaining("cycle");

        assertThat(graph.snapshot().edges()).isEqualTo(before.edges());
        assertThat(graph.getDependencies("a")).isEmpty();
    }

    @Test
    void shouldRejectSelfDependency() {
        add("a");

        assertThatThrownBy(() -> graph.addDependency("a", "a"))
                .isInstanceOf(CircularDependencyException.class);
    }

    @Test
    void shouldTreatExistingEdgeAsNoOp() {
        add("a");
        add("b", "a");

        assertThat(graph.addDependency("b", "a")).isFalse();
        assertThat(graph.snapshot().edges()).hasSize(1);
    }

    @Test
    void shouldNotRecordEdgeToCompletedTask() {
        add("a");
        add("b");
        run("a", "done");

        assertThat(graph.addDependency("b", "a")).isFalse();
        assertThat(graph.isReady("b")).isTrue();

        Task c = add("c", "a");
        assertThat(c.dependencies()).isEmpty();
    }

    @Test
    void shouldRejectDependencyOnFinishedTask() {
        add("a");
        add("b");
        run("a", null);

        assertThatThrownBy(() -> graph.addDependency("a", "b"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRemoveDependencySymmetrically() {
        add("a");
        add("b", "a");

        assertThat(graph.removeDependency("b", "a")).isTrue();
        assertThat(graph.removeDependency("b", "a")).isFalse();
        assertThat(graph.removeDependency("ghost", "a")).isFalse();

        assertThat(graph.getDependencies("b")).isEmpty();
        assertThat(graph.getDependents("a")).isEmpty();
    }

    @Test
    void shouldPromoteReadyTasksByPriorityThenInsertion() {
        graph.addTask(Task.builder("low").build());
        graph.addTask(Task.builder("high").priority(10).build());
        graph.addTask(Task.builder("low2").build());
        graph.addTask(Task.builder("waiting").dependsOn("low").build());

        List<Task> ready = graph.getReadyTasks();

        assertThat(ready).extracting(Task::id).containsExactly("high", "low", "low2");
        assertThat(ready).allMatch(t -> t.status() == TaskStatus.READY);
        assertThat(graph.getReadyTasks()).isEmpty();
        assertThat(graph.getBlockedTasks()).extracting(Task::id).containsExactly("waiting");
    }

    @Test
    void shouldReturnExactlyNewlyUnblockedDependents() {
        // Given: A -> C, B -> C, A -> D
        add("a");
        add("b");
        add("c", "a", "b");
        add("d", "a");

        // When: A completes
        graph.getReadyTasks();
        graph.markRunning("a");
        List<String> unblocked = graph.markCompleted("a", 1);

        // Then: only D has no remaining dependency
        assertThat(unblocked).containsExactly("d");
        assertThat(graph.getDependencies("c")).containsExactly("b");

        graph.markRunning("b");
        assertThat(graph.markCompleted("b", 2)).containsExactly("c");
    }

    @Test
    void shouldDemoteReadyTaskThatGainedDependency() {
        add("a");
        add("b");
        graph.getReadyTasks();

        graph.addDependency("b", "a");

        assertThat(graph.markRunning("b")).isEmpty();
        assertThat(graph.getTask("b").orElseThrow().status()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void shouldSuspendAndResume() {
        add("a");
        add("b");
        graph.getReadyTasks();
        graph.markRunning("a");

        graph.addDependency("a", "b");
        Task blocked = graph.markBlocked("a");
        assertThat(blocked.status()).isEqualTo(TaskStatus.BLOCKED);
        assertThat(graph.getBlockedTasks()).extracting(Task::id).containsExactly("a");

        graph.markRunning("b");
        assertThat(graph.markCompleted("b", "x")).containsExactly("a");

        Task resumed = graph.resume("a");
        assertThat(resumed.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(graph.getReadyTasks()).extracting(Task::id).containsExactly("a");
        assertThat(graph.markRunning("a").orElseThrow().attempts()).isEqualTo(2);
    }

    @Test
    void shouldLeaveDependentsUntouchedUnderBlockPolicy() {
        add("a");
        add("b", "a");
        graph.getReadyTasks();
        graph.markRunning("a");

        List<String> cascaded = graph.markFailed("a", "boom");

        assertThat(cascaded).isEmpty();
        assertThat(graph.getTask("b").orElseThrow().status()).isEqualTo(TaskStatus.PENDING);
        assertThat(graph.unfinishedTasks()).containsEntry("b", Set.of("a"));
    }

    @Test
    void shouldCascadeFailureTransitively() {
        graph = new DependencyGraph(FailurePolicy.CASCADE);
        add("a");
        add("b", "a");
        add("c", "b");
        add("independent");
        graph.getReadyTasks();
        graph.markRunning("a");

        List<String> cascaded = graph.markFailed("a", "boom");

        assertThat(cascaded).containsExactly("b", "c");
        assertThat(graph.getTask("c").orElseThrow().error()).isEqualTo("dependency b failed: dependency a failed: boom");
        assertThat(graph.getTask("independent").orElseThrow().status()).isEqualTo(TaskStatus.READY);
    }

    @Test
    void shouldFailTaskAddedAfterItsDependencyFailed() {
        // Given
        graph = new DependencyGraph(FailurePolicy.CASCADE);
        add("a");
        graph.getReadyTasks();
        graph.markRunning("a");
        graph.markFailed("a", "boom");

        // When
        Task late = add("b", "a");

        // Then
        assertThat(late.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(late.error()).isEqualTo("dependency a failed: boom");
        assertThat(graph.hasUnfinishedTasks()).isFalse();
        assertThat(graph.drainLateFailures()).containsExactly("b");
        assertThat(graph.drainLateFailures()).isEmpty();
    }

    @Test
    void shouldCascadeWhenLinkingOntoFailedTask() {
        // Given: "c" waits on "b", and "a" has already failed
        graph = new DependencyGraph(FailurePolicy.CASCADE);
        add("a");
        add("b");
        add("c", "b");
        graph.getReadyTasks();
        graph.markRunning("a");
        graph.markFailed("a", "boom");

        // When
        boolean added = graph.addDependency("b", "a");

        // Then
        assertThat(added).isTrue();
        assertThat(graph.getTask("b").orElseThrow().status()).isEqualTo(TaskStatus.FAILED);
        assertThat(graph.getTask("c").orElseThrow().error())
                .isEqualTo("dependency b failed: dependency a failed: boom");
        assertThat(graph.drainLateFailures()).containsExactly("b", "c");
    }

    @Test
    void shouldKeepLateDependentPendingUnderBlockPolicy() {
        add("a");
        graph.getReadyTasks();
        graph.markRunning("a");
        graph.markFailed("a", "boom");

        Task late = add("b", "a");

        assertThat(late.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(graph.drainLateFailures()).isEmpty();
    }

    @Test
    void shouldOrderTopologicallyWithInsertionTieBreak() {
        add("c");
        add("a");
        add("b", "c");
        add("d", "a", "b");

        assertThat(graph.topologicalOrder()).containsExactly("c", "a", "b", "d");
    }

    @Test
    void shouldStoreProgressAndCheckpoint() {
        add("a");

        graph.updateProgress("a", 2.0);
        graph.saveCheckpoint("a", Map.of("page", 3));

        Task task = graph.getTask("a").orElseThrow();
        assertThat(task.progress()).isEqualTo(1.0);
        assertThat(task.checkpoint()).containsEntry("page", 3);
    }

    @Test
    void shouldRemoveOnlyFinishedTasksWithoutDependents() {
        add("a");
        add("b", "a");

        assertThatThrownBy(() -> graph.removeTask("a"))
                .isInstanceOf(IllegalStateException.class);

        graph.getReadyTasks();
        graph.markRunning("a");
        graph.markFailed("a", "boom");
        assertThatThrownBy(() -> graph.removeTask("a"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("still required");

        graph.removeDependency("b", "a");
        graph.removeTask("a");
        assertThat(graph.contains("a")).isFalse();
        assertThat(graph.size()).isEqualTo(1);
    }

    @Test
    void shouldFindSubtasksInSpawnOrder() {
        add("parent");
        graph.addTask(Task.builder("c1").parentId("parent").build());
        add("other");
        graph.addTask(Task.builder("c2").parentId("parent").build());

        assertThat(graph.getSubtasks("parent")).containsExactly("c1", "c2");
    }

    @Test
    void shouldComputeStatistics() {
        // Given: A -> B -> D, A -> C -> D
        add("a");
        add("b", "a");
        add("c", "a");
        add("d", "b", "c");

        DagStatistics stats = graph.statistics();

        assertThat(stats.totalTasks()).isEqualTo(4);
        assertThat(stats.edges()).isEqualTo(4);
        assertThat(stats.rootTasks()).isEqualTo(1);
        assertThat(stats.leafTasks()).isEqualTo(1);
        assertThat(stats.executionLevels()).isEqualTo(3);
        assertThat(stats.maxParallelism()).isEqualTo(2);
        assertThat(stats.hasParallelism()).isTrue();
        assertThat(graph.executionLevels().get(1)).containsExactly("b", "c");
    }

    @Test
    void shouldReportEmptyStatistics() {
        assertThat(graph.statistics()).isEqualTo(DagStatistics.empty());
        assertThat(graph.topologicalOrder()).isEmpty();
    }

    @Test
    void shouldCountTasksByStatus() {
        add("a");
        add("b");
        graph.getReadyTasks();
        graph.markRunning("a");

        GraphView view = graph.snapshot();

        assertThat(view.count(TaskStatus.RUNNING)).isEqualTo(1);
        assertThat(view.count(TaskStatus.READY)).isEqualTo(1);
        assertThat(view.nodes()).extracting(GraphView.Node::id).containsExactly("a", "b");
    }
}
