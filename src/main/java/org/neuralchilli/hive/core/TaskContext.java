package org.neuralchilli.hive.core;

import org.neuralchilli.hive.domain.Task;
import org.neuralchilli.hive.domain.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability handed to a running task body.
 * <p>
 * A body is entered again from the beginning after every suspension. Subtasks spawned
 * by an earlier attempt are handed back in spawn order instead of being created twice,
 * so a body that spawns deterministically can simply repeat its calls.
 */
public final class TaskContext {

    private static final Logger log = LoggerFactory.getLogger(TaskContext.class);

    private final Scheduler scheduler;
    private final DependencyGraph graph;
    private final String taskId;
    private final String parentId;
    private final int attempt;
    private final List<String> earlierSubtasks;

    private int spawned;
    private volatile String suspendedOn;

    TaskContext(Scheduler scheduler, DependencyGraph graph, Task task) {
        this.scheduler = scheduler;
        this.graph = graph;
        this.taskId = task.id();
        this.parentId = task.parentId();
        this.attempt = task.attempts();
        this.earlierSubtasks = graph.getSubtasks(task.id());
    }

    public String taskId() {
        return taskId;
    }

    public Optional<String> parentId() {
        return Optional.ofNullable(parentId);
    }

    /**
     * 1 on the first entry into the body, incremented on every re-entry
     */
    public int attempt() {
        return attempt;
    }

    public boolean isResumed() {
        return attempt > 1;
    }

    /**
     * Register a new task owned by this one.
     *
     * @return id of the subtask
     */
    public String spawnSubtask(String description, TaskExecutor executor) {
        if (spawned < earlierSubtasks.size()) {
            String existing = earlierSubtasks.get(spawned++);
            log.trace("Task {} reuses subtask {} from an earlier attempt", taskId, existing);
            return existing;
        }
        spawned++;
        return scheduler.addSubtask(taskId, description, executor);
    }

    /**
     * Register a new task owned by this one and optionally wait for it.
     * With {@code wait} set this returns only once the subtask completed; its result is then
     * available through {@link #resultOf(String)}.
     */
    public String spawnSubtask(String description, TaskExecutor executor, boolean wait) {
        String subtaskId = spawnSubtask(description, executor);
        if (wait) {
            waitFor(subtaskId);
        }
        return subtaskId;
    }

    /**
     * Result of {@code dependencyId} if it already completed. Otherwise records the dependency
     * and suspends this task by throwing {@link TaskSuspension}; the body runs again once the
     * dependency completes.
     *
     * @throws MissingDependencyException if the id is not in the graph
     * @throws TaskExecutionException     if the dependency failed and failures cascade
     */
    public Object waitFor(String dependencyId) {
        Task dependency = graph.getTask(dependencyId)
                .orElseThrow(() -> new MissingDependencyException(taskId, dependencyId));

        if (dependency.status() == TaskStatus.COMPLETED) {
            return dependency.result();
        }
        if (dependency.status() == TaskStatus.FAILED && graph.failurePolicy() == FailurePolicy.CASCADE) {
            throw new TaskExecutionException(taskId,
                    "dependency " + dependencyId + " failed: " + dependency.error());
        }

        try {
            graph.addDependency(taskId, dependencyId);
        } catch (UnknownDependencyException e) {
            throw new MissingDependencyException(taskId, dependencyId);
        }

        // The dependency may have finished between the check and the edge insert
        Optional<Task> latest = graph.getTask(dependencyId);
        if (latest.isPresent() && latest.get().status() == TaskStatus.COMPLETED) {
            return latest.get().result();
        }
        if (latest.isPresent() && latest.get().status() == TaskStatus.FAILED
                && graph.failurePolicy() == FailurePolicy.CASCADE) {
            throw new TaskExecutionException(taskId,
                    "dependency " + dependencyId + " failed: " + latest.get().error());
        }

        log.debug("Task {} suspends waiting for {}", taskId, dependencyId);
        suspendedOn = dependencyId;
        throw new TaskSuspension(dependencyId);
    }

    /**
     * Check for a file this task consumes.
     *
     * @return true if the file exists; false means the body should spawn the task producing it
     */
    public boolean needFile(Path file) {
        boolean present = Files.exists(file);
        if (!present) {
            log.debug("Task {} needs missing file {}", taskId, file);
        }
        return present;
    }

    /**
     * Result of a completed task, empty if it has not completed
     */
    public Optional<Object> resultOf(String otherTaskId) {
        return graph.getTask(otherTaskId)
                .filter(t -> t.status() == TaskStatus.COMPLETED)
                .map(Task::result);
    }

    /**
     * Replace the resumable state of this task
     */
    public void checkpoint(Map<String, Object> state) {
        graph.saveCheckpoint(taskId, state);
    }

    /**
     * Resumable state saved by an earlier attempt, empty on the first attempt
     */
    public Map<String, Object> checkpoint() {
        return graph.getTask(taskId).map(Task::checkpoint).orElse(Map.of());
    }

    /**
     * Report progress as a fraction, clamped to 0..1
     */
    public void progress(double fraction) {
        graph.updateProgress(taskId, fraction);
    }

    /**
     * Dependency this attempt suspended on, if any.
     * Set even when the body caught the suspension signal itself.
     */
    public Optional<String> suspendedOn() {
        return Optional.ofNullable(suspendedOn);
    }
}
