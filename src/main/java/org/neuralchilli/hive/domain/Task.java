package org.neuralchilli.hive.domain;

import org.neuralchilli.hive.core.TaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A schedulable unit of work plus its state.
 * Immutable: the dependency graph replaces the record on every change,
 * so any instance handed out is a consistent point-in-time snapshot.
 */
public record Task(
        String id,
        String description,
        TaskExecutor executor,
        TaskStatus status,
        Set<String> dependencies,
        Set<String> dependents,
        double progress,
        Map<String, Object> checkpoint,
        Object result,
        String error,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String parentId,
        int priority,
        Map<String, String> metadata,
        int attempts
) {

    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (progress < 0.0 || progress > 1.0) {
            throw new IllegalArgumentException("Progress must be between 0.0 and 1.0, got: " + progress);
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("Attempts cannot be negative");
        }

        // Defaults
        if (description == null) {
            description = "";
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        dependencies = dependencies == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        dependents = dependents == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(dependents));
        checkpoint = checkpoint == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checkpoint));
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Builder for creating new PENDING tasks fluently
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Move to another status, enforcing the lifecycle rules
     */
    public Task withStatus(TaskStatus newStatus) {
        requireTransition(newStatus);
        return new Task(id, description, executor, newStatus, dependencies, dependents, progress,
                checkpoint, result, error, createdAt, startedAt, completedAt, parentId, priority,
                metadata, attempts);
    }

    /**
     * Mark as ready for dispatch
     */
    public Task ready() {
        return withStatus(TaskStatus.READY);
    }

    /**
     * Mark as running; every entry into the executor counts as an attempt
     */
    public Task start() {
        requireTransition(TaskStatus.RUNNING);
        return new Task(id, description, executor, TaskStatus.RUNNING, dependencies, dependents, progress,
                checkpoint, result, error, createdAt, Instant.now(), completedAt, parentId, priority,
                metadata, attempts + 1);
    }

    /**
     * Mark as suspended on a dependency
     */
    public Task block() {
        return withStatus(TaskStatus.BLOCKED);
    }

    /**
     * Bring a blocked task back to PENDING for re-dispatch
     */
    public Task resume() {
        return withStatus(TaskStatus.PENDING);
    }

    /**
     * Mark as completed
     */
    public Task complete(Object taskResult) {
        requireTransition(TaskStatus.COMPLETED);
        return new Task(id, description, executor, TaskStatus.COMPLETED, dependencies, dependents, 1.0,
                checkpoint, taskResult, null, createdAt, startedAt, Instant.now(), parentId, priority,
                metadata, attempts);
    }

    /**
     * Mark as failed
     */
    public Task fail(String errorMessage) {
        requireTransition(TaskStatus.FAILED);
        return new Task(id, description, executor, TaskStatus.FAILED, dependencies, dependents, progress,
                checkpoint, result, errorMessage, createdAt, startedAt, Instant.now(), parentId, priority,
                metadata, attempts);
    }

    public Task withDependencies(Collection<String> newDependencies) {
        return new Task(id, description, executor, status, new LinkedHashSet<>(newDependencies), dependents,
                progress, checkpoint, result, error, createdAt, startedAt, completedAt, parentId, priority,
                metadata, attempts);
    }

    public Task withDependents(Collection<String> newDependents) {
        return new Task(id, description, executor, status, dependencies, new LinkedHashSet<>(newDependents),
                progress, checkpoint, result, error, createdAt, startedAt, completedAt, parentId, priority,
                metadata, attempts);
    }

    public Task withProgress(double fraction) {
        double clamped = Math.max(0.0, Math.min(1.0, fraction));
        return new Task(id, description, executor, status, dependencies, dependents, clamped,
                checkpoint, result, error, createdAt, startedAt, completedAt, parentId, priority,
                metadata, attempts);
    }

    public Task withCheckpoint(Map<String, Object> state) {
        return new Task(id, description, executor, status, dependencies, dependents, progress,
                state, result, error, createdAt, startedAt, completedAt, parentId, priority,
                metadata, attempts);
    }

    /**
     * Check if task is finished
     */
    public boolean isFinished() {
        return status.isTerminal();
    }

    /**
     * Check if this task was spawned by another running task
     */
    public boolean isSubtask() {
        return parentId != null;
    }

    /**
     * Time spent between the last start and completion, zero while unfinished
     */
    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }

    private void requireTransition(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Task '" + id + "' cannot move from " + status + " to " + next);
        }
    }

    @Override
    public String toString() {
        return "Task[id=" + id + ", status=" + status + ", dependencies=" + dependencies
                + (parentId != null ? ", parent=" + parentId : "") + "]";
    }

    public static class Builder {
        private final String id;
        private String description = "";
        private TaskExecutor executor;
        private Set<String> dependencies = new LinkedHashSet<>();
        private String parentId;
        private int priority = 0;
        private Map<String, String> metadata = Map.of();

        public Builder(String id) {
            this.id = id;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder executor(TaskExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder dependsOn(Collection<String> dependencies) {
            this.dependencies = new LinkedHashSet<>(dependencies);
            return this;
        }

        public Builder dependsOn(String... dependencies) {
            return dependsOn(List.of(dependencies));
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Task build() {
            return new Task(id, description, executor, TaskStatus.PENDING, dependencies, Set.of(), 0.0,
                    Map.of(), null, null, Instant.now(), null, null, parentId, priority, metadata, 0);
        }
    }
}
