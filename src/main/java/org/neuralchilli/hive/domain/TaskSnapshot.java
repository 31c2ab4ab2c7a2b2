package org.neuralchilli.hive.domain;

import org.neuralchilli.hive.core.TaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Executor-free copy of a task, handed to persistence collaborators.
 * The serialized form of this record is owned by the persistence layer.
 */
public record TaskSnapshot(
        String id,
        String description,
        TaskStatus status,
        List<String> dependencies,
        Object result,
        String error,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String parentId,
        int priority,
        double progress,
        Map<String, Object> checkpoint,
        Map<String, String> metadata
) {
    public TaskSnapshot {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        // checkpoint values may be null, so no Map.copyOf
        checkpoint = checkpoint == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checkpoint));
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static TaskSnapshot of(Task task) {
        return new TaskSnapshot(
                task.id(),
                task.description(),
                task.status(),
                List.copyOf(task.dependencies()),
                task.result(),
                task.error(),
                task.createdAt(),
                task.startedAt(),
                task.completedAt(),
                task.parentId(),
                task.priority(),
                task.progress(),
                task.checkpoint(),
                task.metadata()
        );
    }

    /**
     * Rebuild a task for crash recovery.
     * Work that was in flight restarts from PENDING; terminal tasks keep their state.
     */
    public Task restore(TaskExecutor executor) {
        TaskStatus restored = status.isTerminal() ? status : TaskStatus.PENDING;
        return new Task(
                id,
                description,
                executor,
                restored,
                new LinkedHashSet<>(dependencies),
                null,
                progress,
                checkpoint,
                result,
                error,
                createdAt,
                restored.isTerminal() ? startedAt : null,
                restored.isTerminal() ? completedAt : null,
                parentId,
                priority,
                metadata,
                0
        );
    }

    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
