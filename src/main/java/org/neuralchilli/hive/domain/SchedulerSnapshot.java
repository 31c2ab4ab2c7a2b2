package org.neuralchilli.hive.domain;

import java.time.Instant;
import java.util.List;

/**
 * Exported scheduler state for crash recovery.
 */
public record SchedulerSnapshot(
        int maxWorkers,
        Instant exportedAt,
        List<TaskSnapshot> tasks
) {
    public SchedulerSnapshot {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("Max workers must be >= 1");
        }
        if (exportedAt == null) {
            exportedAt = Instant.now();
        }
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public int size() {
        return tasks.size();
    }
}
