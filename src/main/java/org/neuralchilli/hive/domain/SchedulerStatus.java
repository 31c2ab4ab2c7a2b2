package org.neuralchilli.hive.domain;

import java.util.Map;

/**
 * Point-in-time counts of tasks per lifecycle bucket.
 * Pending includes READY tasks that are waiting for a free worker.
 */
public record SchedulerStatus(
        int running,
        int blocked,
        int pending,
        int completed,
        int failed
) {
    public SchedulerStatus {
        if (running < 0 || blocked < 0 || pending < 0 || completed < 0 || failed < 0) {
            throw new IllegalArgumentException("Task counts cannot be negative");
        }
    }

    /**
     * Build from per-status counts taken under the graph lock
     */
    public static SchedulerStatus of(Map<TaskStatus, Integer> counts) {
        return new SchedulerStatus(
                counts.getOrDefault(TaskStatus.RUNNING, 0),
                counts.getOrDefault(TaskStatus.BLOCKED, 0),
                counts.getOrDefault(TaskStatus.PENDING, 0) + counts.getOrDefault(TaskStatus.READY, 0),
                counts.getOrDefault(TaskStatus.COMPLETED, 0),
                counts.getOrDefault(TaskStatus.FAILED, 0)
        );
    }

    public int total() {
        return running + blocked + pending + completed + failed;
    }

    /**
     * True when every known task reached COMPLETED or FAILED
     */
    public boolean isFinished() {
        return running == 0 && blocked == 0 && pending == 0;
    }

    @Override
    public String toString() {
        return String.format(
                "SchedulerStatus[running=%d, blocked=%d, pending=%d, completed=%d, failed=%d]",
                running, blocked, pending, completed, failed
        );
    }
}
