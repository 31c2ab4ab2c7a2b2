package org.neuralchilli.hive.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a scheduled task.
 */
public enum TaskStatus {
    /**
     * Task registered, waiting for its dependencies to complete
     */
    PENDING,

    /**
     * All dependencies completed, waiting for a free worker
     */
    READY,

    /**
     * A worker is currently executing the task body
     */
    RUNNING,

    /**
     * Task suspended itself waiting on another task
     */
    BLOCKED,

    /**
     * Task completed successfully
     */
    COMPLETED,

    /**
     * Task failed (never retried automatically)
     */
    FAILED;

    /**
     * Check if this is a terminal state (task finished)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check if a worker currently holds the task
     */
    public boolean isInProgress() {
        return this == RUNNING;
    }

    /**
     * Check if the task is waiting (not yet dispatched or parked)
     */
    public boolean isWaiting() {
        return this == PENDING || this == READY || this == BLOCKED;
    }

    /**
     * Check whether moving from this status to {@code next} is a legal transition.
     * READY may fall back to PENDING when a dependency is added before dispatch.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<TaskStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(READY, FAILED);
            case READY -> EnumSet.of(RUNNING, PENDING, FAILED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, BLOCKED);
            case BLOCKED -> EnumSet.of(PENDING, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(TaskStatus.class);
        };
    }
}
