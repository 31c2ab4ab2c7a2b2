package org.neuralchilli.hive.core;

import org.neuralchilli.hive.domain.Task;

/**
 * Lifecycle hooks. Invoked synchronously on the scheduler's control thread,
 * so implementations must return quickly and never block.
 */
public interface TaskLifecycleListener {

    default void onTaskStart(Task task) {
    }

    default void onTaskComplete(Task task) {
    }

    default void onTaskBlocked(Task task, String dependencyId) {
    }

    default void onTaskFailed(Task task, String error) {
    }
}
