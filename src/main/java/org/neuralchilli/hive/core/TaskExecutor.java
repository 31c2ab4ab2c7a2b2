package org.neuralchilli.hive.core;

/**
 * Body of a task. Runs on a worker thread.
 * <p>
 * A body that calls {@link TaskContext#waitFor(String)} is entered again from the
 * beginning once the dependency completes, so it must be idempotent and use
 * {@link TaskContext#checkpoint(java.util.Map)} to skip work already done.
 */
@FunctionalInterface
public interface TaskExecutor {

    Object execute(TaskContext context) throws Exception;
}
