package org.neuralchilli.hive.core;

/**
 * Wraps a failure raised by a task body.
 */
public class TaskExecutionException extends SchedulerException {

    private final String taskId;

    public TaskExecutionException(String taskId, Throwable cause) {
        super("Task '" + taskId + "' failed: " + describe(cause), cause);
        this.taskId = taskId;
    }

    public TaskExecutionException(String taskId, String message) {
        super("Task '" + taskId + "' failed: " + message);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
