package org.neuralchilli.hive.core;

/**
 * Thrown when a running task waits for an id absent from the graph.
 * The waiting task fails instead of hanging on a dangling wait.
 */
public class MissingDependencyException extends SchedulerException {

    private final String taskId;
    private final String dependencyId;

    public MissingDependencyException(String taskId, String dependencyId) {
        super("Task '" + taskId + "' waits for '" + dependencyId + "' which does not exist in the graph");
        this.taskId = taskId;
        this.dependencyId = dependencyId;
    }

    public String taskId() {
        return taskId;
    }

    public String dependencyId() {
        return dependencyId;
    }
}
