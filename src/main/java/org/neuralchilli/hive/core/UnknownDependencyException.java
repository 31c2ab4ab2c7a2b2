package org.neuralchilli.hive.core;

/**
 * Thrown when a task or edge references an id that is not in the graph.
 * Raised before any mutation, so the graph is left unchanged.
 */
public class UnknownDependencyException extends SchedulerException {

    private final String taskId;
    private final String dependencyId;

    public UnknownDependencyException(String taskId, String dependencyId) {
        super("Task '" + taskId + "' depends on '" + dependencyId + "' which does not exist in the graph");
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
