package org.neuralchilli.hive.core;

/**
 * Thrown when a dependency edge would close a cycle.
 * The graph is left unchanged.
 */
public class CircularDependencyException extends SchedulerException {

    private final String taskId;
    private final String dependencyId;

    public CircularDependencyException(String taskId, String dependencyId) {
        super("Adding dependency '" + taskId + "' -> '" + dependencyId + "' would create a cycle in the graph");
        this.taskId = taskId;
        this.dependencyId = dependencyId;
    }

    public CircularDependencyException(String message) {
        super(message);
        this.taskId = null;
        this.dependencyId = null;
    }

    public String taskId() {
        return taskId;
    }

    public String dependencyId() {
        return dependencyId;
    }
}
