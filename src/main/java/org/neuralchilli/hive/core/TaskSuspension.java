package org.neuralchilli.hive.core;

/**
 * Control-flow signal thrown by {@link TaskContext#waitFor(String)} to leave the task body.
 * Task code must let it propagate.
 */
public final class TaskSuspension extends RuntimeException {

    private final String dependencyId;

    TaskSuspension(String dependencyId) {
        super("Suspended waiting for " + dependencyId, null, false, false);
        this.dependencyId = dependencyId;
    }

    public String dependencyId() {
        return dependencyId;
    }
}
