package org.neuralchilli.hive.suggest;

/**
 * A proposed edge: {@code taskId} depends on {@code dependencyId}.
 */
public record SuggestedDependency(
        String taskId,
        String dependencyId,
        double confidence,
        String reason
) {
    public SuggestedDependency {
        if (taskId == null || dependencyId == null) {
            throw new IllegalArgumentException("Task ids cannot be null");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
