package org.neuralchilli.hive.domain;

/**
 * Shape of the outstanding dependency graph.
 * Satisfied edges are dropped on completion, so this describes remaining work.
 */
public record DagStatistics(
        int totalTasks,
        int edges,
        int rootTasks,
        int leafTasks,
        int executionLevels,
        int maxParallelism
) {
    public DagStatistics {
        if (totalTasks < 0 || edges < 0 || rootTasks < 0 || leafTasks < 0
                || executionLevels < 0 || maxParallelism < 0) {
            throw new IllegalArgumentException("Graph statistics cannot be negative");
        }
    }

    public static DagStatistics empty() {
        return new DagStatistics(0, 0, 0, 0, 0, 0);
    }

    /**
     * Check if the graph has any parallelism opportunity
     */
    public boolean hasParallelism() {
        return maxParallelism > 1;
    }

    /**
     * Check if the graph is a single chain
     */
    public boolean isLinear() {
        return maxParallelism == 1;
    }

    /**
     * Number of sequential execution levels
     */
    public int depth() {
        return executionLevels;
    }

    @Override
    public String toString() {
        return String.format(
                "DagStatistics[tasks=%d, edges=%d, levels=%d, max_parallel=%d, roots=%d, leaves=%d]",
                totalTasks, edges, executionLevels, maxParallelism, rootTasks, leafTasks
        );
    }
}
