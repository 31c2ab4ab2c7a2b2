package org.neuralchilli.hive.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Visualization-friendly snapshot of the graph: nodes, edges and per-status counts.
 * Edges point from dependency to dependent.
 */
public record GraphView(
        List<Node> nodes,
        List<Edge> edges,
        Map<TaskStatus, Integer> counts
) {
    private static final int MAX_LABEL_LENGTH = 50;

    public GraphView {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        Map<TaskStatus, Integer> allCounts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            allCounts.put(status, counts != null ? counts.getOrDefault(status, 0) : 0);
        }
        counts = Collections.unmodifiableMap(allCounts);
    }

    public record Node(
            String id,
            String label,
            TaskStatus status,
            int priority,
            String parentId,
            double progress
    ) {
        public static Node of(Task task) {
            return new Node(task.id(), GraphView.label(task.description()), task.status(),
                    task.priority(), task.parentId(), task.progress());
        }
    }

    public record Edge(String from, String to) {
        public Edge {
            if (from == null || to == null) {
                throw new IllegalArgumentException("Edge endpoints cannot be null");
            }
        }
    }

    public int count(TaskStatus status) {
        return counts.get(status);
    }

    static String label(String description) {
        if (description == null) {
            return "";
        }
        return description.length() > MAX_LABEL_LENGTH
                ? description.substring(0, MAX_LABEL_LENGTH) + "..."
                : description;
    }
}
