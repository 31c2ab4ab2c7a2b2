package org.neuralchilli.hive.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * One entry of a YAML task batch.
 * Exactly one of {@code command} or {@code executor} is set.
 *
 * @param timeout command timeout, null to use the configured default
 */
public record TaskDefinition(
        String id,
        String description,
        String command,
        List<String> args,
        Map<String, String> env,
        Duration timeout,
        String executor,
        List<String> dependsOn,
        int priority,
        Map<String, String> metadata
) {
    public TaskDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if ((command == null) == (executor == null)) {
            throw new IllegalArgumentException(
                    "Task '" + id + "' must define exactly one of 'command' or 'executor'");
        }
        if (description == null) {
            description = "";
        }
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? Map.of() : Map.copyOf(env);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isCommand() {
        return command != null;
    }
}
