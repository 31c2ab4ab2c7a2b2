package org.neuralchilli.hive.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Parses YAML task batches into {@link TaskDefinition}s.
 */
@ApplicationScoped
public class TaskDefinitionParser {

    private final Yaml yaml = new Yaml();

    /**
     * Parse a task batch from YAML string
     */
    public List<TaskDefinition> parse(String yamlContent) {
        return parseFromMap(yaml.load(yamlContent));
    }

    /**
     * Parse a task batch from InputStream
     */
    public List<TaskDefinition> parse(InputStream inputStream) {
        return parseFromMap(yaml.load(inputStream));
    }

    @SuppressWarnings("unchecked")
    private List<TaskDefinition> parseFromMap(Object document) {
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Task batch must be a mapping with a 'tasks' list");
        }
        Object tasks = ((Map<String, Object>) document).get("tasks");
        if (!(tasks instanceof List) || ((List<?>) tasks).isEmpty()) {
            throw new IllegalArgumentException("Task batch must have at least one task");
        }

        List<TaskDefinition> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Object entry : (List<Object>) tasks) {
            if (!(entry instanceof Map)) {
                throw new IllegalArgumentException("Each task must be a mapping, got: " + entry);
            }
            TaskDefinition definition = parseTask((Map<String, Object>) entry);
            if (!seen.add(definition.id())) {
                throw new IllegalArgumentException("Duplicate task id: " + definition.id());
            }
            result.add(definition);
        }
        return result;
    }

    private TaskDefinition parseTask(Map<String, Object> data) {
        String id = getString(data, "id", true);
        Integer timeoutSeconds = data.containsKey("timeout") ? getInt(data, "timeout", 0) : null;
        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            throw new IllegalArgumentException("Task '" + id + "' timeout must be positive");
        }

        return new TaskDefinition(
                id,
                getString(data, "description", false),
                getString(data, "command", false),
                getStringList(data, "args", List.of()),
                getStringMap(data, "env", Map.of()),
                timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null,
                getString(data, "executor", false),
                getStringList(data, "depends_on", List.of()),
                getInt(data, "priority", 0),
                getStringMap(data, "metadata", Map.of())
        );
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field '" + key + "' must be an integer, got: " + value, e);
        }
    }

    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        // A single id is accepted in place of a one-element list
        return List.of(value.toString());
    }

    private Map<String, String> getStringMap(Map<String, Object> map, String key, Map<String, String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Map) {
            Map<String, String> result = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) ->
                    result.put(k.toString(), v != null ? v.toString() : "")
            );
            return result;
        }
        throw new IllegalArgumentException("Field '" + key + "' must be a mapping");
    }
}
