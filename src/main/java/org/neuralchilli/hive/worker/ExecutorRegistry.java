package org.neuralchilli.hive.worker;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.hive.core.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named task executors, referenced from YAML task definitions and used to rebind
 * executors when importing exported scheduler state.
 */
@ApplicationScoped
public class ExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRegistry.class);

    private final Map<String, TaskExecutor> executors = new ConcurrentHashMap<>();

    public void register(String name, TaskExecutor executor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Executor name cannot be null or empty");
        }
        if (executor == null) {
            throw new IllegalArgumentException("Executor cannot be null");
        }
        TaskExecutor previous = executors.put(name, executor);
        if (previous != null) {
            log.info("Replaced executor: {}", name);
        } else {
            log.debug("Registered executor: {}", name);
        }
    }

    public Optional<TaskExecutor> resolve(String name) {
        return Optional.ofNullable(executors.get(name));
    }

    /**
     * @throws IllegalArgumentException if nothing is registered under {@code name}
     */
    public TaskExecutor require(String name) {
        return resolve(name).orElseThrow(() ->
                new IllegalArgumentException("No executor registered under '" + name + "'"));
    }

    public boolean unregister(String name) {
        return executors.remove(name) != null;
    }

    public Set<String> names() {
        return new TreeSet<>(executors.keySet());
    }
}
