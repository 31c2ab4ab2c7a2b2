package org.neuralchilli.hive.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.hive.config.SchedulerConfig;
import org.neuralchilli.hive.config.TaskDefinition;
import org.neuralchilli.hive.config.TaskDefinitionParser;
import org.neuralchilli.hive.core.Scheduler;
import org.neuralchilli.hive.core.TaskExecutor;
import org.neuralchilli.hive.domain.Task;
import org.neuralchilli.hive.worker.CommandExecutor;
import org.neuralchilli.hive.worker.ExecutorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads YAML task batches into a scheduler.
 * Within a batch, tasks are added after the tasks they depend on; a task whose
 * dependency failed to load fails too.
 */
@ApplicationScoped
public class TaskDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(TaskDefinitionLoader.class);

    @Inject
    TaskDefinitionParser parser;

    @Inject
    ExecutorRegistry executorRegistry;

    @Inject
    SchedulerConfig config;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Load every batch under the configured {@code hive.tasks.path}
     */
    public List<LoadResult> loadConfigured(Scheduler scheduler) {
        Optional<String> path = config.tasks().path();
        if (path.isEmpty()) {
            log.debug("No task directory configured");
            return List.of();
        }
        return loadAll(scheduler, Path.of(path.get()));
    }

    /**
     * Load all task batches from a directory
     */
    public List<LoadResult> loadAll(Scheduler scheduler, Path directory) {
        List<LoadResult> results = new ArrayList<>();

        if (!Files.exists(directory)) {
            log.warn("Tasks directory does not exist: {}", directory);
            return results;
        }

        List<Path> files;
        try (Stream<Path> paths = Files.walk(directory)) {
            files = paths.filter(p -> p.toString().endsWith(".yaml") || p.toString().endsWith(".yml"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Error scanning tasks directory: {}", directory, e);
            return results;
        }

        for (Path file : files) {
            results.addAll(load(scheduler, file));
        }
        logResults(directory.toString(), results);
        return results;
    }

    /**
     * Load a single batch file
     */
    public List<LoadResult> load(Scheduler scheduler, Path file) {
        try {
            log.debug("Loading tasks from: {}", file);
            return load(scheduler, Files.readString(file));
        } catch (IOException e) {
            log.error("Failed to read task file: {}", file, e);
            return List.of(LoadResult.failure(file.getFileName().toString(), e));
        }
    }

    /**
     * Load a batch from YAML text
     */
    public List<LoadResult> load(Scheduler scheduler, String yaml) {
        List<TaskDefinition> definitions;
        try {
            definitions = parser.parse(yaml);
        } catch (RuntimeException e) {
            log.error("Failed to parse task batch: {}", e.getMessage());
            return List.of(LoadResult.failure("batch", e));
        }

        Map<String, TaskDefinition> pending = new LinkedHashMap<>();
        definitions.forEach(d -> pending.put(d.id(), d));
        Map<String, LoadResult> results = new LinkedHashMap<>();

        boolean progress = true;
        while (!pending.isEmpty() && progress) {
            progress = false;
            Iterator<TaskDefinition> it = pending.values().iterator();
            while (it.hasNext()) {
                TaskDefinition definition = it.next();
                Optional<String> waitingOn = definition.dependsOn().stream()
                        .filter(pending::containsKey)
                        .findFirst();
                if (waitingOn.isPresent()) {
                    continue;
                }
                Optional<String> failedDependency = definition.dependsOn().stream()
                        .filter(id -> results.containsKey(id) && !results.get(id).isSuccess())
                        .findFirst();
                results.put(definition.id(), failedDependency.isPresent()
                        ? LoadResult.failure(definition.id(),
                        "dependency '" + failedDependency.get() + "' was not loaded")
                        : add(scheduler, definition));
                it.remove();
                progress = true;
            }
        }

        for (TaskDefinition unresolved : pending.values()) {
            results.put(unresolved.id(), LoadResult.failure(unresolved.id(),
                    "circular dependency among " + pending.keySet()));
        }

        // Report in the order the batch declared
        List<LoadResult> ordered = new ArrayList<>();
        definitions.forEach(d -> ordered.add(results.get(d.id())));
        return ordered;
    }

    private LoadResult add(Scheduler scheduler, TaskDefinition definition) {
        try {
            Task task = Task.builder(definition.id())
                    .description(definition.description())
                    .executor(executorFor(definition))
                    .dependsOn(definition.dependsOn())
                    .priority(definition.priority())
                    .metadata(definition.metadata())
                    .build();
            scheduler.addTask(task);
            log.info("Loaded task: {}", definition.id());
            return LoadResult.success(definition.id());
        } catch (RuntimeException e) {
            log.error("Failed to load task {}: {}", definition.id(), e.getMessage());
            return LoadResult.failure(definition.id(), e);
        }
    }

    private TaskExecutor executorFor(TaskDefinition definition) {
        if (!definition.isCommand()) {
            return executorRegistry.require(definition.executor());
        }
        return CommandExecutor.builder(definition.command())
                .args(definition.args())
                .env(definition.env())
                .timeout(definition.timeout() != null ? definition.timeout() : config.command().defaultTimeout())
                .trialRun(config.command().trialRun())
                .objectMapper(objectMapper)
                .build();
    }

    private void logResults(String source, List<LoadResult> results) {
        long succeeded = results.stream().filter(LoadResult::isSuccess).count();
        long failed = results.size() - succeeded;
        if (failed > 0) {
            log.warn("Loaded {} tasks from {} ({} failed)", succeeded, source, failed);
            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.warn("  {}: {}", r.name(), r.error().orElse("")));
        } else {
            log.info("Loaded {} tasks from {}", succeeded, source);
        }
    }
}
