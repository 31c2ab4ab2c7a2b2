package org.neuralchilli.hive.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thrown from the run loop when no task is running or ready but some are still unfinished.
 */
public class DeadlockException extends SchedulerException {

    private final Map<String, Set<String>> stuck;

    public DeadlockException(Map<String, Set<String>> stuck) {
        super("No progress possible, stuck tasks: " + describe(stuck));
        this.stuck = Collections.unmodifiableMap(new LinkedHashMap<>(stuck));
    }

    /**
     * Stuck task ids mapped to the dependency ids they are waiting on
     */
    public Map<String, Set<String>> stuck() {
        return stuck;
    }

    private static String describe(Map<String, Set<String>> stuck) {
        return stuck.entrySet().stream()
                .map(e -> e.getKey() + " awaits " + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
