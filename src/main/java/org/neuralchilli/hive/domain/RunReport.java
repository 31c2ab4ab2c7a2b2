package org.neuralchilli.hive.domain;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Summary of one scheduler run.
 *
 * @param completed  ids of COMPLETED tasks
 * @param failed     ids of FAILED tasks
 * @param incomplete non-terminal task ids mapped to the dependency ids they still await
 * @param timedOut   the wall-clock timeout aborted the loop
 * @param stopped    {@code stop()} ended the loop
 * @param elapsed    wall time spent in the loop
 */
public record RunReport(
        List<String> completed,
        List<String> failed,
        Map<String, Set<String>> incomplete,
        boolean timedOut,
        boolean stopped,
        Duration elapsed
) {
    public RunReport {
        completed = completed == null ? List.of() : List.copyOf(completed);
        failed = failed == null ? List.of() : List.copyOf(failed);
        incomplete = incomplete == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(incomplete));
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }

    /**
     * Every task completed and nothing failed
     */
    public boolean isSuccessful() {
        return failed.isEmpty() && incomplete.isEmpty();
    }

    public boolean hasIncomplete() {
        return !incomplete.isEmpty();
    }

    @Override
    public String toString() {
        return String.format(
                "RunReport[completed=%d, failed=%d, incomplete=%s, timedOut=%s, stopped=%s, elapsed=%dms]",
                completed.size(), failed.size(), incomplete.keySet(), timedOut, stopped, elapsed.toMillis()
        );
    }
}
