package org.neuralchilli.hive.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.hive.core.TaskLifecycleListener;
import org.neuralchilli.hive.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters and timings fed by the scheduler's lifecycle hooks.
 *
 * Tracks:
 * - tasks started, completed, blocked and failed
 * - suspensions per task (re-entries)
 * - execution time of completed tasks
 */
@ApplicationScoped
public class SchedulerMetrics implements TaskLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(SchedulerMetrics.class);

    static final String EXECUTION_TIMING = "task.execution";

    private final LongAdder tasksStarted = new LongAdder();
    private final LongAdder tasksCompleted = new LongAdder();
    private final LongAdder tasksBlocked = new LongAdder();
    private final LongAdder tasksFailed = new LongAdder();
    private final LongAdder subtasksCompleted = new LongAdder();

    private final Map<String, TimingStats> timingStats = new ConcurrentHashMap<>();

    @Override
    public void onTaskStart(Task task) {
        tasksStarted.increment();
    }

    @Override
    public void onTaskComplete(Task task) {
        tasksCompleted.increment();
        if (task.isSubtask()) {
            subtasksCompleted.increment();
        }
        recordTiming(EXECUTION_TIMING, task.duration());
    }

    @Override
    public void onTaskBlocked(Task task, String dependencyId) {
        tasksBlocked.increment();
    }

    @Override
    public void onTaskFailed(Task task, String error) {
        tasksFailed.increment();
    }

    /**
     * Completed share of finished tasks, in percent
     */
    public double getTaskSuccessRate() {
        long completed = tasksCompleted.sum();
        long failed = tasksFailed.sum();
        long total = completed + failed;
        return total > 0 ? (completed * 100.0) / total : 0.0;
    }

    /**
     * Average suspensions per started execution
     */
    public double getBlockRate() {
        long started = tasksStarted.sum();
        return started > 0 ? (double) tasksBlocked.sum() / started : 0.0;
    }

    private void recordTiming(String operation, Duration duration) {
        timingStats.compute(operation, (key, stats) -> {
            if (stats == null) {
                stats = new TimingStats();
            }
            stats.record(duration);
            return stats;
        });
    }

    public TimingStats getTimingStats(String operation) {
        return timingStats.getOrDefault(operation, new TimingStats());
    }

    public TimingStats getExecutionTiming() {
        return getTimingStats(EXECUTION_TIMING);
    }

    /**
     * Statistics for operation timing.
     */
    public static class TimingStats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.increment();
            totalNanos.add(nanos);
            minNanos.updateAndGet(current -> Math.min(current, nanos));
            maxNanos.updateAndGet(current -> Math.max(current, nanos));
        }

        public long getCount() {
            return count.sum();
        }

        public Duration getAverage() {
            long total = totalNanos.sum();
            long cnt = count.sum();
            return cnt > 0 ? Duration.ofNanos(total / cnt) : Duration.ZERO;
        }

        public Duration getMin() {
            long min = minNanos.get();
            return min < Long.MAX_VALUE ? Duration.ofNanos(min) : Duration.ZERO;
        }

        public Duration getMax() {
            return Duration.ofNanos(maxNanos.get());
        }

        @Override
        public String toString() {
            return String.format(
                    "TimingStats[count=%d, avg=%dms, min=%dms, max=%dms]",
                    getCount(),
                    getAverage().toMillis(),
                    getMin().toMillis(),
                    getMax().toMillis()
            );
        }
    }

    public MetricsReport getReport() {
        return new MetricsReport(
                tasksStarted.sum(),
                tasksCompleted.sum(),
                tasksBlocked.sum(),
                tasksFailed.sum(),
                subtasksCompleted.sum(),
                getTaskSuccessRate(),
                getBlockRate(),
                getExecutionTiming().getAverage()
        );
    }

    public record MetricsReport(
            long tasksStarted,
            long tasksCompleted,
            long tasksBlocked,
            long tasksFailed,
            long subtasksCompleted,
            double taskSuccessRate,
            double blockRate,
            Duration averageExecution
    ) {
        @Override
        public String toString() {
            return String.format("""
                Scheduler Metrics:
                ==================
                Tasks:
                  Started: %d, Completed: %d, Failed: %d
                  Success Rate: %.1f%%
                  Subtasks Completed: %d

                Suspensions:
                  Blocked: %d (%.2f per start)

                Timing:
                  Avg Execution: %dms
                """,
                    tasksStarted, tasksCompleted, tasksFailed,
                    taskSuccessRate, subtasksCompleted,
                    tasksBlocked, blockRate,
                    averageExecution.toMillis()
            );
        }
    }

    /**
     * Reset all metrics (useful for testing).
     */
    public void reset() {
        tasksStarted.reset();
        tasksCompleted.reset();
        tasksBlocked.reset();
        tasksFailed.reset();
        subtasksCompleted.reset();
        timingStats.clear();
    }

    public void logReport() {
        log.info("\n{}", getReport());
    }
}
