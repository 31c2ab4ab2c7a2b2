package org.neuralchilli.hive.worker;

import org.neuralchilli.hive.core.TaskContext;
import org.neuralchilli.hive.core.TaskExecutionException;
import org.neuralchilli.hive.core.TaskSuspension;
import org.neuralchilli.hive.domain.Task;
import org.neuralchilli.hive.domain.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Runs one attempt of a task body on a worker thread and reports how it ended.
 * Never touches scheduler state; the returned {@link TaskOutcome} is the only channel back.
 */
public class TaskRunner implements Callable<TaskOutcome> {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final Task task;
    private final TaskContext context;

    public TaskRunner(Task task, TaskContext context) {
        this.task = task;
        this.context = context;
    }

    @Override
    public TaskOutcome call() {
        String threadName = Thread.currentThread().getName();
        log.debug("[{}] Executing: {} (attempt {})", threadName, task.id(), task.attempts());

        Instant start = Instant.now();

        try {
            Object result = task.executor().execute(context);

            Optional<String> waiting = context.suspendedOn();
            if (waiting.isPresent()) {
                // Body caught the suspension signal and returned anyway
                log.debug("[{}] Suspended: {} on {}", threadName, task.id(), waiting.get());
                return TaskOutcome.blocked(waiting.get());
            }

            log.debug("[{}] Completed: {} ({}ms)",
                    threadName, task.id(), Duration.between(start, Instant.now()).toMillis());
            return TaskOutcome.completed(result);

        } catch (TaskSuspension suspension) {
            log.debug("[{}] Suspended: {} on {}", threadName, task.id(), suspension.dependencyId());
            return TaskOutcome.blocked(suspension.dependencyId());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted: {}", threadName, task.id());
            return new TaskOutcome.Failed("interrupted", new TaskExecutionException(task.id(), e));

        } catch (Exception e) {
            log.error("[{}] Failed: {} - {}", threadName, task.id(), e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new TaskOutcome.Failed(message, new TaskExecutionException(task.id(), e));
        }
    }
}
