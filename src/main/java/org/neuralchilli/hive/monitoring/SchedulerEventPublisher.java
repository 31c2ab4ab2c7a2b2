package org.neuralchilli.hive.monitoring;

import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.hive.core.TaskLifecycleListener;
import org.neuralchilli.hive.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Bridges lifecycle hooks onto the Vert.x event bus for dashboards and other observers.
 */
@ApplicationScoped
public class SchedulerEventPublisher implements TaskLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(SchedulerEventPublisher.class);

    public static final String TASK_STARTED = "hive.task.started";
    public static final String TASK_COMPLETED = "hive.task.completed";
    public static final String TASK_BLOCKED = "hive.task.blocked";
    public static final String TASK_FAILED = "hive.task.failed";

    @Inject
    EventBus eventBus;

    @Override
    public void onTaskStart(Task task) {
        publish(TASK_STARTED, event(task));
    }

    @Override
    public void onTaskComplete(Task task) {
        publish(TASK_COMPLETED, event(task)
                .put("durationMillis", task.duration().toMillis())
                .put("result", task.result() != null ? String.valueOf(task.result()) : null));
    }

    @Override
    public void onTaskBlocked(Task task, String dependencyId) {
        publish(TASK_BLOCKED, event(task).put("dependencyId", dependencyId));
    }

    @Override
    public void onTaskFailed(Task task, String error) {
        publish(TASK_FAILED, event(task).put("error", error));
    }

    private JsonObject event(Task task) {
        return new JsonObject()
                .put("taskId", task.id())
                .put("description", task.description())
                .put("status", task.status().name())
                .put("parentId", task.parentId())
                .put("attempt", task.attempts())
                .put("timestamp", Instant.now().toString());
    }

    private void publish(String address, JsonObject event) {
        eventBus.publish(address, event);
        log.trace("Published {} to {}", event, address);
    }
}
