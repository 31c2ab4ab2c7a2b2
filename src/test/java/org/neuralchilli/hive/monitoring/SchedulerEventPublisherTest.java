package org.neuralchilli.hive.monitoring;

import io.quarkus.test.junit.QuarkusTest;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.eventbus.EventBus;
import io.vertx.mutiny.core.eventbus.MessageConsumer;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.hive.core.Scheduler;
import org.neuralchilli.hive.domain.Task;
import org.neuralchilli.hive.service.SchedulerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@QuarkusTest
class SchedulerEventPublisherTest {

    @Inject
    EventBus eventBus;

    @Inject
    SchedulerEventPublisher publisher;

    @Inject
    SchedulerFactory factory;

    private final Map<String, List<JsonObject>> received = new ConcurrentHashMap<>();
    private final List<MessageConsumer<JsonObject>> consumers = new ArrayList<>();

    @BeforeEach
    void setup() {
        for (String address : List.of(
                SchedulerEventPublisher.TASK_STARTED,
                SchedulerEventPublisher.TASK_COMPLETED,
                SchedulerEventPublisher.TASK_BLOCKED,
                SchedulerEventPublisher.TASK_FAILED)) {
            MessageConsumer<JsonObject> consumer = eventBus.consumer(address);
            consumer.handler(message -> received
                    .computeIfAbsent(address, k -> new CopyOnWriteArrayList<>())
                    .add(message.body()));
            consumer.completionHandlerAndAwait();
            consumers.add(consumer);
        }
    }

    @AfterEach
    void cleanup() {
        consumers.forEach(MessageConsumer::unregisterAndAwait);
        consumers.clear();
    }

    private List<JsonObject> events(String address) {
        return received.getOrDefault(address, List.of());
    }

    @Test
    void shouldPublishBlockedAndFailedEvents() {
        // Given
        Task task = Task.builder("t1").description("publish me").build().ready().start();

        // When
        publisher.onTaskBlocked(task.block(), "dep");
        publisher.onTaskFailed(task.fail("boom"), "boom");

        // Then
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(events(SchedulerEventPublisher.TASK_BLOCKED)).hasSize(1);
            assertThat(events(SchedulerEventPublisher.TASK_FAILED)).hasSize(1);
        });
        JsonObject blocked = events(SchedulerEventPublisher.TASK_BLOCKED).get(0);
        assertThat(blocked.getString("taskId")).isEqualTo("t1");
        assertThat(blocked.getString("status")).isEqualTo("BLOCKED");
        assertThat(blocked.getString("dependencyId")).isEqualTo("dep");
        assertThat(blocked.getInteger("attempt")).isEqualTo(1);
        assertThat(events(SchedulerEventPublisher.TASK_FAILED).get(0).getString("error")).isEqualTo("boom");
    }

    @Test
    void shouldPublishEventsFromSchedulerRun() {
        // Given: A scheduler wired by the factory
        try (Scheduler scheduler = factory.create("events-test")) {
            scheduler.addTask("job", "publishing job", ctx -> "done", List.of());

            // When
            scheduler.run();
        }

        // Then
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(events(SchedulerEventPublisher.TASK_STARTED))
                    .anySatisfy(e -> assertThat(e.getString("taskId")).isEqualTo("job"));
            assertThat(events(SchedulerEventPublisher.TASK_COMPLETED))
                    .anySatisfy(e -> {
                        assertThat(e.getString("taskId")).isEqualTo("job");
                        assertThat(e.getString("result")).isEqualTo("done");
                        assertThat(e.getString("status")).isEqualTo("COMPLETED");
                    });
        });
    }
}
