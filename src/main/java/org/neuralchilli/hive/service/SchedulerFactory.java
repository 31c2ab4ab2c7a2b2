package org.neuralchilli.hive.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.hive.config.SchedulerConfig;
import org.neuralchilli.hive.core.Scheduler;
import org.neuralchilli.hive.monitoring.SchedulerEventPublisher;
import org.neuralchilli.hive.monitoring.SchedulerMetrics;
import org.neuralchilli.hive.suggest.PatternDependencySuggester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds schedulers from {@code hive.*} configuration.
 * Every call returns a new, independent scheduler; callers own and close it.
 */
@ApplicationScoped
public class SchedulerFactory {

    private static final Logger log = LoggerFactory.getLogger(SchedulerFactory.class);

    @Inject
    SchedulerConfig config;

    @Inject
    SchedulerMetrics metrics;

    @Inject
    SchedulerEventPublisher eventPublisher;

    public Scheduler create() {
        return builder().build();
    }

    public Scheduler create(String workerId) {
        return builder().workerId(workerId).build();
    }

    /**
     * Builder preloaded with configuration and the monitoring listeners, for further tweaks
     */
    public Scheduler.Builder builder() {
        SchedulerConfig.Loop loop = config.scheduler();
        Scheduler.Builder builder = Scheduler.builder()
                .maxWorkers(loop.maxWorkers())
                .tick(loop.tick())
                .timeout(loop.timeout().orElse(null))
                .failurePolicy(loop.failurePolicy())
                .workerId(loop.workerId())
                .listener(metrics)
                .listener(eventPublisher);

        if (config.suggester().enabled()) {
            builder.suggester(new PatternDependencySuggester(config.suggester().threshold()));
        }

        log.debug("Prepared scheduler builder: maxWorkers={}, failurePolicy={}, suggester={}",
                loop.maxWorkers(), loop.failurePolicy(), config.suggester().enabled());
        return builder;
    }
}
