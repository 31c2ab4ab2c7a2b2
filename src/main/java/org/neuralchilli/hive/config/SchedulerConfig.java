package org.neuralchilli.hive.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import org.neuralchilli.hive.core.FailurePolicy;

import java.time.Duration;
import java.util.Optional;

@ConfigMapping(prefix = "hive")
public interface SchedulerConfig {

    @WithName("scheduler")
    Loop scheduler();

    @WithName("suggester")
    Suggester suggester();

    @WithName("command")
    Command command();

    @WithName("tasks")
    Tasks tasks();

    interface Loop {

        @WithName("max-workers")
        @WithDefault("4")
        int maxWorkers();

        /**
         * Longest the loop waits for a worker outcome before re-checking readiness
         */
        @WithName("tick")
        @WithDefault("50ms")
        Duration tick();

        /**
         * Default wall-clock limit for a run; unbounded when absent
         */
        @WithName("timeout")
        Optional<Duration> timeout();

        @WithName("failure-policy")
        @WithDefault("BLOCK")
        FailurePolicy failurePolicy();

        @WithName("worker-id")
        @WithDefault("hive-worker")
        String workerId();
    }

    interface Suggester {

        @WithName("enabled")
        @WithDefault("true")
        boolean enabled();

        @WithName("threshold")
        @WithDefault("0.3")
        double threshold();
    }

    interface Command {

        @WithName("trial-run")
        @WithDefault("false")
        boolean trialRun();

        @WithName("default-timeout")
        @WithDefault("3600s")
        Duration defaultTimeout();
    }

    interface Tasks {

        /**
         * Directory of YAML task batches loaded by {@code TaskDefinitionLoader#loadConfigured}
         */
        @WithName("path")
        Optional<String> path();
    }
}
