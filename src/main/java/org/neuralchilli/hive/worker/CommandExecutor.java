package org.neuralchilli.hive.worker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.neuralchilli.hive.core.TaskContext;
import org.neuralchilli.hive.core.TaskExecutionException;
import org.neuralchilli.hive.core.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command as a task body.
 * <p>
 * stderr is merged into stdout. If the last output line is a JSON object it becomes the
 * task result, otherwise the result is {@code {"output": <trimmed output>}}. A non-zero exit
 * code or a timeout fails the task. In trial-run mode the command is only logged.
 */
public class CommandExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(1);

    private final String command;
    private final List<String> args;
    private final Map<String, String> env;
    private final Duration timeout;
    private final boolean trialRun;
    private final ObjectMapper objectMapper;

    private CommandExecutor(Builder builder) {
        this.command = builder.command;
        this.args = List.copyOf(builder.args);
        this.env = Map.copyOf(builder.env);
        this.timeout = builder.timeout;
        this.trialRun = builder.trialRun;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    }

    public static Builder builder(String command) {
        return new Builder(command);
    }

    @Override
    public Object execute(TaskContext context) throws Exception {
        List<String> fullCommand = new ArrayList<>();
        fullCommand.add(command);
        fullCommand.addAll(args);

        Map<String, String> environment = new HashMap<>(env);
        environment.put("HIVE_TASK_ID", context.taskId());
        environment.put("HIVE_ATTEMPT", String.valueOf(context.attempt()));

        if (trialRun) {
            return executeTrialRun(fullCommand, environment, context);
        }
        return executeCommand(fullCommand, environment, context);
    }

    private Map<String, Object> executeTrialRun(List<String> fullCommand, Map<String, String> environment,
                                                TaskContext context) {
        String commandStr = String.join(" ", fullCommand);

        log.info("TRIAL RUN - would execute:");
        log.info("  Task: {}", context.taskId());
        log.info("  Command: {}", commandStr);
        log.info("  Timeout: {}s", timeout.toSeconds());
        log.info("  Attempt: {}", context.attempt());
        environment.forEach((k, v) -> log.debug("    {}={}", k, v));

        return Map.of(
                "trial_run", true,
                "command", commandStr,
                "timeout", timeout.toSeconds(),
                "attempt", context.attempt()
        );
    }

    private Map<String, Object> executeCommand(List<String> fullCommand, Map<String, String> environment,
                                               TaskContext context) throws Exception {
        log.debug("Executing command: {}", String.join(" ", fullCommand));

        ProcessBuilder pb = new ProcessBuilder(fullCommand);
        pb.environment().putAll(environment);
        pb.redirectErrorStream(true);

        // Read after exit, a pipe read would block past the timeout
        Path outputFile = Files.createTempFile("hive-" + context.taskId() + "-", ".out");
        String output;
        try {
            pb.redirectOutput(outputFile.toFile());
            Process process = pb.start();

            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                throw new TaskExecutionException(context.taskId(),
                        "command timed out after " + timeout.toMillis() + "ms");
            }
            output = Files.readString(outputFile, StandardCharsets.UTF_8);
            output.lines().forEach(line -> log.debug("[{} OUTPUT] {}", context.taskId(), line));

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new TaskExecutionException(context.taskId(),
                        "command exited with code " + exitCode + "\n" + output.trim());
            }
        } finally {
            Files.deleteIfExists(outputFile);
        }
        return parseOutput(output);
    }

    /**
     * Last line as a JSON object if it is one, the whole output otherwise
     */
    Map<String, Object> parseOutput(String output) {
        String trimmed = output.trim();
        if (!trimmed.isEmpty()) {
            String[] lines = trimmed.split("\n");
            String lastLine = lines[lines.length - 1].trim();
            if (lastLine.startsWith("{") && lastLine.endsWith("}")) {
                try {
                    return objectMapper.readValue(lastLine, new TypeReference<Map<String, Object>>() {});
                } catch (Exception e) {
                    log.trace("Last line is not valid JSON: {}", e.getMessage());
                }
            }
        }
        return Map.of("output", trimmed);
    }

    public String command() {
        return command;
    }

    public List<String> args() {
        return args;
    }

    public Duration timeout() {
        return timeout;
    }

    public boolean isTrialRun() {
        return trialRun;
    }

    public static class Builder {
        private final String command;
        private List<String> args = List.of();
        private Map<String, String> env = Map.of();
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean trialRun = false;
        private ObjectMapper objectMapper;

        public Builder(String command) {
            if (command == null || command.isBlank()) {
                throw new IllegalArgumentException("Command cannot be null or empty");
            }
            this.command = command;
        }

        public Builder args(List<String> args) {
            this.args = args;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder trialRun(boolean trialRun) {
            this.trialRun = trialRun;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public CommandExecutor build() {
            return new CommandExecutor(this);
        }
    }
}
