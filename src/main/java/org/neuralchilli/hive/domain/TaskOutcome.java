package org.neuralchilli.hive.domain;

import java.util.Optional;

/**
 * Result of one execution of a task body on a worker.
 * Workers hand this back to the control thread; they never touch scheduler state.
 */
public sealed interface TaskOutcome {

    /**
     * Check if the body ran to completion
     */
    boolean isCompleted();

    /**
     * Get error message if the body failed
     */
    Optional<String> error();

    /**
     * Body returned normally
     */
    record Completed(Object result) implements TaskOutcome {
        @Override
        public boolean isCompleted() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    /**
     * Body suspended itself until another task completes
     */
    record Blocked(String dependencyId) implements TaskOutcome {
        public Blocked {
            if (dependencyId == null || dependencyId.isBlank()) {
                throw new IllegalArgumentException("Dependency id cannot be null or empty");
            }
        }

        @Override
        public boolean isCompleted() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    /**
     * Body raised an error
     */
    record Failed(String message, Throwable cause) implements TaskOutcome {
        @Override
        public boolean isCompleted() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.ofNullable(message);
        }
    }

    static TaskOutcome completed(Object result) {
        return new Completed(result);
    }

    static TaskOutcome blocked(String dependencyId) {
        return new Blocked(dependencyId);
    }

    static TaskOutcome failed(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new Failed(message, cause);
    }

    static TaskOutcome failed(String message) {
        return new Failed(message, null);
    }
}
