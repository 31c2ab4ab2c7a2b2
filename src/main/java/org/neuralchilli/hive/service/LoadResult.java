package org.neuralchilli.hive.service;

import java.util.Optional;

/**
 * Result of loading one task definition into a scheduler.
 */
public sealed interface LoadResult {

    /**
     * Check if load was successful
     */
    boolean isSuccess();

    /**
     * Task id, or the file name when the file itself could not be read
     */
    String name();

    /**
     * Get error message if failed
     */
    Optional<String> error();

    record Success(String name) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failure(String name, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static LoadResult success(String name) {
        return new Success(name);
    }

    static LoadResult failure(String name, String error) {
        return new Failure(name, error);
    }

    static LoadResult failure(String name, Exception e) {
        return new Failure(name, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
}
