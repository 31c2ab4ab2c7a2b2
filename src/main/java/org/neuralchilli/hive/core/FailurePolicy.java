package org.neuralchilli.hive.core;

/**
 * What happens to dependents when a task fails.
 */
public enum FailurePolicy {
    /**
     * Dependents stay where they are and are reported as stuck
     */
    BLOCK,

    /**
     * Every unfinished transitive dependent is marked FAILED as well
     */
    CASCADE
}
