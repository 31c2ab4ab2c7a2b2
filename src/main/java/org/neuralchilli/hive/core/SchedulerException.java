package org.neuralchilli.hive.core;

/**
 * Base class for scheduler errors.
 * Unchecked: structural errors are programming errors at the call site,
 * execution errors are isolated per task by the scheduler.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
