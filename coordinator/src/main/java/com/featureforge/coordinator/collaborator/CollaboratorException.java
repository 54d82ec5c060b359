package com.featureforge.coordinator.collaborator;

/**
 * Thrown when a planner, generator or integration call fails.
 *
 * Retryable failures (timeouts, 5xx, rate limits) put the chunk back in
 * the schedule; others fail the task.
 */
public class CollaboratorException extends RuntimeException {

    private final boolean retryable;

    public CollaboratorException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    public CollaboratorException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
