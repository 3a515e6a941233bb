package com.taskgraph.core.spi;

/**
 * Exception thrown by task runners on failure.
 */
public class TaskRunnerException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public TaskRunnerException(String errorCode, String message) {
        this(errorCode, message, null, true);
    }

    public TaskRunnerException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, null, retryable);
    }

    public TaskRunnerException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, true);
    }

    public TaskRunnerException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static TaskRunnerException permanent(String errorCode, String message) {
        return new TaskRunnerException(errorCode, message, false);
    }

    /**
     * Create a retryable exception (transient failure).
     */
    public static TaskRunnerException transientFailure(String errorCode, String message) {
        return new TaskRunnerException(errorCode, message, true);
    }
}
