package com.taskgraph.worker;

/**
 * Exception thrown by task handlers on failure.
 */
public class TaskHandlerException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public TaskHandlerException(String errorCode, String message) {
        this(errorCode, message, null, true);
    }

    public TaskHandlerException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, null, retryable);
    }

    public TaskHandlerException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, true);
    }

    public TaskHandlerException(String errorCode, String message, Throwable cause, boolean retryable) {
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
    public static TaskHandlerException permanent(String errorCode, String message) {
        return new TaskHandlerException(errorCode, message, false);
    }
}
