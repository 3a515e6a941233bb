package com.taskgraph.core.model;

/**
 * Classification of node-local failures recorded in {@link ErrorInfo}.
 */
public enum ErrorKind {
    /** Task runner reported a failure. Retryable unless the runner says otherwise. */
    RUNNER("RUNNER_ERROR", true),

    /** Attempt exceeded the node timeout. */
    TIMEOUT("TIMEOUT", true),

    /** Absolute deadline passed. Never retried. */
    DEADLINE_EXCEEDED("DEADLINE_EXCEEDED", false),

    /** Allocator could not admit. Used for deferral accounting only. */
    RESOURCE_EXHAUSTED("RESOURCE_EXHAUSTED", false),

    /** Predicate could not be evaluated. */
    PREDICATE("PREDICATE_ERROR", false),

    /** A hard upstream dependency did not succeed. */
    UPSTREAM_FAILED("UPSTREAM_FAILED", false),

    /** Explicit cancellation. */
    CANCELLED("CANCELLED", false),

    /** Owning workflow timed out. */
    WORKFLOW_TIMEOUT("WORKFLOW_TIMEOUT", false),

    /** Loop ran out of iterations with its predicate still true. */
    MAX_ITERATIONS_EXCEEDED("MAX_ITERATIONS_EXCEEDED", false),

    /** External system reported failure through the webhook channel. */
    WEBHOOK("WEBHOOK_FAILED", true);

    private final String defaultCode;
    private final boolean retryable;

    ErrorKind(String defaultCode, boolean retryable) {
        this.defaultCode = defaultCode;
        this.retryable = retryable;
    }

    public String defaultCode() {
        return defaultCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
