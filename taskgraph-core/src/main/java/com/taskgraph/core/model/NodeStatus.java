package com.taskgraph.core.model;

/**
 * Lifecycle states shared by tasks and workflow steps.
 */
public enum NodeStatus {
    /**
     * Created, waiting for its dependencies.
     * Transitions: -> QUEUED, CANCELLED
     */
    PENDING,

    /**
     * Dependencies satisfied, waiting for admission.
     * Transitions: -> RUNNING, CANCELLED
     */
    QUEUED,

    /**
     * Dispatched and executing.
     * Transitions: -> COMPLETED, FAILED, CANCELLED, PAUSED
     */
    RUNNING,

    /**
     * Suspended by a workflow pause.
     * Transitions: -> RUNNING, CANCELLED
     */
    PAUSED,

    /**
     * Finished successfully. Terminal state.
     */
    COMPLETED,

    /**
     * Attempt failed. Terminal unless a retry is scheduled.
     * Transitions: -> RETRYING (while retry budget remains)
     */
    FAILED,

    /**
     * Waiting out a backoff before the next attempt.
     * Transitions: -> QUEUED, CANCELLED
     */
    RETRYING,

    /**
     * Cancelled explicitly, by deadline, or by upstream failure. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this state is terminal.
     * FAILED counts as terminal here; whether a particular failure is final
     * is tracked on {@link NodeLifecycle#isFinal()}.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if this state is waiting for dispatch.
     */
    public boolean isWaiting() {
        return this == PENDING || this == QUEUED;
    }

    /**
     * Check if the transition to the target state is structurally allowed.
     * Retry budget is checked separately by {@link NodeLifecycle}.
     */
    public boolean canTransitionTo(NodeStatus target) {
        return switch (this) {
            case PENDING -> target == QUEUED || target == CANCELLED;
            case QUEUED -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED
                || target == CANCELLED || target == PAUSED;
            case PAUSED -> target == RUNNING || target == CANCELLED;
            case FAILED -> target == RETRYING;
            case RETRYING -> target == QUEUED || target == CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    /**
     * Lower-case wire name used in payloads and the REST API.
     */
    public String wireName() {
        return name().toLowerCase();
    }
}
