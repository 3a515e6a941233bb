package com.taskgraph.core.model;

/**
 * Lifecycle states for a workflow.
 */
public enum WorkflowStatus {
    /**
     * Stored but not yet validated.
     * Transitions: -> READY, CANCELLED
     */
    DRAFT,

    /**
     * Step graph validated, waiting to be started.
     * Transitions: -> RUNNING, CANCELLED
     */
    READY,

    /**
     * Steps are being dispatched.
     * Transitions: -> PAUSED, COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Dispatch suspended.
     * Transitions: -> RUNNING, FAILED, CANCELLED
     */
    PAUSED,

    /**
     * All steps finished without a final failure. Terminal state.
     */
    COMPLETED,

    /**
     * A step failed for good or the workflow timed out. Terminal state.
     */
    FAILED,

    /**
     * Cancelled by request. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Running or paused, i.e. started and not yet finished.
     */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    public boolean canTransitionTo(WorkflowStatus target) {
        return switch (this) {
            case DRAFT -> target == READY || target == CANCELLED;
            case READY -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == PAUSED || target == COMPLETED
                || target == FAILED || target == CANCELLED;
            case PAUSED -> target == RUNNING || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
