package com.taskgraph.engine.retry;

/**
 * What became of a reported failure.
 */
public enum FailureOutcome {
    /** The node failed and a retry timer is set. */
    RETRY_SCHEDULED,
    /** The node failed for good. */
    FAILED,
    /** The node was no longer running; the report was discarded. */
    STALE
}
