package com.taskgraph.scheduler;

/**
 * What a timer does when it fires.
 */
public enum TimerType {
    /** Move a RETRYING node back to QUEUED once its backoff has elapsed. */
    RETRY_REQUEUE,

    /** Wake the scheduler when a wait step's duration has elapsed. */
    WAIT_ELAPSED
}
