package com.taskgraph.core.model;

/**
 * Kinds of audit log entries.
 */
public enum AuditEventType {
    // Node lifecycle
    NODE_TRANSITION,
    RETRY_SCHEDULED,
    LOOP_ITERATION_STARTED,
    WEBHOOK_SIGNAL_RECEIVED,

    // Workflow lifecycle
    WORKFLOW_TRANSITION,
    WORKFLOW_STUCK_DETECTED,

    // Graph changes
    EDGE_ADDED,
    TASK_DELETED,

    // Timers
    TIMER_FIRED
}
