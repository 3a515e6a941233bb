package com.taskgraph.core.model;

/**
 * How a dependent node waits on its upstream.
 */
public enum DependencyType {
    /** Upstream must be COMPLETED. */
    COMPLETION,

    /** Upstream must be COMPLETED with output data present. */
    DATA,

    /** Upstream must be COMPLETED and no longer hold its resource reservation. */
    RESOURCE,

    /** Upstream must be COMPLETED and the edge's condition must evaluate true. */
    CONDITIONAL
}
