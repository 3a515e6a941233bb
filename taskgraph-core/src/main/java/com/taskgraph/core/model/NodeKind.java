package com.taskgraph.core.model;

/**
 * The two kinds of schedulable node.
 */
public enum NodeKind {
    TASK,
    STEP
}
