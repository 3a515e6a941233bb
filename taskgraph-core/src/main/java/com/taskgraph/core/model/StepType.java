package com.taskgraph.core.model;

/**
 * Kinds of workflow step. Each kind has exactly one {@link StepConfig} variant.
 */
public enum StepType {
    /** Leaf work delegated to a task runner. */
    TASK,

    /** Evaluate a predicate once and skip the unchosen branch. */
    CONDITION,

    /** Fan out to children, finish when all are terminal. */
    PARALLEL,

    /** Run children one after another in step order. */
    SEQUENTIAL,

    /** Repeat body steps while a predicate holds, up to a bound. */
    LOOP,

    /** Complete after a duration or once a predicate holds. */
    WAIT,

    /** Wait for an external completion signal. */
    WEBHOOK,

    /** Leaf work routed to a named custom handler. */
    CUSTOM;

    /**
     * Whether a running step of this type occupies a workflow parallelism slot.
     * Containers and conditions only coordinate their children.
     */
    public boolean isLeaf() {
        return this == TASK || this == CUSTOM || this == WAIT || this == WEBHOOK;
    }

    /**
     * Whether the step's work is performed by a task runner.
     */
    public boolean usesRunner() {
        return this == TASK || this == CUSTOM;
    }
}
