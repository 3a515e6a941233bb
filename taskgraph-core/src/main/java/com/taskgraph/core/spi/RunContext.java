package com.taskgraph.core.spi;

import com.taskgraph.core.model.NodeRef;
import com.taskgraph.core.model.TaskType;

import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Context handed to a {@link TaskRunner} for one attempt.
 */
public class RunContext {

    private final NodeRef node;
    private final TaskType taskType;
    private final int attempt;
    private final Instant deadline;
    private final BooleanSupplier cancellation;

    public RunContext(NodeRef node, TaskType taskType, int attempt, Instant deadline,
                      BooleanSupplier cancellation) {
        this.node = node;
        this.taskType = taskType;
        this.attempt = attempt;
        this.deadline = deadline;
        this.cancellation = cancellation;
    }

    /**
     * The task or step being executed.
     */
    public NodeRef getNode() {
        return node;
    }

    public TaskType getTaskType() {
        return taskType;
    }

    /**
     * 1-indexed attempt number (retry count plus one).
     */
    public int getAttempt() {
        return attempt;
    }

    /**
     * Absolute deadline of the node, or null.
     */
    public Instant getDeadline() {
        return deadline;
    }

    /**
     * Key stable across retries of the same node, for idempotent external calls.
     */
    public String getIdempotencyKey() {
        return node.key();
    }

    /**
     * Whether the engine has asked this attempt to stop.
     */
    public boolean isCancelled() {
        return cancellation.getAsBoolean();
    }
}
