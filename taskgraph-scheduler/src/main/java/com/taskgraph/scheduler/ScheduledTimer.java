package com.taskgraph.scheduler;

import com.taskgraph.core.model.NodeRef;

import java.time.Instant;
import java.util.UUID;

/**
 * A timer bound to a node.
 */
public record ScheduledTimer(
    UUID timerId,
    NodeRef node,
    TimerType type,
    Instant fireAt,
    boolean fired,
    Instant firedAt,
    boolean cancelled,
    Instant createdAt
) {
    public boolean isDue(Instant now) {
        return !fired && !cancelled && !fireAt.isAfter(now);
    }

    public ScheduledTimer markFired(Instant at) {
        return new ScheduledTimer(timerId, node, type, fireAt, true, at, cancelled, createdAt);
    }

    public ScheduledTimer markCancelled() {
        return new ScheduledTimer(timerId, node, type, fireAt, fired, firedAt, true, createdAt);
    }
}
