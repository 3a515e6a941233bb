package com.taskgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.exception.InvalidStateTransitionException;

import java.time.Duration;
import java.time.Instant;

/**
 * Execution state of a task or step. Both node kinds embed one of these, so
 * the state machine and its timestamp rules live in a single place.
 *
 * Invariants:
 * - retryCount <= maxRetries
 * - startedAt is set once, on first entry to RUNNING
 * - completedAt is set once, when the node ends for good
 * - actualDuration is only present on COMPLETED
 */
public record NodeLifecycle(
    NodeStatus status,
    int retryCount,
    int maxRetries,
    Duration timeout,
    Instant deadline,
    Instant scheduledAt,
    Instant startedAt,
    Instant attemptStartedAt,
    Instant completedAt,
    Duration actualDuration,
    JsonNode output,
    ErrorInfo error,
    Instant updatedAt
) {
    public NodeLifecycle {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryCount < 0 || retryCount > maxRetries) {
            throw new IllegalArgumentException(
                "retryCount must be in [0, maxRetries], was " + retryCount);
        }
    }

    /**
     * Create the lifecycle of a freshly created node.
     */
    public static NodeLifecycle initial(int maxRetries, Duration timeout, Instant deadline, Instant now) {
        return new NodeLifecycle(
            NodeStatus.PENDING, 0, maxRetries, timeout, deadline,
            null, null, null, null, null, null, null, now);
    }

    /**
     * True once the node can never change again.
     */
    public boolean isFinal() {
        return status == NodeStatus.COMPLETED
            || status == NodeStatus.CANCELLED
            || (status == NodeStatus.FAILED && completedAt != null);
    }

    public boolean isFinalFailure() {
        return status == NodeStatus.FAILED && completedAt != null;
    }

    public boolean hasRetryBudget() {
        return retryCount < maxRetries;
    }

    /**
     * Check whether the current attempt has run longer than the timeout.
     */
    public boolean isTimedOut(Instant now) {
        return status == NodeStatus.RUNNING
            && timeout != null
            && attemptStartedAt != null
            && Duration.between(attemptStartedAt, now).compareTo(timeout) > 0;
    }

    public boolean isPastDeadline(Instant now) {
        return deadline != null && !isFinal() && now.isAfter(deadline);
    }

    /**
     * Apply a transition, returning the new lifecycle.
     *
     * @throws InvalidStateTransitionException if the transition is not allowed
     */
    public NodeLifecycle transition(NodeStatus target, TransitionPayload payload, Instant now) {
        if (!status.canTransitionTo(target) || isFinal()) {
            throw new InvalidStateTransitionException(status, target);
        }
        if (target == NodeStatus.RETRYING && !hasRetryBudget()) {
            throw new InvalidStateTransitionException("Node", status.name(),
                target.name() + " (retry budget exhausted: " + retryCount + "/" + maxRetries + ")");
        }
        if (target == NodeStatus.FAILED && payload.retryScheduled() && !hasRetryBudget()) {
            throw new IllegalArgumentException("Cannot schedule a retry without retry budget");
        }

        int newRetryCount = retryCount;
        Instant newScheduledAt = scheduledAt;
        Instant newStartedAt = startedAt;
        Instant newAttemptStartedAt = attemptStartedAt;
        Instant newCompletedAt = completedAt;
        Duration newActualDuration = actualDuration;
        JsonNode newOutput = output;
        ErrorInfo newError = error;

        switch (target) {
            case QUEUED -> newScheduledAt = now;
            case RUNNING -> {
                if (newStartedAt == null) {
                    newStartedAt = now;
                }
                if (status == NodeStatus.QUEUED) {
                    newAttemptStartedAt = now;
                }
            }
            case COMPLETED -> {
                newOutput = payload.output();
                newError = null;
                newCompletedAt = now;
                newActualDuration = newStartedAt != null ? Duration.between(newStartedAt, now) : Duration.ZERO;
            }
            case FAILED -> {
                newError = payload.error();
                if (!payload.retryScheduled()) {
                    newCompletedAt = now;
                }
            }
            case RETRYING -> newRetryCount = retryCount + 1;
            case CANCELLED -> {
                newError = payload.error();
                newCompletedAt = now;
            }
            case PAUSED, PENDING -> {
                // no bookkeeping
            }
        }

        return new NodeLifecycle(
            target, newRetryCount, maxRetries, timeout, deadline,
            newScheduledAt, newStartedAt, newAttemptStartedAt, newCompletedAt,
            newActualDuration, newOutput, newError, now);
    }
}
