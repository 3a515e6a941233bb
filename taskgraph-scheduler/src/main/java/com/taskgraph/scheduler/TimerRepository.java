package com.taskgraph.scheduler;

import com.taskgraph.core.model.NodeRef;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for scheduled timers.
 */
public interface TimerRepository {

    void save(ScheduledTimer timer);

    Optional<ScheduledTimer> findById(UUID timerId);

    /**
     * Pending timers due at or before {@code now}, earliest first.
     */
    List<ScheduledTimer> findDue(Instant now, int limit);

    /**
     * Pending timers for a node.
     */
    List<ScheduledTimer> findPendingForNode(NodeRef node);

    /**
     * Mark a timer fired. Returns false if it was already fired or cancelled.
     */
    boolean markFired(UUID timerId, Instant firedAt);

    /**
     * Cancel a pending timer. Returns false if it was not pending.
     */
    boolean cancel(UUID timerId);

    int countPending();
}
