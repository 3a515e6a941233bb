package com.taskgraph.scheduler;

import com.taskgraph.core.model.NodeRef;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TimerRepository.
 */
public class InMemoryTimerRepository implements TimerRepository {

    private final Map<UUID, ScheduledTimer> timers = new ConcurrentHashMap<>();

    @Override
    public void save(ScheduledTimer timer) {
        timers.put(timer.timerId(), timer);
    }

    @Override
    public Optional<ScheduledTimer> findById(UUID timerId) {
        return Optional.ofNullable(timers.get(timerId));
    }

    @Override
    public List<ScheduledTimer> findDue(Instant now, int limit) {
        return timers.values().stream()
            .filter(t -> t.isDue(now))
            .sorted(Comparator.comparing(ScheduledTimer::fireAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<ScheduledTimer> findPendingForNode(NodeRef node) {
        return timers.values().stream()
            .filter(t -> !t.fired() && !t.cancelled())
            .filter(t -> t.node().equals(node))
            .collect(Collectors.toList());
    }

    @Override
    public boolean markFired(UUID timerId, Instant firedAt) {
        AtomicBoolean updated = new AtomicBoolean(false);
        timers.computeIfPresent(timerId, (id, timer) -> {
            if (timer.fired() || timer.cancelled()) {
                return timer;
            }
            updated.set(true);
            return timer.markFired(firedAt);
        });
        return updated.get();
    }

    @Override
    public boolean cancel(UUID timerId) {
        AtomicBoolean updated = new AtomicBoolean(false);
        timers.computeIfPresent(timerId, (id, timer) -> {
            if (timer.fired() || timer.cancelled()) {
                return timer;
            }
            updated.set(true);
            return timer.markCancelled();
        });
        return updated.get();
    }

    @Override
    public int countPending() {
        return (int) timers.values().stream()
            .filter(t -> !t.fired() && !t.cancelled())
            .count();
    }
}
