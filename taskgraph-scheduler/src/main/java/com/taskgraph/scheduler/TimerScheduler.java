package com.taskgraph.scheduler;

import com.taskgraph.core.model.AuditEntry;
import com.taskgraph.core.model.AuditEventType;
import com.taskgraph.core.model.NodeRef;
import com.taskgraph.core.repository.AuditRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Time-based scheduler for node timers.
 *
 * Responsibilities:
 * - Hold retry backoff timers until they are due
 * - Hold wait-step wake-ups
 * - Fire due timers into the callback registered for their type
 */
public class TimerScheduler {

    private static final Logger log = LoggerFactory.getLogger(TimerScheduler.class);

    private static final int BATCH_SIZE = 100;

    private final TimerRepository timerRepository;
    private final AuditRepository auditRepository;
    private final Clock clock;
    private final Duration pollInterval;
    private final Map<TimerType, TimerCallback> callbacks = new EnumMap<>(TimerType.class);

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public TimerScheduler(
            TimerRepository timerRepository,
            AuditRepository auditRepository,
            Clock clock,
            Duration pollInterval) {
        this.timerRepository = timerRepository;
        this.auditRepository = auditRepository;
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    /**
     * Register the handler for a timer type. Must be called before timers of that type fire.
     */
    public synchronized void registerCallback(TimerType type, TimerCallback callback) {
        callbacks.put(type, callback);
    }

    /**
     * Start polling for due timers.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Timer scheduler already running");
            return;
        }

        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "timer-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        log.info("Starting timer scheduler (poll every {}ms)", pollInterval.toMillis());

        scheduler.scheduleWithFixedDelay(
            this::pollTimers,
            pollInterval.toMillis(),
            pollInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the scheduler.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Timer scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Schedule a timer to fire at a specific time.
     *
     * @param node The node the timer belongs to
     * @param type What to do when it fires
     * @param fireAt When the timer should fire
     * @return The timer ID
     */
    public UUID scheduleTimer(NodeRef node, TimerType type, Instant fireAt) {
        ScheduledTimer timer = new ScheduledTimer(
            UUID.randomUUID(),
            node,
            type,
            fireAt,
            false,
            null,
            false,
            clock.instant()
        );

        timerRepository.save(timer);

        log.debug("Scheduled {} timer {} for {} at {}", type, timer.timerId(), node, fireAt);
        return timer.timerId();
    }

    /**
     * Schedule a timer to fire after a delay.
     */
    public UUID scheduleDelay(NodeRef node, TimerType type, Duration delay) {
        return scheduleTimer(node, type, clock.instant().plus(delay));
    }

    /**
     * Cancel a scheduled timer.
     *
     * @return true if the timer was pending and is now cancelled
     */
    public boolean cancelTimer(UUID timerId) {
        return timerRepository.cancel(timerId);
    }

    /**
     * Cancel every pending timer of a node.
     *
     * @return number of timers cancelled
     */
    public int cancelTimersFor(NodeRef node) {
        int cancelled = 0;
        for (ScheduledTimer timer : timerRepository.findPendingForNode(node)) {
            if (timerRepository.cancel(timer.timerId())) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public int pendingTimers() {
        return timerRepository.countPending();
    }

    /**
     * Fire every timer that is due now.
     *
     * @return number of timers fired
     */
    public int fireDueTimers() {
        Instant now = clock.instant();
        List<ScheduledTimer> dueTimers = timerRepository.findDue(now, BATCH_SIZE);
        int fired = 0;

        for (ScheduledTimer timer : dueTimers) {
            try {
                if (fireTimer(timer, now)) {
                    fired++;
                }
            } catch (Exception e) {
                log.error("Failed to fire timer: {}", timer.timerId(), e);
            }
        }
        return fired;
    }

    private void pollTimers() {
        if (!running) return;

        try {
            fireDueTimers();
        } catch (Exception e) {
            log.error("Error polling timers", e);
        }
    }

    private boolean fireTimer(ScheduledTimer timer, Instant now) {
        // Mark first so a concurrent poll cannot fire the same timer twice
        if (!timerRepository.markFired(timer.timerId(), now)) {
            return false;
        }

        log.debug("Firing {} timer {} for {}", timer.type(), timer.timerId(), timer.node());

        auditRepository.append(AuditEntry.event(
            timer.node().workflowId(),
            timer.node(),
            AuditEventType.TIMER_FIRED,
            null,
            timer.type().name(),
            AuditEntry.ACTOR_SCHEDULER,
            now
        ));

        TimerCallback callback;
        synchronized (this) {
            callback = callbacks.get(timer.type());
        }
        if (callback == null) {
            log.warn("No callback registered for {} timers, timer {} dropped", timer.type(), timer.timerId());
            return true;
        }
        callback.onTimerFired(timer);
        return true;
    }

    /**
     * Callback for timer events.
     */
    @FunctionalInterface
    public interface TimerCallback {
        void onTimerFired(ScheduledTimer timer);
    }
}
