package com.taskgraph.scheduler;

import com.taskgraph.core.model.AuditEntry;
import com.taskgraph.core.model.AuditEventType;
import com.taskgraph.core.model.NodeRef;
import com.taskgraph.core.repository.AuditRepository;
import com.taskgraph.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TimerSchedulerTest {

    private TimeController time;
    private RecordingAuditRepository audit;
    private TimerScheduler scheduler;
    private List<ScheduledTimer> fired;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(Instant.parse("2024-01-01T00:00:00Z"));
        audit = new RecordingAuditRepository();
        scheduler = new TimerScheduler(new InMemoryTimerRepository(), audit, time, Duration.ofMillis(50));
        fired = new CopyOnWriteArrayList<>();
        scheduler.registerCallback(TimerType.RETRY_REQUEUE, fired::add);
    }

    @Test
    void fireDueTimers_shouldNotFireBeforeDue() {
        NodeRef node = NodeRef.task(UUID.randomUUID());
        scheduler.scheduleDelay(node, TimerType.RETRY_REQUEUE, Duration.ofSeconds(2));

        time.advanceMillis(1999);

        assertEquals(0, scheduler.fireDueTimers());
        assertTrue(fired.isEmpty());
        assertEquals(1, scheduler.pendingTimers());
    }

    @Test
    void fireDueTimers_shouldFireOnceWhenDue() {
        NodeRef node = NodeRef.step(UUID.randomUUID(), "S2");
        scheduler.scheduleDelay(node, TimerType.RETRY_REQUEUE, Duration.ofSeconds(1));

        time.advanceSeconds(1);

        assertEquals(1, scheduler.fireDueTimers());
        assertEquals(0, scheduler.fireDueTimers());
        assertEquals(1, fired.size());
        assertEquals(node, fired.get(0).node());
        assertEquals(0, scheduler.pendingTimers());
    }

    @Test
    void fireDueTimers_shouldFireInDueOrder() {
        NodeRef late = NodeRef.task(UUID.randomUUID());
        NodeRef early = NodeRef.task(UUID.randomUUID());
        scheduler.scheduleDelay(late, TimerType.RETRY_REQUEUE, Duration.ofSeconds(4));
        scheduler.scheduleDelay(early, TimerType.RETRY_REQUEUE, Duration.ofSeconds(2));

        time.advanceSeconds(5);
        scheduler.fireDueTimers();

        assertEquals(List.of(early, late),
            fired.stream().map(ScheduledTimer::node).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Cancelled timers never fire")
    void cancelTimersFor_shouldSuppressFiring() {
        NodeRef node = NodeRef.task(UUID.randomUUID());
        scheduler.scheduleDelay(node, TimerType.RETRY_REQUEUE, Duration.ofSeconds(1));
        scheduler.scheduleDelay(node, TimerType.WAIT_ELAPSED, Duration.ofSeconds(1));

        assertEquals(2, scheduler.cancelTimersFor(node));

        time.advanceSeconds(2);
        assertEquals(0, scheduler.fireDueTimers());
        assertTrue(fired.isEmpty());
    }

    @Test
    void fireDueTimers_shouldAuditEachFiring() {
        UUID workflowId = UUID.randomUUID();
        NodeRef node = NodeRef.step(workflowId, "wait");
        scheduler.scheduleDelay(node, TimerType.WAIT_ELAPSED, Duration.ofSeconds(3));

        time.advanceSeconds(3);
        scheduler.fireDueTimers();

        List<AuditEntry> entries = audit.findByWorkflow(workflowId);
        assertEquals(1, entries.size());
        assertEquals(AuditEventType.TIMER_FIRED, entries.get(0).type());
        assertEquals(node.key(), entries.get(0).nodeKey());
        assertEquals("WAIT_ELAPSED", entries.get(0).reason());
    }

    @Test
    void fireDueTimers_shouldContinueAfterCallbackFailure() {
        scheduler.registerCallback(TimerType.WAIT_ELAPSED, timer -> {
            throw new IllegalStateException("boom");
        });
        scheduler.scheduleDelay(NodeRef.task(UUID.randomUUID()), TimerType.WAIT_ELAPSED, Duration.ZERO);
        scheduler.scheduleDelay(NodeRef.task(UUID.randomUUID()), TimerType.RETRY_REQUEUE, Duration.ZERO);

        scheduler.fireDueTimers();

        assertEquals(1, fired.size());
    }

    @Test
    void startStop_shouldToggleRunning() {
        scheduler.start();
        assertTrue(scheduler.isRunning());
        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }

    private static class RecordingAuditRepository implements AuditRepository {
        private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

        @Override
        public void append(AuditEntry entry) {
            entries.add(entry);
        }

        @Override
        public List<AuditEntry> findByWorkflow(UUID workflowId) {
            return entries.stream()
                .filter(e -> workflowId.equals(e.workflowId()))
                .collect(Collectors.toList());
        }

        @Override
        public List<AuditEntry> findByNode(String nodeKey) {
            return entries.stream()
                .filter(e -> nodeKey.equals(e.nodeKey()))
                .collect(Collectors.toList());
        }

        @Override
        public List<AuditEntry> findByTimeRange(Instant from, Instant to, int limit) {
            return new ArrayList<>(entries);
        }

        @Override
        public Map<AuditEventType, Long> countByType(UUID workflowId) {
            return findByWorkflow(workflowId).stream()
                .collect(Collectors.groupingBy(AuditEntry::type, Collectors.counting()));
        }
    }
}
