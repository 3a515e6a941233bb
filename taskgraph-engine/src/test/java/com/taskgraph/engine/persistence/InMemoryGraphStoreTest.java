package com.taskgraph.engine.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.exception.ConflictException;
import com.taskgraph.core.exception.InvalidStateTransitionException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.model.*;
import com.taskgraph.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class InMemoryGraphStoreTest {

    private final TimeController clock = TimeController.frozenAt(Instant.parse("2026-03-01T12:00:00Z"));
    private InMemoryAuditRepository audit;
    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        audit = new InMemoryAuditRepository();
        store = new InMemoryGraphStore(audit, new ObjectMapper(), clock);
    }

    private Task savedTask() {
        Task task = Task.builder()
            .name("export")
            .taskType(TaskType.of("export"))
            .maxRetries(2)
            .createdAt(clock.instant())
            .build();
        store.saveTask(task);
        return task;
    }

    @Test
    @DisplayName("Transition writes the new lifecycle and one audit entry")
    void testTransitionAudited() {
        Task task = savedTask();

        NodeLifecycle queued = store.saveTransition(task.ref(), NodeStatus.PENDING, NodeStatus.QUEUED,
            TransitionPayload.by(AuditEntry.ACTOR_SCHEDULER).withReason("dependencies satisfied"));

        assertThat(queued.status()).isEqualTo(NodeStatus.QUEUED);
        assertThat(queued.scheduledAt()).isEqualTo(clock.instant());
        assertThat(store.findTask(task.id()).orElseThrow().status()).isEqualTo(NodeStatus.QUEUED);

        List<AuditEntry> entries = audit.findByNode(task.ref().key());
        assertThat(entries).hasSize(1);
        AuditEntry entry = entries.get(0);
        assertThat(entry.fromStatus()).isEqualTo("PENDING");
        assertThat(entry.toStatus()).isEqualTo("QUEUED");
        assertThat(entry.actorType()).isEqualTo(AuditEntry.ACTOR_SCHEDULER);
        assertThat(entry.reason()).isEqualTo("dependencies satisfied");
    }

    @Test
    @DisplayName("Stale expected status is a conflict and leaves no trace")
    void testStaleTransitionConflicts() {
        Task task = savedTask();
        store.saveTransition(task.ref(), NodeStatus.PENDING, NodeStatus.QUEUED, TransitionPayload.by("test"));

        assertThatThrownBy(() -> store.saveTransition(task.ref(), NodeStatus.PENDING, NodeStatus.QUEUED,
                TransitionPayload.by("test")))
            .isInstanceOf(ConflictException.class);
        assertThat(audit.findByNode(task.ref().key())).hasSize(1);
    }

    @Test
    @DisplayName("Disallowed transitions are refused")
    void testIllegalTransition() {
        Task task = savedTask();

        assertThatThrownBy(() -> store.saveTransition(task.ref(), NodeStatus.PENDING, NodeStatus.COMPLETED,
                TransitionPayload.completed(null, "test")))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(audit.size()).isZero();
    }

    @Test
    @DisplayName("Unknown node is reported as not found")
    void testUnknownNode() {
        assertThatThrownBy(() -> store.saveTransition(NodeRef.task(UUID.randomUUID()),
                NodeStatus.PENDING, NodeStatus.QUEUED, TransitionPayload.by("test")))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Racing identical transitions apply exactly once")
    void testConcurrentTransitionsApplyOnce() throws InterruptedException {
        Task task = savedTask();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger applied = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();

        for (int i = 0; i < 16; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    store.saveTransition(task.ref(), NodeStatus.PENDING, NodeStatus.QUEUED,
                        TransitionPayload.by("racer"));
                    applied.incrementAndGet();
                } catch (ConflictException e) {
                    conflicts.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(applied.get()).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(15);
        assertThat(audit.findByNode(task.ref().key())).hasSize(1);
    }

    @Test
    @DisplayName("Workflow updates are guarded by revision")
    void testWorkflowRevisionGuard() {
        Workflow workflow = Workflow.builder()
            .name("nightly")
            .version(store.nextWorkflowVersion("nightly"))
            .createdAt(clock.instant())
            .build();
        store.saveWorkflow(workflow, List.of());

        Workflow updated = store.updateWorkflow(workflow.toBuilder().status(WorkflowStatus.READY).build());
        assertThat(updated.revision()).isEqualTo(workflow.revision() + 1);

        assertThatThrownBy(() -> store.updateWorkflow(workflow.toBuilder().status(WorkflowStatus.CANCELLED).build()))
            .isInstanceOf(ConflictException.class);
        assertThat(store.findWorkflow(workflow.id()).orElseThrow().status()).isEqualTo(WorkflowStatus.READY);
        assertThat(store.nextWorkflowVersion("nightly")).isEqualTo(2);
    }

    @Test
    @DisplayName("Deleting tasks removes their edges")
    void testDeleteTasksRemovesEdges() {
        Task upstream = savedTask();
        Task downstream = savedTask();
        store.saveEdge(DependencyEdge.completion(downstream.ref(), upstream.ref()));

        store.deleteTasks(List.of(upstream.id()));

        assertThat(store.findTask(upstream.id())).isEmpty();
        assertThat(store.findUpstreamEdges(downstream.ref())).isEmpty();
    }
}
