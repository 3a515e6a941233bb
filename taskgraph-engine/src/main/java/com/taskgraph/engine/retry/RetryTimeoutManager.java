package com.taskgraph.engine.retry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.model.*;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.engine.execution.NodeTransitioner;
import com.taskgraph.engine.metrics.OrchestratorMetrics;
import com.taskgraph.scheduler.ScheduledTimer;
import com.taskgraph.scheduler.TimerScheduler;
import com.taskgraph.scheduler.TimerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides between retry and final failure, and enforces timeouts and deadlines.
 *
 * A retry is a FAILED (retry scheduled) write followed by FAILED to RETRYING;
 * the backoff timer later moves the node back to QUEUED. Control steps
 * (condition, parallel, sequential, loop) are never retried.
 */
public class RetryTimeoutManager {

    private static final Logger log = LoggerFactory.getLogger(RetryTimeoutManager.class);

    private static final Set<WorkflowStatus> ACTIVE = EnumSet.of(WorkflowStatus.RUNNING, WorkflowStatus.PAUSED);

    private final GraphStore graphStore;
    private final NodeTransitioner transitioner;
    private final TimerScheduler timerScheduler;
    private final RetryPolicy retryPolicy;
    private final OrchestratorMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RetryTimeoutManager(
            GraphStore graphStore,
            NodeTransitioner transitioner,
            TimerScheduler timerScheduler,
            RetryPolicy retryPolicy,
            OrchestratorMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        this.graphStore = graphStore;
        this.transitioner = transitioner;
        this.timerScheduler = timerScheduler;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;

        timerScheduler.registerCallback(TimerType.RETRY_REQUEUE, this::onRetryTimer);
        transitioner.addListener((node, from, lifecycle) -> {
            if (lifecycle.isFinal()) {
                timerScheduler.cancelTimersFor(node);
            }
        });
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    // ========== Failures ==========

    /**
     * Record a failed attempt of a running node.
     *
     * @param node The node
     * @param error What went wrong
     * @return Whether a retry was scheduled, the node failed for good, or the report was stale
     */
    public FailureOutcome handleFailure(NodeRef node, ErrorInfo error) {
        return handleFailure(node, error, AuditEntry.ACTOR_EXECUTOR);
    }

    public FailureOutcome handleFailure(NodeRef node, ErrorInfo error, String actor) {
        Optional<NodeLifecycle> current = graphStore.findLifecycle(node);
        if (current.isEmpty() || current.get().status() != NodeStatus.RUNNING) {
            log.debug("Ignoring failure report for {} (not running)", node);
            return FailureOutcome.STALE;
        }
        NodeLifecycle lifecycle = current.get();
        boolean retry = isRetryEligible(node, lifecycle, error);

        Optional<NodeLifecycle> failed = transitioner.transition(node, NodeStatus.RUNNING, NodeStatus.FAILED,
            TransitionPayload.failed(error, retry, actor));
        if (failed.isEmpty()) {
            return FailureOutcome.STALE;
        }
        if (!retry) {
            log.warn("{} failed permanently after {} retries: [{}] {}",
                node, lifecycle.retryCount(), error.code(), error.message());
            return FailureOutcome.FAILED;
        }

        Optional<NodeLifecycle> retrying = transitioner.transition(node, NodeStatus.FAILED, NodeStatus.RETRYING,
            TransitionPayload.by(AuditEntry.ACTOR_RETRY_MANAGER));
        if (retrying.isEmpty()) {
            return FailureOutcome.STALE;
        }

        Duration delay = retryPolicy.computeBackoff(lifecycle.retryCount());
        timerScheduler.scheduleDelay(node, TimerType.RETRY_REQUEUE, delay);

        int retryCount = retrying.get().retryCount();
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("retryCount", retryCount);
        payload.put("delayMs", delay.toMillis());
        payload.put("errorCode", error.code());
        graphStore.appendAudit(AuditEntry.event(
            node.workflowId(), node, AuditEventType.RETRY_SCHEDULED,
            payload, error.message(), AuditEntry.ACTOR_RETRY_MANAGER, clock.instant()));
        metrics.retryScheduled(node.kind(), retryCount);

        log.info("Scheduled retry {}/{} for {} in {}ms",
            retryCount, lifecycle.maxRetries(), node, delay.toMillis());
        return FailureOutcome.RETRY_SCHEDULED;
    }

    private boolean isRetryEligible(NodeRef node, NodeLifecycle lifecycle, ErrorInfo error) {
        if (!lifecycle.hasRetryBudget() || !retryPolicy.shouldRetry(error)) {
            return false;
        }
        if (node.isTask()) {
            return true;
        }
        Optional<WorkflowStep> step = graphStore.findStep(node.workflowId(), node.nodeId());
        if (step.isEmpty() || !step.get().stepType().isLeaf()) {
            return false;
        }
        return graphStore.findWorkflow(node.workflowId())
            .map(Workflow::retryFailedSteps)
            .orElse(false);
    }

    private void onRetryTimer(ScheduledTimer timer) {
        Optional<NodeLifecycle> lifecycle = graphStore.findLifecycle(timer.node());
        if (lifecycle.isEmpty() || lifecycle.get().status() != NodeStatus.RETRYING) {
            log.debug("Retry timer {} for {} is stale", timer.timerId(), timer.node());
            return;
        }
        transitioner.transition(timer.node(), NodeStatus.RETRYING, NodeStatus.QUEUED,
            TransitionPayload.by(AuditEntry.ACTOR_RETRY_MANAGER).withReason("backoff elapsed"));
    }

    // ========== Timeouts and deadlines ==========

    /**
     * Fail every running node whose current attempt exceeded its timeout.
     * Wait steps are exempt: they end by their duration or condition, or by cancellation.
     *
     * @return number of nodes timed out
     */
    public int enforceTimeouts() {
        Instant now = clock.instant();
        int timedOut = 0;
        for (NodeSnapshot node : activeNodes()) {
            NodeLifecycle lifecycle = node.lifecycle();
            if (node.stepType() == StepType.WAIT || !lifecycle.isTimedOut(now)) {
                continue;
            }
            ErrorInfo error = ErrorInfo.of(ErrorKind.TIMEOUT,
                "attempt exceeded timeout of " + lifecycle.timeout().toMillis() + "ms", now);
            FailureOutcome outcome = handleFailure(node.ref(), error, AuditEntry.ACTOR_RETRY_MANAGER);
            if (outcome != FailureOutcome.STALE) {
                metrics.nodeTimedOut(node.ref().kind());
                timedOut++;
                log.warn("{} timed out ({})", node.ref(), outcome);
            }
        }
        return timedOut;
    }

    /**
     * Cancel every non-final node whose absolute deadline has passed.
     *
     * @return number of nodes cancelled
     */
    public int enforceDeadlines() {
        Instant now = clock.instant();
        int cancelled = 0;
        for (NodeSnapshot node : activeNodes()) {
            NodeLifecycle lifecycle = node.lifecycle();
            if (!lifecycle.isPastDeadline(now)) {
                continue;
            }
            ErrorInfo error = ErrorInfo.of(ErrorKind.DEADLINE_EXCEEDED,
                "deadline " + lifecycle.deadline() + " has passed", now);
            if (transitioner.cancel(node.ref(), lifecycle, error, AuditEntry.ACTOR_RETRY_MANAGER)) {
                metrics.deadlineExceeded(node.ref().kind());
                cancelled++;
                log.warn("{} cancelled: deadline exceeded", node.ref());
            }
        }
        return cancelled;
    }

    private List<NodeSnapshot> activeNodes() {
        List<NodeSnapshot> nodes = new ArrayList<>();
        Set<NodeStatus> live = EnumSet.of(NodeStatus.PENDING, NodeStatus.QUEUED,
            NodeStatus.RUNNING, NodeStatus.PAUSED, NodeStatus.RETRYING);
        for (Task task : graphStore.findTasksByStatus(live)) {
            nodes.add(new NodeSnapshot(task.ref(), null, task.lifecycle()));
        }
        for (Workflow workflow : graphStore.findWorkflowsByStatus(ACTIVE)) {
            for (WorkflowStep step : graphStore.findSteps(workflow.id())) {
                if (live.contains(step.status())) {
                    nodes.add(new NodeSnapshot(step.ref(), step.stepType(), step.lifecycle()));
                }
            }
        }
        return nodes;
    }

    private record NodeSnapshot(NodeRef ref, StepType stepType, NodeLifecycle lifecycle) {
    }
}
