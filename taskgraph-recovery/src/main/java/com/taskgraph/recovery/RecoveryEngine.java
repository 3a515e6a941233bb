package com.taskgraph.recovery;

import com.taskgraph.core.model.*;
import com.taskgraph.core.repository.AuditRepository;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.engine.coordinator.WorkflowOrchestrator;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.OrchestratorMetrics;
import com.taskgraph.engine.retry.RetryTimeoutManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Periodic sweeps that catch what the scheduler tick does not see.
 *
 * Responsibilities:
 * - Time out running nodes whose attempt exceeded its timeout
 * - Cancel nodes past their deadline
 * - Fail workflows past their workflow timeout
 * - Flag running workflows that have made no progress for too long
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private final GraphStore graphStore;
    private final AuditRepository auditRepository;
    private final RetryTimeoutManager retryManager;
    private final WorkflowOrchestrator orchestrator;
    private final OrchestratorMetrics metrics;
    private final Clock clock;
    private final Duration sweepInterval;
    private final Duration stuckThreshold;

    // workflow -> last progress instant already reported, so one stall is reported once
    private final Map<UUID, Instant> reportedStalls = new ConcurrentHashMap<>();

    private ScheduledExecutorService executor;
    private volatile boolean running = false;

    public RecoveryEngine(
            GraphStore graphStore,
            AuditRepository auditRepository,
            RetryTimeoutManager retryManager,
            WorkflowOrchestrator orchestrator,
            OrchestratorMetrics metrics,
            Clock clock,
            Duration sweepInterval,
            Duration stuckThreshold) {
        this.graphStore = graphStore;
        this.auditRepository = auditRepository;
        this.retryManager = retryManager;
        this.orchestrator = orchestrator;
        this.metrics = metrics;
        this.clock = clock;
        this.sweepInterval = sweepInterval;
        this.stuckThreshold = stuckThreshold;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }
        running = true;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "taskgraph-recovery");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = sweepInterval.toMillis();
        executor.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Recovery engine started, sweeping every {}ms", intervalMs);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void sweepSafely() {
        if (!running) {
            return;
        }
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Recovery sweep failed", e);
        }
    }

    /**
     * Run every sweep once.
     */
    public SweepReport sweep() {
        SweepReport report = new SweepReport(
            runSweep("timeouts", retryManager::enforceTimeouts),
            runSweep("deadlines", retryManager::enforceDeadlines),
            runSweep("workflow-timeouts", orchestrator::enforceWorkflowTimeouts),
            detectStuckWorkflows().size());
        if (report.hasFindings()) {
            log.info("Recovery sweep: {}", report);
        }
        return report;
    }

    private int runSweep(String name, SweepAction action) {
        try (LoggingContext ignored = LoggingContext.forSweep(name)) {
            return action.run();
        } catch (RuntimeException e) {
            log.error("Sweep {} failed", name, e);
            return 0;
        }
    }

    /**
     * Find running workflows with no audited progress within the stuck threshold.
     * Each stall is reported once; the workflow is left untouched.
     *
     * @return ids of workflows newly detected as stuck
     */
    public List<UUID> detectStuckWorkflows() {
        Instant now = clock.instant();
        List<UUID> stuck = new ArrayList<>();
        try (LoggingContext ignored = LoggingContext.forSweep("stuck-workflows")) {
            List<Workflow> active = graphStore.findWorkflowsByStatus(EnumSet.of(WorkflowStatus.RUNNING));
            reportedStalls.keySet().retainAll(active.stream().map(Workflow::id).collect(Collectors.toSet()));

            for (Workflow workflow : active) {
                Instant lastProgress = lastProgress(workflow);
                if (Duration.between(lastProgress, now).compareTo(stuckThreshold) <= 0) {
                    continue;
                }
                if (lastProgress.equals(reportedStalls.get(workflow.id()))) {
                    continue;
                }
                reportedStalls.put(workflow.id(), lastProgress);
                stuck.add(workflow.id());

                log.warn("Workflow {} '{}' made no progress since {}", workflow.id(), workflow.name(), lastProgress);
                metrics.workflowStuck();
                graphStore.appendAudit(AuditEntry.event(workflow.id(), null, AuditEventType.WORKFLOW_STUCK_DETECTED,
                    null, "no progress since " + lastProgress, AuditEntry.ACTOR_RECOVERY, now));
            }
        }
        return stuck;
    }

    private Instant lastProgress(Workflow workflow) {
        Instant last = workflow.startedAt() != null ? workflow.startedAt() : workflow.createdAt();
        for (AuditEntry entry : auditRepository.findByWorkflow(workflow.id())) {
            if (entry.type() != AuditEventType.WORKFLOW_STUCK_DETECTED && entry.timestamp().isAfter(last)) {
                last = entry.timestamp();
            }
        }
        return last;
    }

    @FunctionalInterface
    private interface SweepAction {
        int run();
    }

    /**
     * Counts from one sweep.
     */
    public record SweepReport(int nodesTimedOut, int deadlinesExceeded, int workflowsTimedOut, int stuckWorkflows) {

        public boolean hasFindings() {
            return nodesTimedOut + deadlinesExceeded + workflowsTimedOut + stuckWorkflows > 0;
        }
    }
}
