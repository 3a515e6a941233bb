package com.taskgraph.engine.scheduling;

import com.taskgraph.core.model.*;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.engine.coordinator.WorkflowOrchestrator;
import com.taskgraph.engine.execution.NodeTransitioner;
import com.taskgraph.engine.execution.RunnerDispatcher;
import com.taskgraph.engine.execution.TransitionListener;
import com.taskgraph.engine.graph.DependencyResolver;
import com.taskgraph.engine.graph.Readiness;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.OrchestratorMetrics;
import com.taskgraph.engine.resource.ResourceAllocator;
import com.taskgraph.engine.resource.ResourceToken;
import com.taskgraph.engine.retry.RetryTimeoutManager;
import com.taskgraph.engine.step.StepExecutor;
import com.taskgraph.scheduler.TimerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives every node forward, one tick at a time.
 *
 * A tick:
 * 1. fires due timers
 * 2. times out expired workflows and polls running steps of the others
 * 3. cancels orphaned and blocked nodes, and queues ready ones
 * 4. dispatches queued nodes by priority, then queue time, then step order,
 *    within each workflow's parallelism ceiling and the resource budget
 * 5. closes workflows whose steps have all ended
 *
 * A failure handling one node is logged and never aborts the tick.
 */
public class SchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private static final Set<WorkflowStatus> ACTIVE = EnumSet.of(WorkflowStatus.RUNNING, WorkflowStatus.PAUSED);

    private final GraphStore graphStore;
    private final DependencyResolver resolver;
    private final ResourceAllocator allocator;
    private final NodeTransitioner transitioner;
    private final StepExecutor stepExecutor;
    private final RunnerDispatcher dispatcher;
    private final RetryTimeoutManager retryManager;
    private final WorkflowOrchestrator orchestrator;
    private final TimerScheduler timerScheduler;
    private final OrchestratorMetrics metrics;
    private final Clock clock;
    private final Duration tickInterval;

    private final AtomicLong ticks = new AtomicLong();
    private volatile Instant lastTickAt;
    private volatile boolean running = false;
    private ScheduledExecutorService executor;

    public SchedulerLoop(
            GraphStore graphStore,
            DependencyResolver resolver,
            ResourceAllocator allocator,
            NodeTransitioner transitioner,
            StepExecutor stepExecutor,
            RunnerDispatcher dispatcher,
            RetryTimeoutManager retryManager,
            WorkflowOrchestrator orchestrator,
            TimerScheduler timerScheduler,
            OrchestratorMetrics metrics,
            Clock clock,
            Duration tickInterval) {
        this.graphStore = graphStore;
        this.resolver = resolver;
        this.allocator = allocator;
        this.transitioner = transitioner;
        this.stepExecutor = stepExecutor;
        this.dispatcher = dispatcher;
        this.retryManager = retryManager;
        this.orchestrator = orchestrator;
        this.timerScheduler = timerScheduler;
        this.metrics = metrics;
        this.clock = clock;
        this.tickInterval = tickInterval;

        transitioner.addListener((node, from, lifecycle) -> {
            if (TransitionListener.leftExecution(from, lifecycle)) {
                allocator.releaseFor(node);
            }
        });
    }

    // ========== Lifecycle ==========

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scheduler-loop");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::safeTick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Scheduler loop started with tick interval {}ms", tickInterval.toMillis());
    }

    public synchronized void stop() {
        running = false;
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Scheduler loop stopped after {} ticks", ticks.get());
    }

    public boolean isRunning() {
        return running;
    }

    public Instant getLastTickAt() {
        return lastTickAt;
    }

    public long getTickCount() {
        return ticks.get();
    }

    private void safeTick() {
        if (!running) return;
        try {
            tick();
        } catch (Exception e) {
            log.error("Scheduler tick failed", e);
        }
    }

    // ========== Tick ==========

    /**
     * Run one scheduling pass.
     */
    public synchronized void tick() {
        timerScheduler.fireDueTimers();

        Map<UUID, WorkflowGraph> runningGraphs = new HashMap<>();
        for (Workflow workflow : graphStore.findWorkflowsByStatus(ACTIVE)) {
            try (LoggingContext ignored = LoggingContext.forWorkflow(workflow.id())) {
                if (orchestrator.handleWorkflowTimeout(workflow)) {
                    continue;
                }
                if (workflow.status() != WorkflowStatus.RUNNING) {
                    continue;
                }
                pollRunningSteps(workflow.id());
                advanceSteps(workflow.id());
                runningGraphs.put(workflow.id(), graphStore.loadGraph(workflow.id()));
            } catch (RuntimeException e) {
                log.error("Failed to advance workflow {}", workflow.id(), e);
            }
        }
        advanceTasks();

        dispatch(collectQueued(runningGraphs), runningGraphs);

        for (UUID workflowId : runningGraphs.keySet()) {
            try {
                orchestrator.evaluateCompletion(workflowId);
            } catch (RuntimeException e) {
                log.error("Failed to evaluate completion of workflow {}", workflowId, e);
            }
        }

        lastTickAt = clock.instant();
        ticks.incrementAndGet();
        metrics.schedulerTick();
    }

    private void pollRunningSteps(UUID workflowId) {
        WorkflowGraph graph = graphStore.loadGraph(workflowId);
        for (WorkflowStep step : graph.steps()) {
            if (step.status() != NodeStatus.RUNNING || step.stepType().usesRunner()) {
                continue;
            }
            try {
                stepExecutor.poll(step, graph);
            } catch (RuntimeException e) {
                log.error("Polling step {} failed", step.ref(), e);
            }
        }
    }

    private void advanceSteps(UUID workflowId) {
        WorkflowGraph graph = graphStore.loadGraph(workflowId);
        Map<String, WorkflowStep> byId = graph.stepsById();
        Instant now = clock.instant();

        for (WorkflowStep step : graph.steps()) {
            if (step.lifecycle().isFinal()) {
                continue;
            }
            try {
                WorkflowStep owner = step.parentStepId() != null ? byId.get(step.parentStepId()) : null;
                if (owner != null && owner.lifecycle().isFinal() && owner.status() != NodeStatus.COMPLETED) {
                    transitioner.cancel(step.ref(), step.lifecycle(),
                        ErrorInfo.of(ErrorKind.UPSTREAM_FAILED,
                            "owner " + owner.stepId() + " ended " + owner.status().wireName(), now),
                        AuditEntry.ACTOR_SCHEDULER);
                    continue;
                }
                if (step.status() == NodeStatus.PENDING) {
                    promote(step.ref(), step.lifecycle(), resolver.evaluate(step, graph), now);
                }
            } catch (RuntimeException e) {
                log.error("Failed to advance step {}", step.ref(), e);
            }
        }
    }

    private void advanceTasks() {
        Instant now = clock.instant();
        for (Task task : graphStore.findTasksByStatus(EnumSet.of(NodeStatus.PENDING))) {
            if (!isDispatchable(task)) {
                continue;
            }
            try {
                promote(task.ref(), task.lifecycle(), resolver.evaluate(task), now);
            } catch (RuntimeException e) {
                log.error("Failed to advance task {}", task.ref(), e);
            }
        }
    }

    private void promote(NodeRef node, NodeLifecycle lifecycle, Readiness readiness, Instant now) {
        if (readiness.isReady()) {
            transitioner.transition(node, NodeStatus.PENDING, NodeStatus.QUEUED,
                TransitionPayload.by(AuditEntry.ACTOR_SCHEDULER).withReason("dependencies satisfied"));
        } else if (readiness.isBlocked()) {
            ErrorInfo error = ErrorInfo.of(ErrorKind.UPSTREAM_FAILED, readiness.reason(), now);
            if (transitioner.cancel(node, lifecycle, error, AuditEntry.ACTOR_SCHEDULER)) {
                log.info("Cancelled {}: {}", node, readiness.reason());
            }
        }
    }

    private boolean isDispatchable(Task task) {
        if (task.workflowId() == null) {
            return true;
        }
        return graphStore.findWorkflow(task.workflowId())
            .map(w -> w.status() == WorkflowStatus.RUNNING)
            .orElse(false);
    }

    // ========== Dispatch ==========

    private List<Candidate> collectQueued(Map<UUID, WorkflowGraph> runningGraphs) {
        List<Candidate> queued = new ArrayList<>();
        for (WorkflowGraph graph : runningGraphs.values()) {
            for (WorkflowStep step : graph.steps()) {
                if (step.status() == NodeStatus.QUEUED) {
                    queued.add(Candidate.of(step));
                }
            }
        }
        for (Task task : graphStore.findTasksByStatus(EnumSet.of(NodeStatus.QUEUED))) {
            if (isDispatchable(task)) {
                queued.add(Candidate.of(task));
            }
        }
        queued.sort(Comparator
            .comparingInt(Candidate::priority)
            .thenComparing(Candidate::queuedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(Candidate::order));
        return queued;
    }

    private void dispatch(List<Candidate> queued, Map<UUID, WorkflowGraph> graphs) {
        Map<UUID, Integer> runningLeaves = new HashMap<>();
        graphs.forEach((id, graph) -> runningLeaves.put(id, countRunningLeaves(graph)));

        for (Candidate candidate : queued) {
            try {
                dispatchOne(candidate, graphs, runningLeaves);
            } catch (RuntimeException e) {
                log.error("Dispatch of {} failed", candidate.ref(), e);
                retryManager.handleFailure(candidate.ref(), ErrorInfo.runner("DISPATCH_ERROR",
                    String.valueOf(e.getMessage()), false, clock.instant()), AuditEntry.ACTOR_SCHEDULER);
            }
        }
    }

    private void dispatchOne(Candidate candidate, Map<UUID, WorkflowGraph> graphs, Map<UUID, Integer> runningLeaves) {
        NodeRef ref = candidate.ref();
        boolean countsTowardCeiling = candidate.step() != null && candidate.step().stepType().isLeaf();
        WorkflowGraph graph = candidate.step() != null ? graphs.get(ref.workflowId()) : null;

        if (countsTowardCeiling
                && runningLeaves.getOrDefault(ref.workflowId(), 0) >= graph.workflow().maxParallelSteps()) {
            log.debug("Workflow {} at its parallelism ceiling, {} stays queued", ref.workflowId(), ref);
            return;
        }

        Optional<ResourceToken> token = allocator.tryAdmit(ref, candidate.resources());
        if (token.isEmpty()) {
            metrics.admissionDeferred();
            return;
        }

        Optional<NodeLifecycle> started = transitioner.transition(ref, NodeStatus.QUEUED, NodeStatus.RUNNING,
            TransitionPayload.by(AuditEntry.ACTOR_SCHEDULER));
        if (started.isEmpty()) {
            allocator.release(token.get());
            return;
        }

        try (LoggingContext ignored = LoggingContext.forNode(ref, started.get().retryCount() + 1)) {
            if (candidate.step() != null) {
                if (countsTowardCeiling) {
                    runningLeaves.merge(ref.workflowId(), 1, Integer::sum);
                }
                log.info("Dispatching step {} ({})", ref, candidate.step().stepType());
                stepExecutor.dispatch(candidate.step().withLifecycle(started.get()), graph);
            } else {
                Task task = candidate.task();
                log.info("Dispatching task {} ({})", ref, task.taskType());
                dispatcher.submit(ref, task.taskType(), task.executionContext(), task.input(), started.get());
            }
        }
    }

    private static int countRunningLeaves(WorkflowGraph graph) {
        return (int) graph.steps().stream()
            .filter(s -> s.stepType().isLeaf())
            .filter(s -> s.status() == NodeStatus.RUNNING || s.status() == NodeStatus.PAUSED)
            .count();
    }

    private record Candidate(NodeRef ref, WorkflowStep step, Task task,
                             int priority, Instant queuedAt, int order, ResourceRequirement resources) {

        static Candidate of(WorkflowStep step) {
            return new Candidate(step.ref(), step, null, step.priority(),
                step.lifecycle().scheduledAt(), step.stepOrder(), step.resourceRequirement());
        }

        static Candidate of(Task task) {
            return new Candidate(task.ref(), null, task, task.priority(),
                task.lifecycle().scheduledAt(), 0, task.resourceRequirement());
        }
    }
}
