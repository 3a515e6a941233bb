package com.taskgraph.engine.metrics;

import com.taskgraph.core.model.NodeKind;
import com.taskgraph.core.model.NodeStatus;
import com.taskgraph.core.model.WorkflowStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the orchestrator.
 *
 * Metrics exposed:
 * - Node transitions and running node gauges per node kind
 * - Node duration timer
 * - Retry, timeout and deadline counts
 * - Admission deferrals and transition conflicts
 * - Workflow outcomes
 */
public class OrchestratorMetrics implements MeterBinder {

    // Metric names
    public static final String NODE_TRANSITIONS = "taskgraph.node.transitions";
    public static final String NODES_RUNNING = "taskgraph.nodes.running";
    public static final String NODE_DURATION = "taskgraph.node.duration";
    public static final String NODE_RETRIES = "taskgraph.node.retries";
    public static final String NODE_TIMEOUTS = "taskgraph.node.timeouts";
    public static final String NODE_DEADLINES = "taskgraph.node.deadlines_exceeded";
    public static final String ADMISSION_DEFERRALS = "taskgraph.admission.deferrals";
    public static final String TRANSITION_CONFLICTS = "taskgraph.transition.conflicts";
    public static final String WORKFLOW_TRANSITIONS = "taskgraph.workflow.transitions";
    public static final String WORKFLOW_STUCK = "taskgraph.workflow.stuck";
    public static final String SCHEDULER_TICKS = "taskgraph.scheduler.ticks";

    private final MeterRegistry registry;
    private final Map<NodeKind, AtomicInteger> runningGauges = new EnumMap<>(NodeKind.class);

    public OrchestratorMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (NodeKind kind : NodeKind.values()) {
            runningGauges.put(kind, new AtomicInteger(0));
        }
        bindTo(registry);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        for (Map.Entry<NodeKind, AtomicInteger> entry : runningGauges.entrySet()) {
            Gauge.builder(NODES_RUNNING, entry.getValue(), AtomicInteger::get)
                .tag("kind", entry.getKey().name().toLowerCase())
                .description("Nodes currently running")
                .register(registry);
        }
    }

    // ========== Node Metrics ==========

    public void nodeTransition(NodeKind kind, NodeStatus from, NodeStatus to) {
        Counter.builder(NODE_TRANSITIONS)
            .tag("kind", kind.name().toLowerCase())
            .tag("to", to.wireName())
            .description("Node state transitions")
            .register(registry)
            .increment();

        if (to == NodeStatus.RUNNING) {
            runningGauges.get(kind).incrementAndGet();
        } else if (from == NodeStatus.RUNNING) {
            runningGauges.get(kind).updateAndGet(v -> Math.max(0, v - 1));
        }
    }

    public void nodeCompleted(NodeKind kind, Duration duration) {
        Timer.builder(NODE_DURATION)
            .tag("kind", kind.name().toLowerCase())
            .description("Time from first start to completion")
            .register(registry)
            .record(duration);
    }

    public void retryScheduled(NodeKind kind, int retryCount) {
        Counter.builder(NODE_RETRIES)
            .tag("kind", kind.name().toLowerCase())
            .tag("retry", String.valueOf(retryCount))
            .description("Retries scheduled")
            .register(registry)
            .increment();
    }

    public void nodeTimedOut(NodeKind kind) {
        Counter.builder(NODE_TIMEOUTS)
            .tag("kind", kind.name().toLowerCase())
            .description("Attempts force-failed by timeout")
            .register(registry)
            .increment();
    }

    public void deadlineExceeded(NodeKind kind) {
        Counter.builder(NODE_DEADLINES)
            .tag("kind", kind.name().toLowerCase())
            .description("Nodes cancelled by deadline")
            .register(registry)
            .increment();
    }

    public void admissionDeferred() {
        Counter.builder(ADMISSION_DEFERRALS)
            .description("Dispatches deferred for lack of resources")
            .register(registry)
            .increment();
    }

    public void transitionConflict() {
        Counter.builder(TRANSITION_CONFLICTS)
            .description("Stale transitions discarded")
            .register(registry)
            .increment();
    }

    public int runningNodes(NodeKind kind) {
        return runningGauges.get(kind).get();
    }

    // ========== Workflow Metrics ==========

    public void workflowTransition(WorkflowStatus to) {
        Counter.builder(WORKFLOW_TRANSITIONS)
            .tag("to", to.name().toLowerCase())
            .description("Workflow state transitions")
            .register(registry)
            .increment();
    }

    public void workflowStuck() {
        Counter.builder(WORKFLOW_STUCK)
            .description("Running workflows detected without progress")
            .register(registry)
            .increment();
    }

    public void schedulerTick() {
        Counter.builder(SCHEDULER_TICKS)
            .description("Scheduler loop ticks")
            .register(registry)
            .increment();
    }
}
