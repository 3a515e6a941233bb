package com.taskgraph.engine.step;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.model.*;
import com.taskgraph.engine.execution.NodeTransitioner;
import com.taskgraph.engine.retry.FailureOutcome;
import com.taskgraph.engine.retry.RetryTimeoutManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Map;

/**
 * Completion, failure and cancellation writes shared by the step drivers.
 */
public class StepOutcomes {

    private static final Logger log = LoggerFactory.getLogger(StepOutcomes.class);

    private final NodeTransitioner transitioner;
    private final RetryTimeoutManager retryManager;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StepOutcomes(NodeTransitioner transitioner, RetryTimeoutManager retryManager,
                        ObjectMapper objectMapper, Clock clock) {
        this.transitioner = transitioner;
        this.retryManager = retryManager;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public boolean complete(WorkflowStep step, JsonNode output) {
        return transitioner.transition(step.ref(), NodeStatus.RUNNING, NodeStatus.COMPLETED,
            TransitionPayload.completed(output, AuditEntry.ACTOR_ORCHESTRATOR)).isPresent();
    }

    public FailureOutcome fail(WorkflowStep step, ErrorKind kind, String message) {
        return fail(step, ErrorInfo.of(kind, message, clock.instant()));
    }

    public FailureOutcome fail(WorkflowStep step, ErrorInfo error) {
        return retryManager.handleFailure(step.ref(), error, AuditEntry.ACTOR_ORCHESTRATOR);
    }

    /**
     * Cancel the given steps and everything they structurally own.
     *
     * @return number of steps cancelled
     */
    public int cancelSubtrees(WorkflowGraph graph, Collection<String> rootIds, String reason) {
        Map<String, WorkflowStep> byId = graph.stepsById();
        Deque<String> pending = new ArrayDeque<>(rootIds);
        ErrorInfo error = ErrorInfo.of(ErrorKind.CANCELLED, reason, clock.instant());
        int cancelled = 0;

        while (!pending.isEmpty()) {
            WorkflowStep step = byId.get(pending.pop());
            if (step == null) {
                continue;
            }
            if (transitioner.cancel(step.ref(), step.lifecycle(), error, AuditEntry.ACTOR_ORCHESTRATOR)) {
                cancelled++;
            }
            graph.childrenOf(step.stepId()).forEach(child -> pending.push(child.stepId()));
        }
        if (cancelled > 0) {
            log.debug("Cancelled {} steps of workflow {}: {}", cancelled, graph.workflow().id(), reason);
        }
        return cancelled;
    }

    public ObjectMapper json() {
        return objectMapper;
    }

    public Clock clock() {
        return clock;
    }
}
