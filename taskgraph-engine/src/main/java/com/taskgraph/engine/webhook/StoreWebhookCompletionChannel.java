package com.taskgraph.engine.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.exception.InvalidStateTransitionException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.*;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.core.spi.WebhookCompletionChannel;
import com.taskgraph.engine.execution.NodeTransitioner;
import com.taskgraph.engine.retry.RetryTimeoutManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumSet;

/**
 * Applies external signals to webhook steps through the graph store.
 */
public class StoreWebhookCompletionChannel implements WebhookCompletionChannel {

    private static final Logger log = LoggerFactory.getLogger(StoreWebhookCompletionChannel.class);

    private final GraphStore graphStore;
    private final NodeTransitioner transitioner;
    private final RetryTimeoutManager retryManager;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StoreWebhookCompletionChannel(
            GraphStore graphStore,
            NodeTransitioner transitioner,
            RetryTimeoutManager retryManager,
            ObjectMapper objectMapper,
            Clock clock) {
        this.graphStore = graphStore;
        this.transitioner = transitioner;
        this.retryManager = retryManager;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void complete(NodeRef step, JsonNode output) {
        WorkflowStep webhook = requireRunningWebhook(step);
        audit(webhook, "complete", null);
        boolean completed = transitioner.transition(step, NodeStatus.RUNNING, NodeStatus.COMPLETED,
            TransitionPayload.completed(output, AuditEntry.ACTOR_WEBHOOK)).isPresent();
        if (!completed) {
            throw new InvalidStateTransitionException("WorkflowStep " + step.key(), "changed", NodeStatus.COMPLETED.name());
        }
        log.info("Webhook step {} completed by external signal", step);
    }

    @Override
    public void fail(NodeRef step, String errorCode, String message) {
        WorkflowStep webhook = requireRunningWebhook(step);
        audit(webhook, "fail", errorCode);
        ErrorInfo error = new ErrorInfo(ErrorKind.WEBHOOK,
            errorCode != null ? errorCode : ErrorKind.WEBHOOK.defaultCode(),
            message, true, null, clock.instant());
        log.info("Webhook step {} failed by external signal: [{}] {} ({})",
            step, error.code(), message, retryManager.handleFailure(step, error, AuditEntry.ACTOR_WEBHOOK));
    }

    @Override
    public NodeRef completeByKey(String callbackKey, JsonNode output) {
        for (Workflow workflow : graphStore.findWorkflowsByStatus(EnumSet.of(WorkflowStatus.RUNNING, WorkflowStatus.PAUSED))) {
            for (WorkflowStep step : graphStore.findSteps(workflow.id())) {
                if (step.status() == NodeStatus.RUNNING
                        && step.config() instanceof StepConfig.WebhookConfig webhook
                        && callbackKey.equals(webhook.callbackKey())) {
                    complete(step.ref(), output);
                    return step.ref();
                }
            }
        }
        throw new NotFoundException("Running webhook step", callbackKey);
    }

    private WorkflowStep requireRunningWebhook(NodeRef ref) {
        if (!ref.isStep()) {
            throw new ValidationException("step", ref.key() + " is not a workflow step");
        }
        WorkflowStep step = graphStore.findStep(ref.workflowId(), ref.nodeId())
            .orElseThrow(() -> new NotFoundException("WorkflowStep", ref.key()));
        if (step.stepType() != StepType.WEBHOOK) {
            throw new ValidationException("step", ref.key() + " is a " + step.stepType() + " step, not a webhook");
        }
        if (step.status() != NodeStatus.RUNNING) {
            throw new InvalidStateTransitionException("WorkflowStep " + ref.key(),
                step.status().name(), NodeStatus.COMPLETED.name());
        }
        return step;
    }

    private void audit(WorkflowStep step, String signal, String errorCode) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("signal", signal);
        if (errorCode != null) {
            payload.put("errorCode", errorCode);
        }
        graphStore.appendAudit(AuditEntry.event(step.workflowId(), step.ref(),
            AuditEventType.WEBHOOK_SIGNAL_RECEIVED, payload, null, AuditEntry.ACTOR_WEBHOOK, clock.instant()));
    }
}
