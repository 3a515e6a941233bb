package com.taskgraph.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Node of a workflow's step graph.
 *
 * Primary Key: (workflowId, stepId)
 *
 * Invariants:
 * - config.type() == stepType
 * - parentStepId, when set, names the container or condition that owns this step
 * - iteration is 0 outside loops; loop body steps start at 1 and clones carry "#n" ids
 */
public record WorkflowStep(
    UUID workflowId,
    String stepId,
    String name,
    StepType stepType,
    int stepOrder,
    int priority,
    String parentStepId,
    int iteration,
    StepConfig config,
    ResourceRequirement resourceRequirement,
    Instant createdAt,
    NodeLifecycle lifecycle
) {
    public WorkflowStep {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(stepType, "stepType");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(lifecycle, "lifecycle");
        if (config.type() != stepType) {
            throw new IllegalArgumentException(String.format(
                "Step %s has type %s but %s configuration", stepId, stepType, config.type()));
        }
    }

    public NodeRef ref() {
        return NodeRef.step(workflowId, stepId);
    }

    public NodeStatus status() {
        return lifecycle.status();
    }

    public WorkflowStep withLifecycle(NodeLifecycle lifecycle) {
        return new WorkflowStep(workflowId, stepId, name, stepType, stepOrder, priority,
            parentStepId, iteration, config, resourceRequirement, createdAt, lifecycle);
    }

    public WorkflowStep withParent(String parentStepId, int iteration) {
        return new WorkflowStep(workflowId, stepId, name, stepType, stepOrder, priority,
            parentStepId, iteration, config, resourceRequirement, createdAt, lifecycle);
    }

    /**
     * Fresh copy of this step for a later loop iteration.
     */
    public WorkflowStep cloneForIteration(String cloneId, int iteration, Instant now) {
        NodeLifecycle fresh = NodeLifecycle.initial(
            lifecycle.maxRetries(), lifecycle.timeout(), lifecycle.deadline(), now);
        return new WorkflowStep(workflowId, cloneId, name, stepType, stepOrder, priority,
            parentStepId, iteration, config, resourceRequirement, now, fresh);
    }

    /**
     * Id of this step's clone in the given loop iteration.
     */
    public static String iterationId(String templateId, int iteration) {
        return iteration <= 1 ? templateId : templateId + "#" + iteration;
    }

    /**
     * Strip an iteration suffix, yielding the template id.
     */
    public static String templateId(String stepId) {
        int hash = stepId.indexOf('#');
        return hash < 0 ? stepId : stepId.substring(0, hash);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID workflowId;
        private String stepId;
        private String name;
        private int stepOrder;
        private int priority = Task.DEFAULT_PRIORITY;
        private StepConfig config;
        private ResourceRequirement resourceRequirement;
        private int maxRetries = 0;
        private Duration timeout;
        private Instant deadline;
        private Instant createdAt;

        public Builder workflowId(UUID workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder stepId(String stepId) {
            this.stepId = stepId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder stepOrder(int stepOrder) {
            this.stepOrder = stepOrder;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder config(StepConfig config) {
            this.config = config;
            return this;
        }

        public Builder resourceRequirement(ResourceRequirement resourceRequirement) {
            this.resourceRequirement = resourceRequirement;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public WorkflowStep build() {
            Objects.requireNonNull(config, "config");
            Instant now = createdAt != null ? createdAt : Instant.now();
            return new WorkflowStep(workflowId, stepId, name != null ? name : stepId,
                config.type(), stepOrder, priority, null, 0, config, resourceRequirement, now,
                NodeLifecycle.initial(maxRetries, timeout, deadline, now));
        }
    }
}
