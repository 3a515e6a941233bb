package com.taskgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Unit of schedulable work.
 *
 * Primary Key: id
 * Optional parents: workflowId (owning workflow), parentTaskId (nesting)
 *
 * Invariants:
 * - priority in [1, 5], 1 being the most urgent
 * - lifecycle.retryCount <= lifecycle.maxRetries
 */
public record Task(
    UUID id,
    String name,
    String description,
    TaskType taskType,
    int priority,
    UUID workflowId,
    UUID parentTaskId,
    JsonNode input,
    JsonNode executionContext,
    Duration estimatedDuration,
    ResourceRequirement resourceRequirement,
    Instant createdAt,
    NodeLifecycle lifecycle
) {
    public static final int HIGHEST_PRIORITY = 1;
    public static final int LOWEST_PRIORITY = 5;
    public static final int DEFAULT_PRIORITY = 3;

    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(taskType, "taskType");
        Objects.requireNonNull(lifecycle, "lifecycle");
        if (priority < HIGHEST_PRIORITY || priority > LOWEST_PRIORITY) {
            throw new IllegalArgumentException("priority must be in [1, 5], was " + priority);
        }
    }

    public NodeRef ref() {
        return NodeRef.task(id);
    }

    public NodeStatus status() {
        return lifecycle.status();
    }

    public Task withLifecycle(NodeLifecycle lifecycle) {
        return new Task(id, name, description, taskType, priority, workflowId, parentTaskId,
            input, executionContext, estimatedDuration, resourceRequirement, createdAt, lifecycle);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID id = UUID.randomUUID();
        private String name;
        private String description;
        private TaskType taskType;
        private int priority = DEFAULT_PRIORITY;
        private UUID workflowId;
        private UUID parentTaskId;
        private JsonNode input;
        private JsonNode executionContext;
        private Duration estimatedDuration;
        private ResourceRequirement resourceRequirement;
        private int maxRetries = 0;
        private Duration timeout;
        private Instant deadline;
        private Instant createdAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder taskType(TaskType taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder workflowId(UUID workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder parentTaskId(UUID parentTaskId) {
            this.parentTaskId = parentTaskId;
            return this;
        }

        public Builder input(JsonNode input) {
            this.input = input;
            return this;
        }

        public Builder executionContext(JsonNode executionContext) {
            this.executionContext = executionContext;
            return this;
        }

        public Builder estimatedDuration(Duration estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
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

        public Task build() {
            Instant now = createdAt != null ? createdAt : Instant.now();
            return new Task(id, name, description, taskType, priority, workflowId, parentTaskId,
                input, executionContext, estimatedDuration, resourceRequirement, now,
                NodeLifecycle.initial(maxRetries, timeout, deadline, now));
        }
    }
}
