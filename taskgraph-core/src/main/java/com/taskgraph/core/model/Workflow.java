package com.taskgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Named, versioned container that owns a step graph and, optionally, tasks.
 *
 * Primary Key: id
 * Unique: (name, version)
 *
 * Invariants:
 * - maxParallelSteps >= 1
 * - revision increases by one on every update (optimistic locking)
 */
public record Workflow(
    UUID id,
    String name,
    int version,
    String description,
    WorkflowStatus status,
    int maxParallelSteps,
    Duration timeout,
    boolean retryFailedSteps,
    JsonNode context,
    JsonNode results,
    ErrorInfo error,
    String rootCauseStepId,
    String createdBy,
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant completedAt,
    long revision
) {
    public static final int DEFAULT_MAX_PARALLEL_STEPS = 5;

    public Workflow {
        if (maxParallelSteps < 1) {
            throw new IllegalArgumentException("maxParallelSteps must be >= 1");
        }
    }

    /**
     * Check whether the workflow timeout has elapsed.
     */
    public boolean isTimedOut(Instant now) {
        return timeout != null
            && startedAt != null
            && status.isActive()
            && Duration.between(startedAt, now).compareTo(timeout) > 0;
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .version(version)
            .description(description)
            .status(status)
            .maxParallelSteps(maxParallelSteps)
            .timeout(timeout)
            .retryFailedSteps(retryFailedSteps)
            .context(context)
            .results(results)
            .error(error)
            .rootCauseStepId(rootCauseStepId)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .startedAt(startedAt)
            .completedAt(completedAt)
            .revision(revision);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID id = UUID.randomUUID();
        private String name;
        private int version = 1;
        private String description;
        private WorkflowStatus status = WorkflowStatus.DRAFT;
        private int maxParallelSteps = DEFAULT_MAX_PARALLEL_STEPS;
        private Duration timeout;
        private boolean retryFailedSteps = true;
        private JsonNode context;
        private JsonNode results;
        private ErrorInfo error;
        private String rootCauseStepId;
        private String createdBy;
        private Instant createdAt = Instant.now();
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;
        private long revision;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder maxParallelSteps(int maxParallelSteps) {
            this.maxParallelSteps = maxParallelSteps;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryFailedSteps(boolean retryFailedSteps) {
            this.retryFailedSteps = retryFailedSteps;
            return this;
        }

        public Builder context(JsonNode context) {
            this.context = context;
            return this;
        }

        public Builder results(JsonNode results) {
            this.results = results;
            return this;
        }

        public Builder error(ErrorInfo error) {
            this.error = error;
            return this;
        }

        public Builder rootCauseStepId(String rootCauseStepId) {
            this.rootCauseStepId = rootCauseStepId;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder revision(long revision) {
            this.revision = revision;
            return this;
        }

        public Workflow build() {
            return new Workflow(id, name, version, description, status, maxParallelSteps, timeout,
                retryFailedSteps, context, results, error, rootCauseStepId, createdBy,
                createdAt, updatedAt != null ? updatedAt : createdAt, startedAt, completedAt, revision);
        }
    }
}
