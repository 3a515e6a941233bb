package com.taskgraph.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Type-specific step configuration. One variant per {@link StepType}; each
 * variant holds only the fields its semantics need.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = StepConfig.TaskConfig.class, name = "task"),
    @JsonSubTypes.Type(value = StepConfig.ConditionConfig.class, name = "condition"),
    @JsonSubTypes.Type(value = StepConfig.ParallelConfig.class, name = "parallel"),
    @JsonSubTypes.Type(value = StepConfig.SequentialConfig.class, name = "sequential"),
    @JsonSubTypes.Type(value = StepConfig.LoopConfig.class, name = "loop"),
    @JsonSubTypes.Type(value = StepConfig.WaitConfig.class, name = "wait"),
    @JsonSubTypes.Type(value = StepConfig.WebhookConfig.class, name = "webhook"),
    @JsonSubTypes.Type(value = StepConfig.CustomConfig.class, name = "custom")
})
public sealed interface StepConfig {

    StepType type();

    /**
     * Step ids this configuration refers to structurally (children, branches, loop body).
     */
    default List<String> referencedStepIds() {
        return List.of();
    }

    record TaskConfig(TaskType taskType, JsonNode taskConfig) implements StepConfig {
        public TaskConfig {
            Objects.requireNonNull(taskType, "taskType");
        }

        @Override
        public StepType type() {
            return StepType.TASK;
        }
    }

    record ConditionConfig(
        String predicate,
        List<String> truePathSteps,
        List<String> falsePathSteps
    ) implements StepConfig {
        public ConditionConfig {
            truePathSteps = truePathSteps != null ? List.copyOf(truePathSteps) : List.of();
            falsePathSteps = falsePathSteps != null ? List.copyOf(falsePathSteps) : List.of();
        }

        @Override
        public StepType type() {
            return StepType.CONDITION;
        }

        @Override
        public List<String> referencedStepIds() {
            List<String> ids = new ArrayList<>(truePathSteps);
            ids.addAll(falsePathSteps);
            return ids;
        }
    }

    record ParallelConfig(List<String> childStepIds) implements StepConfig {
        public ParallelConfig {
            childStepIds = childStepIds != null ? List.copyOf(childStepIds) : List.of();
        }

        @Override
        public StepType type() {
            return StepType.PARALLEL;
        }

        @Override
        public List<String> referencedStepIds() {
            return childStepIds;
        }
    }

    record SequentialConfig(List<String> childStepIds) implements StepConfig {
        public SequentialConfig {
            childStepIds = childStepIds != null ? List.copyOf(childStepIds) : List.of();
        }

        @Override
        public StepType type() {
            return StepType.SEQUENTIAL;
        }

        @Override
        public List<String> referencedStepIds() {
            return childStepIds;
        }
    }

    record LoopConfig(String predicate, List<String> bodyStepIds, int maxIterations) implements StepConfig {
        public LoopConfig {
            bodyStepIds = bodyStepIds != null ? List.copyOf(bodyStepIds) : List.of();
        }

        @Override
        public StepType type() {
            return StepType.LOOP;
        }

        @Override
        public List<String> referencedStepIds() {
            return bodyStepIds;
        }
    }

    record WaitConfig(Duration waitDuration, String waitCondition) implements StepConfig {
        @Override
        public StepType type() {
            return StepType.WAIT;
        }
    }

    record WebhookConfig(String callbackKey, String expectedEvent) implements StepConfig {
        @Override
        public StepType type() {
            return StepType.WEBHOOK;
        }
    }

    record CustomConfig(String handler, JsonNode config) implements StepConfig {
        public CustomConfig {
            Objects.requireNonNull(handler, "handler");
        }

        @Override
        public StepType type() {
            return StepType.CUSTOM;
        }
    }
}
