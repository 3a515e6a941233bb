package com.taskgraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Extensible task type. Runners are registered per type name.
 */
public record TaskType(@JsonValue String name) {

    public static final TaskType CODE_ANALYSIS = new TaskType("code_analysis");
    public static final TaskType CODE_GENERATION = new TaskType("code_generation");
    public static final TaskType PR_CREATION = new TaskType("pr_creation");
    public static final TaskType DEPLOYMENT = new TaskType("deployment");
    public static final TaskType VALIDATION = new TaskType("validation");
    public static final TaskType NOTIFICATION = new TaskType("notification");

    private static final String CUSTOM_PREFIX = "custom:";

    public TaskType {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Task type name cannot be blank");
        }
    }

    @JsonCreator
    public static TaskType of(String name) {
        return new TaskType(name);
    }

    /**
     * Type used to route custom steps to a runner.
     */
    public static TaskType custom(String handler) {
        return new TaskType(CUSTOM_PREFIX + handler);
    }

    public boolean isCustom() {
        return name.startsWith(CUSTOM_PREFIX);
    }

    @Override
    public String toString() {
        return name;
    }
}
