package com.taskgraph.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.model.AuditEntry;
import com.taskgraph.core.model.DependencyEdge;
import com.taskgraph.core.model.DependencyType;
import com.taskgraph.core.model.ResourceRequirement;
import com.taskgraph.core.model.Task;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Task-level operations.
 */
public interface TaskService {

    /**
     * Create a task.
     *
     * @throws com.taskgraph.core.exception.ValidationException on bad priority, retries or resources
     */
    Task createTask(CreateTaskRequest request);

    /**
     * Make a task wait on another.
     *
     * @throws com.taskgraph.core.exception.CycleException if the edge would close a cycle
     */
    DependencyEdge addDependency(UUID taskId, AddDependencyRequest request);

    TaskStatusView getTaskStatus(UUID taskId);

    /**
     * Cancel a task and its subtasks.
     *
     * @return number of tasks cancelled
     */
    int cancelTask(UUID taskId, String reason);

    /**
     * Delete a task, its subtasks and their edges.
     *
     * @throws com.taskgraph.core.exception.InvalidStateTransitionException if any of them is running
     */
    void deleteTask(UUID taskId);

    List<Task> listSubtasks(UUID taskId);

    record CreateTaskRequest(
        String name,
        String description,
        String taskType,
        Integer priority,
        UUID workflowId,
        UUID parentTaskId,
        JsonNode input,
        JsonNode executionContext,
        Duration estimatedDuration,
        ResourceRequirement resources,
        Integer maxRetries,
        Duration timeout,
        Instant deadline
    ) {}

    record AddDependencyRequest(
        UUID dependsOn,
        DependencyType type,
        String condition,
        boolean optional
    ) {}

    /**
     * Task with its dependencies, subtasks and transition history.
     */
    record TaskStatusView(
        Task task,
        List<DependencyEdge> dependencies,
        List<Task> subtasks,
        List<AuditEntry> history
    ) {}
}
