package com.taskgraph.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.model.AuditEntry;
import com.taskgraph.core.model.DependencyType;
import com.taskgraph.core.model.ResourceRequirement;
import com.taskgraph.core.model.StepConfig;
import com.taskgraph.core.model.Task;
import com.taskgraph.core.model.Workflow;
import com.taskgraph.core.model.WorkflowStep;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Workflow lifecycle: create, validate, start, pause, resume, cancel, inspect.
 */
public interface WorkflowService {

    /**
     * Validate and store a workflow, ready to start.
     *
     * @param request The workflow definition
     * @return The stored workflow in READY
     * @throws com.taskgraph.core.exception.ValidationException if the step graph is invalid
     */
    Workflow createWorkflow(CreateWorkflowRequest request);

    /**
     * Store a workflow as DRAFT without validating it.
     */
    Workflow saveDraft(CreateWorkflowRequest request);

    /**
     * Validate a draft and move it to READY.
     *
     * @throws com.taskgraph.core.exception.ValidationException if the step graph is invalid
     */
    Workflow validateWorkflow(UUID workflowId);

    /**
     * Start a READY workflow.
     *
     * @throws com.taskgraph.core.exception.InvalidStateTransitionException if not READY
     */
    Workflow startWorkflow(UUID workflowId);

    /**
     * Stop dispatching new steps. Running wait steps are suspended.
     */
    Workflow pauseWorkflow(UUID workflowId, String reason);

    Workflow resumeWorkflow(UUID workflowId);

    /**
     * Cancel every non-terminal step and owned task, then the workflow.
     */
    Workflow cancelWorkflow(UUID workflowId, String reason);

    WorkflowStatusView getStatus(UUID workflowId);

    /**
     * Running and paused workflows.
     */
    List<Workflow> getActiveWorkflows();

    /**
     * Request to create a workflow.
     */
    record CreateWorkflowRequest(
        String name,
        String description,
        Integer maxParallelSteps,
        Duration timeout,
        Boolean retryFailedSteps,
        JsonNode context,
        String createdBy,
        List<StepDefinition> steps,
        List<EdgeDefinition> edges
    ) {
        public CreateWorkflowRequest {
            steps = steps != null ? List.copyOf(steps) : List.of();
            edges = edges != null ? List.copyOf(edges) : List.of();
        }
    }

    /**
     * One step of a workflow definition.
     */
    record StepDefinition(
        String stepId,
        String name,
        StepConfig config,
        Integer stepOrder,
        Integer priority,
        Integer maxRetries,
        Duration timeout,
        Instant deadline,
        ResourceRequirement resources
    ) {}

    /**
     * Explicit edge between two steps: {@code stepId} waits on {@code dependsOn}.
     */
    record EdgeDefinition(
        String stepId,
        String dependsOn,
        DependencyType type,
        String condition,
        boolean optional
    ) {}

    /**
     * Workflow with its steps, owned tasks, progress and audit trail.
     */
    record WorkflowStatusView(
        Workflow workflow,
        List<WorkflowStep> steps,
        List<Task> tasks,
        double progressPercentage,
        String rootCauseStepId,
        List<AuditEntry> audit
    ) {}
}
