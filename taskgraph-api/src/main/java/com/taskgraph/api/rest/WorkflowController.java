package com.taskgraph.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.model.AuditEntry;
import com.taskgraph.core.model.StepConfig;
import com.taskgraph.core.model.Workflow;
import com.taskgraph.core.model.WorkflowStep;
import com.taskgraph.engine.service.WorkflowService;
import com.taskgraph.engine.service.WorkflowService.CreateWorkflowRequest;
import com.taskgraph.engine.service.WorkflowService.WorkflowStatusView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST API for workflow management.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    /**
     * Create a workflow. Drafts are stored without validation.
     */
    @PostMapping
    public ResponseEntity<WorkflowResponse> createWorkflow(
            @RequestBody CreateWorkflowRequest request,
            @RequestParam(defaultValue = "false") boolean draft) {

        Workflow workflow = draft
            ? workflowService.saveDraft(request)
            : workflowService.createWorkflow(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowResponse.from(workflow));
    }

    @PostMapping("/{workflowId}/validate")
    public ResponseEntity<WorkflowResponse> validateWorkflow(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(WorkflowResponse.from(workflowService.validateWorkflow(workflowId)));
    }

    @PostMapping("/{workflowId}/start")
    public ResponseEntity<WorkflowResponse> startWorkflow(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(WorkflowResponse.from(workflowService.startWorkflow(workflowId)));
    }

    @PostMapping("/{workflowId}/pause")
    public ResponseEntity<WorkflowResponse> pauseWorkflow(
            @PathVariable UUID workflowId,
            @RequestBody(required = false) ReasonRequest request) {

        String reason = request != null ? request.reason() : "Manual pause";
        return ResponseEntity.ok(WorkflowResponse.from(workflowService.pauseWorkflow(workflowId, reason)));
    }

    @PostMapping("/{workflowId}/resume")
    public ResponseEntity<WorkflowResponse> resumeWorkflow(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(WorkflowResponse.from(workflowService.resumeWorkflow(workflowId)));
    }

    @PostMapping("/{workflowId}/cancel")
    public ResponseEntity<WorkflowResponse> cancelWorkflow(
            @PathVariable UUID workflowId,
            @RequestBody(required = false) ReasonRequest request) {

        String reason = request != null ? request.reason() : "Manual cancellation";
        return ResponseEntity.ok(WorkflowResponse.from(workflowService.cancelWorkflow(workflowId, reason)));
    }

    /**
     * Workflow with its steps, progress and audit trail.
     */
    @GetMapping("/{workflowId}")
    public ResponseEntity<WorkflowStatusResponse> getWorkflow(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(WorkflowStatusResponse.from(workflowService.getStatus(workflowId)));
    }

    @GetMapping("/active")
    public ResponseEntity<List<WorkflowResponse>> getActiveWorkflows() {
        return ResponseEntity.ok(workflowService.getActiveWorkflows().stream()
            .map(WorkflowResponse::from)
            .collect(Collectors.toList()));
    }

    // ========== DTOs ==========

    public record ReasonRequest(String reason) {}

    public record WorkflowResponse(
        UUID id,
        String name,
        int version,
        String description,
        String status,
        int maxParallelSteps,
        Long timeoutMs,
        JsonNode context,
        JsonNode results,
        String errorCode,
        String errorMessage,
        String rootCauseStepId,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
    ) {
        public static WorkflowResponse from(Workflow workflow) {
            return new WorkflowResponse(
                workflow.id(),
                workflow.name(),
                workflow.version(),
                workflow.description(),
                workflow.status().name().toLowerCase(),
                workflow.maxParallelSteps(),
                workflow.timeout() != null ? workflow.timeout().toMillis() : null,
                workflow.context(),
                workflow.results(),
                workflow.error() != null ? workflow.error().code() : null,
                workflow.error() != null ? workflow.error().message() : null,
                workflow.rootCauseStepId(),
                workflow.createdAt(),
                workflow.startedAt(),
                workflow.completedAt()
            );
        }
    }

    public record StepResponse(
        String stepId,
        String name,
        String stepType,
        int stepOrder,
        int priority,
        String parentStepId,
        int iteration,
        StepConfig config,
        NodeStateResponse state
    ) {
        public static StepResponse from(WorkflowStep step) {
            return new StepResponse(
                step.stepId(),
                step.name(),
                step.stepType().name().toLowerCase(),
                step.stepOrder(),
                step.priority(),
                step.parentStepId(),
                step.iteration(),
                step.config(),
                NodeStateResponse.from(step.lifecycle())
            );
        }
    }

    public record AuditResponse(
        String type,
        String nodeKey,
        String fromStatus,
        String toStatus,
        String reason,
        String actorType,
        Instant timestamp
    ) {
        public static AuditResponse from(AuditEntry entry) {
            return new AuditResponse(
                entry.type().name(),
                entry.nodeKey(),
                entry.fromStatus(),
                entry.toStatus(),
                entry.reason(),
                entry.actorType(),
                entry.timestamp()
            );
        }
    }

    public record WorkflowStatusResponse(
        WorkflowResponse workflow,
        double progressPercentage,
        List<StepResponse> steps,
        List<AuditResponse> audit
    ) {
        public static WorkflowStatusResponse from(WorkflowStatusView view) {
            return new WorkflowStatusResponse(
                WorkflowResponse.from(view.workflow()),
                view.progressPercentage(),
                view.steps().stream().map(StepResponse::from).collect(Collectors.toList()),
                view.audit().stream().map(AuditResponse::from).collect(Collectors.toList())
            );
        }
    }
}
