package com.taskgraph.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.model.DependencyEdge;
import com.taskgraph.core.model.Task;
import com.taskgraph.engine.service.TaskService;
import com.taskgraph.engine.service.TaskService.AddDependencyRequest;
import com.taskgraph.engine.service.TaskService.CreateTaskRequest;
import com.taskgraph.engine.service.TaskService.TaskStatusView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST API for standalone and workflow-owned tasks.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping
    public ResponseEntity<TaskResponse> createTask(@RequestBody CreateTaskRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(taskService.createTask(request)));
    }

    /**
     * Make the task wait on another. Rejected with 400 if the edge closes a cycle.
     */
    @PostMapping("/{taskId}/dependencies")
    public ResponseEntity<EdgeResponse> addDependency(
            @PathVariable UUID taskId,
            @RequestBody AddDependencyRequest request) {

        DependencyEdge edge = taskService.addDependency(taskId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(EdgeResponse.from(edge));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskStatusResponse> getTask(@PathVariable UUID taskId) {
        return ResponseEntity.ok(TaskStatusResponse.from(taskService.getTaskStatus(taskId)));
    }

    @GetMapping("/{taskId}/subtasks")
    public ResponseEntity<List<TaskResponse>> listSubtasks(@PathVariable UUID taskId) {
        return ResponseEntity.ok(taskService.listSubtasks(taskId).stream()
            .map(TaskResponse::from)
            .collect(Collectors.toList()));
    }

    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelTask(
            @PathVariable UUID taskId,
            @RequestBody(required = false) WorkflowController.ReasonRequest request) {

        String reason = request != null ? request.reason() : "Manual cancellation";
        int cancelled = taskService.cancelTask(taskId, reason);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> deleteTask(@PathVariable UUID taskId) {
        taskService.deleteTask(taskId);
        return ResponseEntity.noContent().build();
    }

    // ========== DTOs ==========

    public record TaskResponse(
        UUID id,
        String name,
        String description,
        String taskType,
        int priority,
        UUID workflowId,
        UUID parentTaskId,
        JsonNode input,
        Instant createdAt,
        NodeStateResponse state
    ) {
        public static TaskResponse from(Task task) {
            return new TaskResponse(
                task.id(),
                task.name(),
                task.description(),
                task.taskType().name(),
                task.priority(),
                task.workflowId(),
                task.parentTaskId(),
                task.input(),
                task.createdAt(),
                NodeStateResponse.from(task.lifecycle())
            );
        }
    }

    public record EdgeResponse(
        String dependent,
        String dependsOn,
        String type,
        String condition,
        boolean optional
    ) {
        public static EdgeResponse from(DependencyEdge edge) {
            return new EdgeResponse(
                edge.dependent().key(),
                edge.dependsOn().key(),
                edge.type().name().toLowerCase(),
                edge.conditionExpression(),
                edge.optional()
            );
        }
    }

    public record TaskStatusResponse(
        TaskResponse task,
        List<EdgeResponse> dependencies,
        List<TaskResponse> subtasks,
        List<WorkflowController.AuditResponse> history
    ) {
        public static TaskStatusResponse from(TaskStatusView view) {
            return new TaskStatusResponse(
                TaskResponse.from(view.task()),
                view.dependencies().stream().map(EdgeResponse::from).collect(Collectors.toList()),
                view.subtasks().stream().map(TaskResponse::from).collect(Collectors.toList()),
                view.history().stream().map(WorkflowController.AuditResponse::from).collect(Collectors.toList())
            );
        }
    }
}
