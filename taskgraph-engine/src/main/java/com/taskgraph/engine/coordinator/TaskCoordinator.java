package com.taskgraph.engine.coordinator;

import com.taskgraph.core.exception.InvalidStateTransitionException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.*;
import com.taskgraph.core.repository.AuditRepository;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.engine.execution.NodeTransitioner;
import com.taskgraph.engine.graph.DependencyResolver;
import com.taskgraph.engine.resource.ResourceAllocator;
import com.taskgraph.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Task-level operations: creation, dependencies, cancellation and deletion.
 * Dispatch of tasks is done by the scheduler loop.
 */
public class TaskCoordinator implements TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskCoordinator.class);

    private final GraphStore graphStore;
    private final AuditRepository auditRepository;
    private final DependencyResolver resolver;
    private final ResourceAllocator allocator;
    private final NodeTransitioner transitioner;
    private final Clock clock;

    public TaskCoordinator(
            GraphStore graphStore,
            AuditRepository auditRepository,
            DependencyResolver resolver,
            ResourceAllocator allocator,
            NodeTransitioner transitioner,
            Clock clock) {
        this.graphStore = graphStore;
        this.auditRepository = auditRepository;
        this.resolver = resolver;
        this.allocator = allocator;
        this.transitioner = transitioner;
        this.clock = clock;
    }

    @Override
    public Task createTask(CreateTaskRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("name", "task name is required");
        }
        if (request.taskType() == null || request.taskType().isBlank()) {
            throw new ValidationException("taskType", "task type is required");
        }
        if (request.timeout() != null && (request.timeout().isNegative() || request.timeout().isZero())) {
            throw new ValidationException("timeout", "task timeout must be positive");
        }
        List<String> exceeded = allocator.exceedsCapacity(request.resources());
        if (!exceeded.isEmpty()) {
            throw new ValidationException("resources", "task can never be admitted, exceeds capacity on " + exceeded);
        }
        if (request.workflowId() != null && graphStore.findWorkflow(request.workflowId()).isEmpty()) {
            throw new NotFoundException("Workflow", request.workflowId().toString());
        }
        if (request.parentTaskId() != null && graphStore.findTask(request.parentTaskId()).isEmpty()) {
            throw new NotFoundException("Task", request.parentTaskId().toString());
        }

        Task task;
        try {
            task = Task.builder()
                .name(request.name())
                .description(request.description())
                .taskType(TaskType.of(request.taskType()))
                .priority(request.priority() != null ? request.priority() : Task.DEFAULT_PRIORITY)
                .workflowId(request.workflowId())
                .parentTaskId(request.parentTaskId())
                .input(request.input())
                .executionContext(request.executionContext())
                .estimatedDuration(request.estimatedDuration())
                .resourceRequirement(request.resources())
                .maxRetries(request.maxRetries() != null ? request.maxRetries() : 0)
                .timeout(request.timeout())
                .deadline(request.deadline())
                .createdAt(clock.instant())
                .build();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("task", e.getMessage());
        }

        graphStore.saveTask(task);
        log.info("Created task {} '{}' ({}, priority {})", task.id(), task.name(), task.taskType(), task.priority());
        return task;
    }

    @Override
    public DependencyEdge addDependency(UUID taskId, AddDependencyRequest request) {
        if (request.dependsOn() == null) {
            throw new ValidationException("dependsOn", "upstream task is required");
        }
        DependencyEdge edge = new DependencyEdge(
            NodeRef.task(taskId),
            NodeRef.task(request.dependsOn()),
            request.type() != null ? request.type() : DependencyType.COMPLETION,
            request.condition(),
            request.optional(),
            clock.instant());
        return resolver.addEdge(edge);
    }

    @Override
    public TaskStatusView getTaskStatus(UUID taskId) {
        Task task = requireTask(taskId);
        return new TaskStatusView(
            task,
            graphStore.findUpstreamEdges(task.ref()),
            graphStore.findSubtasks(taskId),
            auditRepository.findByNode(task.ref().key()));
    }

    @Override
    public int cancelTask(UUID taskId, String reason) {
        List<Task> cascade = collectCascade(requireTask(taskId));
        ErrorInfo error = ErrorInfo.of(ErrorKind.CANCELLED,
            reason != null ? reason : "cancelled by request", clock.instant());

        int cancelled = 0;
        for (Task task : cascade) {
            if (transitioner.cancel(task.ref(), task.lifecycle(), error, AuditEntry.ACTOR_USER)) {
                cancelled++;
            }
        }
        log.info("Cancelled {} of {} tasks under {}", cancelled, cascade.size(), taskId);
        return cancelled;
    }

    @Override
    public void deleteTask(UUID taskId) {
        List<Task> cascade = collectCascade(requireTask(taskId));
        for (Task task : cascade) {
            NodeStatus status = task.status();
            if (status == NodeStatus.RUNNING || status == NodeStatus.PAUSED) {
                throw new InvalidStateTransitionException("Task " + task.id(), status.name(), "DELETED");
            }
        }

        Set<UUID> ids = cascade.stream().map(Task::id).collect(Collectors.toCollection(LinkedHashSet::new));
        graphStore.deleteTasks(ids);
        resolver.rebuildScope(NodeRef.TASK_SCOPE);

        Instant now = clock.instant();
        for (Task task : cascade) {
            graphStore.appendAudit(AuditEntry.event(task.workflowId(), task.ref(), AuditEventType.TASK_DELETED,
                null, "deleted with " + taskId, AuditEntry.ACTOR_USER, now));
        }
        log.info("Deleted task {} with {} subtasks", taskId, cascade.size() - 1);
    }

    @Override
    public List<Task> listSubtasks(UUID taskId) {
        requireTask(taskId);
        return graphStore.findSubtasks(taskId);
    }

    private Task requireTask(UUID taskId) {
        return graphStore.findTask(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId.toString()));
    }

    /**
     * The task followed by all of its subtasks, breadth first.
     */
    private List<Task> collectCascade(Task root) {
        List<Task> cascade = new ArrayList<>();
        Set<UUID> seen = new LinkedHashSet<>();
        Deque<Task> pending = new ArrayDeque<>();
        pending.add(root);
        while (!pending.isEmpty()) {
            Task task = pending.poll();
            if (!seen.add(task.id())) {
                continue;
            }
            cascade.add(task);
            pending.addAll(graphStore.findSubtasks(task.id()));
        }
        return cascade;
    }
}
