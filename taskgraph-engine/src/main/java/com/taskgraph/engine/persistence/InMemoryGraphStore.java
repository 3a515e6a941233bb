package com.taskgraph.engine.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.exception.ConflictException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.model.*;
import com.taskgraph.core.repository.AuditRepository;
import com.taskgraph.core.repository.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of GraphStore.
 *
 * Transitions and their audit entries are written under one lock, which
 * makes each transition atomic with its audit record.
 */
public class InMemoryGraphStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private final Map<UUID, Workflow> workflows = new ConcurrentHashMap<>();
    private final Map<UUID, Map<String, WorkflowStep>> steps = new ConcurrentHashMap<>();
    private final Map<UUID, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, Map<String, DependencyEdge>> edgesByScope = new ConcurrentHashMap<>();
    private final AuditRepository auditRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InMemoryGraphStore(AuditRepository auditRepository, ObjectMapper objectMapper, Clock clock) {
        this.auditRepository = auditRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ========== Graph ==========

    @Override
    public WorkflowGraph loadGraph(UUID workflowId) {
        Workflow workflow = findWorkflow(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId.toString()));
        return new WorkflowGraph(
            workflow,
            findSteps(workflowId),
            findEdgesInScope(NodeRef.workflowScope(workflowId))
        );
    }

    @Override
    public synchronized NodeLifecycle saveTransition(
            NodeRef ref, NodeStatus from, NodeStatus to, TransitionPayload payload) {
        NodeLifecycle current = findLifecycle(ref)
            .orElseThrow(() -> new NotFoundException(ref.isTask() ? "Task" : "WorkflowStep", ref.key()));

        if (current.status() != from) {
            throw new ConflictException(ref.key(), from.name(), current.status().name());
        }

        Instant now = clock.instant();
        NodeLifecycle next = current.transition(to, payload, now);
        storeLifecycle(ref, next);

        auditRepository.append(AuditEntry.nodeTransition(
            ref, from, to, auditPayload(payload, next), payload.reason(), payload.actor(), now));

        log.debug("{}: {} -> {}", ref, from, to);
        return next;
    }

    @Override
    public void appendAudit(AuditEntry entry) {
        auditRepository.append(entry);
    }

    @Override
    public Optional<NodeLifecycle> findLifecycle(NodeRef ref) {
        if (ref.isTask()) {
            return findTask(ref.taskId()).map(Task::lifecycle);
        }
        return findStep(ref.workflowId(), ref.nodeId()).map(WorkflowStep::lifecycle);
    }

    private void storeLifecycle(NodeRef ref, NodeLifecycle lifecycle) {
        if (ref.isTask()) {
            tasks.computeIfPresent(ref.taskId(), (id, task) -> task.withLifecycle(lifecycle));
        } else {
            Map<String, WorkflowStep> workflowSteps = steps.get(ref.workflowId());
            workflowSteps.computeIfPresent(ref.nodeId(), (id, step) -> step.withLifecycle(lifecycle));
        }
    }

    private JsonNode auditPayload(TransitionPayload payload, NodeLifecycle next) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("retryCount", next.retryCount());
        if (payload.output() != null) {
            node.set("output", payload.output());
        }
        if (payload.error() != null) {
            ErrorInfo error = payload.error();
            ObjectNode errorNode = node.putObject("error");
            errorNode.put("kind", error.kind().name());
            errorNode.put("code", error.code());
            errorNode.put("message", error.message());
            errorNode.put("retryable", error.retryable());
        }
        if (payload.retryScheduled()) {
            node.put("retryScheduled", true);
        }
        return node;
    }

    // ========== Workflows ==========

    @Override
    public synchronized void saveWorkflow(Workflow workflow, List<WorkflowStep> workflowSteps) {
        workflows.put(workflow.id(), workflow);
        Map<String, WorkflowStep> byId = new ConcurrentHashMap<>();
        for (WorkflowStep step : workflowSteps) {
            byId.put(step.stepId(), step);
        }
        steps.put(workflow.id(), byId);
    }

    @Override
    public synchronized Workflow updateWorkflow(Workflow workflow) {
        Workflow stored = workflows.get(workflow.id());
        if (stored == null) {
            throw new NotFoundException("Workflow", workflow.id().toString());
        }
        if (stored.revision() != workflow.revision()) {
            throw new ConflictException("workflow:" + workflow.id(),
                "revision " + workflow.revision(), "revision " + stored.revision());
        }
        Workflow updated = workflow.toBuilder()
            .revision(workflow.revision() + 1)
            .updatedAt(clock.instant())
            .build();
        workflows.put(updated.id(), updated);
        return updated;
    }

    @Override
    public Optional<Workflow> findWorkflow(UUID workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public List<Workflow> findWorkflowsByStatus(Set<WorkflowStatus> statuses) {
        return workflows.values().stream()
            .filter(w -> statuses.contains(w.status()))
            .sorted(Comparator.comparing(Workflow::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized int nextWorkflowVersion(String name) {
        return workflows.values().stream()
            .filter(w -> w.name().equals(name))
            .mapToInt(Workflow::version)
            .max()
            .orElse(0) + 1;
    }

    // ========== Steps ==========

    @Override
    public synchronized void addStep(WorkflowStep step) {
        Map<String, WorkflowStep> workflowSteps = steps.get(step.workflowId());
        if (workflowSteps == null) {
            throw new NotFoundException("Workflow", step.workflowId().toString());
        }
        workflowSteps.put(step.stepId(), step);
    }

    @Override
    public Optional<WorkflowStep> findStep(UUID workflowId, String stepId) {
        Map<String, WorkflowStep> workflowSteps = steps.get(workflowId);
        return workflowSteps == null ? Optional.empty() : Optional.ofNullable(workflowSteps.get(stepId));
    }

    @Override
    public List<WorkflowStep> findSteps(UUID workflowId) {
        Map<String, WorkflowStep> workflowSteps = steps.getOrDefault(workflowId, Map.of());
        return workflowSteps.values().stream()
            .sorted(Comparator.comparingInt(WorkflowStep::stepOrder).thenComparing(WorkflowStep::stepId))
            .collect(Collectors.toList());
    }

    // ========== Tasks ==========

    @Override
    public void saveTask(Task task) {
        tasks.put(task.id(), task);
    }

    @Override
    public Optional<Task> findTask(UUID taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> findTasksByStatus(Set<NodeStatus> statuses) {
        return tasks.values().stream()
            .filter(t -> statuses.contains(t.status()))
            .sorted(Comparator.comparing(Task::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<Task> findTasksByWorkflow(UUID workflowId) {
        return tasks.values().stream()
            .filter(t -> workflowId.equals(t.workflowId()))
            .sorted(Comparator.comparing(Task::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<Task> findSubtasks(UUID parentTaskId) {
        return tasks.values().stream()
            .filter(t -> parentTaskId.equals(t.parentTaskId()))
            .sorted(Comparator.comparing(Task::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void deleteTasks(Collection<UUID> taskIds) {
        Set<String> keys = taskIds.stream()
            .map(id -> NodeRef.task(id).key())
            .collect(Collectors.toSet());
        taskIds.forEach(tasks::remove);
        Map<String, DependencyEdge> taskEdges = edgesByScope.get(NodeRef.TASK_SCOPE);
        if (taskEdges != null) {
            taskEdges.values().removeIf(e ->
                keys.contains(e.dependent().key()) || keys.contains(e.dependsOn().key()));
        }
    }

    // ========== Edges ==========

    @Override
    public void saveEdge(DependencyEdge edge) {
        edgesByScope
            .computeIfAbsent(edge.scope(), s -> new ConcurrentHashMap<>())
            .put(edge.key(), edge);
    }

    @Override
    public List<DependencyEdge> findUpstreamEdges(NodeRef dependent) {
        return edgesIn(dependent.scope()).stream()
            .filter(e -> e.dependent().equals(dependent))
            .collect(Collectors.toList());
    }

    @Override
    public List<DependencyEdge> findDownstreamEdges(NodeRef dependsOn) {
        return edgesIn(dependsOn.scope()).stream()
            .filter(e -> e.dependsOn().equals(dependsOn))
            .collect(Collectors.toList());
    }

    @Override
    public List<DependencyEdge> findEdgesInScope(String scope) {
        return edgesIn(scope);
    }

    private List<DependencyEdge> edgesIn(String scope) {
        Map<String, DependencyEdge> scoped = edgesByScope.getOrDefault(scope, Map.of());
        return scoped.values().stream()
            .sorted(Comparator.comparing(DependencyEdge::createdAt).thenComparing(DependencyEdge::key))
            .collect(Collectors.toList());
    }
}
