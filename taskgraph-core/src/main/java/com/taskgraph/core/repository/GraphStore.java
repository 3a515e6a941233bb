package com.taskgraph.core.repository;

import com.taskgraph.core.exception.ConflictException;
import com.taskgraph.core.model.*;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable home of tasks, workflows, steps, dependency edges and the audit trail.
 *
 * The engine holds no authoritative state that is not also held here. Every
 * node status change goes through {@link #saveTransition}, which is a
 * compare-and-swap on the node's current status.
 */
public interface GraphStore {

    // ========== Graph ==========

    /**
     * Load a workflow with its steps and step edges.
     *
     * @param workflowId The workflow ID
     * @return The graph snapshot
     * @throws com.taskgraph.core.exception.NotFoundException if the workflow does not exist
     */
    WorkflowGraph loadGraph(UUID workflowId);

    /**
     * Atomically move a node from {@code from} to {@code to} and append the
     * matching audit entry.
     *
     * @param ref The node
     * @param from The status the caller believes the node is in
     * @param to The target status
     * @param payload Output, error and attribution for the transition
     * @return The node's new lifecycle
     * @throws ConflictException if the node is no longer in {@code from}
     * @throws com.taskgraph.core.exception.InvalidStateTransitionException if the transition is illegal
     * @throws com.taskgraph.core.exception.NotFoundException if the node does not exist
     */
    NodeLifecycle saveTransition(NodeRef ref, NodeStatus from, NodeStatus to, TransitionPayload payload);

    /**
     * Append an audit entry that is not part of a node transition.
     *
     * @param entry The entry
     */
    void appendAudit(AuditEntry entry);

    /**
     * Current lifecycle of any node.
     *
     * @param ref The node
     * @return The lifecycle, or empty if the node does not exist
     */
    Optional<NodeLifecycle> findLifecycle(NodeRef ref);

    // ========== Workflows ==========

    /**
     * Save a new workflow together with its steps.
     *
     * @param workflow The workflow
     * @param steps Its steps
     */
    void saveWorkflow(Workflow workflow, List<WorkflowStep> steps);

    /**
     * Update a workflow, checking its revision.
     *
     * @param workflow The new workflow state; its revision must equal the stored revision
     * @return The stored workflow with the revision incremented
     * @throws ConflictException if the stored revision differs
     */
    Workflow updateWorkflow(Workflow workflow);

    Optional<Workflow> findWorkflow(UUID workflowId);

    List<Workflow> findWorkflowsByStatus(Set<WorkflowStatus> statuses);

    /**
     * Next version number for a workflow name.
     *
     * @param name The workflow name
     * @return 1 for a new name, otherwise the highest version plus one
     */
    int nextWorkflowVersion(String name);

    // ========== Steps ==========

    /**
     * Add a step to an existing workflow (used for loop iteration clones).
     *
     * @param step The step
     */
    void addStep(WorkflowStep step);

    Optional<WorkflowStep> findStep(UUID workflowId, String stepId);

    List<WorkflowStep> findSteps(UUID workflowId);

    // ========== Tasks ==========

    void saveTask(Task task);

    Optional<Task> findTask(UUID taskId);

    List<Task> findTasksByStatus(Set<NodeStatus> statuses);

    List<Task> findTasksByWorkflow(UUID workflowId);

    List<Task> findSubtasks(UUID parentTaskId);

    /**
     * Delete tasks and every edge touching them.
     *
     * @param taskIds The tasks to delete
     */
    void deleteTasks(Collection<UUID> taskIds);

    // ========== Edges ==========

    /**
     * Store an edge. Cycle checks happen in the resolver before this call.
     *
     * @param edge The edge
     */
    void saveEdge(DependencyEdge edge);

    /**
     * Edges on which the given node depends.
     */
    List<DependencyEdge> findUpstreamEdges(NodeRef dependent);

    /**
     * Edges whose upstream is the given node.
     */
    List<DependencyEdge> findDownstreamEdges(NodeRef dependsOn);

    /**
     * All edges in a scope (see {@link NodeRef#scope()}).
     */
    List<DependencyEdge> findEdgesInScope(String scope);
}
