package com.taskgraph.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a schedulable node.
 *
 * Tasks are identified by their UUID alone. Steps are identified by
 * (workflowId, stepId), step ids being unique only within their workflow.
 */
public record NodeRef(
    NodeKind kind,
    UUID workflowId,
    String nodeId
) {
    public static final String TASK_SCOPE = "tasks";

    public NodeRef {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(nodeId, "nodeId");
        if (kind == NodeKind.STEP && workflowId == null) {
            throw new IllegalArgumentException("Step reference requires a workflowId");
        }
    }

    public static NodeRef task(UUID taskId) {
        return new NodeRef(NodeKind.TASK, null, taskId.toString());
    }

    public static NodeRef step(UUID workflowId, String stepId) {
        return new NodeRef(NodeKind.STEP, workflowId, stepId);
    }

    /**
     * Dependency scope of a workflow's steps.
     */
    public static String workflowScope(UUID workflowId) {
        return "workflow:" + workflowId;
    }

    public boolean isTask() {
        return kind == NodeKind.TASK;
    }

    public boolean isStep() {
        return kind == NodeKind.STEP;
    }

    /**
     * Task UUID for task references.
     */
    public UUID taskId() {
        if (!isTask()) {
            throw new IllegalStateException("Not a task reference: " + key());
        }
        return UUID.fromString(nodeId);
    }

    /**
     * Dependency scope this node belongs to. Edges never cross scopes.
     */
    public String scope() {
        return isTask() ? TASK_SCOPE : workflowScope(workflowId);
    }

    /**
     * Globally unique string key.
     */
    public String key() {
        return isTask() ? "task:" + nodeId : "step:" + workflowId + ":" + nodeId;
    }

    @Override
    public String toString() {
        return key();
    }
}
