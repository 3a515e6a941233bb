package com.taskgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit log record. Append-only.
 *
 * Primary Key: entryId
 * Index: (workflowId, timestamp), (nodeKey, timestamp)
 *
 * Invariants:
 * - Entries are never modified or deleted
 * - A node transition entry is written together with the transition itself
 */
public record AuditEntry(
    UUID entryId,
    UUID workflowId,
    String nodeKey,
    AuditEventType type,
    String fromStatus,
    String toStatus,
    JsonNode payload,
    String reason,
    String actorType,
    Instant timestamp
) {
    /**
     * Actor types for audit attribution.
     */
    public static final String ACTOR_SYSTEM = "SYSTEM";
    public static final String ACTOR_SCHEDULER = "SCHEDULER";
    public static final String ACTOR_EXECUTOR = "EXECUTOR";
    public static final String ACTOR_RETRY_MANAGER = "RETRY_MANAGER";
    public static final String ACTOR_ORCHESTRATOR = "ORCHESTRATOR";
    public static final String ACTOR_RECOVERY = "RECOVERY";
    public static final String ACTOR_WEBHOOK = "WEBHOOK";
    public static final String ACTOR_USER = "USER";

    /**
     * Entry for a node state transition.
     */
    public static AuditEntry nodeTransition(
            NodeRef ref,
            NodeStatus from,
            NodeStatus to,
            JsonNode payload,
            String reason,
            String actorType,
            Instant timestamp) {
        return new AuditEntry(
            UUID.randomUUID(),
            ref.workflowId(),
            ref.key(),
            AuditEventType.NODE_TRANSITION,
            from.name(),
            to.name(),
            payload,
            reason,
            actorType,
            timestamp
        );
    }

    /**
     * Entry for a workflow state transition.
     */
    public static AuditEntry workflowTransition(
            UUID workflowId,
            WorkflowStatus from,
            WorkflowStatus to,
            String reason,
            String actorType,
            Instant timestamp) {
        return new AuditEntry(
            UUID.randomUUID(),
            workflowId,
            null,
            AuditEventType.WORKFLOW_TRANSITION,
            from != null ? from.name() : null,
            to.name(),
            null,
            reason,
            actorType,
            timestamp
        );
    }

    /**
     * Entry for any other event.
     */
    public static AuditEntry event(
            UUID workflowId,
            NodeRef ref,
            AuditEventType type,
            JsonNode payload,
            String reason,
            String actorType,
            Instant timestamp) {
        return new AuditEntry(
            UUID.randomUUID(),
            workflowId,
            ref != null ? ref.key() : null,
            type,
            null,
            null,
            payload,
            reason,
            actorType,
            timestamp
        );
    }

    public boolean isNodeTransition() {
        return type == AuditEventType.NODE_TRANSITION;
    }

    public boolean isWorkflowEvent() {
        return type.name().startsWith("WORKFLOW_");
    }
}
