package com.taskgraph.core.repository;

import com.taskgraph.core.model.AuditEntry;
import com.taskgraph.core.model.AuditEventType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit log.
 */
public interface AuditRepository {

    /**
     * Append an entry.
     *
     * @param entry The entry to append
     */
    void append(AuditEntry entry);

    /**
     * Find all entries for a workflow, its steps and its owned tasks, oldest first.
     *
     * @param workflowId The workflow ID
     * @return Entries in append order
     */
    List<AuditEntry> findByWorkflow(UUID workflowId);

    /**
     * Find all entries for a single node, oldest first.
     *
     * @param nodeKey The node key (see {@code NodeRef.key()})
     * @return Entries in append order
     */
    List<AuditEntry> findByNode(String nodeKey);

    /**
     * Find entries in a time range.
     *
     * @param from Start time (inclusive)
     * @param to End time (exclusive)
     * @param limit Maximum number of entries
     * @return Matching entries
     */
    List<AuditEntry> findByTimeRange(Instant from, Instant to, int limit);

    /**
     * Count entries by type for a workflow.
     *
     * @param workflowId The workflow ID
     * @return Map of event type to count
     */
    Map<AuditEventType, Long> countByType(UUID workflowId);
}
