package com.taskgraph.engine.persistence;

import com.taskgraph.core.model.AuditEntry;
import com.taskgraph.core.model.AuditEventType;
import com.taskgraph.core.repository.AuditRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * In-memory implementation of AuditRepository.
 * Entries are kept in append order.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new ArrayList<>();

    @Override
    public synchronized void append(AuditEntry entry) {
        entries.add(entry);
    }

    @Override
    public synchronized List<AuditEntry> findByWorkflow(UUID workflowId) {
        return entries.stream()
            .filter(e -> workflowId.equals(e.workflowId()))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<AuditEntry> findByNode(String nodeKey) {
        return entries.stream()
            .filter(e -> nodeKey.equals(e.nodeKey()))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<AuditEntry> findByTimeRange(Instant from, Instant to, int limit) {
        return entries.stream()
            .filter(e -> !e.timestamp().isBefore(from) && e.timestamp().isBefore(to))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized Map<AuditEventType, Long> countByType(UUID workflowId) {
        return entries.stream()
            .filter(e -> workflowId.equals(e.workflowId()))
            .collect(Collectors.groupingBy(AuditEntry::type, Collectors.counting()));
    }

    public synchronized int size() {
        return entries.size();
    }
}
