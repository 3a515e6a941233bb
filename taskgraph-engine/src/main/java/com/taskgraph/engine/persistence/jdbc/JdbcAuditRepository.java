package com.taskgraph.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.model.AuditEntry;
import com.taskgraph.core.model.AuditEventType;
import com.taskgraph.core.repository.AuditRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * PostgreSQL-backed audit trail. Schema: {@code db/audit-schema.sql}.
 *
 * Entries are ordered by insertion sequence. Re-appending an entry with a
 * known id is a no-op.
 */
public class JdbcAuditRepository implements AuditRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final AuditRowMapper rowMapper = new AuditRowMapper();

    public JdbcAuditRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void append(AuditEntry entry) {
        String sql = """
            INSERT INTO audit_log (
                entry_id, workflow_id, node_key, entry_type,
                from_status, to_status, payload, reason,
                actor_type, entry_time
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT (entry_id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            entry.entryId(),
            entry.workflowId(),
            entry.nodeKey(),
            entry.type().name(),
            entry.fromStatus(),
            entry.toStatus(),
            serializePayload(entry.payload()),
            entry.reason(),
            entry.actorType(),
            Timestamp.from(entry.timestamp())
        );

        if (rows == 0) {
            log.debug("Audit entry {} already stored, skipped", entry.entryId());
        }
    }

    @Override
    public List<AuditEntry> findByWorkflow(UUID workflowId) {
        String sql = """
            SELECT * FROM audit_log
            WHERE workflow_id = ?
            ORDER BY seq ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, workflowId);
    }

    @Override
    public List<AuditEntry> findByNode(String nodeKey) {
        String sql = """
            SELECT * FROM audit_log
            WHERE node_key = ?
            ORDER BY seq ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, nodeKey);
    }

    @Override
    public List<AuditEntry> findByTimeRange(Instant from, Instant to, int limit) {
        String sql = """
            SELECT * FROM audit_log
            WHERE entry_time >= ? AND entry_time < ?
            ORDER BY seq ASC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(from), Timestamp.from(to), limit);
    }

    @Override
    public Map<AuditEventType, Long> countByType(UUID workflowId) {
        String sql = """
            SELECT entry_type, COUNT(*) AS count
            FROM audit_log
            WHERE workflow_id = ?
            GROUP BY entry_type
            """;

        Map<AuditEventType, Long> result = new EnumMap<>(AuditEventType.class);
        jdbcTemplate.query(sql, rs -> {
            String typeName = rs.getString("entry_type");
            try {
                result.put(AuditEventType.valueOf(typeName), rs.getLong("count"));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown audit entry type in database: {}", typeName);
            }
        }, workflowId);
        return result;
    }

    private String serializePayload(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit payload is not serializable", e);
        }
    }

    private class AuditRowMapper implements RowMapper<AuditEntry> {

        @Override
        public AuditEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            String workflowId = rs.getString("workflow_id");
            return new AuditEntry(
                UUID.fromString(rs.getString("entry_id")),
                workflowId != null ? UUID.fromString(workflowId) : null,
                rs.getString("node_key"),
                AuditEventType.valueOf(rs.getString("entry_type")),
                rs.getString("from_status"),
                rs.getString("to_status"),
                readPayload(rs.getString("payload")),
                rs.getString("reason"),
                rs.getString("actor_type"),
                rs.getTimestamp("entry_time").toInstant()
            );
        }

        private JsonNode readPayload(String json) throws SQLException {
            if (json == null || json.isBlank()) {
                return null;
            }
            try {
                return objectMapper.readTree(json);
            } catch (JsonProcessingException e) {
                throw new SQLException("Corrupt audit payload: " + e.getMessage(), e);
            }
        }
    }
}
