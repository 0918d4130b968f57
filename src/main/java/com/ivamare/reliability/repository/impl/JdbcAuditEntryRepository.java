package com.ivamare.reliability.repository.impl;

import com.ivamare.reliability.audit.AuditEntry;
import com.ivamare.reliability.model.AuditOutcome;
import com.ivamare.reliability.repository.AuditEntryRepository;
import com.ivamare.reliability.support.CanonicalJson;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of AuditEntryRepository.
 *
 * <p>Details are stored as canonical JSON text, not jsonb, so a reloaded entry
 * re-hashes to its stored chain hash. Rows are ordered by an insertion sequence.
 */
@Repository
public class JdbcAuditEntryRepository implements AuditEntryRepository {

    private static final String SELECT = """
        SELECT id, chain_id, ts, event_type, entity_id, entity_type, actor, action, resource,
               outcome, details, signature, previous_hash, chain_hash
        FROM reliability.audit_entry
        """;

    private final JdbcTemplate jdbcTemplate;
    private final CanonicalJson json;
    private final RowMapper<AuditEntry> entryMapper;

    public JdbcAuditEntryRepository(JdbcTemplate jdbcTemplate, CanonicalJson json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.entryMapper = (rs, rowNum) -> {
            String id = rs.getString("id");
            Map<String, Object> details;
            try {
                details = this.json.readMap(rs.getString("details"));
            } catch (IllegalArgumentException e) {
                throw new DataRetrievalFailureException("Unreadable details for audit entry " + id, e);
            }
            return new AuditEntry(
                id,
                rs.getString("chain_id"),
                rs.getTimestamp("ts").toInstant(),
                rs.getString("event_type"),
                rs.getString("entity_id"),
                rs.getString("entity_type"),
                rs.getString("actor"),
                rs.getString("action"),
                rs.getString("resource"),
                AuditOutcome.valueOf(rs.getString("outcome")),
                details,
                rs.getString("signature"),
                rs.getString("previous_hash"),
                rs.getString("chain_hash")
            );
        };
    }

    @Override
    public void save(AuditEntry entry) {
        jdbcTemplate.update("""
            INSERT INTO reliability.audit_entry (
                id, chain_id, ts, event_type, entity_id, entity_type, actor, action, resource,
                outcome, details, signature, previous_hash, chain_hash
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            entry.id(),
            entry.chainId(),
            Timestamp.from(entry.timestamp()),
            entry.eventType(),
            entry.entityId(),
            entry.entityType(),
            entry.actor(),
            entry.action(),
            entry.resource(),
            entry.outcome().name(),
            json.write(entry.details()),
            entry.signature(),
            entry.previousHash(),
            entry.chainHash()
        );
    }

    @Override
    public Optional<AuditEntry> findLatest(String chainId) {
        List<AuditEntry> results = jdbcTemplate.query(
            SELECT + " WHERE chain_id = ? ORDER BY seq DESC LIMIT 1",
            entryMapper,
            chainId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<AuditEntry> findByChain(String chainId, Instant from, Instant to) {
        return findBy("chain_id", chainId, from, to);
    }

    @Override
    public List<AuditEntry> findByEntity(String entityId, Instant from, Instant to) {
        return findBy("entity_id", entityId, from, to);
    }

    private List<AuditEntry> findBy(String column, String value, Instant from, Instant to) {
        StringBuilder sql = new StringBuilder(SELECT).append(" WHERE ").append(column).append(" = ?");
        List<Object> params = new ArrayList<>();
        params.add(value);
        if (from != null) {
            sql.append(" AND ts >= ?");
            params.add(Timestamp.from(from));
        }
        if (to != null) {
            sql.append(" AND ts <= ?");
            params.add(Timestamp.from(to));
        }
        sql.append(" ORDER BY seq ASC");
        return jdbcTemplate.query(sql.toString(), entryMapper, params.toArray());
    }
}
