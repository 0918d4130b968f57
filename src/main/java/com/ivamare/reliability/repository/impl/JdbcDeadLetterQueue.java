package com.ivamare.reliability.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.reliability.batching.DeadLetter;
import com.ivamare.reliability.batching.DeadLetterFailureType;
import com.ivamare.reliability.batching.DeadLetterStatus;
import com.ivamare.reliability.repository.DeadLetterQueue;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of DeadLetterQueue.
 */
@Repository
public class JdbcDeadLetterQueue implements DeadLetterQueue {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<DeadLetter> letterMapper;

    public JdbcDeadLetterQueue(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.letterMapper = (rs, rowNum) -> new DeadLetter(
            rs.getString("id"),
            rs.getString("job_id"),
            rs.getString("execution_id"),
            rs.getString("transaction_id"),
            DeadLetterFailureType.valueOf(rs.getString("failure_type")),
            rs.getString("failure_reason"),
            deserializePayload(rs.getString("id"), rs.getString("payload")),
            rs.getInt("retry_count"),
            rs.getInt("max_retries"),
            DeadLetterStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant(),
            toInstant(rs.getTimestamp("processed_at")),
            toInstant(rs.getTimestamp("next_retry_at"))
        );
    }

    @Override
    public String enqueue(DeadLetter letter) {
        jdbcTemplate.update("""
            INSERT INTO reliability.dead_letter_queue (
                id, job_id, execution_id, transaction_id, failure_type, failure_reason, payload,
                retry_count, max_retries, status, created_at, processed_at, next_retry_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)
            """,
            letter.id(),
            letter.jobId(),
            letter.executionId(),
            letter.transactionId(),
            letter.failureType().name(),
            letter.failureReason(),
            serializePayload(letter),
            letter.retryCount(),
            letter.maxRetries(),
            letter.status().name(),
            Timestamp.from(letter.createdAt()),
            toTimestamp(letter.processedAt()),
            toTimestamp(letter.nextRetryAt())
        );
        return letter.id();
    }

    @Override
    public Optional<DeadLetter> findById(String id) {
        List<DeadLetter> results = jdbcTemplate.query(
            "SELECT * FROM reliability.dead_letter_queue WHERE id = ?",
            letterMapper,
            id
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<DeadLetter> findDue(Instant now, int limit) {
        return jdbcTemplate.query("""
            SELECT * FROM reliability.dead_letter_queue
            WHERE status = 'PENDING'
              AND (next_retry_at IS NULL OR next_retry_at <= ?)
            ORDER BY created_at ASC
            LIMIT ?
            """,
            letterMapper,
            Timestamp.from(now),
            limit
        );
    }

    @Override
    public void markProcessed(String id, boolean success, Instant processedAt) {
        DeadLetterStatus status = success ? DeadLetterStatus.COMPLETED : DeadLetterStatus.FAILED;
        jdbcTemplate.update("""
            UPDATE reliability.dead_letter_queue
            SET status = ?, processed_at = ?, retry_count = retry_count + 1
            WHERE id = ?
            """,
            status.name(),
            Timestamp.from(processedAt),
            id
        );
    }

    private String serializePayload(DeadLetter letter) {
        try {
            return objectMapper.writeValueAsString(letter.payload());
        } catch (JsonProcessingException e) {
            throw new InvalidDataAccessApiUsageException(
                "Dead letter payload is not serializable: " + letter.id(), e);
        }
    }

    private Map<String, Object> deserializePayload(String id, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable payload for dead letter " + id, e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
