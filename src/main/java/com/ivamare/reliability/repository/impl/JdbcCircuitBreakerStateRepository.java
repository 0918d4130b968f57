package com.ivamare.reliability.repository.impl;

import com.ivamare.reliability.breaker.CircuitBreakerSnapshot;
import com.ivamare.reliability.breaker.CircuitState;
import com.ivamare.reliability.repository.CircuitBreakerStateRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * JDBC implementation of CircuitBreakerStateRepository. One row per service.
 */
@Repository
public class JdbcCircuitBreakerStateRepository implements CircuitBreakerStateRepository {

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<CircuitBreakerSnapshot> stateMapper;

    public JdbcCircuitBreakerStateRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.stateMapper = (rs, rowNum) -> new CircuitBreakerSnapshot(
            rs.getString("service_name"),
            CircuitState.valueOf(rs.getString("state")),
            rs.getInt("failure_count"),
            rs.getInt("success_count"),
            toInstant(rs.getTimestamp("last_failure_time")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    @Override
    public void save(CircuitBreakerSnapshot snapshot) {
        jdbcTemplate.update("""
            INSERT INTO reliability.circuit_breaker_state (
                service_name, state, failure_count, success_count, last_failure_time, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (service_name) DO UPDATE SET
                state = EXCLUDED.state,
                failure_count = EXCLUDED.failure_count,
                success_count = EXCLUDED.success_count,
                last_failure_time = EXCLUDED.last_failure_time,
                updated_at = EXCLUDED.updated_at
            """,
            snapshot.serviceName(),
            snapshot.state().name(),
            snapshot.failureCount(),
            snapshot.successCount(),
            snapshot.lastFailureTime() != null ? Timestamp.from(snapshot.lastFailureTime()) : null,
            Timestamp.from(snapshot.updatedAt())
        );
    }

    @Override
    public List<CircuitBreakerSnapshot> findAll() {
        return jdbcTemplate.query(
            "SELECT * FROM reliability.circuit_breaker_state ORDER BY service_name",
            stateMapper
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
