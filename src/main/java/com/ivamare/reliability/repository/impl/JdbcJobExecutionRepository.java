package com.ivamare.reliability.repository.impl;

import com.ivamare.reliability.job.ExecutionStatus;
import com.ivamare.reliability.job.JobExecution;
import com.ivamare.reliability.repository.JobExecutionRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of JobExecutionRepository over {@code reliability.job_execution}.
 */
@Repository
public class JdbcJobExecutionRepository implements JobExecutionRepository {

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<JobExecution> executionMapper;

    public JdbcJobExecutionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.executionMapper = (rs, rowNum) -> new JobExecution(
            rs.getString("id"),
            rs.getString("job_id"),
            ExecutionStatus.fromValue(rs.getString("status")),
            rs.getTimestamp("started_at").toInstant(),
            toInstant(rs.getTimestamp("processing_start_time")),
            toInstant(rs.getTimestamp("processing_end_time")),
            rs.getLong("records_processed"),
            rs.getLong("records_failed")
        );
    }

    @Override
    public Optional<JobExecution> findById(String executionId) {
        List<JobExecution> results = jdbcTemplate.query(
            "SELECT * FROM reliability.job_execution WHERE id = ?",
            executionMapper,
            executionId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<JobExecution> findLatestRunning(String jobId) {
        List<JobExecution> results = jdbcTemplate.query("""
            SELECT * FROM reliability.job_execution
            WHERE job_id = ? AND status = 'RUNNING'
            ORDER BY started_at DESC
            LIMIT 1
            """,
            executionMapper,
            jobId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
