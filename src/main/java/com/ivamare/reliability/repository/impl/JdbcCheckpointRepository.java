package com.ivamare.reliability.repository.impl;

import com.ivamare.reliability.job.CheckpointState;
import com.ivamare.reliability.job.JobCheckpoint;
import com.ivamare.reliability.repository.CheckpointRepository;
import com.ivamare.reliability.support.CanonicalJson;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of CheckpointRepository.
 *
 * <p>Metadata is part of the checksum, so it is stored as canonical JSON text.
 */
@Repository
public class JdbcCheckpointRepository implements CheckpointRepository {

    private final JdbcTemplate jdbcTemplate;
    private final CanonicalJson json;
    private final RowMapper<JobCheckpoint> checkpointMapper;

    public JdbcCheckpointRepository(JdbcTemplate jdbcTemplate, CanonicalJson json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.checkpointMapper = (rs, rowNum) -> {
            String id = rs.getString("checkpoint_id");
            Map<String, Object> metadata;
            try {
                metadata = this.json.readMap(rs.getString("metadata"));
            } catch (IllegalArgumentException e) {
                throw new DataRetrievalFailureException("Unreadable metadata for checkpoint " + id, e);
            }
            return new JobCheckpoint(
                id,
                rs.getString("job_id"),
                rs.getString("execution_id"),
                rs.getString("step_name"),
                rs.getInt("step_number"),
                rs.getLong("data_processed"),
                rs.getLong("total_data"),
                rs.getTimestamp("ts").toInstant(),
                rs.getString("checksum"),
                CheckpointState.valueOf(rs.getString("state")),
                metadata
            );
        };
    }

    @Override
    public void save(JobCheckpoint checkpoint) {
        jdbcTemplate.update("""
            INSERT INTO reliability.job_checkpoint (
                checkpoint_id, job_id, execution_id, step_name, step_number,
                data_processed, total_data, ts, checksum, state, metadata
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            checkpoint.checkpointId(),
            checkpoint.jobId(),
            checkpoint.executionId(),
            checkpoint.stepName(),
            checkpoint.stepNumber(),
            checkpoint.dataProcessed(),
            checkpoint.totalData(),
            Timestamp.from(checkpoint.timestamp()),
            checkpoint.checksum(),
            checkpoint.state().name(),
            json.write(checkpoint.metadata())
        );
    }

    @Override
    public Optional<JobCheckpoint> findById(String checkpointId) {
        List<JobCheckpoint> results = jdbcTemplate.query(
            "SELECT * FROM reliability.job_checkpoint WHERE checkpoint_id = ?",
            checkpointMapper,
            checkpointId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<JobCheckpoint> findRecent(String jobId, String executionId, CheckpointState state, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM reliability.job_checkpoint WHERE job_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(jobId);
        if (executionId != null) {
            sql.append(" AND execution_id = ?");
            params.add(executionId);
        }
        if (state != null) {
            sql.append(" AND state = ?");
            params.add(state.name());
        }
        sql.append(" ORDER BY ts DESC LIMIT ?");
        params.add(limit);
        return jdbcTemplate.query(sql.toString(), checkpointMapper, params.toArray());
    }
}
