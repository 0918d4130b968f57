package com.ivamare.reliability.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.reliability.metrics.MetricSample;
import com.ivamare.reliability.repository.MetricSampleRepository;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of MetricSampleRepository.
 */
@Repository
public class JdbcMetricSampleRepository implements MetricSampleRepository {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<MetricSample> sampleMapper;

    public JdbcMetricSampleRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.sampleMapper = (rs, rowNum) -> new MetricSample(
            rs.getString("category"),
            rs.getString("name"),
            rs.getDouble("value"),
            rs.getString("unit"),
            rs.getTimestamp("ts").toInstant(),
            deserializeTags(rs.getString("tags"))
        );
    }

    @Override
    public void save(MetricSample sample) {
        jdbcTemplate.update("""
            INSERT INTO reliability.metric_sample (category, name, value, unit, ts, tags)
            VALUES (?, ?, ?, ?, ?, ?::jsonb)
            """,
            sample.category(),
            sample.name(),
            sample.value(),
            sample.unit(),
            Timestamp.from(sample.timestamp()),
            serializeTags(sample.tags())
        );
    }

    @Override
    public List<MetricSample> find(String category, String name, Instant from, Instant to) {
        StringBuilder sql = new StringBuilder(
            "SELECT * FROM reliability.metric_sample WHERE category = ? AND name = ?");
        List<Object> params = new ArrayList<>(List.of(category, name));
        if (from != null) {
            sql.append(" AND ts >= ?");
            params.add(Timestamp.from(from));
        }
        if (to != null) {
            sql.append(" AND ts <= ?");
            params.add(Timestamp.from(to));
        }
        sql.append(" ORDER BY ts ASC");
        return jdbcTemplate.query(sql.toString(), sampleMapper, params.toArray());
    }

    private String serializeTags(Map<String, Object> tags) {
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new InvalidDataAccessApiUsageException("Metric tags are not serializable", e);
        }
    }

    private Map<String, Object> deserializeTags(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable metric tags", e);
        }
    }
}
