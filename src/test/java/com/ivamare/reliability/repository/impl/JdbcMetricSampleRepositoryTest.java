package com.ivamare.reliability.repository.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.reliability.metrics.MetricSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcMetricSampleRepositoryTest {

    private static final Instant TS = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcMetricSampleRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcMetricSampleRepository(jdbcTemplate, new ObjectMapper());
    }

    @Test
    void shouldInsertSample() {
        repository.save(new MetricSample("sla", "processing_latency", 420.0, "ms", TS, Map.of("job", "job-7")));

        verify(jdbcTemplate).update(
            contains("INSERT INTO reliability.metric_sample"),
            eq("sla"),
            eq("processing_latency"),
            eq(420.0),
            eq("ms"),
            eq(Timestamp.from(TS)),
            eq("{\"job\":\"job-7\"}")
        );
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldFindWithinRangeAndMapTags() throws Exception {
        Instant from = TS.minusSeconds(300);
        ArgumentCaptor<RowMapper<MetricSample>> captor = ArgumentCaptor.forClass(RowMapper.class);
        when(jdbcTemplate.query(
            argThat(sql -> sql != null && sql.contains("ts >= ?") && sql.contains("ts <= ?")),
            any(RowMapper.class),
            eq("sla"), eq("processing_latency"), eq(Timestamp.from(from)), eq(Timestamp.from(TS))
        )).thenReturn(List.of());

        assertTrue(repository.find("sla", "processing_latency", from, TS).isEmpty());

        verify(jdbcTemplate).query(anyString(), captor.capture(), any(), any(), any(), any());
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("category")).thenReturn("sla");
        when(rs.getString("name")).thenReturn("processing_latency");
        when(rs.getDouble("value")).thenReturn(420.0);
        when(rs.getString("unit")).thenReturn("ms");
        when(rs.getTimestamp("ts")).thenReturn(Timestamp.from(TS));
        when(rs.getString("tags")).thenReturn(null);

        MetricSample mapped = captor.getValue().mapRow(rs, 0);

        assertEquals("sla.processing_latency", mapped.key());
        assertTrue(mapped.tags().isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldFindWithoutRange() {
        when(jdbcTemplate.query(
            argThat(sql -> sql != null && !sql.contains("ts >=")),
            any(RowMapper.class),
            eq("volume"), eq("records")
        )).thenReturn(List.of());

        assertTrue(repository.find("volume", "records", null, null).isEmpty());
    }
}
