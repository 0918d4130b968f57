package com.ivamare.reliability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.audit.DigestEntrySigner;
import com.ivamare.reliability.audit.EntrySigner;
import com.ivamare.reliability.audit.HmacEntrySigner;
import com.ivamare.reliability.batching.BatchingEngine;
import com.ivamare.reliability.batching.ResourceMonitor;
import com.ivamare.reliability.batching.StrategyCatalog;
import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import com.ivamare.reliability.job.CheckpointChecksums;
import com.ivamare.reliability.job.JobHealthMonitor;
import com.ivamare.reliability.job.JobRestarter;
import com.ivamare.reliability.job.JobStateManager;
import com.ivamare.reliability.metrics.ReliabilityDashboard;
import com.ivamare.reliability.metrics.ReliabilityMonitor;
import com.ivamare.reliability.repository.AuditEntryRepository;
import com.ivamare.reliability.repository.CheckpointRepository;
import com.ivamare.reliability.repository.CircuitBreakerStateRepository;
import com.ivamare.reliability.repository.DeadLetterQueue;
import com.ivamare.reliability.repository.JobExecutionRepository;
import com.ivamare.reliability.repository.MetricSampleRepository;
import com.ivamare.reliability.repository.impl.JdbcAuditEntryRepository;
import com.ivamare.reliability.repository.impl.JdbcCheckpointRepository;
import com.ivamare.reliability.repository.impl.JdbcCircuitBreakerStateRepository;
import com.ivamare.reliability.repository.impl.JdbcDeadLetterQueue;
import com.ivamare.reliability.repository.impl.JdbcJobExecutionRepository;
import com.ivamare.reliability.repository.impl.JdbcMetricSampleRepository;
import com.ivamare.reliability.support.CanonicalJson;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Auto-configuration for the pipeline reliability core.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>JDBC stores (audit entries, breaker states, checkpoints, dead letters, metric samples)</li>
 *   <li>Reliability monitor (metric sink)</li>
 *   <li>Audit ledger</li>
 *   <li>Circuit breaker registry</li>
 *   <li>Batching engine and resource monitor</li>
 *   <li>Job state manager and health monitor, when the host provides a {@link JobRestarter}</li>
 *   <li>Reliability dashboard</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * reliability.enabled=false
 * </pre>
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "reliability", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ReliabilityProperties.class)
public class ReliabilityAutoConfiguration {

    // --- Support ---

    @Bean
    @ConditionalOnMissingBean
    public Clock reliabilityClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper reliabilityObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public CanonicalJson canonicalJson() {
        return new CanonicalJson();
    }

    // --- Repositories ---

    @Bean
    @ConditionalOnMissingBean
    public AuditEntryRepository auditEntryRepository(JdbcTemplate jdbcTemplate, CanonicalJson canonicalJson) {
        return new JdbcAuditEntryRepository(jdbcTemplate, canonicalJson);
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerStateRepository circuitBreakerStateRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcCircuitBreakerStateRepository(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckpointRepository checkpointRepository(JdbcTemplate jdbcTemplate, CanonicalJson canonicalJson) {
        return new JdbcCheckpointRepository(jdbcTemplate, canonicalJson);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterQueue deadLetterQueue(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcDeadLetterQueue(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricSampleRepository metricSampleRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcMetricSampleRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutionRepository jobExecutionRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcJobExecutionRepository(jdbcTemplate);
    }

    // --- Metrics ---

    @Bean
    @ConditionalOnMissingBean
    public ReliabilityMonitor reliabilityMonitor(
            ObjectProvider<MeterRegistry> meterRegistry,
            MetricSampleRepository metricSampleRepository,
            Clock clock,
            ReliabilityProperties properties) {
        ReliabilityProperties.MetricsProperties mp = properties.getMetrics();
        return new ReliabilityMonitor(
            meterRegistry.getIfAvailable(SimpleMeterRegistry::new),
            clock,
            mp.isPersistSamples() ? metricSampleRepository : null,
            mp.getBufferSize(),
            mp.getAlertCapacity(),
            ReliabilityMonitor.defaultSlaThresholds()
        );
    }

    // --- Audit Ledger ---

    @Bean
    @ConditionalOnMissingBean
    public EntrySigner auditEntrySigner(ReliabilityProperties properties) {
        String key = properties.getAudit().getSigningKey();
        return key != null && !key.isBlank() ? new HmacEntrySigner(key) : new DigestEntrySigner();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditLedger auditLedger(
            AuditEntryRepository auditEntryRepository,
            ReliabilityMonitor reliabilityMonitor,
            Clock clock,
            EntrySigner auditEntrySigner,
            ReliabilityProperties properties) {
        return new AuditLedger(auditEntryRepository, reliabilityMonitor, clock, auditEntrySigner,
            properties.getAudit().toSettings());
    }

    // --- Circuit Breakers ---

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            CircuitBreakerStateRepository circuitBreakerStateRepository,
            AuditLedger auditLedger,
            ReliabilityMonitor reliabilityMonitor,
            Clock clock,
            ReliabilityProperties properties) {
        return new CircuitBreakerRegistry(properties.getBreaker().toConfig(), circuitBreakerStateRepository,
            auditLedger, reliabilityMonitor, clock);
    }

    // --- Batching ---

    @Bean
    @ConditionalOnMissingBean
    public StrategyCatalog strategyCatalog() {
        return StrategyCatalog.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceMonitor resourceMonitor(
            CircuitBreakerRegistry circuitBreakerRegistry,
            ReliabilityMonitor reliabilityMonitor,
            ReliabilityProperties properties,
            Clock clock) {
        return new ResourceMonitor(circuitBreakerRegistry, reliabilityMonitor, clock,
            properties.getBatching().getResourceSampleInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchingEngine batchingEngine(
            StrategyCatalog strategyCatalog,
            ResourceMonitor resourceMonitor,
            CircuitBreakerRegistry circuitBreakerRegistry,
            AuditLedger auditLedger,
            DeadLetterQueue deadLetterQueue,
            ReliabilityMonitor reliabilityMonitor,
            Clock clock,
            ReliabilityProperties properties) {
        return new BatchingEngine(strategyCatalog, resourceMonitor, circuitBreakerRegistry, auditLedger,
            deadLetterQueue, reliabilityMonitor, clock, properties.getBatching().toSettings());
    }

    // --- Job State ---

    @Bean
    @ConditionalOnMissingBean
    public CheckpointChecksums checkpointChecksums(CanonicalJson canonicalJson) {
        return new CheckpointChecksums(canonicalJson);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JobRestarter.class)
    public JobStateManager jobStateManager(
            JobExecutionRepository jobExecutionRepository,
            CheckpointRepository checkpointRepository,
            CheckpointChecksums checkpointChecksums,
            JobRestarter jobRestarter,
            AuditLedger auditLedger,
            CircuitBreakerRegistry circuitBreakerRegistry,
            ReliabilityMonitor reliabilityMonitor,
            Clock clock,
            ReliabilityProperties properties) {
        return new JobStateManager(jobExecutionRepository, checkpointRepository, checkpointChecksums,
            jobRestarter, auditLedger, circuitBreakerRegistry, reliabilityMonitor, clock,
            properties.getJob().toSettings());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JobStateManager.class)
    public JobHealthMonitor jobHealthMonitor(
            JobStateManager jobStateManager,
            ReliabilityMonitor reliabilityMonitor,
            ReliabilityProperties properties) {
        return new JobHealthMonitor(jobStateManager, reliabilityMonitor, properties.getJob().toSettings());
    }

    // --- Dashboard ---

    @Bean
    @ConditionalOnMissingBean
    public ReliabilityDashboard reliabilityDashboard(
            ReliabilityMonitor reliabilityMonitor,
            CircuitBreakerRegistry circuitBreakerRegistry,
            BatchingEngine batchingEngine,
            AuditLedger auditLedger,
            Clock clock) {
        return new ReliabilityDashboard(reliabilityMonitor, circuitBreakerRegistry, batchingEngine,
            auditLedger, clock);
    }
}
