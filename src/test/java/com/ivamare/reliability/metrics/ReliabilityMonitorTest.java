package com.ivamare.reliability.metrics;

import com.ivamare.reliability.repository.MetricSampleRepository;
import com.ivamare.reliability.support.MutableClock;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("ReliabilityMonitor")
class ReliabilityMonitorTest {

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private ReliabilityMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        monitor = new ReliabilityMonitor(meterRegistry, clock);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    @Nested
    @DisplayName("recording")
    class RecordingTests {

        @Test
        @DisplayName("should buffer samples under category.name and mirror them to Micrometer")
        void shouldBufferAndMirror() {
            monitor.recordMetric("memory", "heap", 0.4, "ratio", Map.of("pool", "old"));
            monitor.recordMetric("memory", "heap", 0.6, "ratio", null);

            MetricSample latest = monitor.getLatest("memory.heap").orElseThrow();
            assertThat(latest.value()).isEqualTo(0.6);
            assertThat(latest.timestamp()).isEqualTo(clock.instant());

            DistributionSummary summary = meterRegistry.find("reliability.memory.heap").summary();
            assertThat(summary).isNotNull();
            assertThat(summary.count()).isEqualTo(2);
            assertThat(summary.totalAmount()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should keep only the configured number of points per key")
        void shouldBoundBuffers() {
            ReliabilityMonitor small = new ReliabilityMonitor(new SimpleMeterRegistry(), clock, null, 3,
                ReliabilityMonitor.defaultSlaThresholds());
            for (int i = 1; i <= 5; i++) {
                small.recordMetric("queue", "depth", i, "count", Map.of());
            }

            assertThat(small.getRecentSamples("queue.depth", Duration.ofHours(1)))
                .extracting(MetricSample::value)
                .containsExactly(3.0, 4.0, 5.0);
        }

        @Test
        @DisplayName("should key business metrics by category and tag them")
        void shouldKeyBusinessMetrics() {
            monitor.recordBusinessMetric(MetricCategory.ERROR_RATE, "job_health_score", 0.7, "score",
                Map.of("jobId", "job-7"));

            MetricSample sample = monitor.getLatest("business.error_rate.job_health_score").orElseThrow();
            assertThat(sample.tags())
                .containsEntry("jobId", "job-7")
                .containsEntry("category", "ERROR_RATE")
                .containsEntry("isBusinessMetric", true);
            assertThat(monitor.getLatestBusinessMetrics()).containsExactly(sample);
        }

        @Test
        @DisplayName("should track compliance for business metrics named after compliance")
        void shouldTrackBusinessCompliance() {
            monitor.recordBusinessMetric(MetricCategory.TRANSACTION, "aml_compliance_rate", 0.92, "ratio", Map.of());
            monitor.recordBusinessMetric(MetricCategory.VOLUME, "records", 10, "count", Map.of());

            assertThat(monitor.getComplianceStatus()).singleElement().satisfies(metric -> {
                assertThat(metric.name()).isEqualTo("aml_compliance_rate");
                assertThat(metric.status()).isEqualTo(SlaStatus.WARNING);
                assertThat(metric.target()).isEqualTo(0.95);
            });
        }

        @Test
        @DisplayName("should hide business metrics older than an hour")
        void shouldHideStaleBusinessMetrics() {
            monitor.recordBusinessMetric(MetricCategory.VOLUME, "records", 10, "count", Map.of());
            clock.advance(Duration.ofMinutes(61));

            assertThat(monitor.getLatestBusinessMetrics()).isEmpty();
        }

        @Test
        @DisplayName("should persist samples and survive a failing store")
        void shouldPersistSamples() {
            MetricSampleRepository repository = mock(MetricSampleRepository.class);
            ReliabilityMonitor persisting = new ReliabilityMonitor(new SimpleMeterRegistry(), clock, repository,
                10, ReliabilityMonitor.defaultSlaThresholds());
            persisting.recordMetric("memory", "heap", 0.4, "ratio", Map.of());

            doThrow(new DataAccessResourceFailureException("db down")).when(repository).save(any());
            persisting.recordMetric("memory", "heap", 0.5, "ratio", Map.of());

            verify(repository, times(2)).save(any(MetricSample.class));
            assertThat(persisting.getRecentSamples("memory.heap", Duration.ofMinutes(1))).hasSize(2);
        }
    }

    @Nested
    @DisplayName("SLA metrics")
    class SlaTests {

        @Test
        @DisplayName("should not alert on a compliant value")
        void shouldNotAlertWhenCompliant() {
            monitor.recordSlaMetric("processing_latency", 300, "ms", 500, Map.of());

            assertThat(monitor.getAlerts()).isEmpty();
            assertThat(monitor.getLatest("sla.processing_latency").orElseThrow().tags())
                .containsEntry("target", 500.0);
        }

        @Test
        @DisplayName("should raise a warning between the warning and critical thresholds")
        void shouldWarn() {
            monitor.recordSlaMetric("processing_latency", 700, "ms", 500, Map.of());

            assertThat(monitor.getAlerts()).singleElement().satisfies(alert -> {
                assertThat(alert.severity()).isEqualTo(AlertSeverity.WARNING);
                assertThat(alert.category()).isEqualTo(AlertCategory.COMPLIANCE);
                assertThat(alert.metric()).isEqualTo("processing_latency");
                assertThat(alert.raisedAt()).isEqualTo(clock.instant());
                assertThat(alert.message()).startsWith("SLA violation for processing_latency");
            });
        }

        @Test
        @DisplayName("should raise a critical alert at the critical threshold")
        void shouldRaiseCritical() {
            monitor.recordSlaMetric("processing_latency", 1000, "ms", 500, Map.of());

            assertThat(monitor.getAlerts()).extracting(Alert::severity).containsExactly(AlertSeverity.CRITICAL);
        }

        @Test
        @DisplayName("should treat lower values as worse for integrity")
        void shouldEvaluateLowerIsWorse() {
            monitor.recordSlaMetric("data_integrity_score", 0.99, "ratio", 0.95, Map.of());
            monitor.recordSlaMetric("data_integrity_score", 0.92, "ratio", 0.95, Map.of());
            monitor.recordSlaMetric("data_integrity_score", 0.85, "ratio", 0.95, Map.of());

            assertThat(monitor.getAlerts()).extracting(Alert::severity)
                .containsExactly(AlertSeverity.WARNING, AlertSeverity.CRITICAL);
        }

        @Test
        @DisplayName("should record but not alert on an unknown SLA metric")
        void shouldIgnoreUnknownSla() {
            monitor.recordSlaMetric("custom_latency", 99_999, "ms", 10, Map.of());

            assertThat(monitor.getAlerts()).isEmpty();
            assertThat(monitor.getLatest("sla.custom_latency")).isPresent();
        }
    }

    @Nested
    @DisplayName("circuit breaker samples")
    class BreakerSampleTests {

        @Test
        @DisplayName("should alert when a breaker reports OPEN or HALF_OPEN")
        void shouldAlertOnBreakerState() {
            monitor.recordMetric("circuit_breaker", "state_db", 0.0, "state", Map.of("serviceName", "db"));
            monitor.recordMetric("circuit_breaker", "state_api", 0.5, "state", Map.of());
            monitor.recordMetric("circuit_breaker", "state_cache", 1.0, "state", Map.of());

            List<Alert> alerts = monitor.getAlerts();
            assertThat(alerts).extracting(Alert::message)
                .containsExactly("Circuit breaker db is OPEN", "Circuit breaker api is HALF_OPEN");
            assertThat(alerts).extracting(Alert::severity)
                .containsExactly(AlertSeverity.CRITICAL, AlertSeverity.WARNING);
        }
    }

    @Nested
    @DisplayName("alerts")
    class AlertTests {

        @Test
        @DisplayName("should acknowledge and resolve alerts")
        void shouldAcknowledgeAndResolve() {
            monitor.raiseAlert(Alert.of(AlertSeverity.CRITICAL, AlertCategory.SYSTEM, "disk full", Map.of()));
            monitor.raiseAlert(Alert.of(AlertSeverity.WARNING, AlertCategory.SYSTEM, "disk filling", Map.of()));
            String id = monitor.getAlerts().get(0).id();

            assertThat(monitor.getAlertSummary()).isEqualTo(new AlertSummary(2, 1, 1));
            assertThat(meterRegistry.get("reliability.alerts.active").gauge().value()).isEqualTo(2.0);

            assertThat(monitor.acknowledge(id)).isTrue();
            assertThat(monitor.getAlerts().get(0).acknowledged()).isTrue();
            assertThat(monitor.resolve(id)).isTrue();
            assertThat(monitor.resolve(id)).isFalse();

            assertThat(monitor.getActiveAlerts()).extracting(Alert::message).containsExactly("disk filling");
            assertThat(monitor.getAlertSummary()).isEqualTo(new AlertSummary(1, 0, 1));
        }

        @Test
        @DisplayName("should retain no more alerts than the configured capacity")
        void shouldBoundRetainedAlerts() {
            ReliabilityMonitor bounded = new ReliabilityMonitor(new SimpleMeterRegistry(), clock, null,
                ReliabilityMonitor.DEFAULT_BUFFER_SIZE, 100, ReliabilityMonitor.defaultSlaThresholds());

            for (int i = 0; i < 5000; i++) {
                bounded.recordSlaMetric("batch_processing_time", 60000, "ms", 5000, Map.of());
            }

            assertThat(bounded.getAlerts()).hasSize(100);
            assertThat(bounded.getActiveAlerts()).hasSize(100);
        }

        @Test
        @DisplayName("should evict resolved alerts before active ones")
        void shouldEvictResolvedFirst() {
            ReliabilityMonitor bounded = new ReliabilityMonitor(new SimpleMeterRegistry(), clock, null,
                ReliabilityMonitor.DEFAULT_BUFFER_SIZE, 2, ReliabilityMonitor.defaultSlaThresholds());
            bounded.raiseAlert(Alert.of(AlertSeverity.CRITICAL, AlertCategory.SYSTEM, "first", Map.of()));
            bounded.raiseAlert(Alert.of(AlertSeverity.WARNING, AlertCategory.SYSTEM, "second", Map.of()));
            bounded.resolve(bounded.getAlerts().get(1).id());

            bounded.raiseAlert(Alert.of(AlertSeverity.WARNING, AlertCategory.SYSTEM, "third", Map.of()));

            assertThat(bounded.getAlerts()).extracting(Alert::message).containsExactly("first", "third");
        }

        @Test
        @DisplayName("should report unknown alert ids")
        void shouldRejectUnknownIds() {
            assertThat(monitor.acknowledge("missing")).isFalse();
            assertThat(monitor.resolve("missing")).isFalse();
        }
    }

    @Nested
    @DisplayName("aggregation and evaluation")
    class EvaluationTests {

        @Test
        @DisplayName("should aggregate samples of the last five minutes")
        void shouldAggregateRecentSamples() {
            monitor.recordMetric("queue", "depth", 100, "count", Map.of());
            clock.advance(Duration.ofMinutes(6));
            monitor.recordMetric("queue", "depth", 2, "count", Map.of());
            monitor.recordMetric("queue", "depth", 4, "count", Map.of());
            monitor.recordMetric("queue", "lag", 1, "s", Map.of());
            clock.advance(Duration.ofMinutes(6));
            monitor.recordMetric("queue", "size", 1, "count", Map.of());

            Map<String, MetricAggregate> aggregates = monitor.aggregate();

            assertThat(aggregates).containsOnlyKeys("queue.size");

            clock.set(Instant.parse("2024-03-01T10:07:00Z"));
            MetricAggregate depth = monitor.aggregate().get("queue.depth");
            assertThat(depth.average()).isEqualTo(3.0);
            assertThat(depth.maximum()).isEqualTo(4.0);
            assertThat(depth.minimum()).isEqualTo(2.0);
            assertThat(depth.count()).isEqualTo(2);
            assertThat(depth.unit()).isEqualTo("count");
        }

        @Test
        @DisplayName("should judge SLA compliance by the worst value in the window")
        void shouldJudgeByWorstValue() {
            monitor.recordSlaMetric("processing_latency", 200, "ms", 500, Map.of());
            monitor.recordSlaMetric("processing_latency", 1500, "ms", 500, Map.of());
            monitor.recordSlaMetric("memory_usage", 0.5, "ratio", 0.8, Map.of());

            Map<String, SlaStatus> result = monitor.checkSlaCompliance();

            assertThat(result).containsEntry("processing_latency", SlaStatus.CRITICAL)
                .containsEntry("memory_usage", SlaStatus.COMPLIANT)
                .doesNotContainKey("batch_processing_time");
            assertThat(monitor.getLatest("sla_compliance.processing_latency").orElseThrow().value()).isZero();
            assertThat(monitor.getSlaStatus())
                .containsEntry("processing_latency", SlaStatus.CRITICAL)
                .containsEntry("memory_usage", SlaStatus.COMPLIANT)
                .containsEntry("transaction_error_rate", SlaStatus.COMPLIANT);
            assertThat(monitor.getAlerts()).extracting(Alert::message)
                .contains("SLA compliance violation for processing_latency: CRITICAL");
        }

        @Test
        @DisplayName("should resolve alerts whose metric has recovered")
        void shouldResolveRecoveredAlerts() {
            monitor.recordSlaMetric("processing_latency", 700, "ms", 500, Map.of());
            monitor.recordSlaMetric("memory_usage", 0.85, "ratio", 0.8, Map.of());
            String memoryAlert = monitor.getAlerts().get(1).id();
            monitor.acknowledge(memoryAlert);

            clock.advance(Duration.ofMinutes(2));
            monitor.recordSlaMetric("processing_latency", 100, "ms", 500, Map.of());
            monitor.recordSlaMetric("memory_usage", 0.5, "ratio", 0.8, Map.of());

            assertThat(monitor.resolveRecoveredAlerts()).isEqualTo(1);
            assertThat(monitor.getActiveAlerts()).extracting(Alert::id).containsExactly(memoryAlert);
        }

        @Test
        @DisplayName("should not resolve alerts while the metric is still violating")
        void shouldKeepViolatingAlerts() {
            monitor.recordSlaMetric("processing_latency", 700, "ms", 500, Map.of());
            clock.advance(Duration.ofSeconds(30));
            monitor.recordSlaMetric("processing_latency", 100, "ms", 500, Map.of());

            assertThat(monitor.resolveRecoveredAlerts()).isZero();
        }

        @Test
        @DisplayName("should start and stop the evaluation cycle")
        void shouldStartAndStop() {
            monitor.start(Duration.ofMillis(50));
            assertThat(monitor.isRunning()).isTrue();

            monitor.stop();
            assertThat(monitor.isRunning()).isFalse();
        }

        @Test
        @DisplayName("should run one evaluation cycle")
        void shouldRunCycle() {
            monitor.recordSlaMetric("batch_processing_time", 20_000, "ms", 5000, Map.of());

            monitor.runCycle();

            assertThat(monitor.getSlaStatus()).containsEntry("batch_processing_time", SlaStatus.CRITICAL);
        }
    }
}
