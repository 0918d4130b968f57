package com.ivamare.reliability;

import com.ivamare.reliability.audit.AuditEntry;
import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.audit.AuditRecord;
import com.ivamare.reliability.audit.ChainVerification;
import com.ivamare.reliability.batching.BatchResult;
import com.ivamare.reliability.batching.BatchingEngine;
import com.ivamare.reliability.batching.BatchingSettings;
import com.ivamare.reliability.batching.DataCharacteristics;
import com.ivamare.reliability.batching.ResourceMonitor;
import com.ivamare.reliability.batching.StrategyCatalog;
import com.ivamare.reliability.batching.SubBatchOutcome;
import com.ivamare.reliability.batching.SystemStatus;
import com.ivamare.reliability.breaker.CircuitBreakerConfig;
import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import com.ivamare.reliability.breaker.CircuitState;
import com.ivamare.reliability.exception.CircuitBreakerOpenException;
import com.ivamare.reliability.metrics.DashboardSnapshot;
import com.ivamare.reliability.metrics.ReliabilityDashboard;
import com.ivamare.reliability.metrics.ReliabilityMonitor;
import com.ivamare.reliability.model.DataType;
import com.ivamare.reliability.model.Sensitivity;
import com.ivamare.reliability.support.InMemoryAuditEntryRepository;
import com.ivamare.reliability.support.InMemoryCircuitBreakerStateRepository;
import com.ivamare.reliability.support.InMemoryDeadLetterQueue;
import com.ivamare.reliability.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Reliability scenario")
class ReliabilityScenarioTest {

    private static final long MB = 1024L * 1024;

    private MutableClock clock;
    private InMemoryAuditEntryRepository auditRepository;
    private ReliabilityMonitor monitor;
    private AuditLedger ledger;
    private CircuitBreakerRegistry breakers;
    private BatchingEngine engine;
    private ReliabilityDashboard dashboard;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        auditRepository = new InMemoryAuditEntryRepository();
        monitor = new ReliabilityMonitor(new SimpleMeterRegistry(), clock);
        ledger = new AuditLedger(auditRepository, monitor, clock);
        breakers = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults(),
            new InMemoryCircuitBreakerStateRepository(), ledger, monitor, clock);
        ResourceMonitor resources = mock(ResourceMonitor.class);
        when(resources.current()).thenReturn(
            new SystemStatus(0.1, 0.2, 0.5, 400 * MB, 4096 * MB, 0.0, clock.instant()));
        engine = new BatchingEngine(StrategyCatalog.defaults(), resources, breakers, ledger,
            new InMemoryDeadLetterQueue(), monitor, clock, BatchingSettings.defaults().withCpuYieldDelay(Duration.ZERO));
        dashboard = new ReliabilityDashboard(monitor, breakers, engine, ledger, clock);
    }

    @AfterEach
    void tearDown() {
        breakers.shutdown();
    }

    @Test
    @DisplayName("should keep a clean chain verifiable and flag a tampered stored entry")
    void shouldVerifyChain() {
        for (int i = 1; i <= 5; i++) {
            ledger.append(AuditRecord.builder("E" + i, "job-7").detail("step", i).build());
            clock.advance(Duration.ofSeconds(1));
        }

        ChainVerification clean = ledger.verifyChain("job-7");

        assertThat(clean.valid()).isTrue();
        assertThat(clean.integrityScore()).isEqualTo(1.0);
        assertThat(clean.chainLength()).isEqualTo(5);

        AuditEntry third = auditRepository.all().get(2);
        auditRepository.replace(third.withDetails(Map.of("step", 99)));

        ChainVerification stored = ledger.verifyStoredChain("job-7", null, null);

        assertThat(stored.valid()).isFalse();
        assertThat(stored.corruptedEntryIds()).contains(third.id());
        assertThat(stored.integrityScore()).isLessThan(1.0);
    }

    @Test
    @DisplayName("should open a breaker after repeated failures and reject the next call")
    void shouldOpenBreaker() {
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> breakers.execute("db", () -> {
                throw new IllegalStateException("connection refused");
            })).isInstanceOf(IllegalStateException.class);
        }
        AtomicInteger invoked = new AtomicInteger();

        assertThatThrownBy(() -> breakers.execute("db", invoked::incrementAndGet))
            .isInstanceOf(CircuitBreakerOpenException.class);

        assertThat(invoked).hasValue(0);
        assertThat(breakers.getOrCreate("db").getState()).isEqualTo(CircuitState.OPEN);
        assertThat(ledger.verifyChain("db").valid()).isTrue();
        assertThat(dashboard.snapshot().systemHealth().healthy()).isFalse();
    }

    @Test
    @DisplayName("should batch a large transaction load with a few rejected records")
    void shouldProcessTransactionLoad() {
        List<Map<String, Object>> transactions = IntStream.range(0, 12_000)
            .mapToObj(i -> Map.<String, Object>of("id", "tx-" + i, "amount", new BigDecimal("5.00")))
            .toList();
        DataCharacteristics data = DataCharacteristics.of(256, DataType.TRANSACTION, Sensitivity.CONFIDENTIAL);
        AtomicInteger calls = new AtomicInteger();

        BatchResult result = engine.processBatch(transactions, data, (batch, d) -> {
            calls.incrementAndGet();
            return SubBatchOutcome.partial(batch.size() - 1, 1);
        }, "job-7");

        assertThat(result.strategy().name()).isEqualTo("high_value_transactions");
        assertThat(result.batchSize()).isEqualTo(100);
        assertThat(result.totalBatches()).isEqualTo(120);
        assertThat(calls).hasValue(120);
        assertThat(result.totalProcessed()).isEqualTo(11_880);
        assertThat(result.totalErrors()).isEqualTo(120);
        assertThat(result.metrics().batchSize()).isEqualTo(12_000);
        assertThat(result.metrics().errorRate()).isEqualTo(0.01);
        assertThat(result.metrics().financialAmount()).isEqualByComparingTo("60000");
        assertThat(engine.getHistory()).isNotEmpty();

        DashboardSnapshot snapshot = dashboard.snapshot();
        assertThat(snapshot.batching().sampleCount()).isPositive();
        assertThat(snapshot.audit().totalEntries()).isGreaterThanOrEqualTo(1);
        assertThat(ledger.verifyChain("job-7").valid()).isTrue();
    }
}
