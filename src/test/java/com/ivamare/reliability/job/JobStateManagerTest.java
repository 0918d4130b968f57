package com.ivamare.reliability.job;

import com.ivamare.reliability.audit.AuditEntry;
import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.breaker.CircuitBreakerConfig;
import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import com.ivamare.reliability.breaker.CircuitState;
import com.ivamare.reliability.exception.AuditWriteException;
import com.ivamare.reliability.exception.ExecutionNotFoundException;
import com.ivamare.reliability.exception.InvalidOperationException;
import com.ivamare.reliability.metrics.AlertSeverity;
import com.ivamare.reliability.model.RiskLevel;
import com.ivamare.reliability.repository.CheckpointRepository;
import com.ivamare.reliability.repository.JobExecutionRepository;
import com.ivamare.reliability.support.CanonicalJson;
import com.ivamare.reliability.support.InMemoryAuditEntryRepository;
import com.ivamare.reliability.support.InMemoryCheckpointRepository;
import com.ivamare.reliability.support.InMemoryCircuitBreakerStateRepository;
import com.ivamare.reliability.support.InMemoryJobExecutionRepository;
import com.ivamare.reliability.support.MutableClock;
import com.ivamare.reliability.support.RecordingMetricSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("JobStateManager")
class JobStateManagerTest {

    private static final String JOB = "job-7";
    private static final String EXEC = "exec-1";

    private MutableClock clock;
    private InMemoryJobExecutionRepository executions;
    private InMemoryCheckpointRepository checkpoints;
    private CheckpointChecksums checksums;
    private JobRestarter restarter;
    private InMemoryAuditEntryRepository auditRepository;
    private RecordingMetricSink metrics;
    private AuditLedger ledger;
    private CircuitBreakerRegistry breakers;
    private JobStateManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        executions = new InMemoryJobExecutionRepository();
        checkpoints = new InMemoryCheckpointRepository();
        checksums = new CheckpointChecksums(new CanonicalJson());
        restarter = mock(JobRestarter.class);
        auditRepository = new InMemoryAuditEntryRepository();
        metrics = new RecordingMetricSink();
        ledger = new AuditLedger(auditRepository, metrics, clock);
        breakers = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults(),
            new InMemoryCircuitBreakerStateRepository(), ledger, metrics, clock);
        manager = new JobStateManager(executions, checkpoints, checksums, restarter, ledger, breakers,
            metrics, clock, JobSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        breakers.shutdown();
    }

    private void running(Duration age, long processed, long failed) {
        executions.put(new JobExecution(EXEC, JOB, ExecutionStatus.RUNNING, clock.instant().minus(age),
            null, null, processed, failed));
    }

    private void finished(ExecutionStatus status) {
        executions.put(new JobExecution(EXEC, JOB, status, clock.instant().minus(Duration.ofMinutes(20)),
            null, clock.instant(), 1000, 500));
    }

    private JobCheckpoint checkpoint(String step, long processed, long total, CheckpointState state) {
        return manager.createCheckpoint(new CheckpointRequest(JOB, EXEC, step, 1, processed, total, state,
            Map.of("cursor", processed)));
    }

    private void openBreaker(String service) {
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> breakers.execute(service, () -> {
                throw new IllegalStateException("down");
            })).isInstanceOf(IllegalStateException.class);
        }
    }

    private List<String> auditedEventTypes() {
        return ledger.getEntries(JOB).stream().map(AuditEntry::eventType).toList();
    }

    @Nested
    @DisplayName("createCheckpoint")
    class CreateCheckpointTests {

        @Test
        @DisplayName("should store a checksummed checkpoint and audit it")
        void shouldStoreAndAudit() {
            running(Duration.ofMinutes(5), 100, 0);

            JobCheckpoint cp = checkpoint("extract", 4000, 10000, CheckpointState.COMPLETED);

            assertThat(cp.checkpointId()).startsWith("cp_");
            assertThat(cp.checksum()).hasSize(64);
            assertThat(checksums.verify(cp)).isTrue();
            assertThat(cp.metadata()).containsEntry("cursor", 4000);
            assertThat(checkpoints.all()).containsExactly(cp);
            assertThat(auditedEventTypes()).containsExactly(JobStateManager.CHECKPOINT_CREATED);
            assertThat(metrics.samples("job_state.checkpoint_created")).hasSize(1);
        }

        @Test
        @DisplayName("should reject an unknown execution")
        void shouldRejectUnknownExecution() {
            assertThatThrownBy(() -> checkpoint("extract", 1, 10, CheckpointState.COMPLETED))
                .isInstanceOf(ExecutionNotFoundException.class);
            assertThat(checkpoints.all()).isEmpty();
        }

        @Test
        @DisplayName("should reject an execution that belongs to another job")
        void shouldRejectForeignExecution() {
            executions.put(new JobExecution(EXEC, "other-job", ExecutionStatus.RUNNING, clock.instant(),
                null, null, 0, 0));

            assertThatThrownBy(() -> checkpoint("extract", 1, 10, CheckpointState.COMPLETED))
                .isInstanceOf(ExecutionNotFoundException.class);
        }

        @Test
        @DisplayName("should reject progress beyond the total")
        void shouldRejectInvalidProgress() {
            running(Duration.ofMinutes(5), 100, 0);

            assertThatThrownBy(() -> checkpoint("extract", 11, 10, CheckpointState.COMPLETED))
                .isInstanceOf(InvalidOperationException.class);
            assertThatThrownBy(() -> manager.createCheckpoint(new CheckpointRequest(JOB, EXEC, " ", 1, 0, 10,
                CheckpointState.STARTED, null)))
                .isInstanceOf(InvalidOperationException.class);
            assertThat(auditedEventTypes()).isEmpty();
        }
    }

    @Nested
    @DisplayName("getLatestCheckpoint")
    class LatestCheckpointTests {

        @Test
        @DisplayName("should return the newest completed checkpoint")
        void shouldReturnNewestCompleted() {
            running(Duration.ofMinutes(5), 100, 0);
            checkpoint("extract", 1000, 10000, CheckpointState.COMPLETED);
            clock.advance(Duration.ofSeconds(10));
            JobCheckpoint newest = checkpoint("transform", 2000, 10000, CheckpointState.COMPLETED);
            clock.advance(Duration.ofSeconds(10));
            checkpoint("load", 2500, 10000, CheckpointState.STARTED);

            assertThat(manager.getLatestCheckpoint(JOB, null)).contains(newest);
        }

        @Test
        @DisplayName("should skip a checkpoint whose checksum no longer verifies")
        void shouldSkipTamperedCheckpoint() {
            running(Duration.ofMinutes(5), 100, 0);
            JobCheckpoint older = checkpoint("extract", 1000, 10000, CheckpointState.COMPLETED);
            clock.advance(Duration.ofSeconds(10));
            JobCheckpoint newer = checkpoint("transform", 2000, 10000, CheckpointState.COMPLETED);

            checkpoints.replace(new JobCheckpoint(newer.checkpointId(), JOB, EXEC, newer.stepName(),
                newer.stepNumber(), 9999, newer.totalData(), newer.timestamp(), newer.checksum(),
                newer.state(), newer.metadata()));

            assertThat(manager.getLatestCheckpoint(JOB, EXEC)).contains(older);
        }

        @Test
        @DisplayName("should return empty when the store cannot be read")
        void shouldReturnEmptyOnStoreFailure() {
            CheckpointRepository broken = mock(CheckpointRepository.class);
            when(broken.findRecent(any(), any(), any(), anyInt()))
                .thenThrow(new DataAccessResourceFailureException("db down"));
            JobStateManager withBrokenStore = new JobStateManager(executions, broken, checksums, restarter,
                ledger, breakers, metrics, clock, JobSettings.defaults());

            assertThat(withBrokenStore.getLatestCheckpoint(JOB, null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("checkJobHealth")
    class HealthTests {

        @Test
        @DisplayName("should report a healthy job")
        void shouldReportHealthy() {
            running(Duration.ofMinutes(10), 1000, 10);

            JobHealthStatus health = manager.checkJobHealth(JOB, null);

            assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(health.riskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(health.executionId()).isEqualTo(EXEC);
            assertThat(health.failureRate()).isEqualTo(0.01);
            assertThat(health.processingTimeMs()).isEqualTo(600_000);
            assertThat(health.dataIntegrity()).isEqualTo(1.0);
            assertThat(health.recommendations()).isEmpty();
            assertThat(metrics.samples("business.error_rate.job_health_score"))
                .extracting(s -> s.value()).containsExactly(1.0);
        }

        @Test
        @DisplayName("should warn on an elevated failure rate")
        void shouldWarnOnElevatedFailureRate() {
            running(Duration.ofMinutes(10), 1000, 30);

            JobHealthStatus health = manager.checkJobHealth(JOB, EXEC);

            assertThat(health.status()).isEqualTo(HealthStatus.WARNING);
            assertThat(health.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
            assertThat(health.recommendations()).containsExactly("Elevated failure rate: 3.00%");
        }

        @Test
        @DisplayName("should be critical above the maximum failure rate")
        void shouldBeCriticalOnHighFailureRate() {
            running(Duration.ofMinutes(10), 1000, 100);

            JobHealthStatus health = manager.checkJobHealth(JOB, null);

            assertThat(health.status()).isEqualTo(HealthStatus.CRITICAL);
            assertThat(health.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
            assertThat(health.recommendations()).containsExactly("High failure rate detected: 10.00%");
        }

        @Test
        @DisplayName("should warn on long processing time")
        void shouldWarnOnLongProcessing() {
            running(Duration.ofMinutes(45), 1000, 0);
            checkpoint("extract", 100, 1000, CheckpointState.COMPLETED);

            JobHealthStatus health = manager.checkJobHealth(JOB, null);

            assertThat(health.status()).isEqualTo(HealthStatus.WARNING);
            assertThat(health.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
            assertThat(health.recommendations()).containsExactly("Long processing time: 45 minutes");
        }

        @Test
        @DisplayName("should flag a running job without recent checkpoints as stalled")
        void shouldFlagStalledJob() {
            running(Duration.ofHours(2), 1000, 0);

            JobHealthStatus health = manager.checkJobHealth(JOB, null);

            assertThat(health.status()).isEqualTo(HealthStatus.WARNING);
            assertThat(health.recommendations()).contains("Job appears to be stalled");
        }

        @Test
        @DisplayName("should not flag a job with a fresh checkpoint as stalled")
        void shouldNotFlagFreshCheckpoint() {
            running(Duration.ofHours(2), 1000, 0);
            checkpoint("extract", 100, 1000, CheckpointState.COMPLETED);

            JobHealthStatus health = manager.checkJobHealth(JOB, null);

            assertThat(health.recommendations()).doesNotContain("Job appears to be stalled");
        }

        @Test
        @DisplayName("should keep a critical status when the job is also stalled")
        void shouldNotDowngradeCriticalWhenStalled() {
            running(Duration.ofHours(2), 1000, 100);

            JobHealthStatus health = manager.checkJobHealth(JOB, null);

            assertThat(health.status()).isEqualTo(HealthStatus.CRITICAL);
            assertThat(health.recommendations()).contains("Job appears to be stalled");
        }

        @Test
        @DisplayName("should be critical when a checkpoint fails verification")
        void shouldBeCriticalOnLowIntegrity() {
            running(Duration.ofMinutes(10), 1000, 0);
            JobCheckpoint cp = checkpoint("extract", 100, 1000, CheckpointState.COMPLETED);
            checkpoints.replace(new JobCheckpoint(cp.checkpointId(), JOB, EXEC, cp.stepName(), cp.stepNumber(),
                cp.dataProcessed(), cp.totalData(), cp.timestamp(), "0".repeat(64), cp.state(), cp.metadata()));

            JobHealthStatus health = manager.checkJobHealth(JOB, null);

            assertThat(health.status()).isEqualTo(HealthStatus.CRITICAL);
            assertThat(health.dataIntegrity()).isZero();
            assertThat(health.recommendations()).containsExactly("Low data integrity score: 0.00%");
        }

        @Test
        @DisplayName("should report FAILED when no execution is running")
        void shouldFailWithoutExecution() {
            JobHealthStatus health = manager.checkJobHealth(JOB, null);

            assertThat(health.status()).isEqualTo(HealthStatus.FAILED);
            assertThat(health.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
            assertThat(health.recommendations()).containsExactly("No active execution found");
        }

        @Test
        @DisplayName("should report FAILED when the store cannot be read")
        void shouldFailOnStoreError() {
            JobExecutionRepository broken = mock(JobExecutionRepository.class);
            when(broken.findLatestRunning(JOB)).thenThrow(new DataAccessResourceFailureException("db down"));
            JobStateManager withBrokenStore = new JobStateManager(broken, checkpoints, checksums, restarter,
                ledger, breakers, metrics, clock, JobSettings.defaults());

            JobHealthStatus health = withBrokenStore.checkJobHealth(JOB, null);

            assertThat(health.status()).isEqualTo(HealthStatus.FAILED);
            assertThat(health.recommendations()).containsExactly("Health check error: db down");
        }
    }

    @Nested
    @DisplayName("predictJobFailure")
    class PredictionTests {

        @Test
        @DisplayName("should predict nothing for a healthy job")
        void shouldStayBelowFloor() {
            running(Duration.ofMinutes(10), 1000, 10);

            assertThat(manager.predictJobFailure(JOB)).isEmpty();
            assertThat(manager.getCachedPrediction(JOB)).isEmpty();
        }

        @Test
        @DisplayName("should predict a business logic failure from the failure rate")
        void shouldPredictBusinessLogicFailure() {
            running(Duration.ofMinutes(10), 1000, 30);

            FailurePrediction prediction = manager.predictJobFailure(JOB).orElseThrow();

            assertThat(prediction.riskScore()).isEqualTo(30);
            assertThat(prediction.predictedFailureType()).isEqualTo(FailureCategory.BUSINESS_LOGIC);
            assertThat(prediction.confidence()).isCloseTo(0.495, within(1e-9));
            assertThat(prediction.estimatedMinutesToFailure()).isEqualTo(60);
            assertThat(prediction.preventionActions()).containsExactly("Review and validate business logic");
            assertThat(manager.getCachedPrediction(JOB)).contains(prediction);
            assertThat(metrics.samples("failure_prediction.risk_assessment")).hasSize(1);
        }

        @Test
        @DisplayName("should categorise by the highest-weighted factor")
        void shouldCategoriseByHighestWeight() {
            running(Duration.ofMinutes(40), 1000, 0);
            checkpoint("extract", 100, 1000, CheckpointState.COMPLETED);
            openBreaker("db");

            FailurePrediction prediction = manager.predictJobFailure(JOB).orElseThrow();

            // processing time (20) + open breaker (15)
            assertThat(prediction.riskScore()).isEqualTo(35);
            assertThat(prediction.predictedFailureType()).isEqualTo(FailureCategory.MEMORY);
            assertThat(prediction.estimatedMinutesToFailure()).isEqualTo(45);
            assertThat(prediction.preventionActions()).containsExactly(
                "Increase memory allocation", "Check network stability and connectivity");
        }

        @Test
        @DisplayName("should shorten the time to failure as the score rises")
        void shouldShortenTimeToFailure() {
            running(Duration.ofMinutes(40), 1000, 100);
            checkpoint("extract", 100, 1000, CheckpointState.COMPLETED);
            openBreaker("db");

            FailurePrediction prediction = manager.predictJobFailure(JOB).orElseThrow();

            assertThat(prediction.riskScore()).isEqualTo(65);
            assertThat(prediction.predictedFailureType()).isEqualTo(FailureCategory.BUSINESS_LOGIC);
            assertThat(prediction.estimatedMinutesToFailure()).isEqualTo(30);
        }

        @Test
        @DisplayName("should add the risk baseline to low scores")
        void shouldAddBaseline() {
            running(Duration.ofMinutes(10), 1000, 10);
            openBreaker("db");

            // network (15) + LOW baseline (5) stays under the floor of 25
            assertThat(manager.predictJobFailure(JOB)).isEmpty();
        }

        @Test
        @DisplayName("should drop a stale cached prediction once the job recovers")
        void shouldDropCachedPrediction() {
            running(Duration.ofMinutes(10), 1000, 30);
            manager.predictJobFailure(JOB);

            running(Duration.ofMinutes(10), 1000, 0);
            manager.predictJobFailure(JOB);

            assertThat(manager.getCachedPrediction(JOB)).isEmpty();
        }
    }

    @Nested
    @DisplayName("generateRecoveryStrategy")
    class StrategyTests {

        @Test
        @DisplayName("should plan nothing for a healthy job")
        void shouldPlanNothingWhenHealthy() {
            running(Duration.ofMinutes(10), 1000, 0);

            assertThat(manager.generateRecoveryStrategy(JOB)).isEmpty();
        }

        @Test
        @DisplayName("should restart a failed job from its checkpoint")
        void shouldRestartFailedJobFromCheckpoint() {
            running(Duration.ofMinutes(10), 1000, 0);
            JobCheckpoint cp = checkpoint("extract", 4000, 10000, CheckpointState.COMPLETED);
            finished(ExecutionStatus.FAILED);

            RecoveryStrategy strategy = manager.generateRecoveryStrategy(JOB).orElseThrow();

            assertThat(strategy.strategy()).isEqualTo(RecoveryStrategyType.RESTART_FROM_CHECKPOINT);
            assertThat(strategy.riskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(strategy.estimatedRecoveryMinutes()).isEqualTo(6);
            assertThat(strategy.checkpointIds()).containsExactly(cp.checkpointId());
            assertThat(strategy.steps()).contains("Restart from checkpoint: extract");
            assertThat(auditedEventTypes()).contains(JobStateManager.RECOVERY_STRATEGY_GENERATED);
        }

        @Test
        @DisplayName("should fully restart a failed job without a checkpoint")
        void shouldFullyRestartWithoutCheckpoint() {
            RecoveryStrategy strategy = manager.generateRecoveryStrategy(JOB).orElseThrow();

            assertThat(strategy.strategy()).isEqualTo(RecoveryStrategyType.FULL_RESTART);
            assertThat(strategy.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(strategy.estimatedRecoveryMinutes()).isEqualTo(60);
            assertThat(strategy.checkpointIds()).isEmpty();
        }

        @Test
        @DisplayName("should restart a critical job from its checkpoint at medium risk")
        void shouldRestartCriticalJobFromCheckpoint() {
            running(Duration.ofMinutes(10), 1000, 100);
            checkpoint("extract", 4000, 10000, CheckpointState.COMPLETED);

            RecoveryStrategy strategy = manager.generateRecoveryStrategy(JOB, EXEC).orElseThrow();

            assertThat(strategy.strategy()).isEqualTo(RecoveryStrategyType.RESTART_FROM_CHECKPOINT);
            assertThat(strategy.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
            assertThat(strategy.estimatedRecoveryMinutes()).isEqualTo(21);
            assertThat(strategy.executionId()).isEqualTo(EXEC);
        }

        @Test
        @DisplayName("should ask for manual intervention on a critical job without a checkpoint")
        void shouldRequireManualIntervention() {
            running(Duration.ofMinutes(10), 1000, 100);

            RecoveryStrategy strategy = manager.generateRecoveryStrategy(JOB).orElseThrow();

            assertThat(strategy.strategy()).isEqualTo(RecoveryStrategyType.MANUAL_INTERVENTION);
            assertThat(strategy.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(strategy.estimatedRecoveryMinutes()).isEqualTo(120);
        }

        @Test
        @DisplayName("should bypass breakers for a degraded job and carry prediction preconditions")
        void shouldBypassForWarning() {
            running(Duration.ofMinutes(40), 1000, 0);
            checkpoint("extract", 100, 1000, CheckpointState.COMPLETED);
            openBreaker("db");

            RecoveryStrategy strategy = manager.generateRecoveryStrategy(JOB).orElseThrow();

            assertThat(strategy.strategy()).isEqualTo(RecoveryStrategyType.CIRCUIT_BREAKER_BYPASS);
            assertThat(strategy.riskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(strategy.estimatedRecoveryMinutes()).isEqualTo(10);
            assertThat(strategy.preconditions()).containsExactly("Increase memory allocation for job execution");
        }
    }

    @Nested
    @DisplayName("executeRecoveryStrategy")
    class ExecuteTests {

        private RecoveryStrategy strategy(RecoveryStrategyType type, List<String> checkpointIds) {
            return new RecoveryStrategy(JOB, EXEC, type, checkpointIds, 10, RiskLevel.LOW, List.of(),
                List.of("step"));
        }

        @Test
        @DisplayName("should restart from a verified checkpoint")
        void shouldRestartFromCheckpoint() {
            running(Duration.ofMinutes(10), 1000, 0);
            JobCheckpoint cp = checkpoint("extract", 4000, 10000, CheckpointState.COMPLETED);

            boolean recovered = manager.executeRecoveryStrategy(
                strategy(RecoveryStrategyType.RESTART_FROM_CHECKPOINT, List.of(cp.checkpointId())));

            assertThat(recovered).isTrue();
            verify(restarter).restartFromCheckpoint(JOB, EXEC, cp);
            assertThat(auditedEventTypes()).containsSubsequence(
                JobStateManager.RECOVERY_STARTED, "CHECKPOINT_RECOVERY_EXECUTED");
            assertThat(metrics.samples("job_state.recovery_executed"))
                .extracting(s -> s.value()).containsExactly(1.0);
        }

        @Test
        @DisplayName("should refuse a checkpoint that fails verification")
        void shouldRefuseTamperedCheckpoint() {
            running(Duration.ofMinutes(10), 1000, 0);
            JobCheckpoint cp = checkpoint("extract", 4000, 10000, CheckpointState.COMPLETED);
            checkpoints.replace(new JobCheckpoint(cp.checkpointId(), JOB, EXEC, cp.stepName(), cp.stepNumber(),
                5000, cp.totalData(), cp.timestamp(), cp.checksum(), cp.state(), cp.metadata()));

            boolean recovered = manager.executeRecoveryStrategy(
                strategy(RecoveryStrategyType.RESTART_FROM_CHECKPOINT, List.of(cp.checkpointId())));

            assertThat(recovered).isFalse();
            verifyNoInteractions(restarter);
            AuditEntry failed = ledger.getEntries(JOB).stream()
                .filter(e -> e.eventType().equals(JobStateManager.RECOVERY_FAILED))
                .findFirst().orElseThrow();
            assertThat(failed.details().get("error").toString()).contains("integrity");
        }

        @Test
        @DisplayName("should audit a failing restarter as RECOVERY_FAILED")
        void shouldAuditRestarterFailure() {
            doThrow(new IllegalStateException("scheduler offline")).when(restarter).restartFull(JOB, EXEC);

            boolean recovered = manager.executeRecoveryStrategy(strategy(RecoveryStrategyType.FULL_RESTART, List.of()));

            assertThat(recovered).isFalse();
            assertThat(auditedEventTypes()).containsExactly(
                JobStateManager.RECOVERY_STARTED, JobStateManager.RECOVERY_FAILED);
            assertThat(metrics.samples("job_state.recovery_executed"))
                .extracting(s -> s.value()).containsExactly(0.0);
        }

        @Test
        @DisplayName("should fully restart through the restarter")
        void shouldFullyRestart() {
            boolean recovered = manager.executeRecoveryStrategy(strategy(RecoveryStrategyType.FULL_RESTART, List.of()));

            assertThat(recovered).isTrue();
            verify(restarter).restartFull(JOB, EXEC);
        }

        @Test
        @DisplayName("should reset open breakers on bypass")
        void shouldResetBreakersOnBypass() {
            openBreaker("db");

            boolean recovered = manager.executeRecoveryStrategy(
                strategy(RecoveryStrategyType.CIRCUIT_BREAKER_BYPASS, List.of()));

            assertThat(recovered).isTrue();
            assertThat(breakers.getOrCreate("db").getState()).isEqualTo(CircuitState.CLOSED);
        }

        @Test
        @DisplayName("should raise an alert and report failure for manual intervention")
        void shouldAlertForManualIntervention() {
            boolean recovered = manager.executeRecoveryStrategy(
                strategy(RecoveryStrategyType.MANUAL_INTERVENTION, List.of()));

            assertThat(recovered).isFalse();
            assertThat(metrics.getAlerts()).hasSize(1);
            assertThat(metrics.getAlerts().get(0).severity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(auditedEventTypes()).doesNotContain(JobStateManager.RECOVERY_FAILED);
        }

        @Test
        @DisplayName("should fail when no executor handles the strategy")
        void shouldFailWithoutExecutor() {
            JobStateManager bare = new JobStateManager(executions, checkpoints, checksums, ledger, breakers,
                metrics, clock, JobSettings.defaults(), List.of());

            assertThat(bare.executeRecoveryStrategy(strategy(RecoveryStrategyType.FULL_RESTART, List.of())))
                .isFalse();
            assertThat(auditedEventTypes()).contains(JobStateManager.RECOVERY_FAILED);
        }

        @Test
        @DisplayName("should propagate an audit failure")
        void shouldPropagateAuditFailure() {
            auditRepository.failWrites(true);

            assertThatThrownBy(() -> manager.executeRecoveryStrategy(
                strategy(RecoveryStrategyType.FULL_RESTART, List.of())))
                .isInstanceOf(AuditWriteException.class);
            verifyNoInteractions(restarter);
        }
    }

    @Test
    @DisplayName("should assemble a job state report")
    void shouldAssembleReport() {
        running(Duration.ofMinutes(10), 1000, 100);
        checkpoint("extract", 4000, 10000, CheckpointState.COMPLETED);

        JobStateReport report = manager.getJobStateReport(JOB);

        assertThat(report.health().status()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(report.recentCheckpoints()).hasSize(1);
        assertThat(report.prediction()).isNotNull();
        assertThat(report.recoveryStrategy()).isNotNull();
        assertThat(report.recommendations())
            .contains("High failure rate detected: 10.00%", "Review and validate business logic",
                "Recovery strategy available: RESTART_FROM_CHECKPOINT");
    }

    @Test
    @DisplayName("should register the four built-in executors")
    void shouldRegisterBuiltInExecutors() {
        assertThat(manager.executors()).containsOnlyKeys(RecoveryStrategyType.values());
        assertThat(manager.getSettings()).isEqualTo(JobSettings.defaults());
    }

    @Test
    @DisplayName("should pass the checkpoint to the restarter unchanged")
    void shouldPassCheckpoint() {
        running(Duration.ofMinutes(10), 1000, 0);
        JobCheckpoint cp = checkpoint("extract", 10, 100, CheckpointState.COMPLETED);

        manager.executeRecoveryStrategy(new RecoveryStrategy(JOB, null,
            RecoveryStrategyType.RESTART_FROM_CHECKPOINT, List.of(cp.checkpointId()), 5, RiskLevel.LOW,
            List.of(), List.of()));

        verify(restarter).restartFromCheckpoint(eq(JOB), eq(EXEC), any(JobCheckpoint.class));
    }
}
