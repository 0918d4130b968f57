package com.ivamare.reliability.job;

import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.audit.AuditRecord;
import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import com.ivamare.reliability.exception.AuditWriteException;
import com.ivamare.reliability.exception.ExecutionNotFoundException;
import com.ivamare.reliability.exception.InvalidOperationException;
import com.ivamare.reliability.job.recovery.CheckpointRecoveryExecutor;
import com.ivamare.reliability.job.recovery.CircuitBreakerBypassExecutor;
import com.ivamare.reliability.job.recovery.FullRestartExecutor;
import com.ivamare.reliability.job.recovery.ManualInterventionExecutor;
import com.ivamare.reliability.job.recovery.RecoveryExecutor;
import com.ivamare.reliability.metrics.MetricCategory;
import com.ivamare.reliability.metrics.MetricSink;
import com.ivamare.reliability.model.AuditOutcome;
import com.ivamare.reliability.model.RiskLevel;
import com.ivamare.reliability.repository.CheckpointRepository;
import com.ivamare.reliability.repository.JobExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoints, health checks, failure prediction and recovery for jobs.
 *
 * <p>Health is recomputed from scratch on every check from the execution's failure
 * rate, processing time, data integrity and checkpoint progress. Health checks and
 * predictions never throw for store failures; they report a FAILED status instead.
 * Audit write failures always propagate.
 */
public class JobStateManager {

    private static final Logger log = LoggerFactory.getLogger(JobStateManager.class);

    public static final String CHECKPOINT_CREATED = "CHECKPOINT_CREATED";
    public static final String RECOVERY_STRATEGY_GENERATED = "RECOVERY_STRATEGY_GENERATED";
    public static final String RECOVERY_STARTED = "RECOVERY_STARTED";
    public static final String RECOVERY_FAILED = "RECOVERY_FAILED";

    private static final String ACTOR = "job-state-manager";
    private static final long DEFAULT_RECOVERY_MINUTES = 30;

    private final JobExecutionRepository executionRepository;
    private final CheckpointRepository checkpointRepository;
    private final CheckpointChecksums checksums;
    private final AuditLedger auditLedger;
    private final CircuitBreakerRegistry breakerRegistry;
    private final MetricSink metricSink;
    private final Clock clock;
    private final JobSettings settings;
    private final Map<RecoveryStrategyType, RecoveryExecutor> executors = new EnumMap<>(RecoveryStrategyType.class);
    private final Map<String, FailurePrediction> predictions = new ConcurrentHashMap<>();

    /**
     * Manager with the four built-in recovery executors.
     */
    public JobStateManager(
            JobExecutionRepository executionRepository,
            CheckpointRepository checkpointRepository,
            CheckpointChecksums checksums,
            JobRestarter restarter,
            AuditLedger auditLedger,
            CircuitBreakerRegistry breakerRegistry,
            MetricSink metricSink,
            Clock clock,
            JobSettings settings) {
        this(executionRepository, checkpointRepository, checksums, auditLedger, breakerRegistry, metricSink,
            clock, settings, List.of(
                new CheckpointRecoveryExecutor(checkpointRepository, checksums, restarter, auditLedger),
                new FullRestartExecutor(restarter, auditLedger),
                new CircuitBreakerBypassExecutor(breakerRegistry, auditLedger),
                new ManualInterventionExecutor(auditLedger, metricSink)));
    }

    /**
     * @param executors One executor per strategy type; later entries replace earlier ones
     */
    public JobStateManager(
            JobExecutionRepository executionRepository,
            CheckpointRepository checkpointRepository,
            CheckpointChecksums checksums,
            AuditLedger auditLedger,
            CircuitBreakerRegistry breakerRegistry,
            MetricSink metricSink,
            Clock clock,
            JobSettings settings,
            Collection<? extends RecoveryExecutor> executors) {
        this.executionRepository = executionRepository;
        this.checkpointRepository = checkpointRepository;
        this.checksums = checksums;
        this.auditLedger = auditLedger;
        this.breakerRegistry = breakerRegistry;
        this.metricSink = metricSink;
        this.clock = clock;
        this.settings = settings;
        for (RecoveryExecutor executor : executors) {
            this.executors.put(executor.type(), executor);
        }
    }

    // --- Checkpoints ---

    /**
     * Store a checkpoint, audit it and count it.
     *
     * @throws InvalidOperationException if the request is incomplete
     * @throws ExecutionNotFoundException if the execution does not exist for the job
     * @throws AuditWriteException if the checkpoint could not be audited
     */
    public JobCheckpoint createCheckpoint(CheckpointRequest request) {
        request.validate();
        executionRepository.findById(request.executionId())
            .filter(execution -> execution.jobId().equals(request.jobId()))
            .orElseThrow(() -> new ExecutionNotFoundException(request.jobId(), request.executionId()));

        JobCheckpoint unsigned = new JobCheckpoint(
            "cp_" + UUID.randomUUID(),
            request.jobId(),
            request.executionId(),
            request.stepName(),
            request.stepNumber(),
            request.dataProcessed(),
            request.totalData(),
            clock.instant().truncatedTo(ChronoUnit.MILLIS),
            null,
            request.state(),
            checksums.normalizeMetadata(request.metadata()));
        JobCheckpoint checkpoint = unsigned.withChecksum(checksums.compute(unsigned));

        checkpointRepository.save(checkpoint);
        auditLedger.append(AuditRecord.builder(CHECKPOINT_CREATED, checkpoint.jobId())
            .entityType("JOB")
            .actor(ACTOR)
            .action("CREATE_CHECKPOINT")
            .resource("checkpoint:" + checkpoint.checkpointId())
            .detail("checkpointId", checkpoint.checkpointId())
            .detail("executionId", checkpoint.executionId())
            .detail("stepName", checkpoint.stepName())
            .detail("stepNumber", checkpoint.stepNumber())
            .detail("dataProcessed", checkpoint.dataProcessed())
            .detail("totalData", checkpoint.totalData())
            .detail("state", checkpoint.state().name())
            .detail("checksum", checkpoint.checksum())
            .build());
        metricSink.recordMetric("job_state", "checkpoint_created", 1, "count", Map.of(
            "jobId", checkpoint.jobId(),
            "stepName", checkpoint.stepName(),
            "state", checkpoint.state().name()));

        log.debug("Created checkpoint {} for job {} at step {} ({}/{})", checkpoint.checkpointId(),
            checkpoint.jobId(), checkpoint.stepName(), checkpoint.dataProcessed(), checkpoint.totalData());
        return checkpoint;
    }

    /**
     * Newest COMPLETED checkpoint whose checksum still verifies.
     *
     * @param executionId Restrict to one execution (nullable)
     * @return the checkpoint, or empty when none verifies or the store cannot be read
     */
    public Optional<JobCheckpoint> getLatestCheckpoint(String jobId, String executionId) {
        List<JobCheckpoint> completed;
        try {
            completed = checkpointRepository.findRecent(jobId, executionId, CheckpointState.COMPLETED,
                settings.recentCheckpointLimit());
        } catch (DataAccessException e) {
            log.error("Failed to load checkpoints for job {}", jobId, e);
            return Optional.empty();
        }
        for (JobCheckpoint checkpoint : completed) {
            if (checksums.verify(checkpoint)) {
                return Optional.of(checkpoint);
            }
            log.warn("Checkpoint {} of job {} failed integrity verification", checkpoint.checkpointId(), jobId);
        }
        return Optional.empty();
    }

    /**
     * Recent checkpoints in any state, newest first.
     */
    public List<JobCheckpoint> getRecentCheckpoints(String jobId, String executionId) {
        return checkpointRepository.findRecent(jobId, executionId, null, settings.recentCheckpointLimit());
    }

    // --- Health ---

    /**
     * Recompute a job's health.
     *
     * @param executionId Execution to check; null checks the latest RUNNING execution
     * @return the status; FAILED when no execution exists or the stores cannot be read
     */
    public JobHealthStatus checkJobHealth(String jobId, String executionId) {
        Instant now = clock.instant();
        JobHealthStatus health;
        try {
            health = computeHealth(jobId, executionId, now);
        } catch (DataAccessException e) {
            log.error("Health check failed for job {}", jobId, e);
            health = JobHealthStatus.failed(jobId, executionId, now, "Health check error: " + e.getMessage());
        }
        metricSink.recordBusinessMetric(MetricCategory.ERROR_RATE, "job_health_score",
            health.status().score(), "score", Map.of(
                "jobId", jobId,
                "status", health.status().name(),
                "riskLevel", health.riskLevel().name()));
        return health;
    }

    private JobHealthStatus computeHealth(String jobId, String executionId, Instant now) {
        Optional<JobExecution> found = executionId != null
            ? executionRepository.findById(executionId)
            : executionRepository.findLatestRunning(jobId);
        if (found.isEmpty()) {
            return JobHealthStatus.failed(jobId, executionId, now, "No active execution found");
        }
        JobExecution execution = found.get();

        double failureRate = execution.failureRate();
        long processingTimeMs = Math.max(0, execution.processingTime(now).toMillis());
        List<JobCheckpoint> checkpoints = checkpointRepository.findRecent(jobId, execution.id(), null,
            settings.recentCheckpointLimit());
        double dataIntegrity = calculateDataIntegrity(jobId, checkpoints);

        HealthStatus status = HealthStatus.HEALTHY;
        RiskLevel riskLevel = RiskLevel.LOW;
        List<String> recommendations = new ArrayList<>();

        if (failureRate > settings.maxFailureRate()) {
            status = HealthStatus.CRITICAL;
            riskLevel = RiskLevel.CRITICAL;
            recommendations.add("High failure rate detected: " + percent(failureRate));
        } else if (failureRate > settings.maxFailureRate() * 0.5) {
            status = HealthStatus.WARNING;
            riskLevel = RiskLevel.MEDIUM;
            recommendations.add("Elevated failure rate: " + percent(failureRate));
        }

        if (processingTimeMs > settings.criticalProcessingTime().toMillis()) {
            status = status.atLeast(HealthStatus.WARNING);
            riskLevel = riskLevel.isAtLeast(RiskLevel.MEDIUM) ? riskLevel : RiskLevel.MEDIUM;
            recommendations.add("Long processing time: " + Math.round(processingTimeMs / 60000.0) + " minutes");
        }

        if (dataIntegrity < settings.minDataIntegrity()) {
            status = HealthStatus.CRITICAL;
            riskLevel = RiskLevel.CRITICAL;
            recommendations.add("Low data integrity score: " + percent(dataIntegrity));
        }

        if (execution.isRunning() && isStalled(execution, checkpoints, now)) {
            status = status.atLeast(HealthStatus.WARNING);
            recommendations.add("Job appears to be stalled");
        }

        return new JobHealthStatus(jobId, execution.id(), status, now, failureRate, processingTimeMs,
            dataIntegrity, recommendations, riskLevel);
    }

    /**
     * Worst of the checkpoint checksum pass ratio and the job's audit chain integrity.
     */
    private double calculateDataIntegrity(String jobId, List<JobCheckpoint> checkpoints) {
        double checkpointScore = 1.0;
        if (!checkpoints.isEmpty()) {
            long valid = checkpoints.stream().filter(checksums::verify).count();
            checkpointScore = (double) valid / checkpoints.size();
        }
        double chainScore = auditLedger.verifyChain(jobId).integrityScore();
        return Math.min(checkpointScore, chainScore);
    }

    private boolean isStalled(JobExecution execution, List<JobCheckpoint> checkpoints, Instant now) {
        Duration threshold = settings.stallThreshold();
        if (Duration.between(execution.startedAt(), now).compareTo(threshold) <= 0) {
            return false;
        }
        // checkpoints are newest first
        return checkpoints.isEmpty()
            || Duration.between(checkpoints.get(0).timestamp(), now).compareTo(threshold) > 0;
    }

    // --- Prediction ---

    public Optional<FailurePrediction> predictJobFailure(String jobId) {
        return predictJobFailure(jobId, null);
    }

    /**
     * Weighted failure forecast.
     *
     * @return the prediction, or empty when the score is below the risk floor
     */
    public Optional<FailurePrediction> predictJobFailure(String jobId, String executionId) {
        JobHealthStatus health = checkJobHealth(jobId, executionId);
        PredictionWeights weights = settings.prediction();

        int score = 0;
        int topWeight = -1;
        FailureCategory category = FailureCategory.UNKNOWN;
        List<String> actions = new ArrayList<>();

        if (health.failureRate() > weights.failureRateThreshold()) {
            score += weights.failureRateWeight();
            actions.add("Review and validate business logic");
            if (weights.failureRateWeight() > topWeight) {
                topWeight = weights.failureRateWeight();
                category = FailureCategory.BUSINESS_LOGIC;
            }
        }
        if (health.processingTimeMs() > weights.processingTimeThreshold().toMillis()) {
            score += weights.processingTimeWeight();
            actions.add("Increase memory allocation");
            if (weights.processingTimeWeight() > topWeight) {
                topWeight = weights.processingTimeWeight();
                category = FailureCategory.MEMORY;
            }
        }
        if (health.dataIntegrity() < weights.integrityThreshold()) {
            score += weights.integrityWeight();
            actions.add("Check database connectivity and data quality");
            if (weights.integrityWeight() > topWeight) {
                topWeight = weights.integrityWeight();
                category = FailureCategory.DATABASE;
            }
        }
        if (breakerRegistry.isAnyOpen()) {
            score += weights.networkWeight();
            actions.add("Check network stability and connectivity");
            if (weights.networkWeight() > topWeight) {
                category = FailureCategory.NETWORK;
            }
        }

        if (score < 20) {
            score += switch (health.riskLevel()) {
                case LOW -> weights.baselineLow();
                case MEDIUM -> weights.baselineMedium();
                case HIGH, CRITICAL -> weights.baselineHigh();
            };
        }
        score = Math.max(0, Math.min(100, score));

        if (score < weights.riskFloor()) {
            predictions.remove(jobId);
            return Optional.empty();
        }

        double confidence = Math.min(0.95, 0.3 + score / 100.0 * 0.65);
        int minutesToFailure;
        if (score > 70) {
            minutesToFailure = 15;
        } else if (score > 50) {
            minutesToFailure = 30;
        } else if (score > 30) {
            minutesToFailure = 45;
        } else {
            minutesToFailure = 60;
        }

        FailurePrediction prediction = new FailurePrediction(jobId, score, category, confidence,
            minutesToFailure, actions, clock.instant());
        predictions.put(jobId, prediction);

        metricSink.recordMetric("failure_prediction", "risk_assessment", score, "percentage", Map.of(
            "jobId", jobId,
            "failureType", category.name(),
            "confidence", confidence,
            "estimatedTimeToFailure", minutesToFailure));
        return Optional.of(prediction);
    }

    /**
     * Prediction made by the last {@link #predictJobFailure} call for the job, if it crossed the floor.
     */
    public Optional<FailurePrediction> getCachedPrediction(String jobId) {
        return Optional.ofNullable(predictions.get(jobId));
    }

    // --- Recovery ---

    public Optional<RecoveryStrategy> generateRecoveryStrategy(String jobId) {
        return generateRecoveryStrategy(jobId, null);
    }

    /**
     * Plan a recovery from the job's current health and latest checkpoint.
     *
     * @return the strategy, or empty when the job is healthy
     * @throws AuditWriteException if the strategy could not be audited
     */
    public Optional<RecoveryStrategy> generateRecoveryStrategy(String jobId, String executionId) {
        JobHealthStatus health = checkJobHealth(jobId, executionId);
        if (health.status() == HealthStatus.HEALTHY) {
            return Optional.empty();
        }
        Optional<JobCheckpoint> checkpoint = getLatestCheckpoint(jobId, executionId);

        RecoveryStrategyType type;
        long minutes;
        RiskLevel risk;
        List<String> steps = new ArrayList<>();

        switch (health.status()) {
            case FAILED -> {
                if (checkpoint.isPresent()) {
                    type = RecoveryStrategyType.RESTART_FROM_CHECKPOINT;
                    minutes = Math.max(5, checkpoint.get().remaining() / 1000);
                    risk = RiskLevel.LOW;
                    steps.add("Restart from checkpoint: " + checkpoint.get().stepName());
                    steps.add("Validate data integrity before resuming");
                } else {
                    type = RecoveryStrategyType.FULL_RESTART;
                    minutes = 60;
                    risk = RiskLevel.HIGH;
                    steps.add("Perform full job restart");
                    steps.add("Verify all data sources are accessible");
                    steps.add("Clear any cached data");
                }
            }
            case CRITICAL -> {
                if (checkpoint.isPresent()) {
                    type = RecoveryStrategyType.RESTART_FROM_CHECKPOINT;
                    minutes = Math.max(15, Math.round(DEFAULT_RECOVERY_MINUTES * 0.7));
                    risk = RiskLevel.MEDIUM;
                    steps.add("Restart from last successful checkpoint");
                    steps.add("Implement circuit breaker for problematic components");
                } else {
                    type = RecoveryStrategyType.MANUAL_INTERVENTION;
                    minutes = 120;
                    risk = RiskLevel.HIGH;
                    steps.add("Review job logs and configuration");
                    steps.add("Manual data validation required");
                }
            }
            default -> {
                type = RecoveryStrategyType.CIRCUIT_BREAKER_BYPASS;
                minutes = 10;
                risk = RiskLevel.LOW;
                steps.add("Implement circuit breaker bypass");
                steps.add("Monitor closely during recovery");
            }
        }

        List<String> preconditions = new ArrayList<>();
        predictJobFailure(jobId, executionId).ifPresent(prediction -> {
            switch (prediction.predictedFailureType()) {
                case MEMORY -> preconditions.add("Increase memory allocation for job execution");
                case DATABASE -> preconditions.add("Verify database connectivity and performance");
                case NETWORK -> preconditions.add("Check network stability and connectivity");
                default -> {
                }
            }
        });

        String execution = executionId != null ? executionId : health.executionId();
        RecoveryStrategy strategy = new RecoveryStrategy(jobId, execution, type,
            checkpoint.map(cp -> List.of(cp.checkpointId())).orElse(List.of()),
            minutes, risk, preconditions, steps);

        auditLedger.append(AuditRecord.builder(RECOVERY_STRATEGY_GENERATED, jobId)
            .entityType("JOB")
            .actor(ACTOR)
            .action("GENERATE_RECOVERY_STRATEGY")
            .resource("job:" + jobId)
            .outcome(AuditOutcome.WARNING)
            .detail("executionId", execution)
            .detail("strategy", type.name())
            .detail("healthStatus", health.status().name())
            .detail("estimatedRecoveryTime", minutes)
            .detail("riskLevel", risk.name())
            .build());
        log.info("Generated {} recovery strategy for job {} (health={}, risk={})",
            type, jobId, health.status(), risk);
        return Optional.of(strategy);
    }

    /**
     * Run a strategy through its executor.
     *
     * @return true if the job was recovered; false if the executor failed or a person must act
     * @throws AuditWriteException if the recovery could not be audited
     */
    public boolean executeRecoveryStrategy(RecoveryStrategy strategy) {
        log.info("Executing {} recovery for job {}", strategy.strategy(), strategy.jobId());
        auditLedger.append(AuditRecord.builder(RECOVERY_STARTED, strategy.jobId())
            .entityType("JOB")
            .actor(ACTOR)
            .action("EXECUTE_RECOVERY")
            .resource("job:" + strategy.jobId())
            .detail("strategy", strategy.strategy().name())
            .detail("estimatedRecoveryTime", strategy.estimatedRecoveryMinutes())
            .detail("riskLevel", strategy.riskLevel().name())
            .detail("steps", strategy.steps())
            .build());

        boolean recovered;
        try {
            RecoveryExecutor executor = executors.get(strategy.strategy());
            if (executor == null) {
                throw new InvalidOperationException("No executor for recovery strategy " + strategy.strategy());
            }
            recovered = executor.execute(strategy);
        } catch (AuditWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Recovery {} failed for job {}", strategy.strategy(), strategy.jobId(), e);
            auditLedger.append(AuditRecord.builder(RECOVERY_FAILED, strategy.jobId())
                .entityType("JOB")
                .actor(ACTOR)
                .action("EXECUTE_RECOVERY")
                .resource("job:" + strategy.jobId())
                .outcome(AuditOutcome.FAILURE)
                .detail("strategy", strategy.strategy().name())
                .detail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getName())
                .build());
            recovered = false;
        }

        metricSink.recordMetric("job_state", "recovery_executed", recovered ? 1 : 0, "boolean", Map.of(
            "jobId", strategy.jobId(),
            "strategy", strategy.strategy().name()));
        return recovered;
    }

    // --- Reporting ---

    /**
     * Health, checkpoints, prediction and strategy for a job, with merged recommendations.
     */
    public JobStateReport getJobStateReport(String jobId) {
        JobHealthStatus health = checkJobHealth(jobId, null);
        List<JobCheckpoint> checkpoints;
        try {
            checkpoints = getRecentCheckpoints(jobId, null);
        } catch (DataAccessException e) {
            log.error("Failed to load checkpoints for job {}", jobId, e);
            checkpoints = List.of();
        }
        FailurePrediction prediction = predictJobFailure(jobId).orElse(null);
        RecoveryStrategy strategy = generateRecoveryStrategy(jobId).orElse(null);

        List<String> recommendations = new ArrayList<>(health.recommendations());
        if (prediction != null) {
            recommendations.addAll(prediction.preventionActions());
        }
        if (strategy != null) {
            recommendations.add("Recovery strategy available: " + strategy.strategy());
        }
        return new JobStateReport(health, checkpoints, prediction, strategy, recommendations);
    }

    public JobSettings getSettings() {
        return settings;
    }

    Map<RecoveryStrategyType, RecoveryExecutor> executors() {
        return new HashMap<>(executors);
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.2f%%", ratio * 100);
    }
}
