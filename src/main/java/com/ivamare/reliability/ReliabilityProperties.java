package com.ivamare.reliability;

import com.ivamare.reliability.audit.AuditLedgerSettings;
import com.ivamare.reliability.batching.BatchingSettings;
import com.ivamare.reliability.breaker.CircuitBreakerConfig;
import com.ivamare.reliability.job.JobSettings;
import com.ivamare.reliability.job.PredictionWeights;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Configuration properties for the pipeline reliability core.
 *
 * <p>Example configuration:
 * <pre>
 * reliability:
 *   enabled: true
 *   breaker:
 *     failure-threshold: 5
 *     recovery-timeout: 60s
 *     load-on-start: true
 *   audit:
 *     ring-capacity: 100000
 *     signing-key: ${AUDIT_SIGNING_KEY}
 *   batching:
 *     min-batch-size: 100
 *     max-batch-size: 10000
 *   job:
 *     heartbeat-interval: 30s
 *     prediction:
 *       risk-floor: 25
 *   metrics:
 *     buffer-size: 1000
 *     alert-capacity: 1000
 *     persist-samples: true
 * </pre>
 */
@ConfigurationProperties(prefix = "reliability")
public class ReliabilityProperties {

    /**
     * Enable/disable reliability auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Circuit breaker configuration.
     */
    private BreakerProperties breaker = new BreakerProperties();

    /**
     * Audit ledger configuration.
     */
    private AuditProperties audit = new AuditProperties();

    /**
     * Batching engine configuration.
     */
    private BatchingProperties batching = new BatchingProperties();

    /**
     * Job state and recovery configuration.
     */
    private JobProperties job = new JobProperties();

    /**
     * Metrics sink configuration.
     */
    private MetricsProperties metrics = new MetricsProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public BreakerProperties getBreaker() {
        return breaker;
    }

    public void setBreaker(BreakerProperties breaker) {
        this.breaker = breaker;
    }

    public AuditProperties getAudit() {
        return audit;
    }

    public void setAudit(AuditProperties audit) {
        this.audit = audit;
    }

    public BatchingProperties getBatching() {
        return batching;
    }

    public void setBatching(BatchingProperties batching) {
        this.batching = batching;
    }

    public JobProperties getJob() {
        return job;
    }

    public void setJob(JobProperties job) {
        this.job = job;
    }

    public MetricsProperties getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsProperties metrics) {
        this.metrics = metrics;
    }

    /**
     * Circuit breaker properties.
     */
    public static class BreakerProperties {

        /**
         * Consecutive failures that open a breaker.
         */
        private int failureThreshold = CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD;

        /**
         * Time an OPEN breaker waits before letting a trial call through.
         */
        private Duration recoveryTimeout = CircuitBreakerConfig.DEFAULT_RECOVERY_TIMEOUT;

        /**
         * Consecutive HALF_OPEN successes that close a breaker.
         */
        private int successThreshold = CircuitBreakerConfig.DEFAULT_SUCCESS_THRESHOLD;

        /**
         * Upper bound on a single protected operation.
         */
        private Duration operationTimeout = CircuitBreakerConfig.DEFAULT_OPERATION_TIMEOUT;

        /**
         * Restore stored breaker states when the application is ready, so an OPEN
         * breaker stays OPEN across a restart.
         */
        private boolean loadOnStart = true;

        public CircuitBreakerConfig toConfig() {
            return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold, operationTimeout);
        }

        // Getters and setters

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Duration getOperationTimeout() {
            return operationTimeout;
        }

        public void setOperationTimeout(Duration operationTimeout) {
            this.operationTimeout = operationTimeout;
        }

        public boolean isLoadOnStart() {
            return loadOnStart;
        }

        public void setLoadOnStart(boolean loadOnStart) {
            this.loadOnStart = loadOnStart;
        }
    }

    /**
     * Audit ledger properties.
     */
    public static class AuditProperties {

        /**
         * Entries kept in memory per chain.
         */
        private int ringCapacity = AuditLedgerSettings.DEFAULT_RING_CAPACITY;

        /**
         * Amount above which a transaction is high value.
         */
        private BigDecimal highValueThreshold = new BigDecimal("10000");

        /**
         * Daily limit used when an event carries none.
         */
        private BigDecimal defaultDailyLimit = new BigDecimal("50000");

        /**
         * Monthly limit used when an event carries none.
         */
        private BigDecimal defaultMonthlyLimit = new BigDecimal("500000");

        /**
         * Risk score above which a transaction is high risk.
         */
        private double highRiskScore = 0.8;

        /**
         * HMAC key for entry signatures. Plain digest signatures are used when unset.
         */
        private String signingKey;

        public AuditLedgerSettings toSettings() {
            return new AuditLedgerSettings(ringCapacity, highValueThreshold, defaultDailyLimit,
                defaultMonthlyLimit, highRiskScore);
        }

        // Getters and setters

        public int getRingCapacity() {
            return ringCapacity;
        }

        public void setRingCapacity(int ringCapacity) {
            this.ringCapacity = ringCapacity;
        }

        public BigDecimal getHighValueThreshold() {
            return highValueThreshold;
        }

        public void setHighValueThreshold(BigDecimal highValueThreshold) {
            this.highValueThreshold = highValueThreshold;
        }

        public BigDecimal getDefaultDailyLimit() {
            return defaultDailyLimit;
        }

        public void setDefaultDailyLimit(BigDecimal defaultDailyLimit) {
            this.defaultDailyLimit = defaultDailyLimit;
        }

        public BigDecimal getDefaultMonthlyLimit() {
            return defaultMonthlyLimit;
        }

        public void setDefaultMonthlyLimit(BigDecimal defaultMonthlyLimit) {
            this.defaultMonthlyLimit = defaultMonthlyLimit;
        }

        public double getHighRiskScore() {
            return highRiskScore;
        }

        public void setHighRiskScore(double highRiskScore) {
            this.highRiskScore = highRiskScore;
        }

        public String getSigningKey() {
            return signingKey;
        }

        public void setSigningKey(String signingKey) {
            this.signingKey = signingKey;
        }
    }

    /**
     * Batching engine properties.
     */
    public static class BatchingProperties {

        private int minBatchSize = 100;

        private int maxBatchSize = 10_000;

        /**
         * Sub-batch processing time the adaptive feedback aims for.
         */
        private Duration targetProcessingTime = Duration.ofSeconds(5);

        /**
         * Largest financial value a single batch call may carry.
         */
        private BigDecimal maxFinancialBatchValue = new BigDecimal("10000000");

        /**
         * Sub-batch metrics kept for analytics.
         */
        private int historyCapacity = 500;

        /**
         * Error share of attempted items above which a batch call aborts.
         */
        private double abortErrorRatio = 0.1;

        /**
         * Replays allowed for a dead letter.
         */
        private int deadLetterMaxRetries = 3;

        /**
         * Circuit breaker that guards sub-batch processing.
         */
        private String serviceName = "batch_processing";

        /**
         * Pause between sub-batches while CPU use is high.
         */
        private Duration cpuYieldDelay = Duration.ofMillis(100);

        /**
         * Resize strategies from recent sub-batch metrics.
         */
        private boolean adaptive = true;

        /**
         * Interval of the background resource sampler.
         */
        private Duration resourceSampleInterval = Duration.ofSeconds(5);

        public BatchingSettings toSettings() {
            return new BatchingSettings(minBatchSize, maxBatchSize, targetProcessingTime, maxFinancialBatchValue,
                historyCapacity, abortErrorRatio, deadLetterMaxRetries, serviceName, cpuYieldDelay, adaptive);
        }

        // Getters and setters

        public int getMinBatchSize() {
            return minBatchSize;
        }

        public void setMinBatchSize(int minBatchSize) {
            this.minBatchSize = minBatchSize;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public Duration getTargetProcessingTime() {
            return targetProcessingTime;
        }

        public void setTargetProcessingTime(Duration targetProcessingTime) {
            this.targetProcessingTime = targetProcessingTime;
        }

        public BigDecimal getMaxFinancialBatchValue() {
            return maxFinancialBatchValue;
        }

        public void setMaxFinancialBatchValue(BigDecimal maxFinancialBatchValue) {
            this.maxFinancialBatchValue = maxFinancialBatchValue;
        }

        public int getHistoryCapacity() {
            return historyCapacity;
        }

        public void setHistoryCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
        }

        public double getAbortErrorRatio() {
            return abortErrorRatio;
        }

        public void setAbortErrorRatio(double abortErrorRatio) {
            this.abortErrorRatio = abortErrorRatio;
        }

        public int getDeadLetterMaxRetries() {
            return deadLetterMaxRetries;
        }

        public void setDeadLetterMaxRetries(int deadLetterMaxRetries) {
            this.deadLetterMaxRetries = deadLetterMaxRetries;
        }

        public String getServiceName() {
            return serviceName;
        }

        public void setServiceName(String serviceName) {
            this.serviceName = serviceName;
        }

        public Duration getCpuYieldDelay() {
            return cpuYieldDelay;
        }

        public void setCpuYieldDelay(Duration cpuYieldDelay) {
            this.cpuYieldDelay = cpuYieldDelay;
        }

        public boolean isAdaptive() {
            return adaptive;
        }

        public void setAdaptive(boolean adaptive) {
            this.adaptive = adaptive;
        }

        public Duration getResourceSampleInterval() {
            return resourceSampleInterval;
        }

        public void setResourceSampleInterval(Duration resourceSampleInterval) {
            this.resourceSampleInterval = resourceSampleInterval;
        }
    }

    /**
     * Job state and recovery properties.
     */
    public static class JobProperties {

        /**
         * Interval between health checks of a monitored job.
         */
        private Duration heartbeatInterval = Duration.ofSeconds(30);

        /**
         * Failure rate above which a job is CRITICAL.
         */
        private double maxFailureRate = 0.05;

        /**
         * Processing time above which a job is at least WARNING.
         */
        private Duration criticalProcessingTime = Duration.ofMinutes(30);

        /**
         * Data integrity below which a job is CRITICAL.
         */
        private double minDataIntegrity = 0.95;

        /**
         * Time without a checkpoint after which a RUNNING job counts as stalled.
         */
        private Duration stallThreshold = Duration.ofHours(1);

        /**
         * Delay before an automatic recovery runs.
         */
        private Duration autoRecoveryDelay = Duration.ofSeconds(5);

        /**
         * Checkpoints considered for integrity and reports.
         */
        private int recentCheckpointLimit = 5;

        /**
         * Failure prediction weights.
         */
        private PredictionProperties prediction = new PredictionProperties();

        public JobSettings toSettings() {
            return new JobSettings(heartbeatInterval, maxFailureRate, criticalProcessingTime, minDataIntegrity,
                stallThreshold, autoRecoveryDelay, recentCheckpointLimit, prediction.toWeights());
        }

        // Getters and setters

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public double getMaxFailureRate() {
            return maxFailureRate;
        }

        public void setMaxFailureRate(double maxFailureRate) {
            this.maxFailureRate = maxFailureRate;
        }

        public Duration getCriticalProcessingTime() {
            return criticalProcessingTime;
        }

        public void setCriticalProcessingTime(Duration criticalProcessingTime) {
            this.criticalProcessingTime = criticalProcessingTime;
        }

        public double getMinDataIntegrity() {
            return minDataIntegrity;
        }

        public void setMinDataIntegrity(double minDataIntegrity) {
            this.minDataIntegrity = minDataIntegrity;
        }

        public Duration getStallThreshold() {
            return stallThreshold;
        }

        public void setStallThreshold(Duration stallThreshold) {
            this.stallThreshold = stallThreshold;
        }

        public Duration getAutoRecoveryDelay() {
            return autoRecoveryDelay;
        }

        public void setAutoRecoveryDelay(Duration autoRecoveryDelay) {
            this.autoRecoveryDelay = autoRecoveryDelay;
        }

        public int getRecentCheckpointLimit() {
            return recentCheckpointLimit;
        }

        public void setRecentCheckpointLimit(int recentCheckpointLimit) {
            this.recentCheckpointLimit = recentCheckpointLimit;
        }

        public PredictionProperties getPrediction() {
            return prediction;
        }

        public void setPrediction(PredictionProperties prediction) {
            this.prediction = prediction;
        }
    }

    /**
     * Failure prediction properties. Each factor adds its weight to the risk score when
     * its threshold is crossed.
     */
    public static class PredictionProperties {

        private double failureRateThreshold = 0.02;
        private int failureRateWeight = 30;
        private Duration processingTimeThreshold = Duration.ofMinutes(25);
        private int processingTimeWeight = 20;
        private double integrityThreshold = 0.98;
        private int integrityWeight = 25;

        /**
         * Added when any circuit breaker is OPEN.
         */
        private int networkWeight = 15;

        /**
         * Scores below this produce no prediction.
         */
        private int riskFloor = 25;

        private int baselineLow = 5;
        private int baselineMedium = 15;
        private int baselineHigh = 30;

        public PredictionWeights toWeights() {
            return new PredictionWeights(failureRateThreshold, failureRateWeight, processingTimeThreshold,
                processingTimeWeight, integrityThreshold, integrityWeight, networkWeight, riskFloor,
                baselineLow, baselineMedium, baselineHigh);
        }

        // Getters and setters

        public double getFailureRateThreshold() {
            return failureRateThreshold;
        }

        public void setFailureRateThreshold(double failureRateThreshold) {
            this.failureRateThreshold = failureRateThreshold;
        }

        public int getFailureRateWeight() {
            return failureRateWeight;
        }

        public void setFailureRateWeight(int failureRateWeight) {
            this.failureRateWeight = failureRateWeight;
        }

        public Duration getProcessingTimeThreshold() {
            return processingTimeThreshold;
        }

        public void setProcessingTimeThreshold(Duration processingTimeThreshold) {
            this.processingTimeThreshold = processingTimeThreshold;
        }

        public int getProcessingTimeWeight() {
            return processingTimeWeight;
        }

        public void setProcessingTimeWeight(int processingTimeWeight) {
            this.processingTimeWeight = processingTimeWeight;
        }

        public double getIntegrityThreshold() {
            return integrityThreshold;
        }

        public void setIntegrityThreshold(double integrityThreshold) {
            this.integrityThreshold = integrityThreshold;
        }

        public int getIntegrityWeight() {
            return integrityWeight;
        }

        public void setIntegrityWeight(int integrityWeight) {
            this.integrityWeight = integrityWeight;
        }

        public int getNetworkWeight() {
            return networkWeight;
        }

        public void setNetworkWeight(int networkWeight) {
            this.networkWeight = networkWeight;
        }

        public int getRiskFloor() {
            return riskFloor;
        }

        public void setRiskFloor(int riskFloor) {
            this.riskFloor = riskFloor;
        }

        public int getBaselineLow() {
            return baselineLow;
        }

        public void setBaselineLow(int baselineLow) {
            this.baselineLow = baselineLow;
        }

        public int getBaselineMedium() {
            return baselineMedium;
        }

        public void setBaselineMedium(int baselineMedium) {
            this.baselineMedium = baselineMedium;
        }

        public int getBaselineHigh() {
            return baselineHigh;
        }

        public void setBaselineHigh(int baselineHigh) {
            this.baselineHigh = baselineHigh;
        }
    }

    /**
     * Metrics sink properties.
     */
    public static class MetricsProperties {

        /**
         * Samples kept in memory per metric key.
         */
        private int bufferSize = 1000;

        /**
         * Alerts kept in memory; resolved alerts are evicted first.
         */
        private int alertCapacity = 1000;

        /**
         * Write every sample to the metric_sample table.
         */
        private boolean persistSamples = false;

        /**
         * Interval of the SLA evaluation cycle; started with the application when auto-start is on.
         */
        private Duration monitoringInterval = Duration.ofSeconds(30);

        /**
         * Start the SLA cycle and resource sampler when the application is ready.
         */
        private boolean autoStart = false;

        // Getters and setters

        public int getBufferSize() {
            return bufferSize;
        }

        public void setBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
        }

        public int getAlertCapacity() {
            return alertCapacity;
        }

        public void setAlertCapacity(int alertCapacity) {
            this.alertCapacity = alertCapacity;
        }

        public boolean isPersistSamples() {
            return persistSamples;
        }

        public void setPersistSamples(boolean persistSamples) {
            this.persistSamples = persistSamples;
        }

        public Duration getMonitoringInterval() {
            return monitoringInterval;
        }

        public void setMonitoringInterval(Duration monitoringInterval) {
            this.monitoringInterval = monitoringInterval;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }
}
