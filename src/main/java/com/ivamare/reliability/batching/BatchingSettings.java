package com.ivamare.reliability.batching;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunables of the {@link BatchingEngine}.
 *
 * @param minBatchSize Smallest sub-batch, unless fewer items remain
 * @param maxBatchSize Largest sub-batch
 * @param targetProcessingTime Target wall time of one sub-batch
 * @param maxFinancialBatchValue Ceiling on the total value of one call
 * @param historyCapacity Sub-batch metrics kept for adaptation and analytics
 * @param abortErrorRatio Share of failed items above which a call is aborted
 * @param deadLetterMaxRetries Replays allowed per dead letter
 * @param serviceName Circuit breaker that sub-batches run under
 * @param cpuYieldDelay Pause before a sub-batch when the CPU allocation is saturated
 * @param adaptive Whether catalog batch sizes adapt to recent performance
 */
public record BatchingSettings(
    int minBatchSize,
    int maxBatchSize,
    Duration targetProcessingTime,
    BigDecimal maxFinancialBatchValue,
    int historyCapacity,
    double abortErrorRatio,
    int deadLetterMaxRetries,
    String serviceName,
    Duration cpuYieldDelay,
    boolean adaptive
) {
    public BatchingSettings {
        if (minBatchSize <= 0 || maxBatchSize < minBatchSize) {
            throw new IllegalArgumentException(
                "Invalid batch size bounds: min=" + minBatchSize + ", max=" + maxBatchSize);
        }
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be positive");
        }
    }

    public static BatchingSettings defaults() {
        return new BatchingSettings(100, 10000, Duration.ofSeconds(5), new BigDecimal("10000000"),
            500, 0.1, 3, "batch_processing", Duration.ofMillis(100), true);
    }

    public BatchingSettings withCpuYieldDelay(Duration delay) {
        return new BatchingSettings(minBatchSize, maxBatchSize, targetProcessingTime, maxFinancialBatchValue,
            historyCapacity, abortErrorRatio, deadLetterMaxRetries, serviceName, delay, adaptive);
    }

    public BatchingSettings withMaxFinancialBatchValue(BigDecimal value) {
        return new BatchingSettings(minBatchSize, maxBatchSize, targetProcessingTime, value,
            historyCapacity, abortErrorRatio, deadLetterMaxRetries, serviceName, cpuYieldDelay, adaptive);
    }

    public BatchingSettings withAdaptive(boolean enabled) {
        return new BatchingSettings(minBatchSize, maxBatchSize, targetProcessingTime, maxFinancialBatchValue,
            historyCapacity, abortErrorRatio, deadLetterMaxRetries, serviceName, cpuYieldDelay, enabled);
    }
}
