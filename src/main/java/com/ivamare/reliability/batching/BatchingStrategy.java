package com.ivamare.reliability.batching;

/**
 * A named batch size and concurrency suited to certain {@link StrategyConditions}.
 *
 * <p>Instances are immutable. Adaptive resizing replaces them in the
 * {@link StrategyCatalog} through {@link #withBatchSize(int)}.
 *
 * @param name Unique strategy name
 * @param conditions Conditions the strategy is tuned for
 * @param batchSize Base sub-batch size
 * @param concurrency Concurrency the strategy allows
 * @param priority Tie-breaker when scores are equal; higher wins
 */
public record BatchingStrategy(
    String name,
    StrategyConditions conditions,
    int batchSize,
    int concurrency,
    int priority
) {
    public BatchingStrategy {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
    }

    public BatchingStrategy withBatchSize(int newBatchSize) {
        return new BatchingStrategy(name, conditions, newBatchSize, concurrency, priority);
    }

    /**
     * Score this strategy for the current system status and data.
     *
     * <p>Type match +30, sensitivity match +25, memory headroom +20, CPU headroom +15,
     * failure-rate headroom +10, plus a tenth of the priority.
     */
    public double score(SystemStatus status, DataCharacteristics data) {
        double score = 0;
        if (conditions.dataType() == data.dataType()) {
            score += 30;
        }
        if (conditions.sensitivity() == data.sensitivity()) {
            score += 25;
        }
        if (status.memoryUsage() < conditions.maxMemoryUsage()) {
            score += 20;
        }
        if (status.cpuUsage() < conditions.maxCpuUsage()) {
            score += 15;
        }
        if (status.errorRate() < conditions.maxFailureRate()) {
            score += 10;
        }
        return score + priority * 0.1;
    }
}
