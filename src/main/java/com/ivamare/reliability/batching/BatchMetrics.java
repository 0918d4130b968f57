package com.ivamare.reliability.batching;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Measurements for one sub-batch, or for a whole batch call.
 *
 * @param batchSize Items in the batch
 * @param processingTimeMs Wall time spent
 * @param memoryUsedBytes Heap in use when measured
 * @param throughput Processed items per second
 * @param errorRate Errors / items, 0..1
 * @param dataIntegrityScore Processed items / items, 0..1
 * @param financialAmount Financial value carried by the batch
 * @param compliancePassed Whether the financial pre-flight gate passed
 * @param recordedAt When the metrics were taken
 */
public record BatchMetrics(
    int batchSize,
    long processingTimeMs,
    long memoryUsedBytes,
    double throughput,
    double errorRate,
    double dataIntegrityScore,
    BigDecimal financialAmount,
    boolean compliancePassed,
    Instant recordedAt
) {
}
