package com.ivamare.reliability.batching;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one {@link BatchingEngine#processBatch} call.
 *
 * @param strategy Strategy the call ran with
 * @param batchSize Computed sub-batch size
 * @param outcomes Outcomes of the sub-batches that succeeded, in order
 * @param totalBatches Sub-batches dispatched, failed ones included
 * @param failedBatches Sub-batches that threw and were dead-lettered
 * @param totalProcessed Items processed
 * @param totalErrors Items that failed
 * @param averageProcessingTimeMs Mean wall time per sub-batch
 * @param metrics Metrics over the whole call; {@code batchSize} is the item count
 * @param resourceUsage Allocation the call ran under
 * @param deadLetterIds Dead letters written by the call
 * @param processedAt When the call finished
 */
public record BatchResult(
    BatchingStrategy strategy,
    int batchSize,
    List<SubBatchOutcome> outcomes,
    int totalBatches,
    int failedBatches,
    long totalProcessed,
    long totalErrors,
    double averageProcessingTimeMs,
    BatchMetrics metrics,
    ResourceAllocation resourceUsage,
    List<String> deadLetterIds,
    Instant processedAt
) {
    public BatchResult {
        outcomes = List.copyOf(outcomes);
        deadLetterIds = List.copyOf(deadLetterIds);
    }

    public boolean isSuccess() {
        return failedBatches == 0 && totalErrors == 0;
    }
}
