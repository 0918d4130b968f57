package com.ivamare.reliability.batching;

/**
 * What a {@link BatchProcessor} reports for one sub-batch.
 *
 * @param processed Items handled successfully
 * @param errors Items the processor rejected without failing the sub-batch
 * @param processingTimeMs Time the processor reports for itself; informational
 * @param result Optional payload returned to the caller in {@link BatchResult#outcomes()}
 */
public record SubBatchOutcome(
    long processed,
    long errors,
    long processingTimeMs,
    Object result
) {
    public SubBatchOutcome {
        if (processed < 0 || errors < 0) {
            throw new IllegalArgumentException("processed and errors must not be negative");
        }
    }

    /**
     * All items processed, no payload.
     */
    public static SubBatchOutcome processed(long count) {
        return new SubBatchOutcome(count, 0, 0, null);
    }

    /**
     * Some items rejected, no payload.
     */
    public static SubBatchOutcome partial(long processed, long errors) {
        return new SubBatchOutcome(processed, errors, 0, null);
    }
}
