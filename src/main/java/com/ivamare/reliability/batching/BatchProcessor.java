package com.ivamare.reliability.batching;

import java.util.List;

/**
 * Caller-supplied work for one sub-batch.
 *
 * <p>Must be safe to retry at sub-batch granularity: a failed sub-batch is
 * dead-lettered on its own and may be replayed later.
 *
 * @param <T> item type
 */
@FunctionalInterface
public interface BatchProcessor<T> {

    /**
     * Process one sub-batch.
     *
     * @param batch Consecutive slice of the call's items
     * @param characteristics Characteristics passed to the batch call
     * @return outcome of the sub-batch
     * @throws Exception to fail the whole sub-batch
     */
    SubBatchOutcome process(List<T> batch, DataCharacteristics characteristics) throws Exception;
}
