package com.ivamare.reliability.repository;

import com.ivamare.reliability.batching.DeadLetter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Store for failed sub-batches awaiting replay.
 */
public interface DeadLetterQueue {

    /**
     * Queue a letter.
     *
     * @return the letter's id
     */
    String enqueue(DeadLetter letter);

    Optional<DeadLetter> findById(String id);

    /**
     * PENDING letters whose next retry is due, oldest first.
     *
     * @param now Reference time for {@code nextRetryAt}
     * @param limit Maximum letters returned
     */
    List<DeadLetter> findDue(Instant now, int limit);

    /**
     * Record the outcome of a replay. Success moves the letter to COMPLETED;
     * failure moves it to FAILED.
     */
    void markProcessed(String id, boolean success, Instant processedAt);
}
