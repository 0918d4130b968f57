package com.ivamare.reliability.support;

import com.ivamare.reliability.batching.DeadLetter;
import com.ivamare.reliability.batching.DeadLetterStatus;
import com.ivamare.reliability.repository.DeadLetterQueue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dead-letter store backed by a map.
 */
public class InMemoryDeadLetterQueue implements DeadLetterQueue {

    private final Map<String, DeadLetter> letters = new LinkedHashMap<>();

    @Override
    public synchronized String enqueue(DeadLetter letter) {
        letters.put(letter.id(), letter);
        return letter.id();
    }

    @Override
    public synchronized Optional<DeadLetter> findById(String id) {
        return Optional.ofNullable(letters.get(id));
    }

    @Override
    public synchronized List<DeadLetter> findDue(Instant now, int limit) {
        return letters.values().stream()
            .filter(l -> l.status() == DeadLetterStatus.PENDING)
            .filter(l -> l.nextRetryAt() == null || !l.nextRetryAt().isAfter(now))
            .sorted(Comparator.comparing(DeadLetter::createdAt))
            .limit(limit)
            .toList();
    }

    @Override
    public synchronized void markProcessed(String id, boolean success, Instant processedAt) {
        DeadLetter l = letters.get(id);
        if (l == null) {
            return;
        }
        letters.put(id, new DeadLetter(l.id(), l.jobId(), l.executionId(), l.transactionId(), l.failureType(),
            l.failureReason(), l.payload(), l.retryCount() + 1, l.maxRetries(),
            success ? DeadLetterStatus.COMPLETED : DeadLetterStatus.FAILED, l.createdAt(), processedAt,
            l.nextRetryAt()));
    }

    public synchronized List<DeadLetter> all() {
        return new ArrayList<>(letters.values());
    }
}
