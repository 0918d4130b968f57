package com.ivamare.reliability.support;

import com.ivamare.reliability.audit.AuditEntry;
import com.ivamare.reliability.repository.AuditEntryRepository;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Audit store backed by a list. Can be told to fail writes.
 */
public class InMemoryAuditEntryRepository implements AuditEntryRepository {

    private final List<AuditEntry> entries = new ArrayList<>();
    private volatile boolean failWrites;

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    @Override
    public synchronized void save(AuditEntry entry) {
        if (failWrites) {
            throw new DataAccessResourceFailureException("audit store unavailable");
        }
        entries.add(entry);
    }

    @Override
    public synchronized Optional<AuditEntry> findLatest(String chainId) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).chainId().equals(chainId)) {
                return Optional.of(entries.get(i));
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<AuditEntry> findByChain(String chainId, Instant from, Instant to) {
        return find(e -> e.chainId().equals(chainId), from, to);
    }

    @Override
    public synchronized List<AuditEntry> findByEntity(String entityId, Instant from, Instant to) {
        return find(e -> e.entityId().equals(entityId), from, to);
    }

    /**
     * Overwrite a stored entry, simulating tampering at rest.
     */
    public synchronized void replace(AuditEntry entry) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).id().equals(entry.id())) {
                entries.set(i, entry);
                return;
            }
        }
        throw new IllegalArgumentException("No stored entry " + entry.id());
    }

    public synchronized List<AuditEntry> all() {
        return List.copyOf(entries);
    }

    private List<AuditEntry> find(Predicate<AuditEntry> filter, Instant from, Instant to) {
        List<AuditEntry> result = new ArrayList<>();
        for (AuditEntry e : entries) {
            if (filter.test(e)
                    && (from == null || !e.timestamp().isBefore(from))
                    && (to == null || !e.timestamp().isAfter(to))) {
                result.add(e);
            }
        }
        return result;
    }
}
