package com.ivamare.reliability.repository;

import com.ivamare.reliability.audit.AuditEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only durable store for audit entries.
 */
public interface AuditEntryRepository {

    /**
     * Append one entry. Must be atomic.
     *
     * @param entry the entry
     */
    void save(AuditEntry entry);

    /**
     * Most recent entry of a chain.
     *
     * @param chainId the chain
     * @return the chain head, or empty for a new chain
     */
    Optional<AuditEntry> findLatest(String chainId);

    /**
     * Entries of a chain, oldest first.
     *
     * @param chainId the chain
     * @param from Inclusive lower bound (nullable)
     * @param to Inclusive upper bound (nullable)
     * @return entries in append order
     */
    List<AuditEntry> findByChain(String chainId, Instant from, Instant to);

    /**
     * Entries about one entity across chains, oldest first.
     *
     * @param entityId the entity
     * @param from Inclusive lower bound (nullable)
     * @param to Inclusive upper bound (nullable)
     * @return entries in time order
     */
    List<AuditEntry> findByEntity(String entityId, Instant from, Instant to);
}
