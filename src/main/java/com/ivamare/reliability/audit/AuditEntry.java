package com.ivamare.reliability.audit;

import com.ivamare.reliability.model.AuditOutcome;
import com.ivamare.reliability.support.CanonicalJson;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable, hash-chained audit entry.
 *
 * <p>{@code chainHash} is the SHA-256 of the entry's canonical content followed by
 * {@code previousHash}; {@code signature} is derived from {@code chainHash}. Within a
 * chain, each entry's {@code previousHash} equals the prior entry's {@code chainHash}
 * and the first entry's is empty. {@code details} is deep-copied into unmodifiable
 * maps and lists.
 *
 * @param id Unique entry id
 * @param chainId Logical chain
 * @param timestamp Creation time, millisecond precision
 * @param eventType Event type
 * @param entityId Entity the event concerns
 * @param entityType Kind of entity
 * @param actor Who caused the event
 * @param action What was done
 * @param resource Resource acted on (nullable)
 * @param outcome Outcome
 * @param details Structured payload
 * @param signature Signature over {@code chainHash}
 * @param previousHash Chain hash of the prior entry in the chain, or empty
 * @param chainHash Hash of this entry's content and {@code previousHash}
 */
public record AuditEntry(
    String id,
    String chainId,
    Instant timestamp,
    String eventType,
    String entityId,
    String entityType,
    String actor,
    String action,
    String resource,
    AuditOutcome outcome,
    Map<String, Object> details,
    String signature,
    String previousHash,
    String chainHash
) {
    public AuditEntry {
        details = CanonicalJson.immutableCopy(details);
    }

    public boolean isFirstInChain() {
        return previousHash == null || previousHash.isEmpty();
    }

    /**
     * Returns a copy with different details. Used to model tampering.
     */
    public AuditEntry withDetails(Map<String, Object> newDetails) {
        return new AuditEntry(id, chainId, timestamp, eventType, entityId, entityType, actor,
            action, resource, outcome, newDetails, signature, previousHash, chainHash);
    }

    /**
     * Returns a copy with a different outcome. Used to model tampering.
     */
    public AuditEntry withOutcome(AuditOutcome newOutcome) {
        return new AuditEntry(id, chainId, timestamp, eventType, entityId, entityType, actor,
            action, resource, newOutcome, details, signature, previousHash, chainHash);
    }
}
