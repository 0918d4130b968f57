package com.ivamare.reliability.audit;

import com.ivamare.reliability.support.CanonicalJson;
import com.ivamare.reliability.support.Hashing;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Computes the canonical content and chain hash of audit entries.
 *
 * <p>The canonical content is the sorted-key JSON of id, chainId, timestamp,
 * eventType, entityId, entityType, actor, action, resource, outcome and details.
 * Signature and hashes are not part of it.
 */
public class AuditEntryHasher {

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final CanonicalJson json;

    public AuditEntryHasher(CanonicalJson json) {
        this.json = json;
    }

    public String canonicalContent(AuditEntry entry) {
        Map<String, Object> content = new HashMap<>();
        content.put("id", entry.id());
        content.put("chainId", entry.chainId());
        content.put("timestamp", TIMESTAMP.format(entry.timestamp()));
        content.put("eventType", entry.eventType());
        content.put("entityId", entry.entityId());
        content.put("entityType", entry.entityType());
        content.put("actor", entry.actor());
        content.put("action", entry.action());
        content.put("resource", entry.resource());
        content.put("outcome", entry.outcome() != null ? entry.outcome().name() : null);
        content.put("details", entry.details());
        return json.write(content);
    }

    /**
     * SHA-256 hex of the canonical content followed by the entry's previous hash.
     */
    public String chainHash(AuditEntry entry) {
        String previous = entry.previousHash() != null ? entry.previousHash() : "";
        return Hashing.sha256Hex(canonicalContent(entry) + previous);
    }

    /**
     * Round-trip details through canonical JSON so a stored and reloaded entry
     * renders to the same canonical content.
     */
    public Map<String, Object> normalizeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        return json.readMap(json.write(details));
    }

    public CanonicalJson json() {
        return json;
    }
}
