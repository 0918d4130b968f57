package com.ivamare.reliability.audit;

import com.ivamare.reliability.model.AuditOutcome;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied part of an audit entry. The ledger adds id, timestamp and hashes.
 *
 * @param chainId Logical chain the entry is appended to; defaults to {@code entityId}
 * @param eventType Event type, e.g. {@code CIRCUIT_BREAKER_STATE_CHANGED}
 * @param entityId Entity the event concerns
 * @param entityType Kind of entity
 * @param actor Who caused the event
 * @param action What was done
 * @param resource Resource acted on (nullable)
 * @param outcome Outcome of the action
 * @param details Structured payload (never null)
 */
public record AuditRecord(
    String chainId,
    String eventType,
    String entityId,
    String entityType,
    String actor,
    String action,
    String resource,
    AuditOutcome outcome,
    Map<String, Object> details
) {
    public AuditRecord {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(outcome, "outcome");
        if (chainId == null) {
            chainId = entityId;
        }
        details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
    }

    public static Builder builder(String eventType, String entityId) {
        return new Builder(eventType, entityId);
    }

    /**
     * Builder for audit records. Actor defaults to {@code SYSTEM}, outcome to SUCCESS.
     */
    public static final class Builder {
        private final String eventType;
        private final String entityId;
        private String chainId;
        private String entityType = "SYSTEM";
        private String actor = "SYSTEM";
        private String action;
        private String resource;
        private AuditOutcome outcome = AuditOutcome.SUCCESS;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(String eventType, String entityId) {
            this.eventType = eventType;
            this.entityId = entityId;
            this.action = eventType;
        }

        public Builder chainId(String chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder outcome(AuditOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder detail(String key, Object value) {
            this.details.put(key, value);
            return this;
        }

        public Builder details(Map<String, Object> values) {
            if (values != null) {
                this.details.putAll(values);
            }
            return this;
        }

        public AuditRecord build() {
            return new AuditRecord(chainId, eventType, entityId, entityType, actor, action,
                resource, outcome, details);
        }
    }
}
