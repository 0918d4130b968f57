package com.ivamare.reliability.health;

import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.audit.ChainVerification;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the audit ledger.
 *
 * <p>Reports the number of chains held in memory and the result of the latest
 * verification. A failed verification reports DOWN.
 */
public class AuditLedgerHealthIndicator implements HealthIndicator {

    private final AuditLedger auditLedger;

    public AuditLedgerHealthIndicator(AuditLedger auditLedger) {
        this.auditLedger = auditLedger;
    }

    @Override
    public Health health() {
        ChainVerification last = auditLedger.getLastVerification();
        Health.Builder builder = last == null || last.valid() ? Health.up() : Health.down();
        builder.withDetail("chains", auditLedger.chainIds().size());
        if (last == null) {
            return builder.withDetail("lastVerification", "none").build();
        }
        return builder
            .withDetail("lastVerification", last.valid() ? "valid" : "invalid")
            .withDetail("integrityScore", last.integrityScore())
            .withDetail("chainLength", last.chainLength())
            .withDetail("corruptedEntries", last.corruptedEntryIds().size())
            .build();
    }
}
