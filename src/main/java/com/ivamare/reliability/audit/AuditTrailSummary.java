package com.ivamare.reliability.audit;

import com.ivamare.reliability.model.ComplianceFramework;

import java.time.Instant;
import java.util.List;

/**
 * Headline figures of the in-memory audit trail over a period.
 *
 * @param totalEntries Entries in the period
 * @param financialEvents FINANCIAL_EVENT entries
 * @param complianceViolations COMPLIANCE_VIOLATION entries
 * @param averageIntegrityScore Verification integrity score in percent
 * @param frameworks Frameworks covered by the rule catalog
 * @param periodStart Period start (nullable)
 * @param periodEnd Period end (nullable)
 */
public record AuditTrailSummary(
    int totalEntries,
    int financialEvents,
    int complianceViolations,
    double averageIntegrityScore,
    List<ComplianceFramework> frameworks,
    Instant periodStart,
    Instant periodEnd
) {
}
