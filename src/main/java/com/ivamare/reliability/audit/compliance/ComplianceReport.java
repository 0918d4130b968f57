package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.model.ComplianceFramework;
import com.ivamare.reliability.support.CanonicalJson;
import com.ivamare.reliability.support.Hashing;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Regulatory report over a period of the audit ledger.
 *
 * <p>{@code integrityHash} covers the framework, the period, the summary and the
 * findings with their evidence removed, so the report can be checked on its own
 * with {@link #verifyIntegrity(CanonicalJson)}.
 *
 * @param reportId Report id
 * @param framework Framework reported against
 * @param periodStart Inclusive period start
 * @param periodEnd Inclusive period end
 * @param generatedAt Generation time
 * @param totalEntries Entries in the period
 * @param summary Aggregate figures
 * @param findings Findings
 * @param signatures Report signatures
 * @param integrityHash SHA-256 over the hashable content
 */
public record ComplianceReport(
    String reportId,
    ComplianceFramework framework,
    Instant periodStart,
    Instant periodEnd,
    Instant generatedAt,
    int totalEntries,
    ReportSummary summary,
    List<ComplianceFinding> findings,
    ReportSignatures signatures,
    String integrityHash
) {
    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public ComplianceReport {
        findings = List.copyOf(findings);
    }

    /**
     * Recompute the integrity hash and compare.
     */
    public boolean verifyIntegrity(CanonicalJson json) {
        return Hashing.matches(
            computeIntegrityHash(json, framework, periodStart, periodEnd, summary, findings),
            integrityHash);
    }

    public boolean hasFinding(String category) {
        return findings.stream().anyMatch(f -> f.category().equals(category));
    }

    static String computeIntegrityHash(
            CanonicalJson json,
            ComplianceFramework framework,
            Instant periodStart,
            Instant periodEnd,
            ReportSummary summary,
            List<ComplianceFinding> findings) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("framework", framework.getValue());
        content.put("startDate", TIMESTAMP.format(periodStart));
        content.put("endDate", TIMESTAMP.format(periodEnd));
        content.put("totalTransactions", summary.totalTransactions());
        content.put("totalAmount", summary.totalAmount());
        content.put("errorCount", summary.errorCount());
        content.put("complianceScore", summary.complianceScore());
        content.put("findings", findings.stream().map(ComplianceFinding::withoutEvidence).toList());
        return Hashing.sha256Hex(json.write(content));
    }
}
