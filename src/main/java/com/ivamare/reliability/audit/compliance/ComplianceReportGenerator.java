package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.audit.AuditEntry;
import com.ivamare.reliability.audit.EntrySigner;
import com.ivamare.reliability.exception.UnsupportedFrameworkException;
import com.ivamare.reliability.model.AuditOutcome;
import com.ivamare.reliability.model.ComplianceFramework;
import com.ivamare.reliability.model.Severity;
import com.ivamare.reliability.support.CanonicalJson;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds compliance reports from a period's audit entries.
 *
 * <p>Every framework gets the generic HIGH_VALUE_TRANSACTIONS and HIGH_FAILURE_RATE
 * findings; AML and PCI-DSS add their own analyzers' findings.
 */
public class ComplianceReportGenerator {

    private static final double FAILURE_RATE_THRESHOLD = 0.05;

    private final ComplianceRuleCatalog catalog;
    private final EntrySigner signer;
    private final CanonicalJson json;
    private final BigDecimal defaultHighValueThreshold;
    private final Map<ComplianceFramework, FrameworkAnalyzer> analyzers;
    private final Clock clock;

    public ComplianceReportGenerator(
            ComplianceRuleCatalog catalog,
            EntrySigner signer,
            CanonicalJson json,
            BigDecimal defaultHighValueThreshold,
            Clock clock) {
        this.catalog = catalog;
        this.signer = signer;
        this.json = json;
        this.defaultHighValueThreshold = defaultHighValueThreshold;
        this.clock = clock;
        this.analyzers = new EnumMap<>(ComplianceFramework.class);
        this.analyzers.put(ComplianceFramework.AML, new AmlAnalyzer());
        this.analyzers.put(ComplianceFramework.PCI_DSS, new PciDssAnalyzer());
    }

    /**
     * Resolve a framework name against the catalog.
     *
     * @throws UnsupportedFrameworkException if the name is unknown or has no rule
     */
    public ComplianceRule resolveRule(String framework) {
        ComplianceFramework resolved = ComplianceFramework.fromValue(framework);
        if (resolved == null) {
            throw new UnsupportedFrameworkException(framework);
        }
        return catalog.findByFramework(resolved)
            .orElseThrow(() -> new UnsupportedFrameworkException(framework));
    }

    /**
     * Generate a report.
     *
     * @param rule Rule of the framework reported against
     * @param start Period start
     * @param end Period end
     * @param entries Entries in the period, oldest first
     */
    public ComplianceReport generate(ComplianceRule rule, Instant start, Instant end, List<AuditEntry> entries) {
        List<AuditEntry> financial = entries.stream()
            .filter(e -> amountOf(e) != null)
            .toList();
        BigDecimal totalAmount = financial.stream()
            .map(ComplianceReportGenerator::amountOf)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        int errorCount = (int) entries.stream().filter(e -> e.outcome() == AuditOutcome.FAILURE).count();
        long successCount = entries.stream().filter(e -> e.outcome() == AuditOutcome.SUCCESS).count();
        double complianceScore = entries.isEmpty() ? 100.0 : (successCount * 100.0) / entries.size();

        ReportSummary summary = new ReportSummary(financial.size(), totalAmount, errorCount, complianceScore);
        List<ComplianceFinding> findings = analyze(rule, entries, financial);

        String headline = rule.framework().getValue() + ":" + summary.totalTransactions() + ":"
            + totalAmount.toPlainString() + ":" + complianceScore;
        ReportSignatures signatures = new ReportSignatures(
            signer.sign("SYSTEM:" + headline),
            signer.sign("REVIEWER:" + headline),
            signer.sign("VALIDATOR:" + headline));

        String integrityHash = ComplianceReport.computeIntegrityHash(
            json, rule.framework(), start, end, summary, findings);

        return new ComplianceReport(
            "report_" + UUID.randomUUID(),
            rule.framework(),
            start,
            end,
            clock.instant(),
            entries.size(),
            summary,
            findings,
            signatures,
            integrityHash);
    }

    private List<ComplianceFinding> analyze(ComplianceRule rule, List<AuditEntry> entries,
                                            List<AuditEntry> financial) {
        List<ComplianceFinding> findings = new ArrayList<>();

        BigDecimal highValue = rule.decimalCriterion("highValueThreshold", defaultHighValueThreshold);
        List<String> highValueIds = financial.stream()
            .filter(e -> amountOf(e).compareTo(highValue) > 0)
            .map(AuditEntry::id)
            .toList();
        if (!highValueIds.isEmpty()) {
            findings.add(new ComplianceFinding(
                Severity.HIGH,
                "HIGH_VALUE_TRANSACTIONS",
                highValueIds.size() + " transactions exceed high-value threshold",
                highValueIds.subList(0, Math.min(5, highValueIds.size())),
                "Review and document justification for high-value transactions"));
        }

        List<String> failedIds = entries.stream()
            .filter(e -> e.outcome() == AuditOutcome.FAILURE)
            .map(AuditEntry::id)
            .toList();
        if (!entries.isEmpty() && failedIds.size() > entries.size() * FAILURE_RATE_THRESHOLD) {
            long percent = Math.round(failedIds.size() * 100.0 / entries.size());
            findings.add(new ComplianceFinding(
                Severity.MEDIUM,
                "HIGH_FAILURE_RATE",
                "Failure rate of " + percent + "% exceeds acceptable threshold",
                failedIds.subList(0, Math.min(3, failedIds.size())),
                "Investigate root causes of transaction failures"));
        }

        FrameworkAnalyzer analyzer = analyzers.get(rule.framework());
        if (analyzer != null) {
            findings.addAll(analyzer.analyze(entries));
        }
        return findings;
    }

    /**
     * Non-zero {@code details.amount} of an entry, or null.
     */
    static BigDecimal amountOf(AuditEntry entry) {
        BigDecimal amount = MetadataValues.toDecimal(entry.details().get("amount"));
        return amount != null && amount.signum() != 0 ? amount : null;
    }
}
