package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.model.ComplianceFramework;
import com.ivamare.reliability.model.Severity;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog of compliance rules, keyed by rule id.
 */
public final class ComplianceRuleCatalog {

    private final Map<String, ComplianceRule> rules;

    public ComplianceRuleCatalog(Collection<ComplianceRule> rules) {
        Map<String, ComplianceRule> byId = new LinkedHashMap<>();
        for (ComplianceRule rule : rules) {
            byId.put(rule.ruleId(), rule);
        }
        this.rules = Collections.unmodifiableMap(byId);
    }

    /**
     * Catalog with the AML-001, KYC-001, SOX-001 and PCI-001 rules.
     *
     * @param highValueThreshold AML high-value amount
     */
    public static ComplianceRuleCatalog defaults(BigDecimal highValueThreshold) {
        return new ComplianceRuleCatalog(List.of(
            new ComplianceRule(
                "AML-001",
                "Anti-Money Laundering Monitoring",
                "Monitor transactions for suspicious money laundering activities",
                ComplianceFramework.AML,
                Severity.CRITICAL,
                true,
                5,
                Map.of(
                    "highValueThreshold", highValueThreshold,
                    "rapidTransactionThreshold", 5,
                    "timeWindowSeconds", 3600)),
            new ComplianceRule(
                "KYC-001",
                "Know Your Customer Verification",
                "Ensure proper customer identity verification",
                ComplianceFramework.KYC,
                Severity.HIGH,
                true,
                7,
                Map.of(
                    "requiresIdentityVerification", true,
                    "requiresAddressVerification", true,
                    "requiresSourceOfFunds", true)),
            new ComplianceRule(
                "SOX-001",
                "Sarbanes-Oxley Financial Controls",
                "Ensure financial controls and reporting compliance",
                ComplianceFramework.SOX,
                Severity.HIGH,
                true,
                7,
                Map.of(
                    "requiresDualAuthorization", true,
                    "requiresAuditTrail", true,
                    "requiresReconciliation", true)),
            new ComplianceRule(
                "PCI-001",
                "Payment Card Industry Data Security",
                "Protect payment card data and ensure PCI compliance",
                ComplianceFramework.PCI_DSS,
                Severity.CRITICAL,
                true,
                1,
                Map.of(
                    "requiresEncryption", true,
                    "requiresAccessControls", true,
                    "requiresNetworkMonitoring", true))
        ));
    }

    public Optional<ComplianceRule> findById(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public Optional<ComplianceRule> findByFramework(ComplianceFramework framework) {
        return rules.values().stream()
            .filter(rule -> rule.framework() == framework)
            .findFirst();
    }

    public Collection<ComplianceRule> all() {
        return rules.values();
    }

    /**
     * Distinct frameworks covered by the catalog, in rule order.
     */
    public List<ComplianceFramework> frameworks() {
        return rules.values().stream()
            .map(ComplianceRule::framework)
            .distinct()
            .toList();
    }
}
