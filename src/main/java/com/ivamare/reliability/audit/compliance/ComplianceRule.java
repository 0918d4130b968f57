package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.model.ComplianceFramework;
import com.ivamare.reliability.model.Severity;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Static compliance rule for one framework.
 *
 * @param ruleId Rule id, e.g. {@code AML-001}
 * @param name Short name
 * @param description What the rule monitors
 * @param framework Framework the rule belongs to
 * @param severity Severity of a breach
 * @param requiresFullTrail Whether every related event must be on the ledger
 * @param retentionYears Years audit records must be retained
 * @param validationCriteria Thresholds and required controls
 */
public record ComplianceRule(
    String ruleId,
    String name,
    String description,
    ComplianceFramework framework,
    Severity severity,
    boolean requiresFullTrail,
    int retentionYears,
    Map<String, Object> validationCriteria
) {
    public ComplianceRule {
        validationCriteria = validationCriteria != null ? Map.copyOf(validationCriteria) : Map.of();
    }

    /**
     * Numeric criterion as a decimal, or the fallback when absent.
     */
    public BigDecimal decimalCriterion(String key, BigDecimal fallback) {
        Object value = validationCriteria.get(key);
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return fallback;
    }
}
