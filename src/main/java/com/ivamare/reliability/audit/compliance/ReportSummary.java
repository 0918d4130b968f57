package com.ivamare.reliability.audit.compliance;

import java.math.BigDecimal;

/**
 * Aggregates over the entries of a compliance report.
 *
 * @param totalTransactions Entries carrying a non-zero amount
 * @param totalAmount Sum of those amounts
 * @param errorCount Entries with outcome FAILURE
 * @param complianceScore Share of SUCCESS outcomes in percent; 100 when empty
 */
public record ReportSummary(
    int totalTransactions,
    BigDecimal totalAmount,
    int errorCount,
    double complianceScore
) {
}
