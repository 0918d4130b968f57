package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.audit.AuditEntry;

import java.util.List;

/**
 * Framework-specific analysis run while generating a compliance report.
 */
public interface FrameworkAnalyzer {

    /**
     * @param entries Entries in the report period, oldest first
     * @return findings, possibly empty
     */
    List<ComplianceFinding> analyze(List<AuditEntry> entries);
}
