package com.ivamare.reliability.audit.compliance;

/**
 * System, reviewer and validator signatures over a report's headline figures.
 */
public record ReportSignatures(String system, String reviewer, String validator) {
}
