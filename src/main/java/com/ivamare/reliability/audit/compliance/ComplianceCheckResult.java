package com.ivamare.reliability.audit.compliance;

import java.util.List;

/**
 * Outcome of one compliance check on a financial event.
 *
 * @param check Check name, e.g. {@code AML}
 * @param compliant True when no violation was found
 * @param violations Violation messages
 */
public record ComplianceCheckResult(String check, boolean compliant, List<String> violations) {

    public ComplianceCheckResult {
        violations = List.copyOf(violations);
    }

    public static ComplianceCheckResult of(String check, List<String> violations) {
        return new ComplianceCheckResult(check, violations.isEmpty(), violations);
    }
}
