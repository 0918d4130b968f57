package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.audit.FinancialEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Heuristic suspicious-activity flags supplied by upstream detection.
 */
public class SuspiciousActivityCheck implements ComplianceCheck {

    @Override
    public String name() {
        return "SUSPICIOUS_ACTIVITY";
    }

    @Override
    public ComplianceCheckResult evaluate(FinancialEvent event) {
        List<String> violations = new ArrayList<>();
        if (MetadataValues.isSet(event.metadata(), "unusualPattern")) {
            violations.add("Unusual transaction pattern detected");
        }
        if (MetadataValues.isSet(event.metadata(), "rapidSequence")) {
            violations.add("Rapid sequence of transactions detected");
        }
        if (MetadataValues.isSet(event.metadata(), "crossBorder")
                && !MetadataValues.isSet(event.metadata(), "approvedCrossBorder")) {
            violations.add("Cross-border transaction without proper approval");
        }
        return ComplianceCheckResult.of(name(), violations);
    }
}
