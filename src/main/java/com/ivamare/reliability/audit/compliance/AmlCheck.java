package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.audit.FinancialEvent;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Anti-money-laundering check: high value, structuring and high-risk jurisdictions.
 */
public class AmlCheck implements ComplianceCheck {

    private final BigDecimal highValueThreshold;

    public AmlCheck(BigDecimal highValueThreshold) {
        this.highValueThreshold = highValueThreshold;
    }

    @Override
    public String name() {
        return "AML";
    }

    @Override
    public ComplianceCheckResult evaluate(FinancialEvent event) {
        List<String> violations = new ArrayList<>();
        if (event.amount() != null && event.amount().compareTo(highValueThreshold) > 0) {
            violations.add("High-value transaction requires enhanced due diligence");
        }
        if (MetadataValues.isSet(event.metadata(), "structuredTransaction")) {
            violations.add("Potential structuring detected");
        }
        if (MetadataValues.isSet(event.metadata(), "highRiskJurisdiction")) {
            violations.add("High-risk jurisdiction involved");
        }
        return ComplianceCheckResult.of(name(), violations);
    }
}
