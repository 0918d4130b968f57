package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.audit.FinancialEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Know-your-customer check: identity verification and politically exposed persons.
 */
public class KycCheck implements ComplianceCheck {

    @Override
    public String name() {
        return "KYC";
    }

    @Override
    public ComplianceCheckResult evaluate(FinancialEvent event) {
        List<String> violations = new ArrayList<>();
        if (!MetadataValues.isSet(event.metadata(), "customerVerified")) {
            violations.add("Customer identity not verified");
        }
        if (MetadataValues.isSet(event.metadata(), "isPEP")) {
            violations.add("Politically Exposed Person - enhanced due diligence required");
        }
        return ComplianceCheckResult.of(name(), violations);
    }
}
