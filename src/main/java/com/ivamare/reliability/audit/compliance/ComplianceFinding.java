package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.model.Severity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One finding in a compliance report.
 *
 * @param severity Finding severity
 * @param category Finding category, e.g. {@code RAPID_TRANSACTIONS}
 * @param description What was found
 * @param evidence Ids of audit entries supporting the finding
 * @param recommendation Suggested remediation
 */
public record ComplianceFinding(
    Severity severity,
    String category,
    String description,
    List<String> evidence,
    String recommendation
) {
    public ComplianceFinding {
        evidence = List.copyOf(evidence);
    }

    /**
     * Hashable form of the finding, without evidence.
     */
    Map<String, Object> withoutEvidence() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("severity", severity.name());
        content.put("category", category);
        content.put("description", description);
        content.put("recommendation", recommendation);
        return content;
    }
}
