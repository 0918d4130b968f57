package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.audit.AuditEntry;
import com.ivamare.reliability.model.Severity;

import java.util.List;
import java.util.Map;

/**
 * Flags entries whose {@code details.metadata} marks card data as present but not encrypted.
 */
public class PciDssAnalyzer implements FrameworkAnalyzer {

    @Override
    public List<ComplianceFinding> analyze(List<AuditEntry> entries) {
        List<String> unencrypted = entries.stream()
            .filter(entry -> {
                Map<String, Object> metadata = MetadataValues.nested(entry.details(), "metadata");
                return MetadataValues.isSet(metadata, "containsCardData")
                    && !MetadataValues.isSet(metadata, "encrypted");
            })
            .map(AuditEntry::id)
            .toList();

        if (unencrypted.isEmpty()) {
            return List.of();
        }
        return List.of(new ComplianceFinding(
            Severity.CRITICAL,
            "UNENCRYPTED_CARD_DATA",
            "Unencrypted payment card data detected",
            unencrypted.subList(0, Math.min(3, unencrypted.size())),
            "Implement immediate data encryption and secure transmission protocols"));
    }
}
