package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.audit.AuditEntry;
import com.ivamare.reliability.model.Severity;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags possible structuring: two consecutive entries of one chain less than
 * {@code rapidWindow} apart. Reports only the first such pair.
 */
public class AmlAnalyzer implements FrameworkAnalyzer {

    public static final Duration DEFAULT_RAPID_WINDOW = Duration.ofSeconds(60);

    private final Duration rapidWindow;

    public AmlAnalyzer() {
        this(DEFAULT_RAPID_WINDOW);
    }

    public AmlAnalyzer(Duration rapidWindow) {
        this.rapidWindow = rapidWindow;
    }

    @Override
    public List<ComplianceFinding> analyze(List<AuditEntry> entries) {
        Map<String, AuditEntry> lastByChain = new LinkedHashMap<>();
        for (AuditEntry entry : entries) {
            AuditEntry previous = lastByChain.put(entry.chainId(), entry);
            if (previous != null
                    && Duration.between(previous.timestamp(), entry.timestamp()).compareTo(rapidWindow) < 0) {
                return List.of(new ComplianceFinding(
                    Severity.HIGH,
                    "RAPID_TRANSACTIONS",
                    "Rapid sequence of transactions detected - potential structuring",
                    List.of(previous.id(), entry.id()),
                    "Review transactions for potential money laundering activities"));
            }
        }
        return List.of();
    }
}
