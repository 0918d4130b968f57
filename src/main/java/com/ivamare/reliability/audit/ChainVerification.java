package com.ivamare.reliability.audit;

import java.util.List;

/**
 * Result of walking a sequence of audit entries.
 *
 * @param valid True when no violation was found
 * @param integrityScore Valid entries over total, rounded to 4 decimals; 1.0 when empty
 * @param chainLength Entries examined
 * @param corruptedEntryIds Ids of entries that failed
 * @param violations Violations found
 */
public record ChainVerification(
    boolean valid,
    double integrityScore,
    int chainLength,
    List<String> corruptedEntryIds,
    List<ChainViolation> violations
) {
    public ChainVerification {
        corruptedEntryIds = List.copyOf(corruptedEntryIds);
        violations = List.copyOf(violations);
    }

    public static ChainVerification empty() {
        return new ChainVerification(true, 1.0, 0, List.of(), List.of());
    }

    static double round(double score) {
        return Math.round(score * 10000.0) / 10000.0;
    }
}
