package com.ivamare.reliability.audit;

import com.ivamare.reliability.model.Severity;

/**
 * One integrity problem found while verifying a chain.
 *
 * @param entryId Failing entry, or {@code CHAIN} for a chain-level finding
 * @param description What failed
 * @param severity CRITICAL for entries, HIGH for the chain-level summary
 */
public record ChainViolation(String entryId, String description, Severity severity) {

    public static final String CHAIN = "CHAIN";
}
