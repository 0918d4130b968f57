package com.ivamare.reliability.job;

/**
 * Probable cause of a predicted failure.
 */
public enum FailureCategory {
    MEMORY,
    DATABASE,
    NETWORK,
    BUSINESS_LOGIC,
    UNKNOWN
}
