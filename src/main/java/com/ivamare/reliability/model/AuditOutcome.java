package com.ivamare.reliability.model;

/**
 * Outcome recorded on an audit entry.
 */
public enum AuditOutcome {
    SUCCESS,
    FAILURE,
    WARNING
}
