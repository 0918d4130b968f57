package com.ivamare.reliability.exception;

/**
 * Raised when an audit entry could not be made durable.
 *
 * <p>Ledger writes are never absorbed. The chain head is left untouched,
 * so a later append continues from the last durable entry.
 */
public class AuditWriteException extends ReliabilityException {

    private final String chainId;
    private final boolean transientFailure;

    public AuditWriteException(String chainId, boolean transientFailure, Throwable cause) {
        super("Failed to write audit entry to chain " + chainId
            + (transientFailure ? " (transient)" : ""), cause);
        this.chainId = chainId;
        this.transientFailure = transientFailure;
    }

    public String getChainId() {
        return chainId;
    }

    /**
     * Whether the underlying store failure looks temporary (connection loss, timeout).
     */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
