package com.ivamare.reliability.audit;

/**
 * Produces the signature stored on each audit entry and compliance report.
 *
 * <p>Signatures must be deterministic: verification recomputes and compares.
 */
public interface EntrySigner {

    /**
     * Sign a chain hash or report payload.
     *
     * @param data the data to sign
     * @return the signature token
     */
    String sign(String data);

    /**
     * Check a signature by recomputation.
     */
    default boolean verify(String data, String signature) {
        return signature != null && sign(data).equals(signature);
    }
}
