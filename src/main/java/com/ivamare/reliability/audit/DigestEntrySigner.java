package com.ivamare.reliability.audit;

import com.ivamare.reliability.support.Hashing;

/**
 * Keyless signer: {@code "SIG_"} followed by the first 16 hex characters of the
 * SHA-256 of the data.
 *
 * <p>This proves the internal consistency of an entry, not who wrote it. Anyone with
 * write access to the ledger store can produce matching signatures; use
 * {@link HmacEntrySigner} when that matters.
 */
public class DigestEntrySigner implements EntrySigner {

    private static final String PREFIX = "SIG_";

    @Override
    public String sign(String data) {
        return PREFIX + Hashing.sha256Hex(data).substring(0, 16);
    }
}
