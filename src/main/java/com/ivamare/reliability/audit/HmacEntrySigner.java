package com.ivamare.reliability.audit;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Keyed signer using HmacSHA256. Signatures are {@code "HMAC_"} followed by the hex MAC.
 *
 * <p>Forging a signature requires the key, so a party that can write to the
 * ledger store but does not hold the key cannot re-sign tampered entries.
 */
public class HmacEntrySigner implements EntrySigner {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "HMAC_";

    private final SecretKeySpec key;

    public HmacEntrySigner(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("HMAC secret must not be empty");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    @Override
    public String sign(String data) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return PREFIX + HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute " + ALGORITHM, e);
        }
    }

    @Override
    public boolean verify(String data, String signature) {
        if (signature == null) {
            return false;
        }
        return MessageDigest.isEqual(
            sign(data).getBytes(StandardCharsets.UTF_8),
            signature.getBytes(StandardCharsets.UTF_8));
    }
}
