package oktaauth.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for deriving keys from secrets and for fingerprinting
 * secrets in logs.
 */
public final class SecureHash {

    private static final int FINGERPRINT_HEX_CHARS = 12;

    private SecureHash() {}

    /**
     * Return the SHA-256 digest of a UTF-8 string.
     */
    public static byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 not available", e);
        }
    }

    /**
     * Short hex fingerprint of a secret, safe to log.
     */
    public static String fingerprint(String secret) {
        return HexFormat.of().formatHex(sha256(secret)).substring(0, FINGERPRINT_HEX_CHARS);
    }
}
