package io.github.azauth.tokenprovider;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * One-way hashing of secrets for use in cache keys.
 */
final class SecretHash {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private SecretHash() {
        // Utility class
    }

    /**
     * Returns the lowercase hex SHA-256 digest of the secret. A null secret hashes as empty.
     */
    static String sha256(String secret) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] hash = digest.digest((secret != null ? secret : "").getBytes(StandardCharsets.UTF_8));
        char[] out = new char[hash.length * 2];
        for (int i = 0; i < hash.length; i++) {
            out[i * 2] = HEX[(hash[i] >> 4) & 0xF];
            out[i * 2 + 1] = HEX[hash[i] & 0xF];
        }
        return new String(out);
    }
}
