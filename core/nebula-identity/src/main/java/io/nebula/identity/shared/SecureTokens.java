package io.nebula.identity.shared;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Random token generation, hashing and comparison for session ids, CSRF state, nonces and account links.
 */
public final class SecureTokens {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private SecureTokens() {
    }

    /**
     * Generate a base64url token from the given number of random bytes.
     * 32 bytes gives 256 bits of entropy and 43 characters.
     */
    public static String generate(int byteLength) {
        byte[] bytes = new byte[byteLength];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Constant-time string comparison. Null on either side never matches.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(
            a.getBytes(StandardCharsets.UTF_8),
            b.getBytes(StandardCharsets.UTF_8)
        );
    }

    /**
     * Lower-case hex SHA-256 of a UTF-8 string, 64 characters.
     */
    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * First characters of a token, for log lines that must not carry the full value.
     */
    public static String prefix(String token) {
        if (token == null) {
            return "<none>";
        }
        return token.length() <= 8 ? token : token.substring(0, 8) + "...";
    }
}
