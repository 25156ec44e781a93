package com.rightsparser.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Utility class for API key generation and hashing.
 */
public class ApiKeyUtil {

    private static final String API_KEY_PREFIX = "rp_";
    private static final int KEY_LENGTH = 32;
    private static final int DISPLAY_PREFIX_LENGTH = 8;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private ApiKeyUtil() {
    }

    /**
     * Generate a new API key with rp_ prefix.
     *
     * @return Generated API key (e.g., rp_abc123...)
     */
    public static String generateApiKey() {
        byte[] randomBytes = new byte[KEY_LENGTH];
        SECURE_RANDOM.nextBytes(randomBytes);
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
        return API_KEY_PREFIX + encoded;
    }

    /**
     * Hash an API key using SHA-256.
     *
     * @param apiKey The API key to hash
     * @return Lower-case hex SHA-256 hash of the API key
     */
    public static String hashApiKey(String apiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(apiKey.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not found", e);
        }
    }

    /**
     * Non-secret display prefix of an API key (first 8 characters).
     */
    public static String getKeyPrefix(String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            return "";
        }
        return apiKey.substring(0, Math.min(DISPLAY_PREFIX_LENGTH, apiKey.length()));
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }
}
