package dev.zhengxiang.multiplexer;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Helpers for turning entity keys and domains into storage names.
 */
public final class StoreKeys {

    /**
     * Longest name kept readable; longer ones are replaced by a hash.
     */
    static final int MAX_NAME_LENGTH = 120;

    static final int HASH_LENGTH = 32;

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_\\-][A-Za-z0-9._\\-]*");

    private StoreKeys() {
    }

    /**
     * Validates that a key has a non-empty string form and returns it.
     *
     * @throws IllegalArgumentException if the key is null or its string form is empty
     */
    public static String requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("Cache key must not be null");
        }
        String keyStr = key.toString();
        if (keyStr == null || keyStr.isEmpty()) {
            throw new IllegalArgumentException("Cache key must have a non-empty string form: " + key.getClass().getName());
        }
        return keyStr;
    }

    /**
     * Maps an arbitrary key to a file-system safe name. Safe names are kept as is, anything else
     * is percent-encoded, and names that would still be too long become a URL-safe hash.
     */
    public static String fileName(String key) {
        requireKey(key);
        String name = SAFE_NAME.matcher(key).matches()
                ? key
                : URLEncoder.encode(key, StandardCharsets.UTF_8).replace("*", "%2A").replace(".", "%2E");
        if (name.length() > MAX_NAME_LENGTH) {
            return urlSafeHash(key, HASH_LENGTH);
        }
        return name;
    }

    /**
     * SHA-256 of the string, URL-safe base64 without padding, trimmed to its last {@code max}
     * characters.
     */
    public static String urlSafeHash(String s, int max) {
        byte[] digest = sha256(s.getBytes(StandardCharsets.UTF_8));
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        return encoded.length() <= max ? encoded : encoded.substring(encoded.length() - max);
    }

    private static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
