package com.agentstudio.observability.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Normalization and file-name helpers for session keys.
 */
public final class SessionKeys {

    /** Prefix applied to UUID-shaped raw ids so every source converges on one key. */
    public static final String SHARED_PREFIX = "shared-";

    private static final Pattern UUID_SHAPE = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^a-zA-Z0-9_-]+");
    private static final int MAX_CLEANED_LENGTH = 60;
    private static final int HASH_LENGTH = 10;

    private SessionKeys() {
    }

    /**
     * Normalizes a raw session id. Blank input yields {@code null}.
     *
     * @param raw the raw id from payload, environment or file
     * @return the normalized session key, or null
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (UUID_SHAPE.matcher(trimmed).matches()) {
            return SHARED_PREFIX + trimmed.toLowerCase();
        }
        return trimmed;
    }

    /**
     * Derives a filesystem-safe, collision-resistant file id: the cleaned key (max 60 chars)
     * followed by the first 10 hex chars of its SHA-256.
     *
     * @param key the session key
     * @return the file id
     */
    public static String safeFileId(String key) {
        String raw = key == null ? "" : key;
        String cleaned = UNSAFE_CHARS.matcher(raw).replaceAll("_");
        if (cleaned.length() > MAX_CLEANED_LENGTH) {
            cleaned = cleaned.substring(0, MAX_CLEANED_LENGTH);
        }
        if (cleaned.isEmpty()) {
            cleaned = "session";
        }
        return cleaned + "-" + sha256Hex(raw).substring(0, HASH_LENGTH);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is mandatory on every JVM
            throw new IllegalStateException(e);
        }
    }
}
