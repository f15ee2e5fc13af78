package com.example.csvimport.ingestion.support;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Object-key derivation for mirrored uploads: {@code <sha256 prefix>_<basename>}.
 *
 * <p>The same bytes under the same name always map to the same key; different bytes under the same
 * name never share one.</p>
 */
public final class ObjectKeys {

    private static final int HASH_PREFIX_LENGTH = 16;
    private static final String FALLBACK_NAME = "upload.csv";

    private ObjectKeys() {
    }

    public static String forUpload(String filename, byte[] content) {
        return sha256Hex(content).substring(0, HASH_PREFIX_LENGTH) + "_" + basename(filename);
    }

    public static String lockKey(String bucket, String key) {
        return bucket + "/" + key;
    }

    /**
     * Strips the quotes some S3 responses put around an etag so values from events, stat and put
     * responses compare equal.
     */
    public static String normalizeEtag(String etag) {
        if (etag == null) {
            return null;
        }
        String trimmed = etag.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? null : trimmed;
    }

    static String basename(String filename) {
        if (filename == null) {
            return FALLBACK_NAME;
        }
        String normalized = filename.replace('\\', '/').trim();
        String name = normalized.substring(normalized.lastIndexOf('/') + 1).trim();
        return name.isEmpty() ? FALLBACK_NAME : name;
    }

    private static String sha256Hex(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
