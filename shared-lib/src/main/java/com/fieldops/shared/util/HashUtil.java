package com.fieldops.shared.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprints for canonical request payloads.
 * Optimization runs store the fingerprint of their input snapshot so identical
 * requests can be recognised in the audit trail.
 */
public final class HashUtil {

    private HashUtil() {}

    public static String sha256Hex(String canonicalJson) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonicalJson.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Redis key scoped by tenant, e.g. {@code technician:acme:tech-7}.
     */
    public static String tenantKey(String prefix, String tenantId, String id) {
        return prefix + tenantId + ":" + id;
    }
}
