package com.nevis.digest.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.OffsetDateTime;
import java.util.HexFormat;

/**
 * Result of one digester output for one file. Keyed by (filePath, digester).
 */
public record Digest(
    String id,
    String filePath,
    String digester,
    DigestStatus status,
    String content,
    String archiveName,
    String error,
    int attempts,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public static Digest placeholder(String filePath, String digester, OffsetDateTime now) {
        return new Digest(idFor(filePath, digester), filePath, digester, DigestStatus.TODO,
            null, null, null, 0, now, now);
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }

    public static String idFor(String filePath, String digester) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha.digest((filePath + "\u0000" + digester).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
