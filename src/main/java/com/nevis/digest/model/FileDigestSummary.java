package com.nevis.digest.model;

public record FileDigestSummary(
    String filePath,
    boolean locked,
    int processed,
    int skipped,
    int failed
) {

    public static FileDigestSummary lockedBy(String filePath) {
        return new FileDigestSummary(filePath, true, 0, 0, 0);
    }
}
