package com.nevis.digest.service;

public record ChunkerOptions(
    int targetTokens,
    int maxTokens,
    double overlapRatio,
    int minOverlapTokens,
    int maxOverlapTokens
) {

    public ChunkerOptions {
        if (targetTokens <= 0 || maxTokens < targetTokens) {
            throw new IllegalArgumentException(
                "Expected 0 < targetTokens <= maxTokens, got " + targetTokens + "/" + maxTokens);
        }
        if (overlapRatio < 0 || minOverlapTokens < 0 || maxOverlapTokens < minOverlapTokens) {
            throw new IllegalArgumentException("Invalid overlap settings");
        }
    }

    public static ChunkerOptions defaults() {
        return new ChunkerOptions(900, 1200, 0.15, 80, 180);
    }
}
