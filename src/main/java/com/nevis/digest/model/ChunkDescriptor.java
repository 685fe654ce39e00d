package com.nevis.digest.model;

public record ChunkDescriptor(
    int chunkIndex,
    int chunkCount,
    String text,
    int spanStart,
    int spanEnd,
    int overlapTokens,
    int wordCount,
    int tokenCount
) {}
