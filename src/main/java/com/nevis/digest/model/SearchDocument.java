package com.nevis.digest.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SearchDocument(
    UUID id,
    String filePath,
    String sourceType,
    int chunkIndex,
    int chunkCount,
    String text,
    int spanStart,
    int spanEnd,
    int overlapTokens,
    int wordCount,
    int tokenCount,
    String embeddingStatus,
    OffsetDateTime createdAt
) {}
