package com.nevis.digest.model;

public record TaskStats(
    long total,
    long todo,
    long inProgress,
    long success,
    long failed,
    long exhausted
) {}
