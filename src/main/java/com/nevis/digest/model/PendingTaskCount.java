package com.nevis.digest.model;

public record PendingTaskCount(
    String type,
    long ready,
    long inProgress,
    long exhausted
) {}
