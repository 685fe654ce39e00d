package com.nevis.digest.model;

public record DigesterStats(
    String digester,
    long todo,
    long inProgress,
    long completed,
    long failed,
    long skipped
) {}
