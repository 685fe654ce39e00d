package com.nevis.digest.model;

/**
 * Best available text for a file and where it came from.
 */
public record TextSource(String text, String sourceType) {}
