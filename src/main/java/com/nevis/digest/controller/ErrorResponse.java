package com.nevis.digest.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
