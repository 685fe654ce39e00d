package com.nevis.digest.model;

public record IndexResult(String filePath, int embedded) {}
