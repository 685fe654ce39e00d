package com.nevis.digest.model;

import java.time.OffsetDateTime;

public record FileRecord(
    String path,
    String name,
    boolean isFolder,
    Long size,
    String mimeType,
    String hash,
    OffsetDateTime modifiedAt,
    OffsetDateTime createdAt,
    String textPreview
) {

    public String extension() {
        int dot = path.lastIndexOf('.');
        int slash = path.lastIndexOf('/');
        if (dot <= slash + 1) {
            return "";
        }
        return path.substring(dot + 1).toLowerCase();
    }
}
