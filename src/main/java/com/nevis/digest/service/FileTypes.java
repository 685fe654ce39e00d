package com.nevis.digest.service;

import java.util.Set;

public final class FileTypes {

    private static final Set<String> DOCUMENT_MIME_TYPES = Set.of(
        "application/pdf",
        "application/msword",
        "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
        "application/vnd.ms-excel",
        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
        "application/vnd.ms-powerpoint",
        "application/vnd.openxmlformats-officedocument.presentationml.presentation",
        "application/epub+zip"
    );

    private static final Set<String> DOCUMENT_EXTENSIONS = Set.of(
        "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "epub"
    );

    private static final Set<String> TEXT_MIME_TYPES = Set.of(
        "application/json",
        "application/xml",
        "application/x-yaml",
        "application/yaml",
        "application/javascript"
    );

    private static final Set<String> TEXT_EXTENSIONS = Set.of(
        "md", "mdx", "markdown", "txt", "log", "json", "yaml", "yml", "csv", "tsv"
    );

    private FileTypes() {
    }

    public static boolean isImage(String mimeType) {
        return mimeType != null && mimeType.startsWith("image/");
    }

    public static boolean isAudio(String mimeType) {
        return mimeType != null && mimeType.startsWith("audio/");
    }

    public static boolean isVideo(String mimeType) {
        return mimeType != null && mimeType.startsWith("video/");
    }

    public static boolean isDocument(String mimeType, String extension) {
        return (mimeType != null && DOCUMENT_MIME_TYPES.contains(mimeType)) || DOCUMENT_EXTENSIONS.contains(extension);
    }

    public static boolean isText(String mimeType, String extension) {
        if (mimeType != null && (mimeType.startsWith("text/") || TEXT_MIME_TYPES.contains(mimeType))) {
            return true;
        }
        return TEXT_EXTENSIONS.contains(extension);
    }
}
