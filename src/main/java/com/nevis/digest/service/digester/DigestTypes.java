package com.nevis.digest.service.digester;

import java.util.List;

public final class DigestTypes {

    public static final String URL_CRAWL = "url-crawl";
    public static final String URL_CRAWL_CONTENT = "url-crawl-content";
    public static final String URL_CRAWL_SCREENSHOT = "url-crawl-screenshot";
    public static final String DOC_TO_MARKDOWN = "doc-to-markdown";
    public static final String SPEECH_RECOGNITION = "speech-recognition";
    public static final String IMAGE_OCR = "image-ocr";
    public static final String IMAGE_CAPTIONING = "image-captioning";
    public static final String IMAGE_OBJECTS = "image-objects";
    public static final String URL_CRAWL_SUMMARY = "url-crawl-summary";
    public static final String SPEECH_RECOGNITION_SUMMARY = "speech-recognition-summary";
    public static final String TAGS = "tags";
    public static final String SEARCH_KEYWORD = "search-keyword";
    public static final String SEARCH_SEMANTIC = "search-semantic";

    /**
     * Digests whose content can stand in for a file's text, in order of preference.
     */
    public static final List<String> TEXT_SOURCES = List.of(
        URL_CRAWL_CONTENT,
        DOC_TO_MARKDOWN,
        IMAGE_OCR,
        IMAGE_CAPTIONING,
        SPEECH_RECOGNITION
    );

    private DigestTypes() {
    }
}
