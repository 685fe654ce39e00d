package com.nevis.digest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.model.TextSource;
import com.nevis.digest.service.digester.DigestTypes;
import com.nevis.digest.service.digester.Digests;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks the best text representation of a file from its completed digests, falling back
 * to the file itself for text formats.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TextSourceService {

    public static final String FILE_SOURCE = "file";

    private static final List<String> SUMMARY_SOURCES = List.of(
        DigestTypes.URL_CRAWL_SUMMARY,
        DigestTypes.SPEECH_RECOGNITION_SUMMARY
    );

    private final LibraryFileStore fileStore;
    private final ObjectMapper objectMapper;

    public Optional<TextSource> resolve(FileRecord file, List<Digest> digests) {
        if (file.isFolder()) {
            return Optional.empty();
        }

        for (String type : DigestTypes.TEXT_SOURCES) {
            Optional<String> text = Digests.completed(digests, type)
                .filter(Digest::hasContent)
                .map(digest -> extractText(type, digest.content()))
                .filter(value -> !value.isBlank());
            if (text.isPresent()) {
                return Optional.of(new TextSource(text.get(), type));
            }
        }

        if (FileTypes.isText(file.mimeType(), file.extension())) {
            Optional<String> local = fileStore.readText(file.path())
                .or(() -> Optional.ofNullable(file.textPreview()))
                .filter(value -> !value.isBlank());
            if (local.isPresent()) {
                return Optional.of(new TextSource(local.get(), FILE_SOURCE));
            }
        }
        return Optional.empty();
    }

    public Optional<String> summary(List<Digest> digests) {
        for (String type : SUMMARY_SOURCES) {
            Optional<String> summary = Digests.completed(digests, type)
                .filter(Digest::hasContent)
                .map(digest -> field(digest.content(), "summary").orElse(digest.content()));
            if (summary.isPresent()) {
                return summary;
            }
        }
        return Optional.empty();
    }

    public List<String> tags(List<Digest> digests) {
        List<String> tags = new ArrayList<>();
        Digests.completed(digests, DigestTypes.TAGS)
            .filter(Digest::hasContent)
            .flatMap(digest -> parse(digest.content()))
            .map(node -> node.path("tags"))
            .filter(JsonNode::isArray)
            .ifPresent(array -> array.forEach(tag -> tags.add(tag.asText())));
        return tags;
    }

    public String urlCrawlMarkdown(String content) {
        return field(content, "markdown").orElse(content);
    }

    private String extractText(String type, String content) {
        if (DigestTypes.URL_CRAWL_CONTENT.equals(type)) {
            return urlCrawlMarkdown(content);
        }
        if (DigestTypes.SPEECH_RECOGNITION.equals(type)) {
            return field(content, "text").orElse(content);
        }
        return content;
    }

    private Optional<String> field(String json, String name) {
        return parse(json)
            .map(node -> node.path(name))
            .filter(JsonNode::isTextual)
            .map(JsonNode::asText);
    }

    private Optional<JsonNode> parse(String json) {
        String trimmed = json.strip();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(trimmed));
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse digest JSON payload: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
