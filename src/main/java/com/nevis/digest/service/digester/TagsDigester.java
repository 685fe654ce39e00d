package com.nevis.digest.service.digester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.model.TextSource;
import com.nevis.digest.service.TextSourceService;
import dev.langchain4j.model.chat.ChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Asks the chat model for a handful of topical tags. Content is {@code {"tags": [...]}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TagsDigester implements Digester {

    static final int MIN_TEXT_LENGTH = 10;
    static final int MAX_TAGS = 10;
    private static final int MAX_PROMPT_CHARS = 20_000;

    private static final String TAGS_PROMPT_TEMPLATE =
        """
            Role: Librarian organizing a personal knowledge base.
            Task: Suggest up to 10 short topical tags for the text below.
            Constraint: Lowercase, one to three words each, no personal names, no duplicates.

            Output: JSON only, in the form {"tags": ["tag one", "tag two"]}

            Text:
            %s
            """;

    private final ChatModel chatModel;
    private final TextSourceService textSourceService;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return DigestTypes.TAGS;
    }

    @Override
    public boolean canDigest(FileRecord file, List<Digest> existingDigests) {
        return !file.isFolder();
    }

    @Override
    public List<DigestInput> digest(FileRecord file, List<Digest> existingDigests) {
        Optional<TextSource> source = textSourceService.resolve(file, existingDigests);
        if (source.isEmpty() || source.get().text().strip().length() < MIN_TEXT_LENGTH) {
            return List.of(DigestInput.completed(name(), null));
        }

        String text = source.get().text();
        String response = chatModel.chat(String.format(TAGS_PROMPT_TEMPLATE,
            text.substring(0, Math.min(text.length(), MAX_PROMPT_CHARS))));
        List<String> tags = parseTags(response);
        log.info("Generated {} tags for {} from {}", tags.size(), file.path(), source.get().sourceType());

        ObjectNode content = objectMapper.createObjectNode();
        ArrayNode array = content.putArray("tags");
        tags.forEach(array::add);
        return List.of(DigestInput.completed(name(), content.toString()));
    }

    @Override
    public boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
        return Digests.upstreamChanged(file, existingDigests, name(), DigestTypes.TEXT_SOURCES, true);
    }

    /**
     * Reads {@code {"tags": [...]}} out of a model response, tolerating surrounding prose or
     * code fences. Falls back to a comma separated list.
     */
    List<String> parseTags(String response) {
        if (response == null || response.isBlank()) {
            return List.of();
        }

        List<String> raw = new ArrayList<>();
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        boolean parsed = false;
        if (start >= 0 && end > start) {
            try {
                JsonNode tags = objectMapper.readTree(response.substring(start, end + 1)).path("tags");
                if (tags.isArray()) {
                    tags.forEach(tag -> raw.add(tag.asText()));
                    parsed = true;
                }
            } catch (JsonProcessingException e) {
                log.debug("Tags response is not valid JSON, falling back to list parsing");
            }
        }
        if (!parsed) {
            raw.addAll(Arrays.asList(response.replace("`", "").split("[,\\n]")));
        }

        Set<String> tags = new LinkedHashSet<>();
        for (String tag : raw) {
            String normalized = tag.strip().replaceAll("^[-*\"'\\s]+|[\"'\\s.]+$", "").toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                tags.add(normalized);
            }
            if (tags.size() == MAX_TAGS) {
                break;
            }
        }
        return List.copyOf(tags);
    }
}
