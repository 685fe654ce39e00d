package com.nevis.digest.service.digester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.service.FileTypes;
import com.nevis.digest.service.LibraryFileStore;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.List;

/**
 * Detects the objects visible in an image with the vision model. Content is
 * {@code {"objects": [{id, title, name, category, description, bbox, certainty}, ...]}} with
 * bounding boxes normalized to [0, 1].
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageObjectsDigester implements Digester {

    private static final String SYSTEM_PROMPT =
        """
            Role: High-precision image annotation system for object search and spatial indexing.
            Task: Identify all meaningful visible objects: physical objects, UI elements, signs, labels and readable text.
            Include partially visible or unclear objects when there is visual evidence, and mark them with a lower certainty.
            Never invent brands, models or text that cannot be read; say so when text is unreadable.

            Bounding boxes: [x1, y1, x2, y2] normalized to [0,1], (0,0) top-left, x1 < x2 and y1 < y2, tight around visible pixels.
            category: small stable vocabulary (electronics, book, text, furniture, person, food, sign, clothing,
            container, tool, animal, plant, vehicle, ui_element).
            title: 2-6 words, unique within the image; add numeric suffixes for duplicates ("Book 1", "Book 2").
            name: generic noun ("book", "laptop"). description: visible attributes, readable text verbatim.
            Each physical object appears exactly once.

            Output: JSON only, no markdown, in the form
            {"objects": [{"id": "obj_001", "title": "...", "name": "...", "category": "...",
              "description": "...", "bbox": [0.1, 0.2, 0.5, 0.6], "certainty": "certain|likely|uncertain"}]}
            """;

    private static final String USER_PROMPT = "Analyze the image and return JSON annotations for all visible objects.";

    private final ChatModel chatModel;
    private final LibraryFileStore fileStore;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return DigestTypes.IMAGE_OBJECTS;
    }

    @Override
    public boolean canDigest(FileRecord file, List<Digest> existingDigests) {
        return !file.isFolder() && FileTypes.isImage(file.mimeType());
    }

    @Override
    public List<DigestInput> digest(FileRecord file, List<Digest> existingDigests) {
        String image = Base64.getEncoder().encodeToString(fileStore.readBytes(file.path()));
        List<ChatMessage> messages = List.of(
            SystemMessage.from(SYSTEM_PROMPT),
            UserMessage.from(TextContent.from(USER_PROMPT), ImageContent.from(image, file.mimeType())));

        ChatResponse response = chatModel.chat(messages);
        ArrayNode objects = parseObjects(response.aiMessage().text());
        log.info("Detected {} objects in {}", objects.size(), file.path());

        ObjectNode content = objectMapper.createObjectNode();
        content.set("objects", objects);
        return List.of(DigestInput.completed(name(), content.toString()));
    }

    @Override
    public boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
        return Digests.upstreamChanged(file, existingDigests, name(), List.of(), true);
    }

    /**
     * Reads the {@code objects} array out of a model response, tolerating code fences around it.
     * Entries without a title are dropped.
     *
     * @throws IllegalStateException when the response holds no such array
     */
    ArrayNode parseObjects(String response) {
        int start = response == null ? -1 : response.indexOf('{');
        int end = response == null ? -1 : response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IllegalStateException("Image objects response is not JSON");
        }

        JsonNode objects;
        try {
            objects = objectMapper.readTree(response.substring(start, end + 1)).path("objects");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse image objects response: " + e.getOriginalMessage(), e);
        }
        if (!objects.isArray()) {
            throw new IllegalStateException("Image objects response has no objects array");
        }

        ArrayNode kept = objectMapper.createArrayNode();
        for (JsonNode object : objects) {
            if (object.isObject() && !object.path("title").asText().isBlank()) {
                kept.add(object);
            }
        }
        return kept;
    }
}
