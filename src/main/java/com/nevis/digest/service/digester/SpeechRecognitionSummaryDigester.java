package com.nevis.digest.service.digester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.service.FileTypes;
import dev.langchain4j.model.chat.ChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Turns a transcript into markdown notes for the people who recorded it. Content is
 * {@code {"summary": "..."}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpeechRecognitionSummaryDigester implements Digester {

    private static final String SUMMARY_PROMPT_TEMPLATE =
        """
            Role: Assistant turning raw speech transcripts into organized notes for the speakers themselves.
            Task: Summarize the substance: decisions, conclusions, action items, key points. Group by topic, not speaking order.
            Constraint: Write in the transcript's language and keep mixed-language terms, app names and jargon untranslated.
            Constraint: Drop filler and transcription artifacts. Do not invent facts; mark anything unclear.

            Output: JSON only, in the form {"summary": "<markdown>"}. The markdown opens with a one-sentence key takeaway
            as a blockquote, then a title, then the summary. Add Action Items or Open Questions only when present.

            Transcript:
            %s
            """;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    @Value("${app.digest.summary-max-chars:50000}")
    private int maxSummaryChars;

    @Override
    public String name() {
        return DigestTypes.SPEECH_RECOGNITION_SUMMARY;
    }

    @Override
    public boolean canDigest(FileRecord file, List<Digest> existingDigests) {
        return !file.isFolder() && (FileTypes.isAudio(file.mimeType()) || FileTypes.isVideo(file.mimeType()));
    }

    @Override
    public List<DigestInput> digest(FileRecord file, List<Digest> existingDigests) {
        Optional<Digest> transcript = Digests.completed(existingDigests, DigestTypes.SPEECH_RECOGNITION);
        if (transcript.isEmpty()) {
            // picked up again once the transcript completes
            return null;
        }

        String text = transcript.filter(Digest::hasContent)
            .map(digest -> transcriptText(digest.content()))
            .orElse("");
        if (text.isBlank()) {
            return List.of(DigestInput.completed(name(), null));
        }

        String response = chatModel.chat(String.format(SUMMARY_PROMPT_TEMPLATE,
            text.substring(0, Math.min(text.length(), maxSummaryChars))));
        log.info("Transcript summary generated for {}", file.path());

        String content = objectMapper.createObjectNode()
            .put("summary", parseSummary(response))
            .toString();
        return List.of(DigestInput.completed(name(), content));
    }

    @Override
    public boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
        return Digests.upstreamChanged(file, existingDigests, name(), List.of(DigestTypes.SPEECH_RECOGNITION), false);
    }

    /**
     * The {@code summary} field of a JSON response, or the whole response when the model
     * answered in plain markdown.
     */
    String parseSummary(String response) {
        String trimmed = response == null ? "" : response.strip();
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start >= 0 && end > start) {
            try {
                JsonNode summary = objectMapper.readTree(trimmed.substring(start, end + 1)).path("summary");
                if (summary.isTextual()) {
                    return summary.asText().strip();
                }
            } catch (JsonProcessingException e) {
                log.debug("Transcript summary is not valid JSON, keeping the raw response");
            }
        }
        return trimmed;
    }

    private String transcriptText(String content) {
        try {
            JsonNode text = objectMapper.readTree(content).path("text");
            return text.isTextual() ? text.asText() : "";
        } catch (JsonProcessingException e) {
            return content;
        }
    }
}
