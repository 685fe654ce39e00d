package com.nevis.digest.service.digester;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.service.FileTypes;
import com.nevis.digest.service.LibraryFileStore;
import com.nevis.digest.vendor.ContentExtractionClient;
import com.nevis.digest.vendor.ContentExtractionClient.Transcript;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Transcribes audio and video. Content is a JSON object with {@code text}, {@code language}
 * and {@code durationSeconds}.
 */
@Component
@RequiredArgsConstructor
public class SpeechRecognitionDigester implements Digester {

    private final ContentExtractionClient extractionClient;
    private final LibraryFileStore fileStore;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return DigestTypes.SPEECH_RECOGNITION;
    }

    @Override
    public boolean canDigest(FileRecord file, List<Digest> existingDigests) {
        return !file.isFolder() && (FileTypes.isAudio(file.mimeType()) || FileTypes.isVideo(file.mimeType()));
    }

    @Override
    public List<DigestInput> digest(FileRecord file, List<Digest> existingDigests) {
        Transcript transcript = extractionClient.transcribe(fileStore.resolve(file.path()), file.mimeType());
        if (transcript.text() == null || transcript.text().isBlank()) {
            return List.of(DigestInput.completed(name(), null));
        }

        String content = objectMapper.createObjectNode()
            .put("text", transcript.text().strip())
            .put("language", transcript.language())
            .put("durationSeconds", transcript.durationSeconds())
            .toString();
        return List.of(DigestInput.completed(name(), content));
    }

    @Override
    public boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
        return Digests.upstreamChanged(file, existingDigests, name(), List.of(), true);
    }
}
