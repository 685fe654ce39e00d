package com.nevis.digest.service.digester;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.model.TextSource;
import com.nevis.digest.repository.KeywordDocumentRepository;
import com.nevis.digest.service.TextSourceService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Indexes the file's text, summary and tags for full-text search.
 */
@Component
@RequiredArgsConstructor
public class SearchKeywordDigester implements Digester {

    static final List<String> UPSTREAM = upstream();

    private final KeywordDocumentRepository keywordDocumentRepository;
    private final TextSourceService textSourceService;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return DigestTypes.SEARCH_KEYWORD;
    }

    @Override
    public boolean canDigest(FileRecord file, List<Digest> existingDigests) {
        return !file.isFolder();
    }

    @Override
    public List<DigestInput> digest(FileRecord file, List<Digest> existingDigests) {
        Optional<TextSource> source = textSourceService.resolve(file, existingDigests);
        if (source.isEmpty()) {
            return List.of(DigestInput.completed(name(), null));
        }

        StringBuilder document = new StringBuilder(source.get().text());
        textSourceService.summary(existingDigests).ifPresent(summary -> document.append("\n\n").append(summary));
        List<String> tags = textSourceService.tags(existingDigests);
        if (!tags.isEmpty()) {
            document.append("\n\n").append(String.join(", ", tags));
        }

        keywordDocumentRepository.upsert(file.path(), file.name(), document.toString());

        String content = objectMapper.createObjectNode()
            .put("sourceType", source.get().sourceType())
            .put("characters", document.length())
            .toString();
        return List.of(DigestInput.completed(name(), content));
    }

    @Override
    public boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
        return Digests.upstreamChanged(file, existingDigests, name(), UPSTREAM, true);
    }

    private static List<String> upstream() {
        List<String> types = new ArrayList<>(DigestTypes.TEXT_SOURCES);
        types.add(DigestTypes.URL_CRAWL_SUMMARY);
        types.add(DigestTypes.SPEECH_RECOGNITION_SUMMARY);
        types.add(DigestTypes.TAGS);
        return List.copyOf(types);
    }
}
