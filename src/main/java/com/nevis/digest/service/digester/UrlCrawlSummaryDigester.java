package com.nevis.digest.service.digester;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.DigestStatus;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.service.TextSourceService;
import dev.langchain4j.model.chat.ChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class UrlCrawlSummaryDigester implements Digester {

    private static final String SUMMARY_PROMPT_TEMPLATE =
        """
            Role: Careful reader and editor.
            Task: Summarize the web page below in 3-5 sentences for a personal knowledge base.
            Focus: What the page is about, its main claims or facts, and why someone saved it.
            Constraint: Plain prose, no headings, no bullet points, no preamble.

            Output: Output only the summary

            Page Content:
            %s
            """;

    private final ChatModel chatModel;
    private final TextSourceService textSourceService;
    private final ObjectMapper objectMapper;

    @Value("${app.digest.summary-max-chars:50000}")
    private int maxSummaryChars;

    @Override
    public String name() {
        return DigestTypes.URL_CRAWL_SUMMARY;
    }

    @Override
    public boolean canDigest(FileRecord file, List<Digest> existingDigests) {
        if (file.isFolder()) {
            return false;
        }
        return Digests.find(existingDigests, DigestTypes.URL_CRAWL_CONTENT)
            .filter(digest -> digest.status() != DigestStatus.SKIPPED)
            .isPresent();
    }

    @Override
    public List<DigestInput> digest(FileRecord file, List<Digest> existingDigests) {
        String markdown = Digests.completed(existingDigests, DigestTypes.URL_CRAWL_CONTENT)
            .filter(Digest::hasContent)
            .map(digest -> textSourceService.urlCrawlMarkdown(digest.content()))
            .orElse("");

        if (markdown.isBlank()) {
            return List.of(DigestInput.completed(name(), null));
        }

        String head = markdown.substring(0, Math.min(markdown.length(), maxSummaryChars));
        String summary = chatModel.chat(String.format(SUMMARY_PROMPT_TEMPLATE, head));
        log.info("Summary generated for {}", file.path());

        String content = objectMapper.createObjectNode()
            .put("summary", summary.strip())
            .toString();
        return List.of(DigestInput.completed(name(), content));
    }

    @Override
    public boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
        return Digests.upstreamChanged(file, existingDigests, name(), List.of(DigestTypes.URL_CRAWL_CONTENT), false);
    }
}
