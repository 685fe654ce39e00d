package com.nevis.digest.service.digester;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.service.FileTypes;
import com.nevis.digest.service.LibraryFileStore;
import com.nevis.digest.vendor.ContentExtractionClient;
import com.nevis.digest.vendor.ContentExtractionClient.CrawlResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Crawls text files whose content is a single URL. Produces the page as markdown and,
 * when the crawler returns one, a screenshot archive.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UrlCrawlDigester implements Digester {

    private static final int WORDS_PER_MINUTE = 200;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ContentExtractionClient extractionClient;
    private final LibraryFileStore fileStore;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return DigestTypes.URL_CRAWL;
    }

    @Override
    public List<String> outputs() {
        return List.of(DigestTypes.URL_CRAWL_CONTENT, DigestTypes.URL_CRAWL_SCREENSHOT);
    }

    @Override
    public boolean canDigest(FileRecord file, List<Digest> existingDigests) {
        if (file.isFolder() || !FileTypes.isText(file.mimeType(), file.extension())) {
            return false;
        }
        return url(file).isPresent();
    }

    @Override
    public List<DigestInput> digest(FileRecord file, List<Digest> existingDigests) {
        String url = url(file)
            .orElseThrow(() -> new IllegalStateException("No URL found in " + file.path()));

        log.info("Crawling {} for {}", url, file.path());
        CrawlResult result = extractionClient.crawl(url);

        String markdown = result.markdown() != null ? result.markdown().strip() : "";
        int wordCount = markdown.isEmpty() ? 0 : WHITESPACE.split(markdown).length;

        ObjectNode content = objectMapper.createObjectNode()
            .put("url", url)
            .put("title", result.title())
            .put("domain", domain(url))
            .put("markdown", markdown)
            .put("wordCount", wordCount)
            .put("readingTimeMinutes", Math.max(1, (wordCount + WORDS_PER_MINUTE - 1) / WORDS_PER_MINUTE));

        DigestInput screenshot = result.screenshot() != null && result.screenshot().length > 0
            ? DigestInput.completedWithArchive(
                DigestTypes.URL_CRAWL_SCREENSHOT,
                file.path() + "/" + DigestTypes.URL_CRAWL_SCREENSHOT + "." + extension(result.screenshotMimeType()),
                result.screenshot())
            : DigestInput.completed(DigestTypes.URL_CRAWL_SCREENSHOT, null);

        return List.of(DigestInput.completed(DigestTypes.URL_CRAWL_CONTENT, content.toString()), screenshot);
    }

    @Override
    public boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
        // the URL itself lives in the file
        return Digests.upstreamChanged(file, existingDigests, DigestTypes.URL_CRAWL_CONTENT, List.of(), true);
    }

    private Optional<String> url(FileRecord file) {
        String text = file.textPreview() != null && !file.textPreview().isBlank()
            ? file.textPreview()
            : fileStore.readText(file.path()).orElse("");

        String firstLine = text.strip().lines().findFirst().orElse("").strip();
        if (firstLine.startsWith("http://") || firstLine.startsWith("https://")) {
            return Optional.of(firstLine);
        }
        return Optional.empty();
    }

    private static String domain(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    private static String extension(String mimeType) {
        if (mimeType == null) {
            return "png";
        }
        if (mimeType.contains("jpeg") || mimeType.contains("jpg")) {
            return "jpg";
        }
        if (mimeType.contains("webp")) {
            return "webp";
        }
        return "png";
    }
}
