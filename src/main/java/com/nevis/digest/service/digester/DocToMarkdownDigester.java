package com.nevis.digest.service.digester;

import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.service.FileTypes;
import com.nevis.digest.service.LibraryFileStore;
import com.nevis.digest.vendor.ContentExtractionClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class DocToMarkdownDigester implements Digester {

    private final ContentExtractionClient extractionClient;
    private final LibraryFileStore fileStore;

    @Override
    public String name() {
        return DigestTypes.DOC_TO_MARKDOWN;
    }

    @Override
    public boolean canDigest(FileRecord file, List<Digest> existingDigests) {
        return !file.isFolder() && FileTypes.isDocument(file.mimeType(), file.extension());
    }

    @Override
    public List<DigestInput> digest(FileRecord file, List<Digest> existingDigests) {
        String markdown = extractionClient.convertToMarkdown(fileStore.resolve(file.path()), file.mimeType());
        String content = markdown == null || markdown.isBlank() ? null : markdown.strip();
        return List.of(DigestInput.completed(name(), content));
    }

    @Override
    public boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
        return Digests.upstreamChanged(file, existingDigests, name(), List.of(), true);
    }
}
