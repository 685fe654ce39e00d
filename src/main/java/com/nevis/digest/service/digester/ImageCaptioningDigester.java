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
public class ImageCaptioningDigester implements Digester {

    private final ContentExtractionClient extractionClient;
    private final LibraryFileStore fileStore;

    @Override
    public String name() {
        return DigestTypes.IMAGE_CAPTIONING;
    }

    @Override
    public boolean canDigest(FileRecord file, List<Digest> existingDigests) {
        return !file.isFolder() && FileTypes.isImage(file.mimeType());
    }

    @Override
    public List<DigestInput> digest(FileRecord file, List<Digest> existingDigests) {
        String caption = extractionClient.caption(fileStore.resolve(file.path()));
        return List.of(DigestInput.completed(name(), caption == null || caption.isBlank() ? null : caption.strip()));
    }

    @Override
    public boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
        return Digests.upstreamChanged(file, existingDigests, name(), List.of(), true);
    }
}
