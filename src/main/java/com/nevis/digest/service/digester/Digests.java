package com.nevis.digest.service.digester;

import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestStatus;
import com.nevis.digest.model.FileRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Lookups over the digest rows of one file.
 */
public final class Digests {

    private Digests() {
    }

    public static Optional<Digest> find(List<Digest> digests, String digestType) {
        return digests.stream()
            .filter(digest -> digest.digester().equals(digestType))
            .findFirst();
    }

    public static Optional<Digest> completed(List<Digest> digests, String digestType) {
        return find(digests, digestType)
            .filter(digest -> digest.status() == DigestStatus.COMPLETED);
    }

    /**
     * True when any of the upstream digests completed with content after {@code digestType}
     * was last written, or the file was modified after it.
     */
    public static boolean upstreamChanged(FileRecord file, List<Digest> digests, String digestType,
                                          Collection<String> upstreamTypes, boolean includeFile) {
        Optional<Digest> own = find(digests, digestType);
        if (own.isEmpty() || own.get().updatedAt() == null) {
            return false;
        }
        Digest self = own.get();

        if (includeFile && file.modifiedAt() != null && file.modifiedAt().isAfter(self.updatedAt())) {
            return true;
        }

        return upstreamTypes.stream()
            .map(type -> completed(digests, type))
            .flatMap(Optional::stream)
            .filter(Digest::hasContent)
            .anyMatch(upstream -> upstream.updatedAt() != null && upstream.updatedAt().isAfter(self.updatedAt()));
    }
}
