package com.nevis.digest.service.digester;

import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.FileRecord;

import java.util.List;

/**
 * One enrichment step applied to a file. Implementations must be idempotent: the
 * coordinator may run them again after a crash or a cascading reset.
 */
public interface Digester {

    String name();

    /**
     * Digest types this digester writes. Most produce a single type named after themselves.
     */
    default List<String> outputs() {
        return List.of(name());
    }

    /**
     * Structural applicability (MIME type, extension, folder). Must not depend on whether
     * upstream digests have produced content yet.
     */
    boolean canDigest(FileRecord file, List<Digest> existingDigests);

    /**
     * @return one input per produced output, or {@code null} when there is nothing to persist
     * @throws RuntimeException on hard failure; the coordinator records it on the digest rows
     */
    List<DigestInput> digest(FileRecord file, List<Digest> existingDigests);

    /**
     * Whether already completed or skipped outputs must run again, typically because an
     * upstream digest or the file itself changed after they were written.
     */
    default boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
        return false;
    }
}
