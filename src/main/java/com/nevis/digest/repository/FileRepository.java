package com.nevis.digest.repository;

import com.nevis.digest.model.FileRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the file index maintained by the library scanner.
 */
public interface FileRepository {

    Optional<FileRecord> findByPath(String path);

    /**
     * Paths of non-folder files with at least one digest type that has no row, is {@code todo},
     * or failed with fewer than {@code maxAttempts} attempts. Oldest files first.
     */
    List<String> findPathsNeedingDigestion(Collection<String> digestTypes,
                                           Collection<String> excludedPrefixes,
                                           int maxAttempts,
                                           int limit);
}
