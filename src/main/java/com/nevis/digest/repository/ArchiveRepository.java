package com.nevis.digest.repository;

import java.util.Optional;

/**
 * Binary digest artifacts (screenshots and the like), referenced by {@code digests.archive_name}.
 */
public interface ArchiveRepository {

    void save(String name, byte[] data);

    Optional<byte[]> findByName(String name);
}
