package com.nevis.digest.repository;

import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigesterStats;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

public interface DigestRepository {

    List<Digest> findByFilePath(String filePath);

    /**
     * Inserts or replaces the row keyed by (filePath, digester).
     */
    void upsert(Digest digest);

    /**
     * Creates {@code todo} rows for the given digest types that have no row yet.
     */
    int insertMissing(String filePath, Collection<String> digesters, OffsetDateTime now);

    /**
     * Resets every row of the file to {@code todo} with attempts, content and error cleared.
     */
    int resetAllForFile(String filePath, OffsetDateTime now);

    /**
     * Moves {@code in-progress} rows last touched before the cutoff back to {@code todo}.
     */
    int resetStale(OffsetDateTime cutoff, OffsetDateTime now);

    List<DigesterStats> countByDigester();
}
