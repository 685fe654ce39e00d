package com.nevis.digest.repository;

import com.nevis.digest.model.ChunkDescriptor;
import com.nevis.digest.model.SearchDocument;

import java.util.List;
import java.util.UUID;

public interface SearchDocumentRepository {

    /**
     * Drops the file's previous chunks and stores the new ones as pending embedding.
     */
    int replaceForFile(String filePath, String sourceType, List<ChunkDescriptor> chunks);

    List<SearchDocument> findPendingByFilePath(String filePath);

    void saveEmbedding(UUID id, float[] vector);
}
