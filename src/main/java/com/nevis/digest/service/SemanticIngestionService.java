package com.nevis.digest.service;

import com.nevis.digest.exception.VendorException;
import com.nevis.digest.model.ChunkDescriptor;
import com.nevis.digest.model.IndexResult;
import com.nevis.digest.model.SearchDocument;
import com.nevis.digest.model.TextSource;
import com.nevis.digest.repository.SearchDocumentRepository;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticIngestionService {

    static final int EMBEDDING_BATCH_SIZE = 32;

    private final ContentChunker contentChunker;
    private final SearchDocumentRepository searchDocumentRepository;
    private final EmbeddingModel embeddingModel;

    /**
     * Replaces the file's search documents with fresh chunks, pending embedding.
     */
    public int ingest(String filePath, TextSource source) {
        List<ChunkDescriptor> chunks = contentChunker.chunk(source.text());
        int stored = searchDocumentRepository.replaceForFile(filePath, source.sourceType(), chunks);
        log.info("Stored {} chunks for {} from {}", stored, filePath, source.sourceType());
        return stored;
    }

    /**
     * Embeds every pending chunk of the file. Chunks already indexed are left alone, so a
     * retry after a partial failure only embeds the rest.
     */
    public IndexResult indexPending(String filePath) {
        List<SearchDocument> pending = searchDocumentRepository.findPendingByFilePath(filePath);
        int embedded = 0;

        for (int from = 0; from < pending.size(); from += EMBEDDING_BATCH_SIZE) {
            List<SearchDocument> batch = pending.subList(from, Math.min(from + EMBEDDING_BATCH_SIZE, pending.size()));
            List<TextSegment> segments = batch.stream().map(doc -> TextSegment.from(doc.text())).toList();

            Response<List<Embedding>> response;
            try {
                response = embeddingModel.embedAll(segments);
            } catch (RuntimeException e) {
                throw new VendorException("Embedding failed for " + filePath + ": " + e.getMessage(), e);
            }

            List<Embedding> embeddings = response.content();
            if (embeddings == null || embeddings.size() != batch.size()) {
                throw new VendorException("Embedding model returned "
                    + (embeddings == null ? 0 : embeddings.size()) + " vectors for " + batch.size() + " chunks");
            }

            for (int i = 0; i < batch.size(); i++) {
                searchDocumentRepository.saveEmbedding(batch.get(i).id(), embeddings.get(i).vector());
                embedded++;
            }
        }

        log.info("Embedded {} chunks for {}", embedded, filePath);
        return new IndexResult(filePath, embedded);
    }
}
