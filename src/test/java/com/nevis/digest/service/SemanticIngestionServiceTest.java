package com.nevis.digest.service;

import com.nevis.digest.exception.VendorException;
import com.nevis.digest.model.ChunkDescriptor;
import com.nevis.digest.model.IndexResult;
import com.nevis.digest.model.SearchDocument;
import com.nevis.digest.model.TextSource;
import com.nevis.digest.repository.SearchDocumentRepository;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SemanticIngestionServiceTest {

    private static final String PATH = "notes/long.md";

    @Mock
    private SearchDocumentRepository searchDocumentRepository;

    @Mock
    private EmbeddingModel embeddingModel;

    private SemanticIngestionService service;

    @BeforeEach
    void setUp() {
        service = new SemanticIngestionService(new ContentChunker(), searchDocumentRepository, embeddingModel);
    }

    private static List<SearchDocument> pending(int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> new SearchDocument(UUID.randomUUID(), PATH, "file", i, count, "chunk " + i,
                0, 0, 0, 2, 2, "pending", null))
            .toList();
    }

    private static Response<List<Embedding>> vectors(int count) {
        return Response.from(IntStream.range(0, count)
            .mapToObj(i -> Embedding.from(new float[]{i, 1f}))
            .toList());
    }

    @Test
    @DisplayName("Ingest replaces the file's chunks with freshly chunked text")
    @SuppressWarnings("unchecked")
    void shouldReplaceChunks() {
        when(searchDocumentRepository.replaceForFile(eq(PATH), eq("file"), anyList())).thenReturn(1);

        int stored = service.ingest(PATH, new TextSource("# Title\n\nSome body text.", "file"));

        assertThat(stored).isEqualTo(1);
        ArgumentCaptor<List<ChunkDescriptor>> captor = ArgumentCaptor.forClass(List.class);
        verify(searchDocumentRepository).replaceForFile(eq(PATH), eq("file"), captor.capture());
        assertThat(captor.getValue()).singleElement()
            .satisfies(chunk -> assertThat(chunk.text()).isEqualTo("# Title\n\nSome body text."));
    }

    @Nested
    @DisplayName("Indexing")
    class Indexing {

        @Test
        @DisplayName("Embeds pending chunks in batches and stores each vector")
        void shouldEmbedInBatches() {
            int count = SemanticIngestionService.EMBEDDING_BATCH_SIZE + 3;
            when(searchDocumentRepository.findPendingByFilePath(PATH)).thenReturn(pending(count));
            when(embeddingModel.embedAll(anyList()))
                .thenReturn(vectors(SemanticIngestionService.EMBEDDING_BATCH_SIZE))
                .thenReturn(vectors(3));

            IndexResult result = service.indexPending(PATH);

            assertThat(result).isEqualTo(new IndexResult(PATH, count));
            verify(embeddingModel, times(2)).embedAll(anyList());
            verify(searchDocumentRepository, times(count)).saveEmbedding(any(UUID.class), any(float[].class));
        }

        @Test
        @DisplayName("Nothing pending means no model call")
        void shouldSkipWhenNothingPending() {
            when(searchDocumentRepository.findPendingByFilePath(PATH)).thenReturn(List.of());

            assertThat(service.indexPending(PATH).embedded()).isZero();
            verify(embeddingModel, never()).embedAll(anyList());
        }

        @Test
        @DisplayName("Model errors surface as vendor failures so the task is retried")
        void shouldWrapModelErrors() {
            when(searchDocumentRepository.findPendingByFilePath(PATH)).thenReturn(pending(2));
            when(embeddingModel.embedAll(anyList())).thenThrow(new RuntimeException("quota exceeded"));

            assertThatThrownBy(() -> service.indexPending(PATH))
                .isInstanceOf(VendorException.class)
                .hasMessageContaining("quota exceeded");
            verify(searchDocumentRepository, never()).saveEmbedding(any(UUID.class), any(float[].class));
        }

        @Test
        @DisplayName("A vector count mismatch is rejected")
        void shouldRejectMismatchedResponse() {
            when(searchDocumentRepository.findPendingByFilePath(PATH)).thenReturn(pending(2));
            when(embeddingModel.embedAll(anyList())).thenReturn(vectors(1));

            assertThatThrownBy(() -> service.indexPending(PATH))
                .isInstanceOf(VendorException.class);
        }
    }
}
