package com.nevis.digest.repository;

import com.nevis.digest.model.ChunkDescriptor;
import com.nevis.digest.model.SearchDocument;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcSearchDocumentRepository implements SearchDocumentRepository {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<SearchDocument> searchDocumentMapper = (rs, rowNum) -> new SearchDocument(
        rs.getObject("id", UUID.class),
        rs.getString("file_path"),
        rs.getString("source_type"),
        rs.getInt("chunk_index"),
        rs.getInt("chunk_count"),
        rs.getString("text"),
        rs.getInt("span_start"),
        rs.getInt("span_end"),
        rs.getInt("overlap_tokens"),
        rs.getInt("word_count"),
        rs.getInt("token_count"),
        rs.getString("embedding_status"),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    @Transactional
    public int replaceForFile(String filePath, String sourceType, List<ChunkDescriptor> chunks) {
        jdbcClient.sql("DELETE FROM search_documents WHERE file_path = :filePath")
            .param("filePath", filePath)
            .update();

        if (chunks.isEmpty()) {
            return 0;
        }

        String sql = """
            INSERT INTO search_documents (file_path, source_type, chunk_index, chunk_count, text,
                                          span_start, span_end, overlap_tokens, word_count, token_count)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                ChunkDescriptor chunk = chunks.get(i);
                ps.setString(1, filePath);
                ps.setString(2, sourceType);
                ps.setInt(3, chunk.chunkIndex());
                ps.setInt(4, chunk.chunkCount());
                ps.setString(5, chunk.text());
                ps.setInt(6, chunk.spanStart());
                ps.setInt(7, chunk.spanEnd());
                ps.setInt(8, chunk.overlapTokens());
                ps.setInt(9, chunk.wordCount());
                ps.setInt(10, chunk.tokenCount());
            }

            @Override
            public int getBatchSize() {
                return chunks.size();
            }
        });

        return chunks.size();
    }

    @Override
    public List<SearchDocument> findPendingByFilePath(String filePath) {
        String sql = """
            SELECT id, file_path, source_type, chunk_index, chunk_count, text, span_start, span_end,
                   overlap_tokens, word_count, token_count, embedding_status, created_at
            FROM search_documents
            WHERE file_path = :filePath AND embedding_status = 'pending'
            ORDER BY chunk_index
            """;

        return jdbcClient.sql(sql)
            .param("filePath", filePath)
            .query(searchDocumentMapper)
            .list();
    }

    @Override
    public void saveEmbedding(UUID id, float[] vector) {
        jdbcTemplate.update(
            "UPDATE search_documents SET embedding = ?, embedding_status = 'indexed' WHERE id = ?",
            new PGvector(vector),
            id
        );
    }
}
