package com.nevis.digest.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcKeywordDocumentRepository implements KeywordDocumentRepository {

    private final JdbcClient jdbcClient;

    @Override
    public void upsert(String filePath, String title, String content) {
        String sql = """
            INSERT INTO keyword_documents (file_path, title, content, tsv, indexed_at)
            VALUES (:filePath, :title, :content,
                    setweight(to_tsvector('simple', :title), 'A') || setweight(to_tsvector('simple', :content), 'B'),
                    NOW())
            ON CONFLICT (file_path) DO UPDATE SET
                title = EXCLUDED.title,
                content = EXCLUDED.content,
                tsv = EXCLUDED.tsv,
                indexed_at = NOW()
            """;

        jdbcClient.sql(sql)
            .param("filePath", filePath)
            .param("title", title)
            .param("content", content)
            .update();
    }
}
