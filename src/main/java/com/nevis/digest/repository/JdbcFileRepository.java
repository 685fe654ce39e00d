package com.nevis.digest.repository;

import com.nevis.digest.model.FileRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcFileRepository implements FileRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<FileRecord> fileMapper = (rs, rowNum) -> new FileRecord(
        rs.getString("path"),
        rs.getString("name"),
        rs.getBoolean("is_folder"),
        rs.getObject("size", Long.class),
        rs.getString("mime_type"),
        rs.getString("hash"),
        rs.getObject("modified_at", OffsetDateTime.class),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getString("text_preview")
    );

    @Override
    public Optional<FileRecord> findByPath(String path) {
        return jdbcClient.sql("SELECT * FROM files WHERE path = :path")
            .param("path", path)
            .query(fileMapper)
            .optional();
    }

    @Override
    public List<String> findPathsNeedingDigestion(Collection<String> digestTypes,
                                                  Collection<String> excludedPrefixes,
                                                  int maxAttempts,
                                                  int limit) {
        if (digestTypes.isEmpty()) {
            return List.of();
        }

        List<String> prefixes = new ArrayList<>(excludedPrefixes);
        StringBuilder exclusions = new StringBuilder();
        for (int i = 0; i < prefixes.size(); i++) {
            exclusions.append(" AND f.path <> :prefix").append(i)
                .append(" AND f.path NOT LIKE :prefixLike").append(i);
        }

        String sql = """
            SELECT f.path
            FROM files f
            WHERE f.is_folder = FALSE
            """ + exclusions + """
              AND (
                (SELECT COUNT(*) FROM digests d
                 WHERE d.file_path = f.path AND d.digester IN (:types)) < :typeCount
                OR EXISTS (
                    SELECT 1 FROM digests d
                    WHERE d.file_path = f.path
                      AND d.digester IN (:types)
                      AND (d.status = 'todo' OR (d.status = 'failed' AND d.attempts < :maxAttempts))
                )
              )
            ORDER BY f.created_at ASC, f.path ASC
            LIMIT :limit
            """;

        var statement = jdbcClient.sql(sql)
            .param("types", digestTypes)
            .param("typeCount", digestTypes.size())
            .param("maxAttempts", maxAttempts)
            .param("limit", limit);

        for (int i = 0; i < prefixes.size(); i++) {
            String prefix = stripTrailingSlash(prefixes.get(i));
            statement.param("prefix" + i, prefix);
            statement.param("prefixLike" + i, escapeLike(prefix) + "/%");
        }

        return statement.query(String.class).list();
    }

    private static String stripTrailingSlash(String prefix) {
        return prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
