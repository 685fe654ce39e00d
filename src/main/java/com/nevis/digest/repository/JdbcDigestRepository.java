package com.nevis.digest.repository;

import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestStatus;
import com.nevis.digest.model.DigesterStats;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class JdbcDigestRepository implements DigestRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<Digest> digestMapper = (rs, rowNum) -> new Digest(
        rs.getString("id"),
        rs.getString("file_path"),
        rs.getString("digester"),
        DigestStatus.fromDb(rs.getString("status")),
        rs.getString("content"),
        rs.getString("archive_name"),
        rs.getString("error"),
        rs.getInt("attempts"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public List<Digest> findByFilePath(String filePath) {
        return jdbcClient.sql("SELECT * FROM digests WHERE file_path = :filePath ORDER BY created_at, digester")
            .param("filePath", filePath)
            .query(digestMapper)
            .list();
    }

    @Override
    public void upsert(Digest digest) {
        String sql = """
            INSERT INTO digests (id, file_path, digester, status, content, archive_name, error, attempts, created_at, updated_at)
            VALUES (:id, :filePath, :digester, :status, :content, :archiveName, :error, :attempts, :createdAt, :updatedAt)
            ON CONFLICT (id) DO UPDATE SET
                status = EXCLUDED.status,
                content = EXCLUDED.content,
                archive_name = EXCLUDED.archive_name,
                error = EXCLUDED.error,
                attempts = EXCLUDED.attempts,
                updated_at = EXCLUDED.updated_at
            """;

        jdbcClient.sql(sql)
            .param("id", digest.id())
            .param("filePath", digest.filePath())
            .param("digester", digest.digester())
            .param("status", digest.status().dbValue())
            .param("content", digest.content())
            .param("archiveName", digest.archiveName())
            .param("error", digest.error())
            .param("attempts", digest.attempts())
            .param("createdAt", digest.createdAt())
            .param("updatedAt", digest.updatedAt())
            .update();
    }

    @Override
    @Transactional
    public int insertMissing(String filePath, Collection<String> digesters, OffsetDateTime now) {
        String sql = """
            INSERT INTO digests (id, file_path, digester, status, attempts, created_at, updated_at)
            VALUES (:id, :filePath, :digester, :status, :attempts, :createdAt, :updatedAt)
            ON CONFLICT (id) DO NOTHING
            """;

        int inserted = 0;
        for (String digester : digesters) {
            Digest placeholder = Digest.placeholder(filePath, digester, now);
            inserted += jdbcClient.sql(sql)
                .param("id", placeholder.id())
                .param("filePath", placeholder.filePath())
                .param("digester", placeholder.digester())
                .param("status", placeholder.status().dbValue())
                .param("attempts", placeholder.attempts())
                .param("createdAt", placeholder.createdAt())
                .param("updatedAt", placeholder.updatedAt())
                .update();
        }
        return inserted;
    }

    @Override
    public int resetAllForFile(String filePath, OffsetDateTime now) {
        String sql = """
            UPDATE digests
            SET status = 'todo', content = NULL, archive_name = NULL, error = NULL,
                attempts = 0, updated_at = :now
            WHERE file_path = :filePath
            """;

        return jdbcClient.sql(sql)
            .param("filePath", filePath)
            .param("now", now)
            .update();
    }

    @Override
    public int resetStale(OffsetDateTime cutoff, OffsetDateTime now) {
        String sql = """
            UPDATE digests
            SET status = 'todo', updated_at = :now
            WHERE status = 'in-progress' AND updated_at < :cutoff
            """;

        return jdbcClient.sql(sql)
            .param("cutoff", cutoff)
            .param("now", now)
            .update();
    }

    @Override
    public List<DigesterStats> countByDigester() {
        String sql = """
            SELECT digester,
                   COUNT(*) FILTER (WHERE status = 'todo') AS todo,
                   COUNT(*) FILTER (WHERE status = 'in-progress') AS in_progress,
                   COUNT(*) FILTER (WHERE status = 'completed') AS completed,
                   COUNT(*) FILTER (WHERE status = 'failed') AS failed,
                   COUNT(*) FILTER (WHERE status = 'skipped') AS skipped
            FROM digests
            GROUP BY digester
            ORDER BY digester
            """;

        return jdbcClient.sql(sql)
            .query((rs, rowNum) -> new DigesterStats(
                rs.getString("digester"),
                rs.getLong("todo"),
                rs.getLong("in_progress"),
                rs.getLong("completed"),
                rs.getLong("failed"),
                rs.getLong("skipped")
            ))
            .list();
    }
}
