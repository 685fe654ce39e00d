package com.nevis.digest.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;

@Repository
@RequiredArgsConstructor
public class JdbcProcessingLockRepository implements ProcessingLockRepository {

    private final JdbcClient jdbcClient;

    @Override
    public boolean tryAcquire(String filePath, String owner, OffsetDateTime now) {
        String sql = """
            INSERT INTO processing_locks (file_path, locked_by, locked_at)
            VALUES (:filePath, :owner, :now)
            ON CONFLICT (file_path) DO NOTHING
            """;

        return jdbcClient.sql(sql)
            .param("filePath", filePath)
            .param("owner", owner)
            .param("now", now)
            .update() == 1;
    }

    @Override
    public void release(String filePath, String owner) {
        jdbcClient.sql("DELETE FROM processing_locks WHERE file_path = :filePath AND locked_by = :owner")
            .param("filePath", filePath)
            .param("owner", owner)
            .update();
    }

    @Override
    public boolean refresh(String filePath, String owner, OffsetDateTime now) {
        String sql = """
            UPDATE processing_locks
            SET locked_at = :now
            WHERE file_path = :filePath AND locked_by = :owner
            """;

        return jdbcClient.sql(sql)
            .param("filePath", filePath)
            .param("owner", owner)
            .param("now", now)
            .update() == 1;
    }

    @Override
    public int deleteOlderThan(OffsetDateTime cutoff) {
        return jdbcClient.sql("DELETE FROM processing_locks WHERE locked_at < :cutoff")
            .param("cutoff", cutoff)
            .update();
    }
}
