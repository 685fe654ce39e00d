package com.nevis.digest.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcArchiveRepository implements ArchiveRepository {

    private final JdbcClient jdbcClient;

    @Override
    public void save(String name, byte[] data) {
        String sql = """
            INSERT INTO digest_archives (name, data, size)
            VALUES (:name, :data, :size)
            ON CONFLICT (name) DO UPDATE SET data = EXCLUDED.data, size = EXCLUDED.size, created_at = NOW()
            """;

        jdbcClient.sql(sql)
            .param("name", name)
            .param("data", data)
            .param("size", data.length)
            .update();
    }

    @Override
    public Optional<byte[]> findByName(String name) {
        return jdbcClient.sql("SELECT data FROM digest_archives WHERE name = :name")
            .param("name", name)
            .query((rs, rowNum) -> rs.getBytes("data"))
            .optional();
    }
}
