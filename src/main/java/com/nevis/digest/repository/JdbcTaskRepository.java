package com.nevis.digest.repository;

import com.nevis.digest.model.PendingTaskCount;
import com.nevis.digest.model.Task;
import com.nevis.digest.model.TaskStats;
import com.nevis.digest.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcTaskRepository implements TaskRepository {

    private static final String READY_PREDICATE = """
        (status = 'to-do' OR (status = 'failed' AND attempts < :maxAttempts))
        AND (run_after IS NULL OR run_after <= :now)
        """;

    private final JdbcClient jdbcClient;

    private final RowMapper<Task> taskMapper = (rs, rowNum) -> new Task(
        rs.getObject("id", UUID.class),
        rs.getString("type"),
        rs.getString("input"),
        TaskStatus.fromDb(rs.getString("status")),
        rs.getInt("version"),
        rs.getInt("attempts"),
        rs.getObject("last_attempt_at", Long.class),
        rs.getString("output"),
        rs.getString("error"),
        rs.getObject("run_after", Long.class),
        rs.getLong("created_at"),
        rs.getLong("updated_at"),
        rs.getObject("completed_at", Long.class)
    );

    @Override
    public Task save(Task task) {
        String sql = """
            INSERT INTO tasks (id, type, input, status, version, attempts, last_attempt_at,
                               output, error, run_after, created_at, updated_at, completed_at)
            VALUES (:id, :type, :input, :status, :version, :attempts, :lastAttemptAt,
                    :output, :error, :runAfter, :createdAt, :updatedAt, :completedAt)
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("id", task.id())
            .param("type", task.type())
            .param("input", task.input())
            .param("status", task.status().dbValue())
            .param("version", task.version())
            .param("attempts", task.attempts())
            .param("lastAttemptAt", task.lastAttemptAt())
            .param("output", task.output())
            .param("error", task.error())
            .param("runAfter", task.runAfter())
            .param("createdAt", task.createdAt())
            .param("updatedAt", task.updatedAt())
            .param("completedAt", task.completedAt())
            .query(taskMapper)
            .single();
    }

    @Override
    public Optional<Task> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM tasks WHERE id = :id")
            .param("id", id)
            .query(taskMapper)
            .optional();
    }

    @Override
    public boolean updateIfVersion(Task task, int expectedVersion) {
        String sql = """
            UPDATE tasks
            SET status = :status,
                version = :version,
                attempts = :attempts,
                last_attempt_at = :lastAttemptAt,
                output = :output,
                error = :error,
                run_after = :runAfter,
                updated_at = :updatedAt,
                completed_at = :completedAt
            WHERE id = :id AND version = :expectedVersion
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("status", task.status().dbValue())
            .param("version", task.version())
            .param("attempts", task.attempts())
            .param("lastAttemptAt", task.lastAttemptAt())
            .param("output", task.output())
            .param("error", task.error())
            .param("runAfter", task.runAfter())
            .param("updatedAt", task.updatedAt())
            .param("completedAt", task.completedAt())
            .param("id", task.id())
            .param("expectedVersion", expectedVersion)
            .update();

        return rowsAffected == 1;
    }

    @Override
    public List<Task> findReady(long now, int maxAttempts, int limit) {
        String sql = "SELECT * FROM tasks WHERE " + READY_PREDICATE + " ORDER BY created_at ASC LIMIT :limit";

        return jdbcClient.sql(sql)
            .param("maxAttempts", maxAttempts)
            .param("now", now)
            .param("limit", limit)
            .query(taskMapper)
            .list();
    }

    @Override
    public List<Task> findStale(long lastAttemptBefore) {
        String sql = """
            SELECT * FROM tasks
            WHERE status = 'in-progress'
              AND last_attempt_at < :cutoff
            ORDER BY last_attempt_at ASC
            """;

        return jdbcClient.sql(sql)
            .param("cutoff", lastAttemptBefore)
            .query(taskMapper)
            .list();
    }

    @Override
    public boolean existsReady(long now, int maxAttempts) {
        String sql = "SELECT EXISTS (SELECT 1 FROM tasks WHERE " + READY_PREDICATE + ")";

        return Boolean.TRUE.equals(jdbcClient.sql(sql)
            .param("maxAttempts", maxAttempts)
            .param("now", now)
            .query(Boolean.class)
            .single());
    }

    @Override
    public List<PendingTaskCount> countPendingByType(long now, int maxAttempts) {
        String sql = """
            SELECT type,
                   COUNT(*) FILTER (WHERE %s) AS ready,
                   COUNT(*) FILTER (WHERE status = 'in-progress') AS in_progress,
                   COUNT(*) FILTER (WHERE status = 'failed' AND attempts >= :maxAttempts) AS exhausted
            FROM tasks
            WHERE status <> 'success'
            GROUP BY type
            ORDER BY type
            """.formatted(READY_PREDICATE);

        return jdbcClient.sql(sql)
            .param("maxAttempts", maxAttempts)
            .param("now", now)
            .query((rs, rowNum) -> new PendingTaskCount(
                rs.getString("type"),
                rs.getLong("ready"),
                rs.getLong("in_progress"),
                rs.getLong("exhausted")
            ))
            .list();
    }

    @Override
    public TaskStats stats(int maxAttempts) {
        String sql = """
            SELECT COUNT(*) AS total,
                   COUNT(*) FILTER (WHERE status = 'to-do') AS todo,
                   COUNT(*) FILTER (WHERE status = 'in-progress') AS in_progress,
                   COUNT(*) FILTER (WHERE status = 'success') AS success,
                   COUNT(*) FILTER (WHERE status = 'failed') AS failed,
                   COUNT(*) FILTER (WHERE status = 'failed' AND attempts >= :maxAttempts) AS exhausted
            FROM tasks
            """;

        return jdbcClient.sql(sql)
            .param("maxAttempts", maxAttempts)
            .query((rs, rowNum) -> new TaskStats(
                rs.getLong("total"),
                rs.getLong("todo"),
                rs.getLong("in_progress"),
                rs.getLong("success"),
                rs.getLong("failed"),
                rs.getLong("exhausted")
            ))
            .single();
    }
}
