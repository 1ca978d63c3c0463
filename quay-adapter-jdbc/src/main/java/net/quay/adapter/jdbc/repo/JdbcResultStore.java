package net.quay.adapter.jdbc.repo;

import net.quay.adapter.jdbc.JsonCodec;
import net.quay.adapter.jdbc.TxContext;
import net.quay.adapter.jdbc.mapper.RowMappers;
import net.quay.core.model.TaskError;
import net.quay.core.model.TaskResult;
import net.quay.core.spi.ResultStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

import static net.quay.adapter.jdbc.JdbcUtil.setInstant;

/** TB_TASK_RESULT. 상태 전이는 모두 조건부 단일 UPDATE라 키 단위로 원자적이다. */
public final class JdbcResultStore implements ResultStore {
    private static final int MESSAGE_MAX = 1000;

    private final DataSource ds;
    private final JsonCodec json;

    public JdbcResultStore(DataSource ds, JsonCodec json) {
        this.ds = ds;
        this.json = json;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public void createPending(TaskResult r) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            MERGE INTO TB_TASK_RESULT t
            USING (SELECT ? AS task_id, ? AS task_name, ? AS created_at FROM dual) s
            ON (t.TASK_ID = s.task_id)
            WHEN MATCHED THEN UPDATE SET
                t.TASK_NAME = s.task_name, t.STATE = 'PENDING', t.PROGRESS = 0, t.MESSAGE = NULL,
                t.RESULT_JSON = NULL, t.ERROR_KIND = NULL, t.ERROR_MESSAGE = NULL, t.ATTEMPT = 0,
                t.CANCEL_REQUESTED = 'N', t.STARTED_AT = NULL, t.FINISHED_AT = NULL, t.EXPIRES_AT = NULL,
                t.UPDATED_AT = CURRENT_TIMESTAMP
            WHEN NOT MATCHED THEN INSERT (
                TASK_ID, TASK_NAME, STATE, PROGRESS, ATTEMPT, CANCEL_REQUESTED, CREATED_AT, UPDATED_AT
            ) VALUES (
                s.task_id, s.task_name, 'PENDING', 0, 0, 'N', s.created_at, CURRENT_TIMESTAMP
            )
        """)) {
            ps.setString(1, r.taskId());
            ps.setString(2, r.taskName());
            setInstant(ps, 3, r.createdAt());
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<TaskResult> find(String taskId, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_TASK_RESULT
             WHERE TASK_ID = ? AND (EXPIRES_AT IS NULL OR EXPIRES_AT > ?)
        """)) {
            ps.setString(1, taskId);
            setInstant(ps, 2, now);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toTaskResult(rs, json)) : Optional.empty();
            }
        }
    }

    @Override
    public boolean markStarted(String taskId, int attempt, Instant startedAt) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_RESULT
               SET STATE = 'PROGRESS', PROGRESS = 0, MESSAGE = NULL,
                   ATTEMPT = ?, STARTED_AT = ?, UPDATED_AT = CURRENT_TIMESTAMP
             WHERE TASK_ID = ? AND STATE IN ('PENDING', 'PROGRESS')
        """)) {
            ps.setInt(1, attempt);
            setInstant(ps, 2, startedAt);
            ps.setString(3, taskId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void updateProgress(String taskId, int attempt, int progress, String message) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_RESULT
               SET PROGRESS = GREATEST(PROGRESS, ?), MESSAGE = ?, UPDATED_AT = CURRENT_TIMESTAMP
             WHERE TASK_ID = ? AND STATE = 'PROGRESS' AND ATTEMPT = ?
        """)) {
            ps.setInt(1, progress);
            ps.setString(2, clip(message));
            ps.setString(3, taskId);
            ps.setInt(4, attempt);
            ps.executeUpdate();
        }
    }

    @Override
    public void markRetrying(String taskId, String message) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_RESULT
               SET STATE = 'PENDING', MESSAGE = ?, CANCEL_REQUESTED = 'N', UPDATED_AT = CURRENT_TIMESTAMP
             WHERE TASK_ID = ? AND STATE = 'PROGRESS'
        """)) {
            ps.setString(1, clip(message));
            ps.setString(2, taskId);
            ps.executeUpdate();
        }
    }

    @Override
    public void complete(String taskId, TaskResult.State state, Object result, TaskError error,
                         Instant finishedAt, Instant expiresAt) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_RESULT
               SET STATE = ?,
                   PROGRESS = CASE WHEN ? = 'SUCCESS' THEN 100 ELSE PROGRESS END,
                   RESULT_JSON = ?, ERROR_KIND = ?, ERROR_MESSAGE = ?,
                   FINISHED_AT = ?, EXPIRES_AT = ?, UPDATED_AT = CURRENT_TIMESTAMP
             WHERE TASK_ID = ? AND STATE NOT IN ('SUCCESS', 'FAILURE')
        """)) {
            ps.setString(1, state.code());
            ps.setString(2, state.code());
            ps.setString(3, json.write(result));
            ps.setString(4, error == null ? null : error.kind().code());
            ps.setString(5, error == null ? null : clip(error.message()));
            setInstant(ps, 6, finishedAt);
            setInstant(ps, 7, expiresAt);
            ps.setString(8, taskId);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean revoke(String taskId, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_RESULT
               SET STATE = 'REVOKED', FINISHED_AT = ?, UPDATED_AT = CURRENT_TIMESTAMP
             WHERE TASK_ID = ? AND STATE = 'PENDING'
        """)) {
            setInstant(ps, 1, now);
            ps.setString(2, taskId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean requestCancel(String taskId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_RESULT
               SET CANCEL_REQUESTED = 'Y', UPDATED_AT = CURRENT_TIMESTAMP
             WHERE TASK_ID = ? AND STATE = 'PROGRESS'
        """)) {
            ps.setString(1, taskId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void delete(String taskId) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_TASK_RESULT WHERE TASK_ID = ?")) {
            ps.setString(1, taskId);
            ps.executeUpdate();
        }
    }

    @Override
    public int purgeExpired(Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            DELETE FROM TB_TASK_RESULT
             WHERE EXPIRES_AT IS NOT NULL
               AND EXPIRES_AT <= ?
        """)) {
            setInstant(ps, 1, now);
            return ps.executeUpdate();
        }
    }

    private static String clip(String s) {
        return s == null || s.length() <= MESSAGE_MAX ? s : s.substring(0, MESSAGE_MAX);
    }
}
