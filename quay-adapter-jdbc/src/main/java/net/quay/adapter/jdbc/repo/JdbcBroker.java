package net.quay.adapter.jdbc.repo;

import net.quay.adapter.jdbc.JsonCodec;
import net.quay.adapter.jdbc.TxContext;
import net.quay.adapter.jdbc.mapper.RowMappers;
import net.quay.core.model.Delivery;
import net.quay.core.model.TaskMessage;
import net.quay.core.spi.Broker;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static net.quay.adapter.jdbc.JdbcUtil.getInstant;
import static net.quay.adapter.jdbc.JdbcUtil.seconds;
import static net.quay.adapter.jdbc.JdbcUtil.setInstant;

/**
 * TB_TASK_MESSAGE 위의 브로커. lease/가시성 판단은 DB 시각(CURRENT_TIMESTAMP) 기준.
 * STATUS: READY → RUNNING → (삭제 | READY 재시도 | DEAD)
 */
public final class JdbcBroker implements Broker {
    private final DataSource ds;
    private final JsonCodec json;

    public JdbcBroker(DataSource ds, JsonCodec json) {
        this.ds = ds;
        this.json = json;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public void enqueue(TaskMessage m) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_TASK_MESSAGE(
                TASK_ID, TASK_NAME, QUEUE_NAME, PRIORITY, SEQ, STATUS, ARGS_JSON, KWARGS_JSON,
                ATTEMPT, MAX_RETRIES, ETA, VISIBLE_AT, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, SEQ_TASK_MESSAGE.NEXTVAL, 'READY', ?, ?, ?, ?, ?, COALESCE(?, CURRENT_TIMESTAMP), ?, CURRENT_TIMESTAMP)
        """)) {
            ps.setString(1, m.id());
            ps.setString(2, m.name());
            ps.setString(3, m.queue());
            ps.setInt(4, m.priority());
            ps.setString(5, json.write(m.args()));
            ps.setString(6, json.write(m.kwargs()));
            ps.setInt(7, m.attempt());
            ps.setInt(8, m.maxRetries());
            setInstant(ps, 9, m.eta());
            setInstant(ps, 10, m.eta());
            setInstant(ps, 11, m.createdAt());
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<Delivery> dequeue(List<String> queues, Duration visibilityTimeout, String consumer) throws Exception {
        Connection c = mustConn();
        for (String queue : queues) {
            // 1) 큐 하나에서 픽업 (만료된 RUNNING도 대상: 죽은 컨슈머의 메시지 재전달)
            String taskId = null;
            try (var ps = c.prepareStatement("""
                SELECT  m.TASK_ID
                FROM    TB_TASK_MESSAGE m
                WHERE   m.ROWID IN (
                    SELECT rid
                    FROM (
                        SELECT  m2.ROWID AS rid
                        FROM    TB_TASK_MESSAGE m2
                        WHERE   m2.QUEUE_NAME = ?
                          AND ( (m2.STATUS = 'READY'   AND m2.VISIBLE_AT  <= CURRENT_TIMESTAMP)
                             OR (m2.STATUS = 'RUNNING' AND m2.LEASE_UNTIL <= CURRENT_TIMESTAMP) )
                        ORDER BY m2.PRIORITY DESC, m2.SEQ ASC
                        FETCH FIRST 1 ROWS ONLY
                    )
                )
                FOR UPDATE OF m.STATUS SKIP LOCKED
            """)) {
                ps.setString(1, queue);
                try (var rs = ps.executeQuery()) {
                    if (rs.next()) taskId = rs.getString(1);
                }
            }
            if (taskId == null) continue;

            // 2) RUNNING 전환 + lease 발급
            String token = UUID.randomUUID().toString();
            try (var up = c.prepareStatement("""
                UPDATE TB_TASK_MESSAGE
                   SET STATUS      = 'RUNNING',
                       LEASE_TOKEN = ?,
                       CONSUMER    = ?,
                       LEASE_UNTIL = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                       UPDATED_AT  = CURRENT_TIMESTAMP
                 WHERE TASK_ID = ?
            """)) {
                up.setString(1, token);
                up.setString(2, consumer);
                up.setDouble(3, seconds(visibilityTimeout));
                up.setString(4, taskId);
                up.executeUpdate();
            }

            // 3) 로우 반환
            try (var sel = c.prepareStatement("SELECT * FROM TB_TASK_MESSAGE WHERE TASK_ID=?")) {
                sel.setString(1, taskId);
                try (var rs = sel.executeQuery()) {
                    if (rs.next()) {
                        return Optional.of(new Delivery(RowMappers.toTaskMessage(rs, json), consumer, token,
                                getInstant(rs, "LEASE_UNTIL")));
                    }
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean ack(Delivery d) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            DELETE FROM TB_TASK_MESSAGE
             WHERE TASK_ID = ? AND LEASE_TOKEN = ? AND STATUS = 'RUNNING'
        """)) {
            ps.setString(1, d.taskId());
            ps.setString(2, d.leaseToken());
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean nack(Delivery d, boolean requeue, Duration delay) throws Exception {
        if (!requeue) {
            try (var ps = mustConn().prepareStatement("""
                UPDATE TB_TASK_MESSAGE
                   SET STATUS = 'DEAD',
                       LEASE_TOKEN = NULL, CONSUMER = NULL, LEASE_UNTIL = NULL,
                       UPDATED_AT = CURRENT_TIMESTAMP
                 WHERE TASK_ID = ? AND LEASE_TOKEN = ? AND STATUS = 'RUNNING'
            """)) {
                ps.setString(1, d.taskId());
                ps.setString(2, d.leaseToken());
                return ps.executeUpdate() == 1;
            }
        }
        // 재시도: attempt++, 새 시퀀스로 큐 뒤에, delay 후 노출
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_MESSAGE
               SET STATUS      = 'READY',
                   ATTEMPT     = ATTEMPT + 1,
                   SEQ         = SEQ_TASK_MESSAGE.NEXTVAL,
                   ETA         = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   VISIBLE_AT  = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   LEASE_TOKEN = NULL, CONSUMER = NULL, LEASE_UNTIL = NULL,
                   UPDATED_AT  = CURRENT_TIMESTAMP
             WHERE TASK_ID = ? AND LEASE_TOKEN = ? AND STATUS = 'RUNNING'
        """)) {
            ps.setDouble(1, seconds(delay));
            ps.setDouble(2, seconds(delay));
            ps.setString(3, d.taskId());
            ps.setString(4, d.leaseToken());
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean release(Delivery d) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_MESSAGE
               SET STATUS = 'READY',
                   VISIBLE_AT = CURRENT_TIMESTAMP,
                   LEASE_TOKEN = NULL, CONSUMER = NULL, LEASE_UNTIL = NULL,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE TASK_ID = ? AND LEASE_TOKEN = ? AND STATUS = 'RUNNING'
        """)) {
            ps.setString(1, d.taskId());
            ps.setString(2, d.leaseToken());
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean extendLease(Delivery d, Duration visibilityTimeout) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_MESSAGE
               SET LEASE_UNTIL = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   UPDATED_AT  = CURRENT_TIMESTAMP
             WHERE TASK_ID = ? AND LEASE_TOKEN = ? AND STATUS = 'RUNNING'
        """)) {
            ps.setDouble(1, seconds(visibilityTimeout));
            ps.setString(2, d.taskId());
            ps.setString(3, d.leaseToken());
            return ps.executeUpdate() == 1;
        }
    }

    // --- Maintenance 전용 ---

    @Override
    public int recoverExpired() throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_MESSAGE
               SET STATUS = 'READY',
                   VISIBLE_AT = CURRENT_TIMESTAMP,
                   LEASE_TOKEN = NULL, CONSUMER = NULL, LEASE_UNTIL = NULL,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE STATUS = 'RUNNING'
               AND LEASE_UNTIL IS NOT NULL
               AND LEASE_UNTIL <= CURRENT_TIMESTAMP
        """)) {
            return ps.executeUpdate();
        }
    }

    @Override
    public List<TaskMessage> deadLetters(String queue, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_TASK_MESSAGE
             WHERE QUEUE_NAME = ? AND STATUS = 'DEAD'
             ORDER BY UPDATED_AT, SEQ
             FETCH FIRST ? ROWS ONLY
        """)) {
            ps.setString(1, queue);
            ps.setInt(2, limit);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<TaskMessage>();
                while (rs.next()) out.add(RowMappers.toTaskMessage(rs, json));
                return out;
            }
        }
    }

    @Override
    public long depth(String queue) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT COUNT(*) FROM TB_TASK_MESSAGE WHERE QUEUE_NAME = ? AND STATUS = 'READY'")) {
            ps.setString(1, queue);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    @Override
    public void ping() throws Exception {
        try (var st = mustConn().createStatement(); var rs = st.executeQuery("SELECT 1 FROM dual")) {
            rs.next();
        }
    }
}
