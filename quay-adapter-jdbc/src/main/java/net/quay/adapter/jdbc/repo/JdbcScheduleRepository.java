package net.quay.adapter.jdbc.repo;

import net.quay.adapter.jdbc.JsonCodec;
import net.quay.adapter.jdbc.TxContext;
import net.quay.adapter.jdbc.mapper.RowMappers;
import net.quay.core.model.ScheduleEntry;
import net.quay.core.spi.ScheduleRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static net.quay.adapter.jdbc.JdbcUtil.setInstant;
import static net.quay.adapter.jdbc.JdbcUtil.yn;

/** TB_SCHEDULE. 커서 시각은 beat의 Clock 기준으로 받는다. */
public final class JdbcScheduleRepository implements ScheduleRepository {
    private final DataSource ds;
    private final JsonCodec json;

    public JdbcScheduleRepository(DataSource ds, JsonCodec json) {
        this.ds = ds;
        this.json = json;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public void save(ScheduleEntry e) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            MERGE INTO TB_SCHEDULE t
            USING (
                SELECT ? AS name, ? AS task_name, ? AS trigger_kind, ? AS trigger_expr, ? AS enabled,
                       ? AS queue_name, ? AS args_json, ? AS kwargs_json,
                       ? AS next_fire_at, ? AS last_fired_at, ? AS lease_until
                FROM dual
            ) s
            ON (t.NAME = s.name)
            WHEN MATCHED THEN UPDATE SET
                t.TASK_NAME = s.task_name, t.TRIGGER_KIND = s.trigger_kind, t.TRIGGER_EXPR = s.trigger_expr,
                t.ENABLED = s.enabled, t.QUEUE_NAME = s.queue_name,
                t.ARGS_JSON = s.args_json, t.KWARGS_JSON = s.kwargs_json,
                t.NEXT_FIRE_AT = s.next_fire_at, t.LAST_FIRED_AT = s.last_fired_at, t.LEASE_UNTIL = s.lease_until,
                t.UPDATED_AT = CURRENT_TIMESTAMP
            WHEN NOT MATCHED THEN INSERT (
                NAME, TASK_NAME, TRIGGER_KIND, TRIGGER_EXPR, ENABLED, QUEUE_NAME, ARGS_JSON, KWARGS_JSON,
                NEXT_FIRE_AT, LAST_FIRED_AT, LEASE_UNTIL, CREATED_AT, UPDATED_AT
            ) VALUES (
                s.name, s.task_name, s.trigger_kind, s.trigger_expr, s.enabled, s.queue_name, s.args_json, s.kwargs_json,
                s.next_fire_at, s.last_fired_at, s.lease_until, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP
            )
        """)) {
            ps.setString(1, e.name());
            ps.setString(2, e.taskName());
            ps.setString(3, e.trigger().kind().name());
            ps.setString(4, e.trigger().expression());
            ps.setString(5, yn(e.enabled()));
            ps.setString(6, e.queue());
            ps.setString(7, json.write(e.args()));
            ps.setString(8, json.write(e.kwargs()));
            setInstant(ps, 9, e.nextFireAt());
            setInstant(ps, 10, e.lastFiredAt());
            setInstant(ps, 11, e.leaseUntil());
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<ScheduleEntry> findByName(String name) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_SCHEDULE WHERE NAME = ?")) {
            ps.setString(1, name);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toScheduleEntry(rs, json)) : Optional.empty();
            }
        }
    }

    @Override
    public List<ScheduleEntry> findAll() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_SCHEDULE ORDER BY NAME");
             var rs = ps.executeQuery()) {
            var out = new ArrayList<ScheduleEntry>();
            while (rs.next()) out.add(RowMappers.toScheduleEntry(rs, json));
            return out;
        }
    }

    @Override
    public Optional<ScheduleEntry> claimDue(Instant now, Duration lease, String owner) throws Exception {
        Connection c = mustConn();

        // due 하나 집어서 선점
        try (var ps = c.prepareStatement("""
            SELECT  s.*
            FROM    TB_SCHEDULE s
            WHERE   s.ROWID IN (
                SELECT rid
                FROM (
                    SELECT  s2.ROWID AS rid
                    FROM    TB_SCHEDULE s2
                    WHERE   s2.ENABLED = 'Y'
                      AND   s2.NEXT_FIRE_AT <= ?
                      AND  (s2.LEASE_UNTIL IS NULL OR s2.LEASE_UNTIL <= ?)
                    ORDER BY s2.NEXT_FIRE_AT ASC, s2.NAME ASC
                    FETCH FIRST 1 ROWS ONLY
                )
            )
            FOR UPDATE OF s.LEASE_UNTIL SKIP LOCKED
        """)) {
            setInstant(ps, 1, now);
            setInstant(ps, 2, now);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                ScheduleEntry entry = RowMappers.toScheduleEntry(rs, json);
                Instant until = now.plus(lease);
                try (var upd = c.prepareStatement("""
                    UPDATE TB_SCHEDULE
                       SET LEASE_UNTIL = ?, LEASE_OWNER = ?, UPDATED_AT = CURRENT_TIMESTAMP
                     WHERE NAME = ?
                """)) {
                    setInstant(upd, 1, until);
                    upd.setString(2, owner);
                    upd.setString(3, entry.name());
                    upd.executeUpdate();
                }
                return Optional.of(new ScheduleEntry(entry.name(), entry.taskName(), entry.trigger(), entry.enabled(),
                        entry.queue(), entry.args(), entry.kwargs(), entry.nextFireAt(), entry.lastFiredAt(), until));
            }
        }
    }

    @Override
    public void advanceCursor(String name, Instant nextFireAt, Instant lastFiredAt) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_SCHEDULE
               SET NEXT_FIRE_AT = ?, LAST_FIRED_AT = ?, LEASE_UNTIL = NULL, LEASE_OWNER = NULL,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE NAME = ?
        """)) {
            setInstant(ps, 1, nextFireAt);
            setInstant(ps, 2, lastFiredAt);
            ps.setString(3, name);
            ps.executeUpdate();
        }
    }

    @Override
    public void releaseLease(String name) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_SCHEDULE SET LEASE_UNTIL = NULL, LEASE_OWNER = NULL, UPDATED_AT = CURRENT_TIMESTAMP
             WHERE NAME = ?
        """)) {
            ps.setString(1, name);
            ps.executeUpdate();
        }
    }

    @Override
    public int disableAllExcept(List<String> keep) throws Exception {
        String sql = "UPDATE TB_SCHEDULE SET ENABLED = 'N', UPDATED_AT = CURRENT_TIMESTAMP WHERE ENABLED = 'Y'";
        if (!keep.isEmpty()) {
            sql += " AND NAME NOT IN (" + String.join(",", Collections.nCopies(keep.size(), "?")) + ")";
        }
        try (var ps = mustConn().prepareStatement(sql)) {
            for (int i = 0; i < keep.size(); i++) ps.setString(i + 1, keep.get(i));
            return ps.executeUpdate();
        }
    }
}
