package net.quay.adapter.jdbc;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/** 시각 컬럼은 모두 TIMESTAMP WITH TIME ZONE. 세션 TZ와 무관하게 절대 시각으로 주고받는다. */
public final class JdbcUtil {
    private JdbcUtil() {}

    public static void setInstant(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.TIMESTAMP_WITH_TIMEZONE);
        else ps.setObject(idx, OffsetDateTime.ofInstant(i, ZoneOffset.UTC));
    }

    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime v = rs.getObject(column, OffsetDateTime.class);
        return v == null ? null : v.toInstant();
    }

    /** NUMTODSINTERVAL(?, 'SECOND') 바인딩용. 밀리초 단위까지 살린다. */
    public static double seconds(Duration d) {
        return d == null ? 0d : d.toMillis() / 1000d;
    }

    public static String yn(boolean b) { return b ? "Y" : "N"; }
}
