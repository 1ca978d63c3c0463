package net.quay.adapter.jdbc.mapper;

import net.quay.adapter.jdbc.JsonCodec;
import net.quay.core.model.ScheduleEntry;
import net.quay.core.model.TaskError;
import net.quay.core.model.TaskMessage;
import net.quay.core.model.TaskResult;
import net.quay.core.model.Trigger;

import java.sql.ResultSet;
import java.sql.SQLException;

import static net.quay.adapter.jdbc.JdbcUtil.getInstant;

public final class RowMappers {
    private RowMappers() {}

    // --- TaskMessage ---
    public static TaskMessage toTaskMessage(ResultSet rs, JsonCodec json) throws SQLException {
        return new TaskMessage(
                rs.getString("TASK_ID"),
                rs.getString("TASK_NAME"),
                json.readList(rs.getString("ARGS_JSON")),
                json.readMap(rs.getString("KWARGS_JSON")),
                rs.getString("QUEUE_NAME"),
                rs.getInt("PRIORITY"),
                getInstant(rs, "ETA"),
                rs.getInt("ATTEMPT"),
                rs.getInt("MAX_RETRIES"),
                getInstant(rs, "CREATED_AT")
        );
    }

    // --- TaskResult ---
    public static TaskResult toTaskResult(ResultSet rs, JsonCodec json) throws SQLException {
        String errorKind = rs.getString("ERROR_KIND");
        TaskError error = errorKind == null ? null
                : new TaskError(TaskError.Kind.from(errorKind), rs.getString("ERROR_MESSAGE"));
        return new TaskResult(
                rs.getString("TASK_ID"),
                rs.getString("TASK_NAME"),
                TaskResult.State.from(rs.getString("STATE")),
                rs.getInt("PROGRESS"),
                rs.getString("MESSAGE"),
                json.readValue(rs.getString("RESULT_JSON")),
                error,
                rs.getInt("ATTEMPT"),
                "Y".equals(rs.getString("CANCEL_REQUESTED")),
                getInstant(rs, "CREATED_AT"),
                getInstant(rs, "STARTED_AT"),
                getInstant(rs, "FINISHED_AT"),
                getInstant(rs, "EXPIRES_AT")
        );
    }

    // --- ScheduleEntry ---
    public static ScheduleEntry toScheduleEntry(ResultSet rs, JsonCodec json) throws SQLException {
        return new ScheduleEntry(
                rs.getString("NAME"),
                rs.getString("TASK_NAME"),
                Trigger.parse(rs.getString("TRIGGER_KIND"), rs.getString("TRIGGER_EXPR")),
                "Y".equals(rs.getString("ENABLED")),
                rs.getString("QUEUE_NAME"),
                json.readList(rs.getString("ARGS_JSON")),
                json.readMap(rs.getString("KWARGS_JSON")),
                getInstant(rs, "NEXT_FIRE_AT"),
                getInstant(rs, "LAST_FIRED_AT"),
                getInstant(rs, "LEASE_UNTIL")
        );
    }
}
