package net.quay.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * beat 스케줄의 한 행. 정의 부분은 설정에서 오고, 커서 부분
 * (nextFireAt, lastFiredAt, leaseUntil)은 beat 서비스가 관리한다.
 */
public record ScheduleEntry(
        String name,
        String taskName,
        Trigger trigger,
        boolean enabled,
        String queue,
        List<Object> args,
        Map<String, Object> kwargs,
        Instant nextFireAt,
        Instant lastFiredAt,
        Instant leaseUntil
) {
    public ScheduleEntry {
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public static ScheduleEntry define(String name, String taskName, Trigger trigger,
                                       List<Object> args, Map<String, Object> kwargs) {
        return new ScheduleEntry(name, taskName, trigger, true, null, args, kwargs, null, null, null);
    }

    public ScheduleEntry withQueue(String queue) {
        return new ScheduleEntry(name, taskName, trigger, enabled, queue, args, kwargs, nextFireAt, lastFiredAt, leaseUntil);
    }

    public ScheduleEntry withEnabled(boolean enabled) {
        return new ScheduleEntry(name, taskName, trigger, enabled, queue, args, kwargs, nextFireAt, lastFiredAt, leaseUntil);
    }

    public ScheduleEntry withCursor(Instant nextFireAt, Instant lastFiredAt) {
        return new ScheduleEntry(name, taskName, trigger, enabled, queue, args, kwargs, nextFireAt, lastFiredAt, null);
    }

    /** 커서를 뺀 정의가 같은지. */
    public boolean sameDefinition(ScheduleEntry other) {
        return taskName.equals(other.taskName)
                && trigger.equals(other.trigger)
                && java.util.Objects.equals(queue, other.queue)
                && args.equals(other.args)
                && kwargs.equals(other.kwargs);
    }
}
