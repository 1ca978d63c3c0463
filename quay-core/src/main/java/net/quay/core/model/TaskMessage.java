package net.quay.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 큐에 들어가면 불변. 재시도는 id와 createdAt이 같은 새 메시지다. */
public record TaskMessage(
        String id,
        String name,
        List<Object> args,
        Map<String, Object> kwargs,
        String queue,
        int priority,
        Instant eta,          // null이면 즉시 노출
        int attempt,          // 0부터
        int maxRetries,
        Instant createdAt
) {
    public TaskMessage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(queue, "queue");
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public TaskMessage nextAttempt(Instant nextEta) {
        return new TaskMessage(id, name, args, kwargs, queue, priority, nextEta, attempt + 1, maxRetries, createdAt);
    }

    public boolean retriesLeft() {
        return attempt < maxRetries;
    }
}
