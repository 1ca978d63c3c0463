package net.quay.core.model;

import java.time.Instant;

public record TaskResult(
        String taskId,
        String taskName,
        State state,
        int progress,
        String message,
        Object result,        // SUCCESS일 때만
        TaskError error,      // FAILURE일 때만
        int attempt,
        boolean cancelRequested,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        Instant expiresAt     // 터미널 전까지 null
) {
    public enum State {
        PENDING, PROGRESS, SUCCESS, FAILURE, REVOKED, UNKNOWN;

        public static State from(String s) {
            if (s == null) return UNKNOWN;
            try { return State.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean terminal() {
            return this == SUCCESS || this == FAILURE || this == REVOKED;
        }
    }

    public static TaskResult pending(String taskId, String taskName, Instant createdAt) {
        return new TaskResult(taskId, taskName, State.PENDING, 0, null, null, null,
                0, false, createdAt, null, null, null);
    }

    public boolean expired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
