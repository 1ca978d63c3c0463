package net.quay.core.service;

import java.time.Duration;
import java.time.Instant;

/** {@link TaskClient#submit} 호출별 오버라이드. 모든 필드는 선택. */
public record SubmitOptions(
        String queue,
        Duration countdown,
        Instant eta,
        Integer priority,
        String taskId,
        Integer maxRetries
) {
    public static final SubmitOptions DEFAULTS = new SubmitOptions(null, null, null, null, null, null);

    public SubmitOptions {
        if (countdown != null && eta != null) {
            throw new IllegalArgumentException("countdown and eta are mutually exclusive");
        }
        if (countdown != null && countdown.isNegative()) {
            throw new IllegalArgumentException("countdown must not be negative");
        }
    }

    public static SubmitOptions queue(String queue) { return DEFAULTS.withQueue(queue); }
    public static SubmitOptions countdown(Duration countdown) { return DEFAULTS.withCountdown(countdown); }
    public static SubmitOptions eta(Instant eta) { return DEFAULTS.withEta(eta); }

    public SubmitOptions withQueue(String q) { return new SubmitOptions(q, countdown, eta, priority, taskId, maxRetries); }
    public SubmitOptions withCountdown(Duration c) { return new SubmitOptions(queue, c, eta, priority, taskId, maxRetries); }
    public SubmitOptions withEta(Instant e) { return new SubmitOptions(queue, countdown, e, priority, taskId, maxRetries); }
    public SubmitOptions withPriority(int p) { return new SubmitOptions(queue, countdown, eta, p, taskId, maxRetries); }
    public SubmitOptions withTaskId(String id) { return new SubmitOptions(queue, countdown, eta, priority, id, maxRetries); }
    public SubmitOptions withMaxRetries(int r) { return new SubmitOptions(queue, countdown, eta, priority, taskId, r); }
}
