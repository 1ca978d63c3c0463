package net.quay.core.service;

import net.quay.core.handler.TaskHandler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record TaskDefinition(
        String name,
        TaskHandler handler,
        String defaultQueue,
        int priority,
        int maxRetries,
        RetryPolicy retryPolicy,
        Duration timeLimit,
        boolean timeoutRetryable,
        List<Class<? extends Throwable>> transientErrors
) {
    public static final String DEFAULT_QUEUE = "default";
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofMinutes(5);

    public TaskDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        if (name.isBlank()) throw new IllegalArgumentException("task name must not be blank");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (timeLimit == null || timeLimit.isZero() || timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must be positive");
        }
        defaultQueue = defaultQueue == null || defaultQueue.isBlank() ? DEFAULT_QUEUE : defaultQueue;
        retryPolicy = retryPolicy == null ? new ExponentialBackoffRetryPolicy() : retryPolicy;
        transientErrors = transientErrors == null ? List.of() : List.copyOf(transientErrors);
    }

    public static Builder builder(String name, TaskHandler handler) {
        return new Builder(name, handler);
    }

    /** 설정의 오버라이드를 적용한 사본. null은 현재 값 유지. */
    public TaskDefinition withOverrides(String queue, Integer maxRetries, Duration timeLimit) {
        return new TaskDefinition(name, handler,
                queue != null ? queue : defaultQueue,
                priority,
                maxRetries != null ? maxRetries : this.maxRetries,
                retryPolicy,
                timeLimit != null ? timeLimit : this.timeLimit,
                timeoutRetryable, transientErrors);
    }

    public static final class Builder {
        private final String name;
        private final TaskHandler handler;
        private String queue = DEFAULT_QUEUE;
        private int priority;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private RetryPolicy retryPolicy;
        private Duration timeLimit = DEFAULT_TIME_LIMIT;
        private boolean timeoutRetryable = true;
        private final List<Class<? extends Throwable>> transientErrors = new ArrayList<>();

        private Builder(String name, TaskHandler handler) {
            this.name = name;
            this.handler = handler;
        }

        public Builder queue(String queue) { this.queue = queue; return this; }
        public Builder priority(int priority) { this.priority = priority; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder retryPolicy(RetryPolicy retryPolicy) { this.retryPolicy = retryPolicy; return this; }
        public Builder timeLimit(Duration timeLimit) { this.timeLimit = timeLimit; return this; }
        public Builder timeoutRetryable(boolean retryable) { this.timeoutRetryable = retryable; return this; }

        /** 핸들러가 쓰는 의존성이 던지는 예외 중 재시도할 가치가 있는 타입. */
        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            transientErrors.addAll(List.of(types));
            return this;
        }

        public TaskDefinition build() {
            return new TaskDefinition(name, handler, queue, priority, maxRetries, retryPolicy,
                    timeLimit, timeoutRetryable, transientErrors);
        }
    }
}
