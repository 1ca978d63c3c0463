package net.quay.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** {@code attempt}(0부터)번째에 실패한 메시지를 다시 돌리기 전 대기 시간. */
    Duration nextBackoff(long attempt);

    /** 매 시도 같은 지연. */
    static RetryPolicy fixed(Duration backoff) {
        return new FixedRetryPolicy(backoff);
    }

    static RetryPolicy exponential(Duration base, Duration jitter, Duration maxDelay) {
        return new ExponentialBackoffRetryPolicy(base, jitter, maxDelay);
    }
}
