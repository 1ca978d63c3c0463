package net.quay.core.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * {@code min(base * 2^attempt + random[0, jitter], maxDelay)}.
 * <p>
 * jitter는 base를 넘을 수 없다. 이 제한 아래에서는 난수와 무관하게
 * n+1번째 지연이 n번째 지연보다 작아지지 않는다.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
    public static final Duration DEFAULT_JITTER = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(10);

    private final long baseMillis;
    private final long jitterMillis;
    private final long maxMillis;
    private final LongUnaryOperator random; // bound -> [0, bound] 구간

    public ExponentialBackoffRetryPolicy() {
        this(DEFAULT_BASE, DEFAULT_JITTER, DEFAULT_MAX_DELAY);
    }

    public ExponentialBackoffRetryPolicy(Duration base, Duration jitter, Duration maxDelay) {
        this(base, jitter, maxDelay, bound -> bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound + 1));
    }

    ExponentialBackoffRetryPolicy(Duration base, Duration jitter, Duration maxDelay, LongUnaryOperator random) {
        if (base == null || base.isNegative() || base.isZero()) throw new IllegalArgumentException("base must be positive");
        if (jitter == null || jitter.isNegative()) throw new IllegalArgumentException("jitter must not be negative");
        if (jitter.compareTo(base) > 0) throw new IllegalArgumentException("jitter must not exceed base");
        if (maxDelay == null || maxDelay.compareTo(base) < 0) throw new IllegalArgumentException("maxDelay must be >= base");
        this.baseMillis = base.toMillis();
        this.jitterMillis = jitter.toMillis();
        this.maxMillis = maxDelay.toMillis();
        this.random = random;
    }

    @Override
    public Duration nextBackoff(long attempt) {
        long n = Math.max(0, attempt);
        long exp;
        // 2^62면 어떤 상한이든 이미 넘는다
        if (n >= 62 || baseMillis > (Long.MAX_VALUE >> n)) {
            exp = Long.MAX_VALUE;
        } else {
            exp = baseMillis << n;
        }
        long delay = exp >= maxMillis ? maxMillis : Math.min(maxMillis, exp + random.applyAsLong(jitterMillis));
        return Duration.ofMillis(delay);
    }

    public Duration base() { return Duration.ofMillis(baseMillis); }
    public Duration jitter() { return Duration.ofMillis(jitterMillis); }
    public Duration maxDelay() { return Duration.ofMillis(maxMillis); }
}
