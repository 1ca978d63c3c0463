package net.quay.core.service;

import java.time.Duration;
import java.util.Objects;

final class FixedRetryPolicy implements RetryPolicy {
    private final Duration backoff;
    FixedRetryPolicy(Duration backoff) { this.backoff = Objects.requireNonNull(backoff, "backoff"); }
    @Override public Duration nextBackoff(long attempt) { return backoff; }
}
