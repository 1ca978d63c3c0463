package net.quay.core.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

    @Test
    void delay_doubles_per_attempt_without_jitter() {
        var p = new ExponentialBackoffRetryPolicy(Duration.ofSeconds(1), Duration.ZERO, Duration.ofMinutes(10));

        assertEquals(Duration.ofSeconds(1), p.nextBackoff(0));
        assertEquals(Duration.ofSeconds(2), p.nextBackoff(1));
        assertEquals(Duration.ofSeconds(4), p.nextBackoff(2));
        assertEquals(Duration.ofSeconds(8), p.nextBackoff(3));
    }

    @Test
    void delay_is_capped_at_max_even_for_huge_attempts() {
        var p = new ExponentialBackoffRetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(30));

        assertEquals(Duration.ofSeconds(30), p.nextBackoff(5));
        assertEquals(Duration.ofSeconds(30), p.nextBackoff(63));
        assertEquals(Duration.ofSeconds(30), p.nextBackoff(Long.MAX_VALUE));
    }

    @Test
    void jitter_stays_within_bound_and_never_breaks_monotonicity() {
        // 최악의 경우: attempt n은 최대 지터, n+1은 지터 0
        var high = new ExponentialBackoffRetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofHours(1), b -> b);
        var low = new ExponentialBackoffRetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofHours(1), b -> 0);

        for (int n = 0; n < 10; n++) {
            assertTrue(low.nextBackoff(n + 1).compareTo(high.nextBackoff(n)) >= 0, "attempt " + n);
        }

        var real = new ExponentialBackoffRetryPolicy();
        for (int i = 0; i < 200; i++) {
            long ms = real.nextBackoff(2).toMillis();
            assertTrue(ms >= 4_000 && ms <= 5_000, "out of range: " + ms);
        }
    }

    @Test
    void rejects_jitter_larger_than_base() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffRetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffRetryPolicy(Duration.ZERO, Duration.ZERO, Duration.ofMinutes(1)));
    }

    @Test
    void fixed_policy_ignores_attempt() {
        var p = RetryPolicy.fixed(Duration.ofSeconds(10));
        assertEquals(Duration.ofSeconds(10), p.nextBackoff(0));
        assertEquals(Duration.ofSeconds(10), p.nextBackoff(7));
    }
}
