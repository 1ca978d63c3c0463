package net.quay.core.service;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 워커 프로세스 설정.
 *
 * @param hostname          컨슈머 토큰 접두사 (hostname#index)
 * @param queues            구독 큐, 앞쪽이 우선
 * @param concurrency       동시에 실행하는 핸들러 수
 * @param prefetch          워커 스레드 하나가 미리 가져오는 메시지 수
 * @param pollTimeout       빈 큐에서 한 번 대기하는 시간
 * @param visibilityTimeout ack 전 lease 길이. 하트비트가 1/3 주기로 연장
 * @param shutdownGrace     종료 시 실행 중인 태스크를 기다리는 시간
 */
public record WorkerOptions(
        String hostname,
        List<String> queues,
        int concurrency,
        int prefetch,
        Duration pollTimeout,
        Duration visibilityTimeout,
        Duration shutdownGrace
) {
    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_VISIBILITY_TIMEOUT = Duration.ofMinutes(10);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(30);

    public WorkerOptions {
        Objects.requireNonNull(hostname, "hostname");
        if (queues == null || queues.isEmpty()) throw new IllegalArgumentException("at least one queue required");
        queues = List.copyOf(queues);
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1: " + concurrency);
        if (prefetch < 1) throw new IllegalArgumentException("prefetch must be >= 1: " + prefetch);
        if (pollTimeout == null) pollTimeout = DEFAULT_POLL_TIMEOUT;
        if (visibilityTimeout == null) visibilityTimeout = DEFAULT_VISIBILITY_TIMEOUT;
        if (shutdownGrace == null) shutdownGrace = DEFAULT_SHUTDOWN_GRACE;
        if (visibilityTimeout.toMillis() < 3) throw new IllegalArgumentException("visibilityTimeout too short");
    }

    public static WorkerOptions of(String hostname, List<String> queues, int concurrency) {
        return new WorkerOptions(hostname, queues, concurrency, 1, null, null, null);
    }

    public WorkerOptions withPrefetch(int prefetch) {
        return new WorkerOptions(hostname, queues, concurrency, prefetch, pollTimeout, visibilityTimeout, shutdownGrace);
    }

    public WorkerOptions withPollTimeout(Duration pollTimeout) {
        return new WorkerOptions(hostname, queues, concurrency, prefetch, pollTimeout, visibilityTimeout, shutdownGrace);
    }

    public WorkerOptions withVisibilityTimeout(Duration visibilityTimeout) {
        return new WorkerOptions(hostname, queues, concurrency, prefetch, pollTimeout, visibilityTimeout, shutdownGrace);
    }

    public WorkerOptions withShutdownGrace(Duration shutdownGrace) {
        return new WorkerOptions(hostname, queues, concurrency, prefetch, pollTimeout, visibilityTimeout, shutdownGrace);
    }
}
