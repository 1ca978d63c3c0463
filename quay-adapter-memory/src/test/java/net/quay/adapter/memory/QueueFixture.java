package net.quay.adapter.memory;

import net.quay.core.handler.ExecutionContext;
import net.quay.core.model.Delivery;
import net.quay.core.service.BrokerClient;
import net.quay.core.service.RetryPolicyEngine;
import net.quay.core.service.TaskClient;
import net.quay.core.service.TaskExecutor;
import net.quay.core.service.TaskRegistry;
import net.quay.core.service.TaskRouter;
import net.quay.core.spi.TxRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** 메모리 어댑터 위에 코어 서비스를 한 벌 조립한다. 시계는 테스트가 직접 움직인다. */
final class QueueFixture implements AutoCloseable {
    static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    static final Duration VISIBILITY = Duration.ofMinutes(1);
    static final Duration RESULT_TTL = Duration.ofHours(1);

    final MutableClock clock = new MutableClock(T0);
    final InMemoryBroker broker = new InMemoryBroker(clock);
    final InMemoryResultStore results = new InMemoryResultStore();
    final InMemoryScheduleRepository schedules = new InMemoryScheduleRepository();
    final TxRunner tx = new DirectTxRunner();
    final BrokerClient brokerClient = new BrokerClient(broker, tx, Duration.ofMillis(5));
    final TaskRegistry registry;
    final TaskClient client;
    final TaskExecutor executor;

    QueueFixture(TaskRegistry registry) {
        this(registry, Map.of());
    }

    QueueFixture(TaskRegistry registry, Map<String, String> routes) {
        this.registry = registry;
        this.client = new TaskClient(registry, brokerClient, results, tx, clock, new TaskRouter(routes));
        this.executor = new TaskExecutor(registry, brokerClient, results, tx, clock,
                new RetryPolicyEngine(), ExecutionContext.EMPTY, RESULT_TTL);
    }

    Optional<Delivery> next(String... queues) {
        return brokerClient.tryDequeue(List.of(queues), VISIBILITY, "test-worker");
    }

    /**
     * 큐가 빌 때까지 실행. 지연된 재시도가 있으면 시계를 1분씩 당겨서 기다린다.
     * 실행 횟수를 반환.
     */
    int drain(String... queues) throws InterruptedException {
        int runs = 0;
        for (int idle = 0; idle < 30; ) {
            Optional<Delivery> d = next(queues);
            if (d.isEmpty()) {
                clock.advance(Duration.ofMinutes(1));
                idle++;
                continue;
            }
            executor.execute(d.get());
            runs++;
            idle = 0;
        }
        return runs;
    }

    @Override
    public void close() {
        executor.close();
    }
}
