package net.quay.adapter.memory;

import net.quay.core.error.TransientTaskException;
import net.quay.core.handler.ExecutionContext;
import net.quay.core.model.TaskResult;
import net.quay.core.service.BrokerClient;
import net.quay.core.service.RetryPolicy;
import net.quay.core.service.RetryPolicyEngine;
import net.quay.core.service.TaskClient;
import net.quay.core.service.TaskDefinition;
import net.quay.core.service.TaskExecutor;
import net.quay.core.service.TaskRegistry;
import net.quay.core.service.TaskRouter;
import net.quay.core.service.WorkerOptions;
import net.quay.core.service.WorkerPool;
import net.quay.core.spi.Clock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/** 실제 시계 + 실제 스레드. */
class WorkerPoolAcceptanceTest {

    final Clock clock = Clock.system();
    final InMemoryBroker broker = new InMemoryBroker(clock);
    final InMemoryResultStore results = new InMemoryResultStore();
    final DirectTxRunner tx = new DirectTxRunner();
    final BrokerClient brokerClient = new BrokerClient(broker, tx, Duration.ofMillis(10));

    final Set<String> threads = ConcurrentHashMap.newKeySet();
    final AtomicInteger flakyCalls = new AtomicInteger();
    final CountDownLatch blocker = new CountDownLatch(1);

    TaskRegistry registry;
    TaskClient client;
    TaskExecutor executor;
    WorkerPool pool;

    @BeforeEach
    void setUp() {
        registry = TaskRegistry.builder()
                .register("send_notification", (call, progress) -> {
                    threads.add(Thread.currentThread().getName());
                    Thread.sleep(20);
                    return "sent " + call.arg(0, Integer.class);
                }, "default")
                .register(TaskDefinition.builder("flaky", (call, progress) -> {
                    if (flakyCalls.incrementAndGet() < 3) throw new TransientTaskException("blip");
                    return "ok";
                }).retryPolicy(RetryPolicy.fixed(Duration.ofMillis(50))).build())
                .register("blocking", (call, progress) -> {
                    blocker.await();
                    return null;
                }, "slow")
                .build();
        client = new TaskClient(registry, brokerClient, results, tx, clock, TaskRouter.NONE);
        executor = new TaskExecutor(registry, brokerClient, results, tx, clock,
                new RetryPolicyEngine(), ExecutionContext.EMPTY, Duration.ofMinutes(5));
    }

    WorkerPool start(WorkerOptions options) {
        pool = new WorkerPool(brokerClient, executor, options.withPollTimeout(Duration.ofMillis(50)));
        pool.start();
        return pool;
    }

    @AfterEach
    void tearDown() throws Exception {
        blocker.countDown();
        if (pool != null) pool.shutdown(Duration.ofSeconds(2));
        executor.close();
    }

    @Test
    void executor_outlives_a_stopped_pool() throws Exception {
        WorkerPool first = start(WorkerOptions.of("host-a", List.of("default"), 1));
        first.shutdown(Duration.ofSeconds(1));

        start(WorkerOptions.of("host-b", List.of("default"), 1));
        String id = client.submit("send_notification", List.of(5), Map.of());

        TaskResult r = client.await(id, Duration.ofSeconds(10));
        assertEquals(TaskResult.State.SUCCESS, r.state());
        assertEquals("sent 5", r.result());
    }

    @Test
    void pool_runs_submitted_tasks_concurrently() {
        start(WorkerOptions.of("host-a", List.of("default"), 3));

        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 12; i++) ids.add(client.submit("send_notification", List.of(i), Map.of()));

        await().atMost(Duration.ofSeconds(10)).until(() -> ids.stream()
                .allMatch(id -> client.getStatus(id).map(r -> r.state() == TaskResult.State.SUCCESS).orElse(false)));

        assertEquals("sent 7", client.getStatus(ids.get(7)).orElseThrow().result());
        assertEquals(12, pool.processed(TaskExecutor.Outcome.SUCCEEDED));
        assertTrue(threads.size() > 1, "more than one handler thread used: " + threads);
    }

    @Test
    void transient_failures_are_retried_by_the_pool() throws Exception {
        start(WorkerOptions.of("host-a", List.of("default"), 1));

        String id = client.submit("flaky", List.of(), Map.of());

        TaskResult r = client.await(id, Duration.ofSeconds(10));
        assertEquals(TaskResult.State.SUCCESS, r.state());
        assertEquals(3, flakyCalls.get());
        assertEquals(2, pool.processed(TaskExecutor.Outcome.RETRY_SCHEDULED));
    }

    @Test
    void shutdown_gives_prefetched_messages_back() throws Exception {
        start(WorkerOptions.of("host-a", List.of("slow"), 1).withPrefetch(3).withShutdownGrace(Duration.ofMillis(200)));

        String running = client.submit("blocking", List.of(), Map.of());
        client.submit("blocking", List.of(), Map.of());
        client.submit("blocking", List.of(), Map.of());

        await().atMost(Duration.ofSeconds(5)).until(() ->
                client.getStatus(running).map(r -> r.state() == TaskResult.State.PROGRESS).orElse(false));
        assertEquals(0, broker.depth("slow"), "all three held by the worker");

        pool.close();

        assertFalse(pool.isRunning());
        assertEquals(3, broker.depth("slow"), "prefetched and interrupted messages released");
    }

    @Test
    void heartbeat_keeps_long_tasks_leased() throws Exception {
        start(WorkerOptions.of("host-a", List.of("slow"), 1).withVisibilityTimeout(Duration.ofMillis(300)));

        client.submit("blocking", List.of(), Map.of());
        TimeUnit.MILLISECONDS.sleep(900);

        assertTrue(brokerClient.tryDequeue(List.of("slow"), Duration.ofSeconds(1), "thief").isEmpty(),
                "lease extended while running");
    }
}
