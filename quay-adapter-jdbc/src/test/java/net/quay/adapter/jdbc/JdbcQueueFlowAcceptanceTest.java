package net.quay.adapter.jdbc;

import net.quay.adapter.jdbc.repo.JdbcBroker;
import net.quay.adapter.jdbc.repo.JdbcResultStore;
import net.quay.adapter.jdbc.repo.JdbcScheduleRepository;
import net.quay.core.error.TransientTaskException;
import net.quay.core.handler.ExecutionContext;
import net.quay.core.model.ScheduleEntry;
import net.quay.core.model.TaskResult;
import net.quay.core.model.TaskResult.State;
import net.quay.core.model.Trigger;
import net.quay.core.service.BeatService;
import net.quay.core.service.BrokerClient;
import net.quay.core.service.RetryPolicy;
import net.quay.core.service.RetryPolicyEngine;
import net.quay.core.service.TaskClient;
import net.quay.core.service.TaskDefinition;
import net.quay.core.service.TaskExecutor;
import net.quay.core.service.TaskRegistry;
import net.quay.core.service.TaskRouter;
import net.quay.core.spi.Clock;
import net.quay.core.spi.TxRunner;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/** 클라이언트 → 브로커 → 실행기 → 결과 저장소, beat까지 Oracle 위에서 한 번에. */
class JdbcQueueFlowAcceptanceTest extends TestSupport {

    TxRunner tx;
    Clock clock;
    BrokerClient brokerClient;
    JdbcResultStore results;
    JdbcScheduleRepository schedules;
    TaskRegistry registry;
    TaskClient client;
    TaskExecutor executor;

    final AtomicInteger flaky = new AtomicInteger();
    final AtomicInteger orders = new AtomicInteger();

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        clock = Clock.system();
        JsonCodec json = new JsonCodec();
        brokerClient = new BrokerClient(new JdbcBroker(ds, json), tx, Duration.ofMillis(20));
        results = new JdbcResultStore(ds, json);
        schedules = new JdbcScheduleRepository(ds, json);

        registry = TaskRegistry.builder()
                .register("export_work_logs", (call, progress) -> {
                    for (int i = 1; i <= 500; i++) {
                        if (i % 50 == 0) progress.report(i, 500, "Processing " + i + "/500");
                    }
                    return Map.of("record_count", 500, "start_date", call.kwarg("start", String.class));
                }, "export")
                .register(TaskDefinition.builder("flaky_task", (call, progress) -> {
                    if (flaky.incrementAndGet() <= 3) throw new TransientTaskException("attempt " + call.attempt());
                    return "ok";
                }).maxRetries(3).retryPolicy(RetryPolicy.fixed(Duration.ofMillis(10))).build())
                .register("process_order", (call, progress) -> orders.incrementAndGet(), "default")
                .build();
        client = new TaskClient(registry, brokerClient, results, tx, clock, TaskRouter.NONE);
        executor = new TaskExecutor(registry, brokerClient, results, tx, clock,
                new RetryPolicyEngine(), ExecutionContext.EMPTY, Duration.ofHours(1));
    }

    @AfterAll
    void closeExecutor() {
        if (executor != null) executor.close();
    }

    @BeforeEach
    void clean() throws Exception {
        truncateAll(tx);
        flaky.set(0);
        orders.set(0);
    }

    void drain(String queue) throws Exception {
        for (int idle = 0; idle < 10; ) {
            var d = brokerClient.tryDequeue(List.of(queue), Duration.ofSeconds(30), "jdbc-test");
            if (d.isEmpty()) { idle++; Thread.sleep(20); continue; }
            executor.execute(d.get());
            idle = 0;
        }
    }

    @Test
    void export_reaches_success_with_full_progress() throws Exception {
        String id = client.submit("export_work_logs", List.of(), Map.of("start", "2024-01-01", "end", "2024-01-31"));
        drain("export");

        TaskResult r = client.getStatus(id).orElseThrow();
        assertEquals(State.SUCCESS, r.state());
        assertEquals(100, r.progress());
        assertEquals(500, ((Map<?, ?>) r.result()).get("record_count"));
    }

    @Test
    void flaky_task_succeeds_after_three_retries() throws Exception {
        String id = client.submit("flaky_task", List.of(), Map.of());
        drain("default");

        TaskResult r = client.getStatus(id).orElseThrow();
        assertEquals(State.SUCCESS, r.state());
        assertEquals(3, r.attempt());
        assertEquals(4, flaky.get());
    }

    @Test
    void revoked_task_is_skipped() throws Exception {
        String id = client.submit("process_order", List.of(7), Map.of());
        assertTrue(client.revoke(id));
        drain("default");

        assertEquals(State.REVOKED, client.getStatus(id).orElseThrow().state());
        assertEquals(0, orders.get());
    }

    @Test
    void beat_fires_due_entry_once_and_advances_cursor() throws Exception {
        BeatService beat = new BeatService(schedules, client, tx, clock,
                (from, expr, zone) -> from.plusSeconds(3600), ZoneOffset.UTC);
        beat.register(List.of(ScheduleEntry.define("orders", "process_order", Trigger.every(Duration.ofSeconds(1)),
                List.of(1), Map.of())));

        Thread.sleep(1_100);
        assertEquals(1, beat.tickOnce(Duration.ofSeconds(30), "beat-a"));
        assertEquals(0, beat.tickOnce(Duration.ofSeconds(30), "beat-b"));

        ScheduleEntry e = tx.required(() -> schedules.findByName("orders")).orElseThrow();
        assertNotNull(e.lastFiredAt());
        assertNull(e.leaseUntil());
        assertTrue(e.nextFireAt().isAfter(e.lastFiredAt()));
        assertEquals(1L, brokerClient.depth("default"));
    }
}
