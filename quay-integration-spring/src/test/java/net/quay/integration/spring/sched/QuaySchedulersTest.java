package net.quay.integration.spring.sched;

import net.quay.adapter.memory.DirectTxRunner;
import net.quay.adapter.memory.InMemoryBroker;
import net.quay.adapter.memory.InMemoryResultStore;
import net.quay.adapter.memory.InMemoryScheduleRepository;
import net.quay.core.maintenance.MaintenanceService;
import net.quay.core.model.ScheduleEntry;
import net.quay.core.model.Trigger;
import net.quay.core.service.BeatService;
import net.quay.core.service.BrokerClient;
import net.quay.core.service.TaskClient;
import net.quay.core.service.TaskRegistry;
import net.quay.core.service.TaskRouter;
import net.quay.core.spi.Clock;
import net.quay.core.spi.TxRunner;
import net.quay.integration.spring.cron.CronUtilsCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class QuaySchedulersTest {

    final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2024-01-01T00:00:00Z"));
    final Clock clock = now::get;

    InMemoryBroker broker;
    BrokerClient brokerClient;
    QuaySchedulers schedulers;

    @BeforeEach
    void setUp() throws Exception {
        TxRunner tx = new DirectTxRunner();
        broker = new InMemoryBroker(clock);
        brokerClient = new BrokerClient(broker, tx);
        var results = new InMemoryResultStore();
        var registry = TaskRegistry.builder()
                .register("cleanup_old_exports", (call, progress) -> 0, "maintenance")
                .build();
        var client = new TaskClient(registry, brokerClient, results, tx, clock, TaskRouter.NONE);
        var beat = new BeatService(new InMemoryScheduleRepository(), client, tx, clock,
                new CronUtilsCalculator(), ZoneOffset.UTC);
        beat.register(List.of(ScheduleEntry.define("nightly-cleanup", "cleanup_old_exports",
                Trigger.cron("0 0 3 * * ?"), List.of(), Map.of())));

        schedulers = new QuaySchedulers(beat, new MaintenanceService(broker, results, tx, clock));
    }

    @Test
    void beat_tick_is_inert_until_enabled() throws Exception {
        now.set(Instant.parse("2024-01-01T03:00:01Z"));

        schedulers.beatTick();
        assertThat(brokerClient.depth("maintenance")).isZero();

        schedulers.setBeatEnabled(true);
        schedulers.beatTick();
        schedulers.beatTick();
        assertThat(brokerClient.depth("maintenance")).isEqualTo(1);
    }

    @Test
    void maintenance_recovers_expired_leases() throws Exception {
        schedulers.setBeatEnabled(true);
        now.set(Instant.parse("2024-01-01T03:00:01Z"));
        schedulers.beatTick();

        assertThat(brokerClient.tryDequeue(List.of("maintenance"), Duration.ofSeconds(10), "w#0")).isPresent();
        assertThat(brokerClient.depth("maintenance")).isZero();

        now.set(now.get().plusSeconds(11));
        schedulers.maintenance();
        assertThat(brokerClient.depth("maintenance")).isEqualTo(1);
    }
}
