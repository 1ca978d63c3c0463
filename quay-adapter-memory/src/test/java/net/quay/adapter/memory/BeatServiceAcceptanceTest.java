package net.quay.adapter.memory;

import net.quay.core.model.ScheduleEntry;
import net.quay.core.model.TaskMessage;
import net.quay.core.model.Trigger;
import net.quay.core.service.BeatService;
import net.quay.core.service.TaskRegistry;
import net.quay.core.spi.CronCalculator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BeatServiceAcceptanceTest {

    // 매 정시(hour)마다. 실제 cron 파서는 integration-spring에서 검증
    static final CronCalculator HOURLY = (from, expr, zone) -> from.truncatedTo(ChronoUnit.HOURS).plus(Duration.ofHours(1));

    QueueFixture f;
    BeatService beat;

    @BeforeEach
    void setUp() {
        f = new QueueFixture(TaskRegistry.builder()
                .register("cleanup_old_exports", (call, progress) -> null, "maintenance")
                .register("send_notification", (call, progress) -> null, "default")
                .build());
        beat = newBeat();
    }

    BeatService newBeat() {
        return new BeatService(f.schedules, f.client, f.tx, f.clock, HOURLY, ZoneOffset.UTC);
    }

    @AfterEach
    void tearDown() {
        f.close();
    }

    @Test
    void one_second_interval_fires_five_times_in_five_and_a_half_seconds() throws Exception {
        beat.register(List.of(ScheduleEntry.define("ping", "send_notification", Trigger.every(Duration.ofSeconds(1)),
                List.of(1), Map.of())));

        int fired = 0;
        for (int tick = 0; tick <= 11; tick++) {           // t = 0.0, 0.5, ... 5.5
            fired += beat.tickOnce(BeatService.DEFAULT_LEASE, "beat");
            if (tick < 11) f.clock.advance(Duration.ofMillis(500));
        }

        assertEquals(5, fired);
        assertEquals(5, f.broker.depth("default"));
    }

    @Test
    void millisecond_interval_keeps_ticking_after_a_misfire() throws Exception {
        beat.register(List.of(ScheduleEntry.define("fast", "send_notification", Trigger.every(Duration.ofMillis(1)),
                List.of(), Map.of())));

        f.clock.advance(Duration.ofMillis(1));
        assertEquals(1, beat.tickOnce(BeatService.DEFAULT_LEASE, "beat"));
        f.clock.advance(Duration.ofMillis(7).plusNanos(300_000));
        assertEquals(1, beat.tickOnce(BeatService.DEFAULT_LEASE, "beat"));

        ScheduleEntry e = f.schedules.findByName("fast").orElseThrow();
        assertEquals(QueueFixture.T0.plusMillis(9), e.nextFireAt());
    }

    @Test
    void daily_cleanup_fires_once_after_two_restarts() throws Exception {
        var cleanup = ScheduleEntry.define("cleanup", "cleanup_old_exports", Trigger.every(Duration.ofHours(24)),
                List.of(), Map.of());
        beat.register(List.of(cleanup));

        // 두 번의 다운/재시작. 재시작마다 같은 정의로 재등록
        f.clock.advance(Duration.ofHours(10));
        newBeat().register(List.of(cleanup));
        f.clock.advance(Duration.ofHours(10));
        beat = newBeat();
        beat.register(List.of(cleanup));

        f.clock.advance(Duration.ofHours(5));     // t0 + 25h
        assertEquals(1, beat.tickOnce(BeatService.DEFAULT_LEASE, "beat"));
        assertEquals(0, beat.tickOnce(BeatService.DEFAULT_LEASE, "beat"));

        ScheduleEntry after = f.schedules.findByName("cleanup").orElseThrow();
        assertEquals(QueueFixture.T0.plus(Duration.ofHours(48)), after.nextFireAt(), "phase kept");
        assertEquals(1, f.broker.depth("maintenance"));
    }

    @Test
    void long_downtime_is_not_replayed() throws Exception {
        beat.register(List.of(ScheduleEntry.define("ping", "send_notification", Trigger.every(Duration.ofMinutes(1)),
                List.of(), Map.of())));

        f.clock.advance(Duration.ofMinutes(30).plusSeconds(10));
        assertEquals(1, beat.tickOnce(BeatService.DEFAULT_LEASE, "beat"));

        ScheduleEntry e = f.schedules.findByName("ping").orElseThrow();
        assertEquals(QueueFixture.T0.plus(Duration.ofMinutes(31)), e.nextFireAt());
        assertEquals(f.clock.now(), e.lastFiredAt());
    }

    @Test
    void cron_entry_fires_at_each_slot() throws Exception {
        beat.register(List.of(ScheduleEntry.define("hourly", "cleanup_old_exports", Trigger.cron("0 0 * * * ?"),
                List.of(), Map.of())));
        assertEquals(QueueFixture.T0.plus(Duration.ofHours(1)), f.schedules.findByName("hourly").orElseThrow().nextFireAt());

        int fired = 0;
        for (int m = 0; m < 180; m += 15) {
            f.clock.advance(Duration.ofMinutes(15));
            fired += beat.tickOnce(BeatService.DEFAULT_LEASE, "beat");
        }
        assertEquals(3, fired);
    }

    @Test
    void registration_keeps_cursor_for_unchanged_entries_and_resets_changed_ones() throws Exception {
        var every = ScheduleEntry.define("ping", "send_notification", Trigger.every(Duration.ofMinutes(5)), List.of(), Map.of());
        var other = ScheduleEntry.define("other", "send_notification", Trigger.every(Duration.ofMinutes(5)), List.of(), Map.of());
        beat.register(List.of(every, other));
        Instant firstCursor = f.schedules.findByName("ping").orElseThrow().nextFireAt();

        f.clock.advance(Duration.ofMinutes(2));
        beat.register(List.of(every));
        assertEquals(firstCursor, f.schedules.findByName("ping").orElseThrow().nextFireAt());
        assertFalse(f.schedules.findByName("other").orElseThrow().enabled(), "removed entry disabled");

        var changed = ScheduleEntry.define("ping", "send_notification", Trigger.every(Duration.ofMinutes(10)), List.of(), Map.of());
        beat.register(List.of(changed));
        assertEquals(f.clock.now().plus(Duration.ofMinutes(10)), f.schedules.findByName("ping").orElseThrow().nextFireAt());
    }

    @Test
    void unknown_task_is_skipped_and_cursor_still_advances() throws Exception {
        beat.register(List.of(
                ScheduleEntry.define("ghost", "no_such_task", Trigger.every(Duration.ofMinutes(1)), List.of(), Map.of()),
                ScheduleEntry.define("ping", "send_notification", Trigger.every(Duration.ofMinutes(1)), List.of(), Map.of())
                        .withQueue("alerts")));

        f.clock.advance(Duration.ofMinutes(1));
        assertEquals(2, beat.tickOnce(BeatService.DEFAULT_LEASE, "beat"));

        assertEquals(f.clock.now().plus(Duration.ofMinutes(1)), f.schedules.findByName("ghost").orElseThrow().nextFireAt());
        TaskMessage m = f.next("alerts").orElseThrow().message();
        assertEquals("send_notification", m.name());
        assertEquals(0, f.broker.depth("default"));
    }
}
