package net.quay.core.service;

import net.quay.core.error.BrokerUnavailableException;
import net.quay.core.error.UnknownTaskNameException;
import net.quay.core.model.ScheduleEntry;
import net.quay.core.model.Trigger;
import net.quay.core.spi.Clock;
import net.quay.core.spi.CronCalculator;
import net.quay.core.spi.ScheduleRepository;
import net.quay.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 주기 스케줄러(beat). 틱마다 due 엔트리를 하나씩 선점 → 태스크 발행 → 커서 전진.
 * 선점/발행/전진은 한 트랜잭션이라 JDBC 모드에서는 여러 beat 프로세스가 떠도 슬롯당 한 번만 발행된다.
 */
public final class BeatService {
    private static final Logger log = LoggerFactory.getLogger(BeatService.class);

    public static final Duration DEFAULT_LEASE = Duration.ofSeconds(30);

    private final ScheduleRepository schedules;
    private final TaskClient client;
    private final TxRunner tx;
    private final Clock clock;
    private final CronCalculator cron;
    private final ZoneId zone;

    public BeatService(ScheduleRepository schedules, TaskClient client, TxRunner tx,
                       Clock clock, CronCalculator cron, ZoneId zone) {
        this.schedules = schedules;
        this.client = client;
        this.tx = tx;
        this.clock = clock;
        this.cron = cron;
        this.zone = zone;
    }

    /**
     * 설정된 엔트리를 저장소에 동기화. 정의가 그대로면 커서를 유지하고, 새로 생기거나 바뀐 엔트리는
     * 지금부터 한 주기 뒤에 처음 발행된다. 목록에 없는 엔트리는 비활성화.
     */
    public void register(List<ScheduleEntry> entries) throws Exception {
        Instant now = clock.now();
        List<String> names = new ArrayList<>();
        tx.required(() -> {
            for (ScheduleEntry def : entries) {
                names.add(def.name());
                Optional<ScheduleEntry> existing = schedules.findByName(def.name());
                if (existing.isPresent() && existing.get().sameDefinition(def) && existing.get().nextFireAt() != null) {
                    schedules.save(existing.get().withEnabled(def.enabled()));
                    continue;
                }
                Instant lastFired = existing.map(ScheduleEntry::lastFiredAt).orElse(null);
                Instant first = initialFireAt(def.trigger(), now);
                schedules.save(def.withCursor(first, lastFired));
                log.info("Schedule '{}' -> {} {} (first at {})", def.name(), def.taskName(), def.trigger(), first);
            }
            int disabled = schedules.disableAllExcept(names);
            if (disabled > 0) log.info("Disabled {} schedule entries no longer configured", disabled);
            return null;
        });
    }

    /** 한 번의 틱. 이번 틱에 발행한 엔트리 수를 반환한다. */
    public int tickOnce(Duration lease, String owner) throws Exception {
        int fired = 0;
        while (true) {
            Instant now = clock.now();
            Optional<String> claimed;
            try {
                claimed = tx.requiresNew(() -> {
                    var opt = schedules.claimDue(now, lease, owner); // FOR UPDATE SKIP LOCKED 내부
                    if (opt.isEmpty()) return Optional.<String>empty();
                    fire(opt.get(), now);
                    return Optional.of(opt.get().name());
                });
            } catch (BrokerUnavailableException e) {
                // 커서는 그대로. 다음 틱에 다시 시도
                log.warn("Beat could not publish a due entry; will retry next tick", e);
                releaseLeases(now);
                throw e;
            }
            if (claimed.isEmpty()) return fired;
            fired++;
        }
    }

    private void fire(ScheduleEntry entry, Instant now) throws Exception {
        Instant scheduled = entry.nextFireAt();
        Instant next = nextFireAfter(entry, now);

        Duration late = Duration.between(scheduled, now);
        Duration period = period(entry.trigger(), scheduled);
        if (late.compareTo(period) > 0) {
            // 놓친 슬롯은 재생하지 않고 한 번만 발행
            log.info("SchedulerMisfire: '{}' was due at {} and is {} late; firing once, next at {}",
                    entry.name(), scheduled, late, next);
        }

        try {
            String id = client.submit(entry.taskName(), entry.args(), entry.kwargs(), SubmitOptions.queue(entry.queue()));
            log.info("Beat fired '{}' -> {}[{}]", entry.name(), entry.taskName(), id);
        } catch (UnknownTaskNameException e) {
            log.error("Schedule '{}' names unknown task '{}'; skipping this slot", entry.name(), e.getTaskName());
        }
        schedules.advanceCursor(entry.name(), next, now);
    }

    private void releaseLeases(Instant now) {
        // 메모리 저장소는 롤백이 없어서 선점 흔적을 직접 지운다
        try {
            tx.requiresNew(() -> {
                for (ScheduleEntry e : schedules.findAll()) {
                    if (e.leaseUntil() != null && e.nextFireAt() != null && !e.nextFireAt().isAfter(now)) {
                        schedules.releaseLease(e.name());
                    }
                }
                return null;
            });
        } catch (Exception ex) {
            log.warn("Could not release schedule leases; they expire on their own", ex);
        }
    }

    /** 새 엔트리의 첫 발행 시각. */
    public Instant initialFireAt(Trigger trigger, Instant now) {
        return switch (trigger.kind()) {
            case INTERVAL -> now.plus(trigger.interval());
            case CRON -> cron.next(now, trigger.cronExpr(), zone);
        };
    }

    /** now 이후 첫 슬롯. interval은 위상을 유지한다 (nextFireAt + k*interval). */
    Instant nextFireAfter(ScheduleEntry entry, Instant now) {
        Trigger t = entry.trigger();
        if (t.kind() == Trigger.Kind.CRON) return cron.next(now, t.cronExpr(), zone);

        Instant base = entry.nextFireAt();
        if (base.isAfter(now)) return base;
        long periodMs = t.interval().toMillis();
        long missed = Duration.between(base, now).toMillis() / periodMs + 1;
        return base.plusMillis(missed * periodMs);
    }

    private Duration period(Trigger t, Instant scheduled) {
        if (t.kind() == Trigger.Kind.INTERVAL) return t.interval();
        return Duration.between(scheduled, cron.next(scheduled, t.cronExpr(), zone));
    }

    public List<ScheduleEntry> entries() throws Exception {
        return tx.required(schedules::findAll);
    }
}
