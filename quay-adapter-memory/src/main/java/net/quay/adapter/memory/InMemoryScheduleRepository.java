package net.quay.adapter.memory;

import net.quay.core.model.ScheduleEntry;
import net.quay.core.spi.ScheduleRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemoryScheduleRepository implements ScheduleRepository {
    private final Map<String, ScheduleEntry> entries = new LinkedHashMap<>();

    @Override
    public synchronized void save(ScheduleEntry entry) {
        entries.put(entry.name(), entry);
    }

    @Override
    public synchronized Optional<ScheduleEntry> findByName(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    @Override
    public synchronized List<ScheduleEntry> findAll() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public synchronized Optional<ScheduleEntry> claimDue(Instant now, Duration lease, String owner) {
        Optional<ScheduleEntry> due = entries.values().stream()
                .filter(ScheduleEntry::enabled)
                .filter(e -> e.nextFireAt() != null && !e.nextFireAt().isAfter(now))
                .filter(e -> e.leaseUntil() == null || !e.leaseUntil().isAfter(now))
                .min(Comparator.comparing(ScheduleEntry::nextFireAt));
        due.ifPresent(e -> entries.put(e.name(), new ScheduleEntry(e.name(), e.taskName(), e.trigger(), e.enabled(),
                e.queue(), e.args(), e.kwargs(), e.nextFireAt(), e.lastFiredAt(), now.plus(lease))));
        return due;
    }

    @Override
    public synchronized void advanceCursor(String name, Instant nextFireAt, Instant lastFiredAt) {
        ScheduleEntry e = entries.get(name);
        if (e != null) entries.put(name, e.withCursor(nextFireAt, lastFiredAt));
    }

    @Override
    public synchronized void releaseLease(String name) {
        ScheduleEntry e = entries.get(name);
        if (e != null) entries.put(name, e.withCursor(e.nextFireAt(), e.lastFiredAt()));
    }

    @Override
    public synchronized int disableAllExcept(List<String> keep) {
        int n = 0;
        for (var it : new ArrayList<>(entries.values())) {
            if (it.enabled() && !keep.contains(it.name())) {
                entries.put(it.name(), it.withEnabled(false));
                n++;
            }
        }
        return n;
    }
}
