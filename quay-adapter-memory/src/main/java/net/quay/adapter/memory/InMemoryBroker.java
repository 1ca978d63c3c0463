package net.quay.adapter.memory;

import net.quay.core.model.Delivery;
import net.quay.core.model.TaskMessage;
import net.quay.core.spi.Broker;
import net.quay.core.spi.Clock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 단일 프로세스 브로커. 모든 메서드가 모니터 하나로 직렬화된다.
 * 메시지 상태: READY(visibleAt 이후 노출) → RUNNING(lease) → 삭제(ack) / READY(재시도) / DEAD.
 */
public final class InMemoryBroker implements Broker {
    enum Status { READY, RUNNING, DEAD }

    private static final class Entry {
        TaskMessage message;
        Status status = Status.READY;
        Instant visibleAt;
        long seq;
        String consumer;
        String leaseToken;
        Instant leaseUntil;
    }

    private static final Comparator<Entry> DELIVERY_ORDER =
            Comparator.<Entry>comparingInt(e -> e.message.priority()).reversed()
                    .thenComparingLong(e -> e.seq);

    private final Clock clock;
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private long seq;

    public InMemoryBroker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void enqueue(TaskMessage message) {
        // JDBC 쪽 PK 위반과 동일하게 취급: 같은 id의 메시지(DEAD 포함)는 덮어쓰지 않는다
        if (entries.containsKey(message.id())) {
            throw new IllegalStateException("Message " + message.id() + " is already held by the broker");
        }
        Entry e = new Entry();
        e.message = message;
        e.visibleAt = message.eta() != null ? message.eta() : clock.now();
        e.seq = ++seq;
        entries.put(message.id(), e);
    }

    @Override
    public synchronized Optional<Delivery> dequeue(List<String> queues, Duration visibilityTimeout, String consumer) {
        Instant now = clock.now();
        for (String queue : queues) {
            Optional<Entry> picked = entries.values().stream()
                    .filter(e -> e.message.queue().equals(queue))
                    .filter(e -> claimable(e, now))
                    .min(DELIVERY_ORDER);
            if (picked.isEmpty()) continue;

            // lease 만료로 다시 잡히는 메시지도 attempt는 그대로 (실패가 아님)
            Entry e = picked.get();
            e.status = Status.RUNNING;
            e.consumer = consumer;
            e.leaseToken = UUID.randomUUID().toString();
            e.leaseUntil = now.plus(visibilityTimeout);
            return Optional.of(new Delivery(e.message, consumer, e.leaseToken, e.leaseUntil));
        }
        return Optional.empty();
    }

    private static boolean claimable(Entry e, Instant now) {
        return switch (e.status) {
            case READY -> !e.visibleAt.isAfter(now);
            case RUNNING -> !e.leaseUntil.isAfter(now);
            case DEAD -> false;
        };
    }

    @Override
    public synchronized boolean ack(Delivery d) {
        Entry e = leased(d);
        if (e == null) return false;
        entries.remove(d.taskId());
        return true;
    }

    @Override
    public synchronized boolean nack(Delivery d, boolean requeue, Duration delay) {
        Entry e = leased(d);
        if (e == null) return false;
        clearLease(e);
        if (requeue) {
            Instant visibleAt = clock.now().plus(delay == null ? Duration.ZERO : delay);
            e.message = e.message.nextAttempt(visibleAt);
            e.visibleAt = visibleAt;
            e.status = Status.READY;
            e.seq = ++seq;
        } else {
            e.status = Status.DEAD;
        }
        return true;
    }

    @Override
    public synchronized boolean release(Delivery d) {
        Entry e = leased(d);
        if (e == null) return false;
        clearLease(e);
        e.status = Status.READY;
        e.visibleAt = clock.now();
        return true;
    }

    @Override
    public synchronized boolean extendLease(Delivery d, Duration visibilityTimeout) {
        Entry e = leased(d);
        if (e == null) return false;
        e.leaseUntil = clock.now().plus(visibilityTimeout);
        return true;
    }

    @Override
    public synchronized int recoverExpired() {
        Instant now = clock.now();
        int n = 0;
        for (Entry e : entries.values()) {
            if (e.status == Status.RUNNING && !e.leaseUntil.isAfter(now)) {
                clearLease(e);
                e.status = Status.READY;
                e.visibleAt = now;
                n++;
            }
        }
        return n;
    }

    @Override
    public synchronized List<TaskMessage> deadLetters(String queue, int limit) {
        List<TaskMessage> out = new ArrayList<>();
        for (Entry e : entries.values()) {
            if (out.size() >= limit) break;
            if (e.status == Status.DEAD && e.message.queue().equals(queue)) out.add(e.message);
        }
        return out;
    }

    @Override
    public synchronized long depth(String queue) {
        return entries.values().stream()
                .filter(e -> e.status == Status.READY && e.message.queue().equals(queue))
                .count();
    }

    @Override
    public void ping() {
        // 항상 연결됨
    }

    private Entry leased(Delivery d) {
        Entry e = entries.get(d.taskId());
        if (e == null || e.status != Status.RUNNING || !d.leaseToken().equals(e.leaseToken)) return null;
        return e;
    }

    private static void clearLease(Entry e) {
        e.consumer = null;
        e.leaseToken = null;
        e.leaseUntil = null;
    }
}
