package net.quay.core.service;

import net.quay.core.error.BrokerUnavailableException;
import net.quay.core.error.QuayException;
import net.quay.core.model.Delivery;
import net.quay.core.model.TaskMessage;
import net.quay.core.spi.Broker;
import net.quay.core.spi.TxRunner;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * {@link Broker}의 생산자/소비자 쪽 창구. 호출마다 트랜잭션을 열고, 저장소 실패는
 * {@link BrokerUnavailableException}으로 바꾸고, 블로킹 dequeue를 얹는다.
 */
public final class BrokerClient {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);

    private final Broker broker;
    private final TxRunner tx;
    private final Duration pollInterval;

    public BrokerClient(Broker broker, TxRunner tx) {
        this(broker, tx, DEFAULT_POLL_INTERVAL);
    }

    public BrokerClient(Broker broker, TxRunner tx, Duration pollInterval) {
        this.broker = broker;
        this.tx = tx;
        this.pollInterval = pollInterval;
    }

    public void enqueue(TaskMessage message) {
        call("enqueue " + message.id(), () -> { broker.enqueue(message); return null; });
    }

    /**
     * {@code queues} 중 하나에 메시지가 올 때까지 최대 {@code blockTimeout} 기다린다.
     * 타임아웃이면 empty (오류 아님).
     */
    public Optional<Delivery> dequeue(List<String> queues, Duration blockTimeout,
                                      Duration visibilityTimeout, String consumer) throws InterruptedException {
        long deadline = System.nanoTime() + blockTimeout.toNanos();
        while (true) {
            Optional<Delivery> got = tryDequeue(queues, visibilityTimeout, consumer);
            if (got.isPresent()) return got;
            long left = deadline - System.nanoTime();
            if (left <= 0) return Optional.empty();
            Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), left / 1_000_000)));
        }
    }

    public Optional<Delivery> tryDequeue(List<String> queues, Duration visibilityTimeout, String consumer) {
        try {
            return tx.requiresNew(() -> broker.dequeue(queues, visibilityTimeout, consumer));
        } catch (QuayException e) {
            throw e;
        } catch (Exception e) {
            throw new BrokerUnavailableException("dequeue from " + queues + " failed", e);
        }
    }

    public boolean ack(Delivery d) {
        return call("ack " + d.taskId(), () -> broker.ack(d));
    }

    public boolean nack(Delivery d, boolean requeue, Duration delay) {
        return call("nack " + d.taskId(), () -> broker.nack(d, requeue, delay));
    }

    public boolean release(Delivery d) {
        return call("release " + d.taskId(), () -> broker.release(d));
    }

    public boolean extendLease(Delivery d, Duration visibilityTimeout) {
        return call("extend lease of " + d.taskId(), () -> broker.extendLease(d, visibilityTimeout));
    }

    public int recoverExpired() {
        return call("recover expired leases", broker::recoverExpired);
    }

    public List<TaskMessage> deadLetters(String queue, int limit) {
        return call("list dead letters of " + queue, () -> broker.deadLetters(queue, limit));
    }

    public long depth(String queue) {
        return call("depth of " + queue, () -> broker.depth(queue));
    }

    public void ping() {
        call("ping", () -> { broker.ping(); return null; });
    }

    private <T> T call(String what, Callable<T> body) {
        try {
            return tx.required(body);
        } catch (QuayException e) {
            throw e;
        } catch (Exception e) {
            throw new BrokerUnavailableException("Broker call failed: " + what, e);
        }
    }
}
