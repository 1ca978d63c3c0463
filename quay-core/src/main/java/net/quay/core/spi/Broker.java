package net.quay.core.spi;

import net.quay.core.model.Delivery;
import net.quay.core.model.TaskMessage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * at-least-once 전달을 하는 큐 저장소. 선점된 메시지는 ack/nack/release 되거나
 * lease(visibility timeout)가 끝날 때까지 다른 소비자에게 보이지 않는다.
 */
public interface Broker {
    void enqueue(TaskMessage message) throws Exception;

    /**
     * 보이는 메시지 하나를 선점한다. 큐는 목록 순서대로, 큐 안에서는 priority DESC 다음 enqueue 순.
     * 블록하지 않는다. 블로킹 버전은 {@code BrokerClient}.
     */
    Optional<Delivery> dequeue(List<String> queues, Duration visibilityTimeout, String consumer) throws Exception;

    /** 메시지를 완전히 지운다. lease를 다른 소비자에게 뺏겼으면 false. */
    boolean ack(Delivery delivery) throws Exception;

    /**
     * requeue=true: attempt+1로 재발행 (id, createdAt 유지), {@code delay} 뒤에 노출.
     * requeue=false: 큐의 dead-letter 영역으로 이동.
     */
    boolean nack(Delivery delivery, boolean requeue, Duration delay) throws Exception;

    /** 선점한 메시지를 그대로 돌려준다 (prefetch만 하고 시작 안 한 것). */
    boolean release(Delivery delivery) throws Exception;

    /** 오래 도는 핸들러용 하트비트. */
    boolean extendLease(Delivery delivery, Duration visibilityTimeout) throws Exception;

    /** 만료된 lease를 다시 노출. 복구한 메시지 수를 반환. */
    int recoverExpired() throws Exception;

    List<TaskMessage> deadLetters(String queue, int limit) throws Exception;

    /** 큐에서 대기 중인 메시지 수 (lease 중이거나 DEAD인 것 제외). */
    long depth(String queue) throws Exception;

    void ping() throws Exception;
}
