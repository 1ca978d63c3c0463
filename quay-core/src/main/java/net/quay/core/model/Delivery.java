package net.quay.core.model;

import java.time.Instant;

/** 한 소비자에게 lease된 메시지. lease 토큰이 맞을 때만 ack/nack이 성공한다. */
public record Delivery(
        TaskMessage message,
        String consumer,
        String leaseToken,
        Instant leaseUntil
) {
    public String taskId() {
        return message.id();
    }
}
