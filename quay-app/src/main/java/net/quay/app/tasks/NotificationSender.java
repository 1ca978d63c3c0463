package net.quay.app.tasks;

/** 알림 채널. 일시 장애는 TransientTaskException 으로 던진다. */
@FunctionalInterface
public interface NotificationSender {
    void send(String userId, String message, String type) throws Exception;
}
