package net.quay.app.tasks;

import net.quay.core.handler.ProgressReporter;
import net.quay.core.handler.TaskCall;
import net.quay.core.handler.TaskHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/** send_notification(user_id, message, notification_type="email") */
public final class SendNotificationTask implements TaskHandler {
    public static final String NAME = "send_notification";

    private final NotificationSender sender;

    public SendNotificationTask(NotificationSender sender) {
        this.sender = sender;
    }

    @Override
    public Object handle(TaskCall call, ProgressReporter progress) throws Exception {
        String userId = TaskArgs.get(call, 0, "user_id", String.class);
        String message = TaskArgs.get(call, 1, "message", String.class);
        String type = TaskArgs.get(call, 2, "notification_type", String.class, "email");

        sender.send(userId, message, type);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("user_id", userId);
        result.put("notification_type", type);
        result.put("status", "sent");
        return result;
    }
}
