package net.quay.core.error;

import java.time.Duration;

public class TaskTimeoutException extends QuayException {
    public TaskTimeoutException(String taskName, Duration limit) {
        super("Task " + taskName + " exceeded its time limit of " + limit);
    }
}
