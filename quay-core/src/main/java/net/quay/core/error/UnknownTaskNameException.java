package net.quay.core.error;

/** submit 시점에 발생. 메시지는 큐에 들어가지 않는다. */
public class UnknownTaskNameException extends QuayException {
    private final String taskName;

    public UnknownTaskNameException(String taskName) {
        super("Unknown task name: " + taskName);
        this.taskName = taskName;
    }

    public String getTaskName() { return taskName; }
}
