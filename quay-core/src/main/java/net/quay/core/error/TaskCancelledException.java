package net.quay.core.error;

/** 협조적 취소 요청을 확인한 핸들러가 던진다. */
public class TaskCancelledException extends QuayException {
    public TaskCancelledException(String message) { super(message); }
}
