package net.quay.core.error;

/** 재시도해도 소용없는 실패 (잘못된 입력, 없는 데이터). 핸들러가 던진다. */
public class PermanentTaskException extends QuayException {
    public PermanentTaskException(String message) { super(message); }
    public PermanentTaskException(String message, Throwable cause) { super(message, cause); }
}
