package net.quay.core.error;

/** 재시도를 요청할 때 핸들러가 던진다. */
public class TransientTaskException extends QuayException {
    public TransientTaskException(String message) { super(message); }
    public TransientTaskException(String message, Throwable cause) { super(message, cause); }
}
