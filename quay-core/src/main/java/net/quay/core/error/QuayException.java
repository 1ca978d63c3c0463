package net.quay.core.error;

public class QuayException extends RuntimeException {
    public QuayException(String message) { super(message); }
    public QuayException(String message, Throwable cause) { super(message, cause); }
}
