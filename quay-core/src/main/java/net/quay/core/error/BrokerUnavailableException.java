package net.quay.core.error;

/** 브로커나 결과 저장소와의 통신 자체가 실패. */
public class BrokerUnavailableException extends QuayException {
    public BrokerUnavailableException(String message, Throwable cause) { super(message, cause); }
}
