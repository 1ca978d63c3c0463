package net.quay.core.service;

import net.quay.core.error.BrokerUnavailableException;
import net.quay.core.error.PermanentTaskException;
import net.quay.core.error.TaskTimeoutException;
import net.quay.core.error.TransientTaskException;
import net.quay.core.model.TaskError;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/** 핸들러 실패를 재시도 가능(transient)과 불가(permanent)로 나눈다. */
public final class ErrorClassifier {
    private static final List<Class<? extends Throwable>> KNOWN_TRANSIENT = List.of(
            TransientTaskException.class,
            BrokerUnavailableException.class,
            SocketTimeoutException.class,
            ConnectException.class,
            TimeoutException.class
    );

    private ErrorClassifier() {}

    public static TaskError.Kind classify(Throwable error, TaskDefinition definition) {
        if (error instanceof TaskTimeoutException) {
            return TaskError.Kind.TIMEOUT;
        }
        if (error instanceof PermanentTaskException) {
            return TaskError.Kind.PERMANENT;
        }
        if (matches(error, KNOWN_TRANSIENT) || matches(error, definition.transientErrors())) {
            return TaskError.Kind.TRANSIENT;
        }
        return TaskError.Kind.PERMANENT;
    }

    public static boolean retryable(TaskError.Kind kind, TaskDefinition definition) {
        return switch (kind) {
            case TRANSIENT -> true;
            case TIMEOUT -> definition.timeoutRetryable();
            default -> false;
        };
    }

    private static boolean matches(Throwable error, List<Class<? extends Throwable>> types) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(t)) return true;
            }
            if (t.getCause() == t) break;
        }
        return false;
    }

    /** 클라이언트에 노출하는 문구. 스택트레이스 없이 길이 제한. */
    public static String sanitize(Throwable error) {
        String msg = error.getMessage();
        if (msg == null || msg.isBlank()) msg = error.getClass().getSimpleName();
        msg = msg.replaceAll("\\s+", " ").trim();
        return msg.length() > 500 ? msg.substring(0, 497) + "..." : msg;
    }
}
