package net.quay.core.model;

import java.time.Duration;
import java.util.Objects;

/** 고정 간격 또는 cron 표현식. */
public record Trigger(Kind kind, Duration interval, String cronExpr) {
    public enum Kind { INTERVAL, CRON }

    public Trigger {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.INTERVAL && (interval == null || interval.toMillis() < 1)) {
            throw new IllegalArgumentException("interval trigger needs a duration of at least 1ms, got " + interval);
        }
        if (kind == Kind.CRON && (cronExpr == null || cronExpr.isBlank())) {
            throw new IllegalArgumentException("cron trigger needs an expression");
        }
    }

    public static Trigger every(Duration interval) {
        return new Trigger(Kind.INTERVAL, interval, null);
    }

    public static Trigger cron(String expr) {
        return new Trigger(Kind.CRON, null, expr.trim());
    }

    /** 저장 형태: interval은 ISO-8601 duration, cron은 표현식 그대로. */
    public String expression() {
        return kind == Kind.INTERVAL ? interval.toString() : cronExpr;
    }

    public static Trigger parse(String kind, String expression) {
        return Kind.valueOf(kind) == Kind.INTERVAL
                ? every(Duration.parse(expression))
                : cron(expression);
    }

    @Override
    public String toString() {
        return kind == Kind.INTERVAL ? "every " + interval : "cron '" + cronExpr + "'";
    }
}
