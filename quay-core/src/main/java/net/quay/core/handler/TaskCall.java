package net.quay.core.handler;

import java.util.List;
import java.util.Map;

/** 핸들러가 보는 메시지의 모습. */
public record TaskCall(
        String taskId,
        String name,
        List<Object> args,
        Map<String, Object> kwargs,
        int attempt,
        ExecutionContext context
) {
    public Object arg(int index) {
        if (index < 0 || index >= args.size()) {
            throw new IllegalArgumentException(name + " expects positional argument #" + index);
        }
        return args.get(index);
    }

    public <T> T arg(int index, Class<T> type) {
        return coerce("#" + index, arg(index), type);
    }

    public <T> T kwarg(String key, Class<T> type) {
        if (!kwargs.containsKey(key)) {
            throw new IllegalArgumentException(name + " expects keyword argument '" + key + "'");
        }
        return coerce(key, kwargs.get(key), type);
    }

    public <T> T kwarg(String key, Class<T> type, T fallback) {
        Object v = kwargs.get(key);
        return v == null ? fallback : coerce(key, v, type);
    }

    // JSON 왕복으로 int/long이 섞이므로 숫자 타겟에는 아무 Number나 받는다
    private <T> T coerce(String key, Object value, Class<T> type) {
        if (value == null || type.isInstance(value)) return type.cast(value);
        if (value instanceof Number n) {
            if (type == Integer.class) return type.cast(n.intValue());
            if (type == Long.class) return type.cast(n.longValue());
            if (type == Double.class) return type.cast(n.doubleValue());
        }
        // 설정에서 바인딩된 스케줄 엔트리는 스칼라를 문자열로 들고 온다
        if (value instanceof String s && type != String.class) {
            try {
                if (type == Integer.class) return type.cast(Integer.valueOf(s.trim()));
                if (type == Long.class) return type.cast(Long.valueOf(s.trim()));
                if (type == Double.class) return type.cast(Double.valueOf(s.trim()));
                if (type == Boolean.class) return type.cast(Boolean.valueOf(s.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + ": argument " + key + " is not a number: '" + s + "'", e);
            }
        }
        if (type == String.class) return type.cast(String.valueOf(value));
        throw new IllegalArgumentException(name + ": argument " + key + " is a "
                + value.getClass().getSimpleName() + ", expected " + type.getSimpleName());
    }
}
