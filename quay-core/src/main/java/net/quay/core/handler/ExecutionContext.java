package net.quay.core.handler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 모든 핸들러 호출에 넘겨주는 자원 (DataSource, 내보내기 디렉터리 등). 워커 기동 시 만들고
 * 워커 스레드끼리 읽기 전용으로 공유한다.
 */
public final class ExecutionContext {
    public static final ExecutionContext EMPTY = new ExecutionContext(Map.of());

    private final Map<Class<?>, Object> resources;

    private ExecutionContext(Map<Class<?>, Object> resources) {
        this.resources = resources;
    }

    public <T> Optional<T> find(Class<T> type) {
        return Optional.ofNullable(type.cast(resources.get(type)));
    }

    public <T> T require(Class<T> type) {
        return find(type).orElseThrow(() ->
                new IllegalStateException("No " + type.getSimpleName() + " in execution context"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Class<?>, Object> resources = new LinkedHashMap<>();

        public <T> Builder with(Class<T> type, T value) {
            resources.put(type, type.cast(value));
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(Map.copyOf(resources));
        }
    }
}
