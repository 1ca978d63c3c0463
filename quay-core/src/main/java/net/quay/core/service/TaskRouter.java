package net.quay.core.service;

import java.util.Map;

/** 설정의 고정 라우팅 (이름 -> 큐). 정의의 기본 큐보다 먼저 적용된다. */
public final class TaskRouter {
    public static final TaskRouter NONE = new TaskRouter(Map.of());

    private final Map<String, String> routes;

    public TaskRouter(Map<String, String> routes) {
        this.routes = Map.copyOf(routes);
    }

    public String route(TaskDefinition definition, String explicitQueue) {
        if (explicitQueue != null && !explicitQueue.isBlank()) return explicitQueue;
        String routed = routes.get(definition.name());
        return routed != null ? routed : definition.defaultQueue();
    }
}
