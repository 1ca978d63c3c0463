package net.quay.app.tasks;

import net.quay.core.handler.TaskCall;

/** 키워드 인자가 있으면 그것을, 없으면 같은 자리의 위치 인자를 쓴다. */
final class TaskArgs {
    private TaskArgs() {}

    static <T> T get(TaskCall call, int position, String key, Class<T> type) {
        if (call.kwargs().containsKey(key)) return call.kwarg(key, type);
        return call.arg(position, type);
    }

    static <T> T get(TaskCall call, int position, String key, Class<T> type, T fallback) {
        if (call.kwargs().containsKey(key)) return call.kwarg(key, type, fallback);
        if (position < call.args().size()) {
            T v = call.arg(position, type);
            return v == null ? fallback : v;
        }
        return fallback;
    }
}
