package net.quay.adapter.memory;

import net.quay.core.model.TaskError;
import net.quay.core.model.TaskResult;
import net.quay.core.model.TaskResult.State;
import net.quay.core.spi.ResultStore;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/** 키 단위 원자 갱신은 ConcurrentHashMap.compute로 보장한다. */
public final class InMemoryResultStore implements ResultStore {
    private final ConcurrentMap<String, TaskResult> results = new ConcurrentHashMap<>();

    @Override
    public void createPending(TaskResult pending) {
        results.put(pending.taskId(), pending);
    }

    @Override
    public Optional<TaskResult> find(String taskId, Instant now) {
        TaskResult r = results.get(taskId);
        return r == null || r.expired(now) ? Optional.empty() : Optional.of(r);
    }

    @Override
    public boolean markStarted(String taskId, int attempt, Instant startedAt) {
        AtomicBoolean done = new AtomicBoolean();
        results.computeIfPresent(taskId, (id, r) -> {
            if (r.state() != State.PENDING && r.state() != State.PROGRESS) return r;
            done.set(true);
            return new TaskResult(id, r.taskName(), State.PROGRESS, 0, null, null, null,
                    attempt, r.cancelRequested(), r.createdAt(), startedAt, null, null);
        });
        return done.get();
    }

    @Override
    public void updateProgress(String taskId, int attempt, int progress, String message) {
        results.computeIfPresent(taskId, (id, r) -> {
            if (r.state() != State.PROGRESS || r.attempt() != attempt) return r;
            return new TaskResult(id, r.taskName(), State.PROGRESS, Math.max(r.progress(), progress),
                    message, null, null, r.attempt(), r.cancelRequested(), r.createdAt(), r.startedAt(), null, null);
        });
    }

    @Override
    public void markRetrying(String taskId, String message) {
        results.computeIfPresent(taskId, (id, r) -> {
            if (r.state() != State.PROGRESS) return r;
            return new TaskResult(id, r.taskName(), State.PENDING, r.progress(), message, null, null,
                    r.attempt(), false, r.createdAt(), r.startedAt(), null, null);
        });
    }

    @Override
    public void complete(String taskId, State state, Object result, TaskError error,
                         Instant finishedAt, Instant expiresAt) {
        results.computeIfPresent(taskId, (id, r) -> {
            if (r.state() == State.SUCCESS || r.state() == State.FAILURE) return r;
            int progress = state == State.SUCCESS ? 100 : r.progress();
            return new TaskResult(id, r.taskName(), state, progress, r.message(), result, error,
                    r.attempt(), r.cancelRequested(), r.createdAt(), r.startedAt(), finishedAt, expiresAt);
        });
    }

    @Override
    public boolean revoke(String taskId, Instant now) {
        AtomicBoolean done = new AtomicBoolean();
        results.computeIfPresent(taskId, (id, r) -> {
            if (r.state() != State.PENDING) return r;
            done.set(true);
            return new TaskResult(id, r.taskName(), State.REVOKED, r.progress(), r.message(), null, null,
                    r.attempt(), r.cancelRequested(), r.createdAt(), r.startedAt(), now, null);
        });
        return done.get();
    }

    @Override
    public boolean requestCancel(String taskId) {
        AtomicBoolean done = new AtomicBoolean();
        results.computeIfPresent(taskId, (id, r) -> {
            if (r.state() != State.PROGRESS) return r;
            done.set(true);
            return new TaskResult(id, r.taskName(), r.state(), r.progress(), r.message(), null, null,
                    r.attempt(), true, r.createdAt(), r.startedAt(), null, null);
        });
        return done.get();
    }

    @Override
    public void delete(String taskId) {
        results.remove(taskId);
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = results.size();
        results.values().removeIf(r -> r.expired(now));
        return before - results.size();
    }
}
