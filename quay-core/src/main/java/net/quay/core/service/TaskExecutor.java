package net.quay.core.service;

import net.quay.core.error.BrokerUnavailableException;
import net.quay.core.error.QuayException;
import net.quay.core.error.TaskCancelledException;
import net.quay.core.error.TaskTimeoutException;
import net.quay.core.handler.ExecutionContext;
import net.quay.core.handler.TaskCall;
import net.quay.core.model.Delivery;
import net.quay.core.model.TaskError;
import net.quay.core.model.TaskMessage;
import net.quay.core.model.TaskResult;
import net.quay.core.spi.Clock;
import net.quay.core.spi.ResultStore;
import net.quay.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 전달받은 메시지 하나를 끝까지 처리한다: revoke 확인 → 레지스트리 조회 → 시간 제한 안에서
 * 핸들러 호출 → 결과 저장소 갱신 → ack/nack.
 * <p>
 * 핸들러 실패는 밖으로 새지 않는다. 브로커/결과 저장소 실패는 그대로 던지며, 메시지는 ack 안 된 채
 * 남아 lease가 끝나면 다시 전달된다.
 */
public final class TaskExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    public enum Outcome { SUCCEEDED, RETRY_SCHEDULED, DEAD_LETTERED, REVOKED, ALREADY_DONE, RELEASED }

    public static final Duration DEFAULT_RESULT_TTL = Duration.ofHours(1);

    private final TaskRegistry registry;
    private final BrokerClient broker;
    private final ResultStore results;
    private final TxRunner tx;
    private final Clock clock;
    private final RetryPolicyEngine retry;
    private final ExecutionContext context;
    private final Duration resultTtl;
    private final ExecutorService handlerThreads;

    public TaskExecutor(TaskRegistry registry, BrokerClient broker, ResultStore results, TxRunner tx,
                        Clock clock, RetryPolicyEngine retry, ExecutionContext context, Duration resultTtl) {
        this.registry = registry;
        this.broker = broker;
        this.results = results;
        this.tx = tx;
        this.clock = clock;
        this.retry = retry;
        this.context = context;
        this.resultTtl = resultTtl;
        this.handlerThreads = Executors.newCachedThreadPool(daemonThreads("quay-handler-"));
    }

    public Outcome execute(Delivery delivery) throws InterruptedException {
        TaskMessage m = delivery.message();
        Optional<TaskResult> current = store("read", m, () -> results.find(m.id(), clock.now()));

        if (current.isPresent()) {
            TaskResult.State state = current.get().state();
            if (state == TaskResult.State.REVOKED) return skipRevoked(delivery);
            if (state.terminal()) {
                // 앞선 전달이 끝내놓고 ack 전에 죽은 경우
                log.info("Task {}[{}] already {}; dropping duplicate delivery", m.name(), m.id(), state);
                broker.ack(delivery);
                return Outcome.ALREADY_DONE;
            }
        }

        TaskDefinition def = registry.find(m.name()).orElse(null);
        if (def == null) {
            log.error("No handler registered for task '{}' (id {}); dead-lettering", m.name(), m.id());
            TaskError error = new TaskError(TaskError.Kind.UNKNOWN_TASK, "No handler registered for " + m.name());
            fail(m, error, current.isEmpty());
            broker.nack(delivery, false, Duration.ZERO);
            return Outcome.DEAD_LETTERED;
        }

        boolean started = store("start", m, () -> {
            if (current.isEmpty()) {
                // 결과가 만료됐거나 처음부터 없음 (브로커에 직접 넣은 메시지)
                results.createPending(TaskResult.pending(m.id(), m.name(), m.createdAt()));
            }
            return results.markStarted(m.id(), m.attempt(), clock.now());
        });
        if (!started) {
            TaskResult now = store("read", m, () -> results.find(m.id(), clock.now())).orElse(null);
            if (now != null && now.state() == TaskResult.State.REVOKED) return skipRevoked(delivery);
            broker.ack(delivery);
            return Outcome.ALREADY_DONE;
        }

        log.debug("Running {}[{}] attempt {}/{}", m.name(), m.id(), m.attempt(), m.maxRetries());
        StoreProgressReporter progress = new StoreProgressReporter(m.id(), m.attempt(), results, tx, clock);
        TaskCall call = new TaskCall(m.id(), m.name(), m.args(), m.kwargs(), m.attempt(), context);

        Object value = null;
        Throwable failure = null;
        Future<Object> running;
        try {
            running = handlerThreads.submit(() -> def.handler().handle(call, progress));
        } catch (RejectedExecutionException e) {
            // 살아있는 워커 아래서 executor가 닫힘: 시작 표시를 되돌리고 메시지 반납
            log.warn("Handler threads are closed; releasing {}[{}]", m.name(), m.id());
            store("unmark started", m, () -> { results.markRetrying(m.id(), "Released by a stopping worker"); return null; });
            broker.release(delivery);
            return Outcome.RELEASED;
        }
        try {
            value = running.get(def.timeLimit().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            running.cancel(true);
            failure = new TaskTimeoutException(m.name(), def.timeLimit());
        } catch (ExecutionException e) {
            failure = e.getCause() != null ? e.getCause() : e;
        } catch (InterruptedException e) {
            // 워커 종료 중: 다른 워커가 받도록 메시지 반납
            running.cancel(true);
            log.warn("Interrupted while running {}[{}]; releasing message", m.name(), m.id());
            broker.release(delivery);
            throw e;
        }

        if (failure == null) {
            Object result = value;
            store("complete", m, () -> {
                Instant at = clock.now();
                results.complete(m.id(), TaskResult.State.SUCCESS, result, null, at, at.plus(resultTtl));
                return null;
            });
            broker.ack(delivery);
            log.info("Task {}[{}] succeeded on attempt {}", m.name(), m.id(), m.attempt());
            return Outcome.SUCCEEDED;
        }

        if (failure instanceof TaskCancelledException) {
            store("cancel", m, () -> {
                Instant at = clock.now();
                results.complete(m.id(), TaskResult.State.REVOKED, null, null, at, at.plus(resultTtl));
                return null;
            });
            broker.ack(delivery);
            log.info("Task {}[{}] stopped after a cancellation request", m.name(), m.id());
            return Outcome.REVOKED;
        }

        RetryPolicyEngine.Decision decision = retry.decide(m, def, failure);
        if (decision.retry()) {
            log.warn("Task {}[{}] failed on attempt {} ({}); retrying in {}",
                    m.name(), m.id(), m.attempt(), decision.error(), decision.delay(), failure);
            String note = "Retry " + (m.attempt() + 1) + "/" + m.maxRetries() + " in "
                    + decision.delay().toMillis() + "ms after " + decision.error();
            store("mark retrying", m, () -> { results.markRetrying(m.id(), note); return null; });
            broker.nack(delivery, true, decision.delay());
            return Outcome.RETRY_SCHEDULED;
        }

        log.error("Task {}[{}] failed on attempt {} ({}); dead-lettering",
                m.name(), m.id(), m.attempt(), decision.error(), failure);
        fail(m, decision.error(), false);
        broker.nack(delivery, false, Duration.ZERO);
        return Outcome.DEAD_LETTERED;
    }

    private Outcome skipRevoked(Delivery delivery) {
        TaskMessage m = delivery.message();
        log.info("Task {}[{}] was revoked; skipping execution", m.name(), m.id());
        store("expire revoked", m, () -> {
            Instant at = clock.now();
            results.complete(m.id(), TaskResult.State.REVOKED, null, null, at, at.plus(resultTtl));
            return null;
        });
        broker.ack(delivery);
        return Outcome.REVOKED;
    }

    private void fail(TaskMessage m, TaskError error, boolean createFirst) {
        store("fail", m, () -> {
            if (createFirst) results.createPending(TaskResult.pending(m.id(), m.name(), m.createdAt()));
            Instant at = clock.now();
            results.complete(m.id(), TaskResult.State.FAILURE, null, error, at, at.plus(resultTtl));
            return null;
        });
    }

    private <T> T store(String what, TaskMessage m, Callable<T> body) {
        try {
            return tx.required(body);
        } catch (QuayException e) {
            throw e;
        } catch (Exception e) {
            throw new BrokerUnavailableException("Result store failed to " + what + " " + m.id(), e);
        }
    }

    @Override
    public void close() {
        handlerThreads.shutdownNow();
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
