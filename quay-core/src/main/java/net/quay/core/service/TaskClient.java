package net.quay.core.service;

import net.quay.core.error.BrokerUnavailableException;
import net.quay.core.error.QuayException;
import net.quay.core.error.UnknownTaskNameException;
import net.quay.core.model.TaskMessage;
import net.quay.core.model.TaskResult;
import net.quay.core.spi.Clock;
import net.quay.core.spi.ResultStore;
import net.quay.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/** 생산자 파사드. 워커 밖의 호출자는 이것만 쓰면 된다. */
public final class TaskClient {
    private static final Logger log = LoggerFactory.getLogger(TaskClient.class);

    private final TaskRegistry registry;
    private final BrokerClient broker;
    private final ResultStore results;
    private final TxRunner tx;
    private final Clock clock;
    private final TaskRouter router;

    public TaskClient(TaskRegistry registry, BrokerClient broker, ResultStore results,
                      TxRunner tx, Clock clock, TaskRouter router) {
        this.registry = registry;
        this.broker = broker;
        this.results = results;
        this.tx = tx;
        this.clock = clock;
        this.router = router;
    }

    public String submit(String taskName, List<?> args, Map<String, ?> kwargs) {
        return submit(taskName, args, kwargs, SubmitOptions.DEFAULTS);
    }

    /**
     * 레지스트리로 이름을 검증하고, PENDING 결과 기록과 enqueue를
     * 한 트랜잭션으로 처리한다.
     *
     * @throws UnknownTaskNameException 등록되지 않은 이름. 아무것도 enqueue되지 않음
     * @throws BrokerUnavailableException 브로커나 결과 저장소에 닿지 못함
     */
    @SuppressWarnings("unchecked")
    public String submit(String taskName, List<?> args, Map<String, ?> kwargs, SubmitOptions options) {
        TaskDefinition def = registry.find(taskName).orElseThrow(() -> new UnknownTaskNameException(taskName));
        SubmitOptions opts = options == null ? SubmitOptions.DEFAULTS : options;

        Instant now = clock.now();
        Instant eta = opts.eta() != null ? opts.eta()
                : opts.countdown() != null ? now.plus(opts.countdown())
                : null;
        String id = opts.taskId() != null ? opts.taskId() : UUID.randomUUID().toString();
        TaskMessage message = new TaskMessage(
                id, taskName,
                (List<Object>) args, (Map<String, Object>) kwargs,
                router.route(def, opts.queue()),
                opts.priority() != null ? opts.priority() : def.priority(),
                eta, 0,
                opts.maxRetries() != null ? opts.maxRetries() : def.maxRetries(),
                now);

        try {
            tx.required(() -> {
                if (opts.taskId() != null && results.find(id, now).isPresent()) {
                    throw new IllegalArgumentException("Task id already in use: " + id);
                }
                results.createPending(TaskResult.pending(id, taskName, now));
                broker.enqueue(message);
                return null;
            });
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (BrokerUnavailableException e) {
            discardPending(id);
            throw e;
        } catch (QuayException e) {
            throw e;
        } catch (Exception e) {
            discardPending(id);
            throw new BrokerUnavailableException("Could not submit " + taskName, e);
        }
        log.debug("Submitted {}[{}] to queue '{}' priority={} eta={}",
                taskName, id, message.queue(), message.priority(), eta);
        return id;
    }

    /** 모르는 id이거나 결과가 이미 만료됐으면 empty. */
    public Optional<TaskResult> getStatus(String taskId) {
        return call("read status of " + taskId, () -> results.find(taskId, clock.now()));
    }

    /**
     * PENDING 태스크를 REVOKED로 바꿔 어떤 워커도 실행하지 않게 한다. 이미 실행 중이면
     * 중단 요청(협조적 취소)만 남기고 false를 반환한다.
     */
    public boolean revoke(String taskId) {
        return call("revoke " + taskId, () -> {
            if (results.revoke(taskId, clock.now())) {
                log.info("Task {} revoked", taskId);
                return true;
            }
            if (results.requestCancel(taskId)) {
                log.info("Task {} already running; cancellation requested", taskId);
            }
            return false;
        });
    }

    public TaskResult await(String taskId, Duration timeout) throws InterruptedException, TimeoutException {
        return await(taskId, timeout, Duration.ofMillis(100));
    }

    /** 터미널 상태가 될 때까지 폴링. */
    public TaskResult await(String taskId, Duration timeout, Duration pollInterval)
            throws InterruptedException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            TaskResult r = getStatus(taskId)
                    .orElseThrow(() -> new NoSuchElementException("Unknown or expired task: " + taskId));
            if (r.state().terminal()) return r;
            if (System.nanoTime() >= deadline) {
                throw new TimeoutException("Task " + taskId + " still " + r.state() + " after " + timeout);
            }
            Thread.sleep(pollInterval.toMillis());
        }
    }

    public TaskRegistry registry() {
        return registry;
    }

    private void discardPending(String id) {
        try {
            tx.requiresNew(() -> { results.delete(id); return null; });
        } catch (Exception cleanup) {
            log.warn("Could not remove PENDING result of failed submission {}", id, cleanup);
        }
    }

    private <T> T call(String what, Callable<T> body) {
        try {
            return tx.required(body);
        } catch (QuayException e) {
            throw e;
        } catch (Exception e) {
            throw new BrokerUnavailableException("Result store call failed: " + what, e);
        }
    }
}
