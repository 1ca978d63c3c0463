package net.quay.core.service;

import net.quay.core.model.Delivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 워커 스레드 N개가 각자 pull 루프를 돈다: prefetch만큼 당겨오고 → 하나씩 실행 → ack/nack.
 * 하트비트 스레드는 들고 있는 모든 메시지(실행 중 + prefetch)의 lease를 연장한다.
 * TaskExecutor는 빌려 쓸 뿐이라 닫지 않는다. 닫는 건 만든 쪽 책임.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    static final Duration MIN_BACKOFF = Duration.ofMillis(500);
    static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final BrokerClient broker;
    private final TaskExecutor executor;
    private final WorkerOptions options;

    private final Set<Delivery> held = ConcurrentHashMap.newKeySet();
    private final Map<TaskExecutor.Outcome, AtomicLong> outcomes = new EnumMap<>(TaskExecutor.Outcome.class);

    private volatile boolean running;
    private boolean stopped;
    private ExecutorService workers;
    private ScheduledExecutorService heartbeat;

    public WorkerPool(BrokerClient broker, TaskExecutor executor, WorkerOptions options) {
        this.broker = broker;
        this.executor = executor;
        this.options = options;
        for (TaskExecutor.Outcome o : TaskExecutor.Outcome.values()) outcomes.put(o, new AtomicLong());
    }

    public synchronized void start() {
        if (running) throw new IllegalStateException("worker pool already started");
        running = true;
        workers = Executors.newFixedThreadPool(options.concurrency(),
                TaskExecutor.daemonThreads(options.hostname() + "-worker-"));
        for (int i = 0; i < options.concurrency(); i++) {
            String consumer = options.hostname() + "#" + i;
            workers.submit(() -> loop(consumer));
        }

        long period = Math.max(1, options.visibilityTimeout().toMillis() / 3);
        heartbeat = Executors.newSingleThreadScheduledExecutor(
                TaskExecutor.daemonThreads(options.hostname() + "-heartbeat-"));
        heartbeat.scheduleAtFixedRate(this::extendLeases, period, period, TimeUnit.MILLISECONDS);

        log.info("Worker {} started: queues={} concurrency={} prefetch={} visibility={}",
                options.hostname(), options.queues(), options.concurrency(), options.prefetch(),
                options.visibilityTimeout());
    }

    private void loop(String consumer) {
        Deque<Delivery> buffer = new ArrayDeque<>();
        int failures = 0;
        try {
            while (running) {
                try {
                    if (buffer.isEmpty() && !fill(buffer, consumer)) continue;

                    Delivery d = buffer.poll();
                    try {
                        TaskExecutor.Outcome o = executor.execute(d);
                        outcomes.get(o).incrementAndGet();
                    } finally {
                        held.remove(d);
                    }
                    failures = 0;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) {
                    // 브로커/스토어 장애: 메시지는 ack 안 된 채로 남고 lease 만료 후 재전달됨
                    failures++;
                    Duration wait = backoff(failures);
                    log.warn("Worker {} hit a broker failure (#{}); backing off {}", consumer, failures, wait, e);
                    try {
                        Thread.sleep(wait.toMillis());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        } finally {
            releaseAll(buffer, consumer);
        }
    }

    /** 첫 메시지는 pollTimeout까지 기다리고, 나머지 prefetch 분량은 있는 만큼만 당긴다. */
    private boolean fill(Deque<Delivery> buffer, String consumer) throws InterruptedException {
        Optional<Delivery> first = broker.dequeue(options.queues(), options.pollTimeout(),
                options.visibilityTimeout(), consumer);
        if (first.isEmpty()) return false;
        add(buffer, first.get());
        while (buffer.size() < options.prefetch() && running) {
            Optional<Delivery> more = broker.tryDequeue(options.queues(), options.visibilityTimeout(), consumer);
            if (more.isEmpty()) break;
            add(buffer, more.get());
        }
        return true;
    }

    private void add(Deque<Delivery> buffer, Delivery d) {
        buffer.add(d);
        held.add(d);
    }

    private void releaseAll(Deque<Delivery> buffer, String consumer) {
        for (Delivery d; (d = buffer.poll()) != null; ) {
            held.remove(d);
            try {
                broker.release(d);
            } catch (RuntimeException e) {
                log.warn("Worker {} could not release {}; it returns after its lease", consumer, d.taskId(), e);
            }
        }
    }

    private void extendLeases() {
        for (Delivery d : held) {
            try {
                if (!broker.extendLease(d, options.visibilityTimeout())) {
                    log.warn("Lease of {} was lost; another worker may run it", d.taskId());
                }
            } catch (RuntimeException e) {
                log.warn("Heartbeat for {} failed", d.taskId(), e);
            }
        }
    }

    static Duration backoff(int failures) {
        long ms = MIN_BACKOFF.toMillis() << Math.min(failures - 1, 16);
        return Duration.ofMillis(Math.min(ms, MAX_BACKOFF.toMillis()));
    }

    /**
     * 새 메시지 수신을 멈추고 실행 중인 태스크를 grace 동안 기다린다. 넘기면 인터럽트해서
     * 메시지를 브로커에 돌려준다. prefetch된 메시지는 바로 반납.
     */
    public synchronized void shutdown(Duration grace) throws InterruptedException {
        if (workers == null || stopped) return;
        stopped = true;
        running = false;
        workers.shutdown();
        if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Worker {} still busy after {}; interrupting", options.hostname(), grace);
            workers.shutdownNow();
            workers.awaitTermination(5, TimeUnit.SECONDS);
        }
        heartbeat.shutdownNow();
        log.info("Worker {} stopped. outcomes={}", options.hostname(), outcomes);
    }

    /** 외부 종료 신호까지 블록. */
    public void awaitTermination() throws InterruptedException {
        ExecutorService w;
        synchronized (this) { w = workers; }
        if (w == null) return;
        while (!w.awaitTermination(1, TimeUnit.SECONDS)) {
            // 계속 대기
        }
    }

    public boolean isRunning() {
        return running;
    }

    public long processed(TaskExecutor.Outcome outcome) {
        return outcomes.get(outcome).get();
    }

    public WorkerOptions options() {
        return options;
    }

    @Override
    public void close() throws InterruptedException {
        shutdown(options.shutdownGrace());
    }
}
