package net.quay.core.service;

import net.quay.core.error.BrokerUnavailableException;
import net.quay.core.handler.ProgressReporter;
import net.quay.core.model.TaskResult;
import net.quay.core.spi.Clock;
import net.quay.core.spi.ResultStore;
import net.quay.core.spi.TxRunner;

import java.util.concurrent.atomic.AtomicInteger;

/** 한 번의 실행 시도의 진행률을 결과 저장소에 바로 기록한다. */
final class StoreProgressReporter implements ProgressReporter {
    private final String taskId;
    private final int attempt;
    private final ResultStore results;
    private final TxRunner tx;
    private final Clock clock;
    private final AtomicInteger max = new AtomicInteger(0);

    StoreProgressReporter(String taskId, int attempt, ResultStore results, TxRunner tx, Clock clock) {
        this.taskId = taskId;
        this.attempt = attempt;
        this.results = results;
        this.tx = tx;
        this.clock = clock;
    }

    @Override
    public void report(int percent, String message) {
        int clamped = Math.max(0, Math.min(100, percent));
        int value = max.accumulateAndGet(clamped, Math::max);
        try {
            tx.required(() -> { results.updateProgress(taskId, attempt, value, message); return null; });
        } catch (Exception e) {
            throw new BrokerUnavailableException("Could not record progress of " + taskId, e);
        }
    }

    @Override
    public boolean isCancellationRequested() {
        try {
            return tx.required(() -> results.find(taskId, clock.now()))
                    .map(TaskResult::cancelRequested)
                    .orElse(false);
        } catch (Exception e) {
            throw new BrokerUnavailableException("Could not read cancel flag of " + taskId, e);
        }
    }

    @Override
    public int current() {
        return max.get();
    }
}
