package net.quay.core.maintenance;

import net.quay.core.spi.Broker;
import net.quay.core.spi.Clock;
import net.quay.core.spi.ResultStore;
import net.quay.core.spi.TxRunner;

import java.time.Instant;

public final class MaintenanceService {
    private final Broker broker;
    private final ResultStore results;
    private final TxRunner tx;
    private final Clock clock;

    public MaintenanceService(Broker broker, ResultStore results, TxRunner tx, Clock clock) {
        this.broker = broker;
        this.results = results;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 주기 점검 메인 루틴.
     * - lease 만료된 RUNNING 메시지 재노출
     * - expires_at 지난 결과 삭제
     */
    public MaintenanceReport runOnce() throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        // 1) 죽은 워커가 들고 있던 메시지 복구 (attempt 유지)
        r.recoveredMessages = tx.required(broker::recoverExpired);

        // 2) TTL 지난 결과 정리
        r.purgedResults = tx.required(() -> results.purgeExpired(now));

        r.timestamp = now;
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int recoveredMessages;
        public int purgedResults;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", recoveredMessages=" + recoveredMessages +
                    ", purgedResults=" + purgedResults +
                    '}';
        }
    }
}
