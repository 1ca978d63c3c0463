package net.quay.adapter.jdbc;

import net.quay.adapter.jdbc.repo.JdbcResultStore;
import net.quay.core.model.TaskError;
import net.quay.core.model.TaskResult;
import net.quay.core.model.TaskResult.State;
import net.quay.core.spi.ResultStore;
import net.quay.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcResultStoreAcceptanceTest extends TestSupport {

    TxRunner tx;
    ResultStore results;
    final Instant t0 = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        results = new JdbcResultStore(ds, new JsonCodec());
    }

    @BeforeEach
    void clean() throws Exception {
        truncateAll(tx);
    }

    TaskResult get(String id, Instant now) throws Exception {
        return tx.required(() -> results.find(id, now)).orElseThrow();
    }

    @Test
    void lifecycle_pending_progress_success() throws Exception {
        tx.required(() -> { results.createPending(TaskResult.pending("t1", "export_work_logs", t0)); return null; });
        assertEquals(State.PENDING, get("t1", t0).state());
        assertEquals(t0, get("t1", t0).createdAt());

        assertTrue(tx.required(() -> results.markStarted("t1", 0, t0)));
        tx.required(() -> { results.updateProgress("t1", 0, 40, "Processing 200/500"); return null; });
        tx.required(() -> { results.updateProgress("t1", 0, 30, "late report"); return null; });

        TaskResult mid = get("t1", t0);
        assertEquals(State.PROGRESS, mid.state());
        assertEquals(40, mid.progress(), "progress never decreases");

        Instant expires = t0.plus(Duration.ofHours(1));
        tx.required(() -> {
            results.complete("t1", State.SUCCESS, Map.of("record_count", 500, "file_name", "work_logs.csv"),
                    null, t0, expires);
            return null;
        });

        TaskResult done = get("t1", t0);
        assertEquals(State.SUCCESS, done.state());
        assertEquals(100, done.progress());
        assertEquals(500, ((Map<?, ?>) done.result()).get("record_count"));
        assertEquals(expires, done.expiresAt());

        // 터미널 이후 덮어쓰기 없음
        tx.required(() -> {
            results.complete("t1", State.FAILURE, null, new TaskError(TaskError.Kind.PERMANENT, "x"), t0, expires);
            return null;
        });
        assertEquals(State.SUCCESS, get("t1", t0).state());
    }

    @Test
    void retry_failure_and_error_columns() throws Exception {
        tx.required(() -> { results.createPending(TaskResult.pending("t2", "send_notification", t0)); return null; });
        tx.required(() -> results.markStarted("t2", 0, t0));
        tx.required(() -> { results.markRetrying("t2", "Retry 1/3"); return null; });
        assertEquals(State.PENDING, get("t2", t0).state());

        tx.required(() -> results.markStarted("t2", 1, t0));
        tx.required(() -> {
            results.complete("t2", State.FAILURE, null, new TaskError(TaskError.Kind.TRANSIENT, "smtp down"), t0, null);
            return null;
        });

        TaskResult r = get("t2", t0);
        assertEquals(State.FAILURE, r.state());
        assertEquals(1, r.attempt());
        assertEquals(new TaskError(TaskError.Kind.TRANSIENT, "smtp down"), r.error());
        assertNull(r.result());
    }

    @Test
    void progress_from_an_abandoned_attempt_is_dropped() throws Exception {
        tx.required(() -> { results.createPending(TaskResult.pending("t3", "export_work_logs", t0)); return null; });
        tx.required(() -> results.markStarted("t3", 0, t0));
        tx.required(() -> { results.markRetrying("t3", "Retry 1/3"); return null; });
        tx.required(() -> results.markStarted("t3", 1, t0));

        // 타임아웃된 0번 시도의 스레드가 뒤늦게 보고
        tx.required(() -> { results.updateProgress("t3", 0, 90, "stale"); return null; });
        assertEquals(0, get("t3", t0).progress());

        tx.required(() -> { results.updateProgress("t3", 1, 20, "Processing 100/500"); return null; });
        TaskResult r = get("t3", t0);
        assertEquals(20, r.progress());
        assertEquals("Processing 100/500", r.message());
    }

    @Test
    void revoke_only_from_pending_and_cancel_flag_only_while_running() throws Exception {
        tx.required(() -> { results.createPending(TaskResult.pending("p", "process_order", t0)); return null; });
        tx.required(() -> { results.createPending(TaskResult.pending("r", "process_order", t0)); return null; });
        tx.required(() -> results.markStarted("r", 0, t0));

        assertFalse(tx.required(() -> results.requestCancel("p")));
        assertTrue(tx.required(() -> results.revoke("p", t0)));
        assertFalse(tx.required(() -> results.revoke("p", t0)));
        assertFalse(tx.required(() -> results.markStarted("p", 0, t0)), "revoked task never starts");

        assertFalse(tx.required(() -> results.revoke("r", t0)));
        assertTrue(tx.required(() -> results.requestCancel("r")));
        assertTrue(get("r", t0).cancelRequested());
        assertEquals(State.REVOKED, get("p", t0).state());
    }

    @Test
    void expired_results_are_hidden_then_purged() throws Exception {
        tx.required(() -> { results.createPending(TaskResult.pending("old", "cleanup_old_exports", t0)); return null; });
        tx.required(() -> results.markStarted("old", 0, t0));
        tx.required(() -> { results.complete("old", State.SUCCESS, 3, null, t0, t0.plusSeconds(60)); return null; });

        Instant later = t0.plusSeconds(61);
        assertTrue(tx.required(() -> results.find("old", later)).isEmpty());
        assertTrue(tx.required(() -> results.find("old", t0)).isPresent());

        assertEquals(1, (int) tx.required(() -> results.purgeExpired(later)));
        assertTrue(tx.required(() -> results.find("old", t0)).isEmpty());
    }
}
