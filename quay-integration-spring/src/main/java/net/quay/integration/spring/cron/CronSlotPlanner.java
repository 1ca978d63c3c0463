package net.quay.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** cron-utils(Quartz 문법) 기반 다음 슬롯 계산기. 파싱 결과는 LRU 로 캐시. */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));

    // 간단 LRU(최대 256개)
    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronSlotPlanner() {}

    /** zone 기준 벽시계로 평가한 now 이후(같은 시각 제외) 첫 슬롯. */
    public static Instant nextSlot(String cronExpr, ZoneId zone, Instant now) {
        Objects.requireNonNull(cronExpr); Objects.requireNonNull(zone); Objects.requireNonNull(now);

        var base = now.atZone(zone);
        return executionTime(cronExpr).nextExecution(base)
                .orElseThrow(() -> new IllegalStateException("No next execution for [" + cronExpr + "] at " + base))
                .toInstant();
    }

    /** 설정 검증용. 문법이 틀리면 IllegalArgumentException. */
    public static void validate(String cronExpr) {
        executionTime(cronExpr);
    }

    private static ExecutionTime executionTime(String cronExpr) {
        synchronized (CACHE) {
            return CACHE.computeIfAbsent(cronExpr, expr -> ExecutionTime.forCron(PARSER.parse(expr)));
        }
    }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
