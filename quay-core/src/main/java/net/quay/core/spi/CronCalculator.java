package net.quay.core.spi;

import java.time.Instant;
import java.time.ZoneId;

public interface CronCalculator {
    /** {@code from} 이후(같은 시각 제외) 첫 발행 시각. */
    Instant next(Instant from, String cronExpr, ZoneId zone);
}
