package net.quay.integration.spring.cron;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronSlotPlannerTest {

    @Test
    void hourly_next_slot() {
        var next = CronSlotPlanner.nextSlot("0 0 * * * ?", ZoneOffset.UTC, Instant.parse("2024-01-01T10:15:00Z"));

        assertThat(next).isEqualTo(Instant.parse("2024-01-01T11:00:00Z"));
        // 캐시된 파싱 결과로 다시 계산해도 같은 답
        assertThat(CronSlotPlanner.nextSlot("0 0 * * * ?", ZoneOffset.UTC, Instant.parse("2024-01-01T11:30:00Z")))
                .isEqualTo(Instant.parse("2024-01-01T12:00:00Z"));
    }

    @Test
    void next_is_strictly_after_a_matching_instant() {
        var calc = new CronUtilsCalculator();

        assertThat(calc.next(Instant.parse("2024-01-01T11:00:00Z"), "0 0 * * * ?", ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2024-01-01T12:00:00Z"));
    }

    @Test
    void zone_is_applied_to_wall_clock_fields() {
        // 매일 09:00 KST = 00:00 UTC
        var next = new CronUtilsCalculator().next(
                Instant.parse("2024-01-01T00:30:00Z"), "0 0 9 * * ?", ZoneId.of("Asia/Seoul"));

        assertThat(next).isEqualTo(Instant.parse("2024-01-02T00:00:00Z"));
    }

    @Test
    void invalid_expression_is_rejected() {
        assertThatThrownBy(() -> CronSlotPlanner.validate("every minute please"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
