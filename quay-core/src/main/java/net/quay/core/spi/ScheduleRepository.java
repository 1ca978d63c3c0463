package net.quay.core.spi;

import net.quay.core.model.ScheduleEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleRepository {
    /** 커서까지 포함해 엔트리를 넣거나 교체. */
    void save(ScheduleEntry entry) throws Exception;

    Optional<ScheduleEntry> findByName(String name) throws Exception;

    List<ScheduleEntry> findAll() throws Exception;

    /** nextFireAt <= now 이고 살아있는 lease가 없는 활성 엔트리 하나를 선점. */
    Optional<ScheduleEntry> claimDue(Instant now, Duration lease, String owner) throws Exception;

    /** 커서를 옮기고 lease를 푼다. */
    void advanceCursor(String name, Instant nextFireAt, Instant lastFiredAt) throws Exception;

    /** 커서는 그대로 두고 lease만 푼다. */
    void releaseLease(String name) throws Exception;

    /** 이름이 {@code keep}에 없는 엔트리를 비활성화. */
    int disableAllExcept(List<String> keep) throws Exception;
}
