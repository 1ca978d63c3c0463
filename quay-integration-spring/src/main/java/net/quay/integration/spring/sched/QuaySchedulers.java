package net.quay.integration.spring.sched;

import net.quay.core.maintenance.MaintenanceService;
import net.quay.core.service.BeatService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/**
 * beat 틱과 유지보수 루프. 주기는 YAML(quay.beat.tick-delay-ms / quay.maintenance.delay-ms)에서,
 * 나머지 파라미터는 세터로 받는다.
 */
public class QuaySchedulers {
    private static final Logger log = LoggerFactory.getLogger(QuaySchedulers.class);

    private final BeatService beat;
    private final MaintenanceService maintenance;

    private boolean beatEnabled = false;
    private boolean maintenanceEnabled = true;
    private Duration beatLease = BeatService.DEFAULT_LEASE;
    private String owner = "beat";

    public QuaySchedulers(BeatService beat, MaintenanceService maintenance) {
        this.beat = beat;
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${quay.beat.tick-delay-ms:1000}")
    public void beatTick() throws Exception {
        if (!beatEnabled) return;
        int fired = beat.tickOnce(beatLease, owner);
        if (fired > 0) log.debug("Beat tick fired {} entries", fired);
    }

    @Scheduled(fixedDelayString = "${quay.maintenance.delay-ms:60000}")
    public void maintenance() throws Exception {
        if (!maintenanceEnabled) return;
        var report = maintenance.runOnce();
        if (report.recoveredMessages > 0 || report.purgedResults > 0) log.info("{}", report);
    }

    public void setBeatEnabled(boolean beatEnabled) {
        this.beatEnabled = beatEnabled;
    }

    public boolean isBeatEnabled() {
        return beatEnabled;
    }

    public void setMaintenanceEnabled(boolean maintenanceEnabled) {
        this.maintenanceEnabled = maintenanceEnabled;
    }

    public void setBeatLease(Duration beatLease) {
        this.beatLease = beatLease;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }
}
