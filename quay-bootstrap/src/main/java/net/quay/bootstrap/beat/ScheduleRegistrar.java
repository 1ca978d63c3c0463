package net.quay.bootstrap.beat;

import net.quay.bootstrap.props.QuayProperties;
import net.quay.core.model.ScheduleEntry;
import net.quay.core.model.Trigger;
import net.quay.core.service.BeatService;
import net.quay.core.service.TaskRegistry;
import net.quay.integration.spring.cron.CronSlotPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/** 설정(quay.beat.entries)의 스케줄 표를 저장소에 동기화한다. */
public class ScheduleRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ScheduleRegistrar.class);

    private final BeatService beat;
    private final TaskRegistry registry;

    public ScheduleRegistrar(BeatService beat, TaskRegistry registry) {
        this.beat = beat;
        this.registry = registry;
    }

    public void register(QuayProperties.Beat config) throws Exception {
        List<ScheduleEntry> entries = toEntries(config.getEntries());
        beat.register(entries);
        log.info("Beat schedule registered: {} entries", entries.size());
    }

    List<ScheduleEntry> toEntries(List<QuayProperties.EntryDef> defs) {
        var names = new HashSet<String>();
        var out = new ArrayList<ScheduleEntry>();
        for (var def : defs) {
            // 1) 필수값 / 중복 검사
            if (def.getName() == null || def.getTask() == null) {
                throw new IllegalArgumentException("beat entry name and task are required: " + def);
            }
            if (!names.add(def.getName())) {
                throw new IllegalArgumentException("Duplicate beat entry: " + def.getName());
            }

            // 2) 트리거: every / cron 중 정확히 하나
            if ((def.getEvery() == null) == (def.getCron() == null)) {
                throw new IllegalArgumentException("beat entry '" + def.getName() + "' needs exactly one of every/cron");
            }
            Trigger trigger;
            if (def.getCron() != null) {
                CronSlotPlanner.validate(def.getCron());
                trigger = Trigger.cron(def.getCron());
            } else {
                trigger = Trigger.every(def.getEvery());
            }

            // 3) 모르는 태스크는 막지 않는다 (발행 시점에 로그 후 건너뜀)
            if (!registry.contains(def.getTask())) {
                log.warn("Beat entry '{}' refers to unregistered task '{}'", def.getName(), def.getTask());
            }

            out.add(ScheduleEntry.define(def.getName(), def.getTask(), trigger, def.getArgs(), def.getKwargs())
                    .withQueue(def.getQueue())
                    .withEnabled(def.isEnabled()));
        }
        return out;
    }
}
