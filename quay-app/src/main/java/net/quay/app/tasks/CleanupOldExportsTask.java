package net.quay.app.tasks;

import net.quay.core.handler.ProgressReporter;
import net.quay.core.handler.TaskCall;
import net.quay.core.handler.TaskHandler;
import net.quay.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** cleanup_old_exports(days_old=7). 내보내기 디렉터리에서 오래된 파일을 지운다. */
public final class CleanupOldExportsTask implements TaskHandler {
    private static final Logger log = LoggerFactory.getLogger(CleanupOldExportsTask.class);

    public static final String NAME = "cleanup_old_exports";

    private final Path exportDir;
    private final Clock clock;

    public CleanupOldExportsTask(Path exportDir, Clock clock) {
        this.exportDir = exportDir;
        this.clock = clock;
    }

    @Override
    public Object handle(TaskCall call, ProgressReporter progress) throws Exception {
        int daysOld = TaskArgs.get(call, 0, "days_old", Integer.class, 7);
        Instant cutoff = clock.now().minus(Duration.ofDays(daysOld));

        int deleted = 0;
        if (Files.isDirectory(exportDir)) {
            List<Path> files;
            try (Stream<Path> s = Files.list(exportDir)) {
                files = s.filter(Files::isRegularFile).collect(Collectors.toList());
            }
            for (Path f : files) {
                if (Files.getLastModifiedTime(f).toInstant().isBefore(cutoff) && Files.deleteIfExists(f)) {
                    log.debug("Deleted old export {}", f.getFileName());
                    deleted++;
                }
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("deleted_count", deleted);
        result.put("days_old", daysOld);
        result.put("cleaned_at", clock.now().toString());
        return result;
    }
}
