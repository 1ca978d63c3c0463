package net.quay.app.tasks;

import net.quay.core.service.RetryPolicy;
import net.quay.core.service.TaskDefinition;
import net.quay.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * 데모 태스크 카탈로그. 큐 배치:
 * high_priority(알림) / default(주문, 정리) / export(일지 내보내기) / low_priority(대량 내보내기)
 */
@Configuration(proxyBeanMethods = false)
public class DemoTaskConfig {
    private static final Logger log = LoggerFactory.getLogger(DemoTaskConfig.class);

    private final Path exportDir;

    public DemoTaskConfig(@Value("${quay.demo.export-dir:${java.io.tmpdir}/quay_exports}") String exportDir) {
        this.exportDir = Path.of(exportDir);
    }

    @Bean
    public TaskDefinition exportWorkLogs() {
        return TaskDefinition.builder(WorkLogExportTask.NAME, new WorkLogExportTask(exportDir))
                .queue("export")
                .maxRetries(1)
                .timeLimit(Duration.ofMinutes(30))
                .retryOn(IOException.class)
                .build();
    }

    @Bean
    public TaskDefinition sendNotification(NotificationSender sender) {
        return TaskDefinition.builder(SendNotificationTask.NAME, new SendNotificationTask(sender))
                .queue("high_priority")
                .priority(9)
                .maxRetries(3)
                .retryPolicy(RetryPolicy.fixed(Duration.ofSeconds(5)))
                .timeLimit(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public TaskDefinition processOrder() {
        return TaskDefinition.builder(ProcessOrderTask.NAME, new ProcessOrderTask())
                .queue("default")
                .priority(5)
                .build();
    }

    @Bean
    public TaskDefinition cleanupOldExports(Clock clock) {
        return TaskDefinition.builder(CleanupOldExportsTask.NAME, new CleanupOldExportsTask(exportDir, clock))
                .queue("default")
                .maxRetries(0)
                .build();
    }

    @Bean
    public TaskDefinition batchExport() {
        return TaskDefinition.builder(BatchExportTask.NAME, new BatchExportTask())
                .queue("low_priority")
                .priority(1)
                .timeLimit(Duration.ofHours(1))
                .build();
    }

    /** 기본 알림 채널: 로그만 남긴다. 실제 채널은 NotificationSender 빈으로 교체. */
    @Bean
    public NotificationSender notificationSender() {
        return (userId, message, type) -> log.info("[{}] -> {}: {}", type, userId, message);
    }
}
