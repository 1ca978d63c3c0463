package net.quay.app.tasks;

import net.quay.core.error.PermanentTaskException;
import net.quay.core.error.TaskCancelledException;
import net.quay.core.handler.ProgressReporter;
import net.quay.core.handler.TaskCall;
import net.quay.core.handler.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * export_work_logs(start_date, end_date, employee_ids=None, records=500)
 *
 * <p>기간 안의 작업 일지를 CSV 로 내보낸다. 10% 마다 진행률을 남기고,
 * 그 시점에 취소 요청이 있으면 만들던 파일을 지우고 REVOKED 로 끝난다.
 */
public final class WorkLogExportTask implements TaskHandler {
    private static final Logger log = LoggerFactory.getLogger(WorkLogExportTask.class);

    public static final String NAME = "export_work_logs";
    public static final int DEFAULT_RECORDS = 500;
    private static final List<String> SAMPLE_EMPLOYEES = List.of("E001", "E002", "E003", "E004", "E005");

    private final Path exportDir;

    public WorkLogExportTask(Path exportDir) {
        this.exportDir = exportDir;
    }

    @Override
    public Object handle(TaskCall call, ProgressReporter progress) throws Exception {
        LocalDate start = date(call, 0, "start_date");
        LocalDate end = date(call, 1, "end_date");
        if (end.isBefore(start)) {
            throw new PermanentTaskException("end_date " + end + " is before start_date " + start);
        }
        @SuppressWarnings("unchecked")
        List<Object> employees = TaskArgs.get(call, 2, "employee_ids", List.class, List.copyOf(SAMPLE_EMPLOYEES));
        if (employees.isEmpty()) employees = List.copyOf(SAMPLE_EMPLOYEES);
        int total = TaskArgs.get(call, 3, "records", Integer.class, DEFAULT_RECORDS);

        progress.report(0, "Querying work logs " + start + " .. " + end);

        Files.createDirectories(exportDir);
        String fileName = "work_logs_" + start + "_" + end + "_" + call.taskId() + ".csv";
        Path file = exportDir.resolve(fileName);
        long days = ChronoUnit.DAYS.between(start, end) + 1;
        int step = Math.max(1, total / 10);

        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write("no,employee_id,log_date,work_content");
            out.newLine();
            for (int i = 1; i <= total; i++) {
                LocalDate day = start.plusDays((i - 1) % days);
                Object employee = employees.get((i - 1) % employees.size());
                out.write(i + "," + employee + "," + day + ",work item " + i);
                out.newLine();

                if (i % step == 0 || i == total) {
                    progress.report(i, total, "Processing " + i + "/" + total);
                    if (i < total && progress.isCancellationRequested()) {
                        throw new TaskCancelledException("export cancelled at " + i + "/" + total);
                    }
                }
            }
        } catch (TaskCancelledException e) {
            Files.deleteIfExists(file);
            throw e;
        }

        log.info("Exported {} work logs to {}", total, file);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("record_count", total);
        result.put("file_name", fileName);
        result.put("file_path", file.toString());
        result.put("start_date", start.toString());
        result.put("end_date", end.toString());
        return result;
    }

    private static LocalDate date(TaskCall call, int position, String key) {
        String raw = TaskArgs.get(call, position, key, String.class);
        if (raw == null) throw new PermanentTaskException(NAME + " needs " + key);
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new PermanentTaskException(key + " is not a YYYY-MM-DD date: " + raw, e);
        }
    }
}
