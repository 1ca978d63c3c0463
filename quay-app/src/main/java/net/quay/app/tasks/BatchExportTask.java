package net.quay.app.tasks;

import net.quay.core.error.TaskCancelledException;
import net.quay.core.handler.ProgressReporter;
import net.quay.core.handler.TaskCall;
import net.quay.core.handler.TaskHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/** batch_export(export_type, filters=None, total=10000, batch_size=1000). 저우선 큐에서 배치 단위로 진행. */
public final class BatchExportTask implements TaskHandler {
    public static final String NAME = "batch_export";

    @Override
    public Object handle(TaskCall call, ProgressReporter progress) throws Exception {
        String exportType = TaskArgs.get(call, 0, "export_type", String.class);
        int total = TaskArgs.get(call, 2, "total", Integer.class, 10_000);
        int batchSize = TaskArgs.get(call, 3, "batch_size", Integer.class, 1_000);
        if (batchSize < 1) batchSize = 1;

        int done = 0;
        while (done < total) {
            if (progress.isCancellationRequested()) {
                throw new TaskCancelledException(NAME + " cancelled at " + done + "/" + total);
            }
            done = Math.min(total, done + batchSize);
            progress.report(done, total, "Exported " + done + "/" + total);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("export_type", exportType);
        result.put("records_count", total);
        result.put("file_name", "export_" + exportType + "_" + call.taskId() + ".csv");
        return result;
    }
}
