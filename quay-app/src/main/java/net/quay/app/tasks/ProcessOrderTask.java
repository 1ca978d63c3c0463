package net.quay.app.tasks;

import net.quay.core.error.PermanentTaskException;
import net.quay.core.handler.ProgressReporter;
import net.quay.core.handler.TaskCall;
import net.quay.core.handler.TaskHandler;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** process_order(order_id, items). items 는 {"sku":..., "price":...} 목록 */
public final class ProcessOrderTask implements TaskHandler {
    public static final String NAME = "process_order";

    @Override
    public Object handle(TaskCall call, ProgressReporter progress) throws Exception {
        Object orderId = TaskArgs.get(call, 0, "order_id", Object.class);
        List<?> items = TaskArgs.get(call, 1, "items", List.class, List.of());

        BigDecimal total = BigDecimal.ZERO;
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> m)) {
                throw new PermanentTaskException("order " + orderId + ": item is not an object: " + item);
            }
            Object price = m.get("price");
            if (price != null) total = total.add(new BigDecimal(price.toString()));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("order_id", orderId);
        result.put("items_count", items.size());
        result.put("total_amount", total.doubleValue());
        result.put("status", "completed");
        return result;
    }
}
