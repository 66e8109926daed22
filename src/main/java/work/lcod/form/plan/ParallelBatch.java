package work.lcod.form.plan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Items at one order level that separate actors may work on at the same time.
 */
public record ParallelBatch(String batchId, int order, Optional<String> role, List<PlanItem> items) {
    public ParallelBatch {
        Objects.requireNonNull(batchId, "batchId");
        Objects.requireNonNull(role, "role");
        items = List.copyOf(items);
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("batchId", batchId);
        map.put("order", order);
        role.ifPresent(value -> map.put("role", value));
        map.put("items", items.stream().map(PlanItem::toSerializableMap).toList());
        return map;
    }
}
