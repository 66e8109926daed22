package work.lcod.form.plan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ExecutionPlan(List<Integer> orderLevels, List<PlanItem> looseSerial, List<ParallelBatch> parallelBatches) {
    public static final ExecutionPlan EMPTY = new ExecutionPlan(List.of(), List.of(), List.of());

    public ExecutionPlan {
        orderLevels = List.copyOf(orderLevels);
        looseSerial = List.copyOf(looseSerial);
        parallelBatches = List.copyOf(parallelBatches);
    }

    public boolean isEmpty() {
        return looseSerial.isEmpty() && parallelBatches.isEmpty();
    }

    public int remainingFieldCount() {
        int loose = looseSerial.stream().mapToInt(item -> item.remainingFieldIds().size()).sum();
        int batched = parallelBatches.stream()
            .flatMap(batch -> batch.items().stream())
            .mapToInt(item -> item.remainingFieldIds().size())
            .sum();
        return loose + batched;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("orderLevels", orderLevels);
        map.put("looseSerial", looseSerial.stream().map(PlanItem::toSerializableMap).toList());
        map.put("parallelBatches", parallelBatches.stream().map(ParallelBatch::toSerializableMap).toList());
        return map;
    }
}
