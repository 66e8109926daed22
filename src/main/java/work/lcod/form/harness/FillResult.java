package work.lcod.form.harness;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.form.model.FormDocument;

public record FillResult(FillStatus status, FormDocument document, List<TurnRecord> turns) {
    public FillResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(document, "document");
        turns = List.copyOf(turns);
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("status", status.wireName());
        map.put("turns", turns.stream().map(TurnRecord::toSerializableMap).toList());
        return map;
    }
}
