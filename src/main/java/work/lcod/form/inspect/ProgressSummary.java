package work.lcod.form.inspect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProgressSummary(ProgressCounts counts, Map<String, FieldProgress> fields) {
    public ProgressSummary {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public FieldProgress field(String fieldId) {
        return fields.get(fieldId);
    }

    public Map<String, Object> toSerializableMap() {
        var fieldMaps = new LinkedHashMap<String, Object>();
        fields.forEach((id, progress) -> fieldMaps.put(id, progress.toSerializableMap()));
        var map = new LinkedHashMap<String, Object>();
        map.put("counts", counts.toSerializableMap());
        map.put("fields", fieldMaps);
        return map;
    }
}
