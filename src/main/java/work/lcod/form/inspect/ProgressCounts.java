package work.lcod.form.inspect;

import java.util.LinkedHashMap;
import java.util.Map;

public record ProgressCounts(
    int totalFields,
    int requiredFields,
    int answered,
    int skipped,
    int aborted,
    int unanswered,
    int filled,
    int empty,
    int valid,
    int invalid,
    int resolved
) {
    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("totalFields", totalFields);
        map.put("requiredFields", requiredFields);
        map.put("answered", answered);
        map.put("skipped", skipped);
        map.put("aborted", aborted);
        map.put("unanswered", unanswered);
        map.put("filled", filled);
        map.put("empty", empty);
        map.put("valid", valid);
        map.put("invalid", invalid);
        map.put("resolved", resolved);
        return map;
    }
}
