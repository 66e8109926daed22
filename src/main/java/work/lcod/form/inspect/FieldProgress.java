package work.lcod.form.inspect;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.form.model.AnswerState;

/**
 * Per-field progress. {@code filled} means answered with a non-empty value; {@code valid} is false
 * only for a filled value that breaks its constraints; {@code resolved} means no further work is
 * expected (filled, valid and complete, or skipped/aborted).
 */
public record FieldProgress(String fieldId, boolean required, AnswerState state, boolean filled, boolean valid, boolean resolved) {
    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("required", required);
        map.put("state", state.wireName());
        map.put("filled", filled);
        map.put("valid", valid);
        map.put("resolved", resolved);
        return map;
    }
}
