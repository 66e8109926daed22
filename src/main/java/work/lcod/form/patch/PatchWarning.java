package work.lcod.form.patch;

import java.util.LinkedHashMap;
import java.util.Map;

/** A payload that was accepted after coercion into the field's shape. */
public record PatchWarning(int patchIndex, String fieldId, String message) {
    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("patchIndex", patchIndex);
        map.put("fieldId", fieldId);
        map.put("message", message);
        return map;
    }
}
