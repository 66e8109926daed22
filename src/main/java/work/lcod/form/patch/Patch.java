package work.lcod.form.patch;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One proposed change to one field. {@code value} is the JSON payload of {@code set_value};
 * {@code reason} accompanies {@code skip} and {@code abort}.
 */
public record Patch(String fieldId, PatchOperation operation, Optional<JsonNode> value, Optional<String> reason) {
    public Patch {
        Objects.requireNonNull(fieldId, "fieldId");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(reason, "reason");
    }

    public static Patch setValue(String fieldId, JsonNode value) {
        return new Patch(fieldId, PatchOperation.SET_VALUE, Optional.ofNullable(value), Optional.empty());
    }

    public static Patch skip(String fieldId, String reason) {
        return new Patch(fieldId, PatchOperation.SKIP, Optional.empty(), Optional.ofNullable(reason));
    }

    public static Patch abort(String fieldId, String reason) {
        return new Patch(fieldId, PatchOperation.ABORT, Optional.empty(), Optional.ofNullable(reason));
    }

    public static Patch clear(String fieldId) {
        return new Patch(fieldId, PatchOperation.CLEAR, Optional.empty(), Optional.empty());
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("fieldId", fieldId);
        map.put("operation", operation.wireName());
        value.ifPresent(node -> map.put("value", node));
        reason.ifPresent(text -> map.put("reason", text));
        return map;
    }
}
