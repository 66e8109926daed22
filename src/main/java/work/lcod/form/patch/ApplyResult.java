package work.lcod.form.patch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.form.inspect.InspectResult;
import work.lcod.form.model.FormDocument;

/**
 * Outcome of a patch batch: the resulting document (the input one when rejected), a fresh
 * inspection of it, and what was rejected or coerced.
 */
public record ApplyResult(
    ApplyStatus status,
    FormDocument document,
    InspectResult inspection,
    List<PatchRejection> rejections,
    List<PatchWarning> warnings
) {
    public ApplyResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(inspection, "inspection");
        rejections = List.copyOf(rejections);
        warnings = List.copyOf(warnings);
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("applyStatus", status.wireName());
        map.putAll(inspection.toSerializableMap());
        map.put("rejections", rejections.stream().map(PatchRejection::toSerializableMap).toList());
        map.put("warnings", warnings.stream().map(PatchWarning::toSerializableMap).toList());
        return map;
    }
}
