package work.lcod.form.inspect;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record InspectResult(
    StructureSummary structureSummary,
    ProgressSummary progressSummary,
    FormState formState,
    List<Issue> issues
) {
    public InspectResult {
        Objects.requireNonNull(structureSummary, "structureSummary");
        Objects.requireNonNull(progressSummary, "progressSummary");
        Objects.requireNonNull(formState, "formState");
        issues = List.copyOf(issues);
    }

    public boolean isComplete() {
        return formState == FormState.COMPLETE;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("formState", formState.wireName());
        map.put("structure", structureSummary.toSerializableMap());
        map.put("progress", progressSummary.toSerializableMap());
        map.put("issues", issues.stream().map(Issue::toSerializableMap).toList());
        return map;
    }
}
