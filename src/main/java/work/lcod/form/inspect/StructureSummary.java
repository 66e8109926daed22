package work.lcod.form.inspect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of the schema: how many groups, fields and options, fields per kind, declared roles.
 */
public record StructureSummary(
    int groupCount,
    int fieldCount,
    int requiredFieldCount,
    int optionCount,
    int columnCount,
    Map<String, Integer> fieldsByKind,
    List<String> roles
) {
    public StructureSummary {
        fieldsByKind = Collections.unmodifiableMap(new LinkedHashMap<>(fieldsByKind));
        roles = List.copyOf(roles);
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("groupCount", groupCount);
        map.put("fieldCount", fieldCount);
        map.put("requiredFieldCount", requiredFieldCount);
        map.put("optionCount", optionCount);
        map.put("columnCount", columnCount);
        map.put("fieldsByKind", fieldsByKind);
        map.put("roles", roles);
        return map;
    }
}
