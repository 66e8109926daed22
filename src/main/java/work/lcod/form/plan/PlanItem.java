package work.lcod.form.plan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A unit of remaining work: an explicit group, or a single field written outside any group.
 * {@code role} is empty when the remaining fields belong to several roles.
 */
public record PlanItem(String itemId, ItemType itemType, int order, Optional<String> role, List<String> remainingFieldIds) {
    public enum ItemType {
        FIELD,
        GROUP;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public PlanItem {
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(itemType, "itemType");
        Objects.requireNonNull(role, "role");
        remainingFieldIds = List.copyOf(remainingFieldIds);
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("itemId", itemId);
        map.put("itemType", itemType.wireName());
        map.put("order", order);
        role.ifPresent(value -> map.put("role", value));
        map.put("remainingFieldIds", remainingFieldIds);
        return map;
    }
}
