package work.lcod.form.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered groups of fields plus the lookups every engine component needs.
 */
public final class FormSchema {
    private final String id;
    private final String title;
    private final List<FieldGroup> groups;
    private final Map<String, Field> fieldsById;
    private final Map<String, FieldGroup> groupsByFieldId;
    private final Map<String, Integer> declarationIndex;

    public FormSchema(String id, String title, List<FieldGroup> groups) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title == null ? "" : title;
        this.groups = groups == null ? List.of() : List.copyOf(groups);
        var fields = new LinkedHashMap<String, Field>();
        var owners = new LinkedHashMap<String, FieldGroup>();
        var index = new LinkedHashMap<String, Integer>();
        var groupIds = new HashSet<String>();
        for (FieldGroup group : this.groups) {
            if (!groupIds.add(group.id())) {
                throw new IllegalArgumentException("Duplicate group id '" + group.id() + "'");
            }
            for (Field field : group.fields()) {
                if (fields.putIfAbsent(field.id(), field) != null) {
                    throw new IllegalArgumentException("Duplicate field id '" + field.id() + "'");
                }
                owners.put(field.id(), group);
                index.put(field.id(), index.size());
            }
        }
        this.fieldsById = Collections.unmodifiableMap(fields);
        this.groupsByFieldId = Collections.unmodifiableMap(owners);
        this.declarationIndex = Collections.unmodifiableMap(index);
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public List<FieldGroup> groups() {
        return groups;
    }

    /** All fields in declaration order. */
    public List<Field> fields() {
        return new ArrayList<>(fieldsById.values());
    }

    public Optional<Field> field(String fieldId) {
        return Optional.ofNullable(fieldsById.get(fieldId));
    }

    public boolean hasField(String fieldId) {
        return fieldsById.containsKey(fieldId);
    }

    public Optional<FieldGroup> group(String groupId) {
        return groups.stream().filter(group -> group.id().equals(groupId)).findFirst();
    }

    public Optional<FieldGroup> groupOf(String fieldId) {
        return Optional.ofNullable(groupsByFieldId.get(fieldId));
    }

    /** Position of the field in document order, or {@link Integer#MAX_VALUE} for unknown ids. */
    public int declarationIndex(String fieldId) {
        return declarationIndex.getOrDefault(fieldId, Integer.MAX_VALUE);
    }

    /** Effective order level: the field's own order, else its group's, else {@code 0}. */
    public int orderOf(Field field) {
        if (field.order().isPresent()) {
            return field.order().get();
        }
        return groupOf(field.id()).flatMap(FieldGroup::order).orElse(0);
    }

    public boolean isKnownRef(String ref) {
        return id.equals(ref) || fieldsById.containsKey(ref) || group(ref).isPresent();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FormSchema that)) {
            return false;
        }
        return id.equals(that.id) && title.equals(that.title) && groups.equals(that.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, groups);
    }

    @Override
    public String toString() {
        return "FormSchema[id=" + id + ", groups=" + groups.size() + ", fields=" + fieldsById.size() + "]";
    }
}
