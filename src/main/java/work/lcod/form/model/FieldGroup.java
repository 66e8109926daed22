package work.lcod.form.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered container of fields. Fields written directly under the form land in an implicit group.
 */
public record FieldGroup(
    String id,
    String title,
    Optional<Integer> order,
    Optional<String> parallel,
    boolean serial,
    boolean implicit,
    List<Field> fields
) {
    public static final String IMPLICIT_ID = "default";

    public FieldGroup {
        Objects.requireNonNull(id, "id");
        title = title == null ? "" : title;
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(parallel, "parallel");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static FieldGroup implicitGroup(List<Field> fields) {
        return new FieldGroup(IMPLICIT_ID, "", Optional.empty(), Optional.empty(), false, true, fields);
    }

    public FieldGroup withFields(List<Field> newFields) {
        return new FieldGroup(id, title, order, parallel, serial, implicit, newFields);
    }
}
