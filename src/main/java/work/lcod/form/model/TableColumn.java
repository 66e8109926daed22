package work.lcod.form.model;

import java.util.Objects;

/**
 * Column of a table field. Required columns must hold an answered cell in every row.
 */
public record TableColumn(String id, String label, ColumnType type, boolean required) {
    public TableColumn {
        Objects.requireNonNull(id, "id");
        label = label == null || label.isBlank() ? id : label;
        type = type == null ? ColumnType.STRING : type;
    }
}
