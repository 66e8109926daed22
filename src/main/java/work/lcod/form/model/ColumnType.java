package work.lcod.form.model;

import java.util.Locale;

/**
 * Cell types allowed in table columns; each maps onto the scalar field kind its cells hold.
 */
public enum ColumnType {
    STRING(FieldKind.STRING),
    NUMBER(FieldKind.NUMBER),
    URL(FieldKind.URL),
    DATE(FieldKind.DATE),
    YEAR(FieldKind.YEAR);

    private final FieldKind cellKind;

    ColumnType(FieldKind cellKind) {
        this.cellKind = cellKind;
    }

    public FieldKind cellKind() {
        return cellKind;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ColumnType from(String value) {
        if (value == null || value.isBlank()) {
            return STRING;
        }
        try {
            return ColumnType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported column type: " + value);
        }
    }
}
