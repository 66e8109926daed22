package work.lcod.form.model;

import java.util.Locale;

/**
 * Closed set of field kinds. The wire name is what appears in {@code kind="..."}.
 */
public enum FieldKind {
    STRING("string"),
    NUMBER("number"),
    STRING_LIST("string_list"),
    SINGLE_SELECT("single_select"),
    MULTI_SELECT("multi_select"),
    CHECKBOXES("checkboxes"),
    URL("url"),
    URL_LIST("url_list"),
    DATE("date"),
    YEAR("year"),
    TABLE("table");

    private final String wireName;

    FieldKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Kinds whose schema carries an option list. */
    public boolean hasOptions() {
        return this == SINGLE_SELECT || this == MULTI_SELECT || this == CHECKBOXES;
    }

    public boolean isList() {
        return this == STRING_LIST || this == URL_LIST;
    }

    public static FieldKind from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Field kind must be provided");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FieldKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported field kind: " + value);
    }
}
