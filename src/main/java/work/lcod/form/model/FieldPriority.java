package work.lcod.form.model;

import java.util.Locale;

public enum FieldPriority {
    HIGH,
    MEDIUM,
    LOW;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FieldPriority from(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return FieldPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported priority: " + value);
        }
    }
}
