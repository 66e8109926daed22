package work.lcod.form.patch;

import java.util.Locale;

public enum ApplyStatus {
    APPLIED,
    /** Batch applied, but some field set by it is now invalid. */
    PARTIAL,
    /** Batch failed structural checks; nothing was applied. */
    REJECTED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
