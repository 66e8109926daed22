package work.lcod.form.inspect;

import java.util.Locale;

/** Declaration order is sort order: required issues sort before recommended ones. */
public enum Severity {
    REQUIRED,
    RECOMMENDED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
