package work.lcod.form.model;

import java.util.Locale;

/**
 * Declared run mode of a form, read from the {@code markform.run_mode} frontmatter key.
 */
public enum RunMode {
    INTERACTIVE,
    FILL,
    RESEARCH;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunMode from(String value) {
        try {
            return RunMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException(
                "Invalid run_mode: '" + value + "'. Must be one of: interactive, fill, research"
            );
        }
    }
}
