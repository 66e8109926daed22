package work.lcod.form.cli;

import java.util.Locale;

enum OutputFormat {
    JSON,
    YAML;

    static OutputFormat from(String raw) {
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown output format '" + raw + "' (expected json or yaml)");
        }
    }
}
