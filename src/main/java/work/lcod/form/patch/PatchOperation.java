package work.lcod.form.patch;

import java.util.Locale;

public enum PatchOperation {
    SET_VALUE("set_value"),
    SKIP("skip"),
    ABORT("abort"),
    /** Returns the field to unanswered. */
    CLEAR("clear");

    private final String wireName;

    PatchOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Accepts {@code set_value}, {@code set-value}, {@code skip_field}, {@code clear_field} and similar spellings. */
    public static PatchOperation from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Patch operation must be provided");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case "set_value":
            case "setvalue":
            case "set":
                return SET_VALUE;
            case "skip":
            case "skip_field":
                return SKIP;
            case "abort":
            case "abort_field":
                return ABORT;
            case "clear":
            case "clear_field":
                return CLEAR;
            default:
                throw new IllegalArgumentException("Unsupported patch operation: " + value);
        }
    }
}
