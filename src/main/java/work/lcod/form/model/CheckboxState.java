package work.lcod.form.model;

import java.util.Locale;
import java.util.Optional;

public enum CheckboxState {
    TODO("[ ]"),
    DONE("[x]"),
    INCOMPLETE("[/]"),
    ACTIVE("[*]"),
    NA("[-]"),
    UNFILLED("[ ]"),
    YES("[y]"),
    NO("[n]");

    private final String marker;

    CheckboxState(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a list marker under the given mode. {@code [ ]} means {@code todo} except in
     * explicit mode where it means {@code unfilled}.
     */
    public static Optional<CheckboxState> fromMarker(String marker, CheckboxMode mode) {
        if (marker == null) {
            return Optional.empty();
        }
        switch (marker) {
            case "[ ]":
                return Optional.of(mode == CheckboxMode.EXPLICIT ? UNFILLED : TODO);
            case "[x]":
            case "[X]":
                return Optional.of(DONE);
            case "[/]":
                return Optional.of(INCOMPLETE);
            case "[*]":
                return Optional.of(ACTIVE);
            case "[-]":
                return Optional.of(NA);
            case "[y]":
            case "[Y]":
                return Optional.of(YES);
            case "[n]":
            case "[N]":
                return Optional.of(NO);
            default:
                return Optional.empty();
        }
    }

    public static Optional<CheckboxState> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(CheckboxState.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
