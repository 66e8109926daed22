package work.lcod.form.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Which states a checkbox option may take. {@code SIMPLE} is the boolean-per-option mode,
 * {@code MULTI} and {@code EXPLICIT} are status-per-option modes.
 */
public enum CheckboxMode {
    SIMPLE(EnumSet.of(CheckboxState.TODO, CheckboxState.DONE), CheckboxState.TODO),
    MULTI(
        EnumSet.of(CheckboxState.TODO, CheckboxState.DONE, CheckboxState.INCOMPLETE, CheckboxState.ACTIVE, CheckboxState.NA),
        CheckboxState.TODO
    ),
    EXPLICIT(EnumSet.of(CheckboxState.UNFILLED, CheckboxState.YES, CheckboxState.NO), CheckboxState.UNFILLED);

    private final Set<CheckboxState> allowed;
    private final CheckboxState initial;

    CheckboxMode(Set<CheckboxState> allowed, CheckboxState initial) {
        this.allowed = allowed;
        this.initial = initial;
    }

    public boolean allows(CheckboxState state) {
        return allowed.contains(state);
    }

    public CheckboxState initialState() {
        return initial;
    }

    /** Maps a boolean answer onto this mode's "checked"/"unchecked" states. */
    public CheckboxState fromBoolean(boolean checked) {
        if (this == EXPLICIT) {
            return checked ? CheckboxState.YES : CheckboxState.NO;
        }
        return checked ? CheckboxState.DONE : CheckboxState.TODO;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CheckboxMode from(String value) {
        if (value == null || value.isBlank()) {
            return MULTI;
        }
        try {
            return CheckboxMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported checkbox mode: " + value);
        }
    }
}
