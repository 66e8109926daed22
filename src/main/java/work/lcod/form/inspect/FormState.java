package work.lcod.form.inspect;

import java.util.Locale;

/**
 * Overall state of a form. A form is complete once no required field is left open, even when
 * nothing has been answered yet; {@code EMPTY} is reserved for a form that declares no fields.
 */
public enum FormState {
    EMPTY,
    INCOMPLETE,
    COMPLETE,
    INVALID;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
