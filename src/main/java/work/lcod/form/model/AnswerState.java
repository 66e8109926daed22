package work.lcod.form.model;

import java.util.Locale;

public enum AnswerState {
    UNANSWERED,
    ANSWERED,
    SKIPPED,
    ABORTED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AnswerState from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Answer state must be provided");
        }
        try {
            return AnswerState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported answer state: " + value);
        }
    }
}
