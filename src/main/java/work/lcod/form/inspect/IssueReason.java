package work.lcod.form.inspect;

import java.util.Locale;

public enum IssueReason {
    MISSING_REQUIRED_VALUE,
    INVALID_VALUE_FOR_KIND,
    CHECKBOX_INCOMPLETE,
    MIN_ITEMS_NOT_MET,
    OPTIONAL_UNANSWERED;

    /** Kebab-case code used in reports, e.g. {@code missing-required-value}. */
    public String code() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
