package work.lcod.form.inspect;

import java.util.Locale;

public enum IssueScope {
    FIELD,
    GROUP,
    FORM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
