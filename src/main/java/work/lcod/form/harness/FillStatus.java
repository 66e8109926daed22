package work.lcod.form.harness;

import java.util.Locale;

public enum FillStatus {
    COMPLETE,
    MAX_TURNS,
    AGENT_STOPPED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
