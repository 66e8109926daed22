package work.lcod.form.model;

import java.util.List;

/**
 * Well-known role names.
 */
public final class Roles {
    public static final String USER = "user";
    public static final String AGENT = "agent";
    /** Matches every role when used as a target role. */
    public static final String WILDCARD = "*";
    public static final List<String> DEFAULTS = List.of(USER, AGENT);

    private Roles() {}
}
