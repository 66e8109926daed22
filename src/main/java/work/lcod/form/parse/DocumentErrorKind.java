package work.lcod.form.parse;

import java.util.Locale;

public enum DocumentErrorKind {
    MALFORMED_FRONTMATTER,
    DUPLICATE_ID,
    UNKNOWN_DIRECTIVE,
    TYPE_MISMATCH_IN_LITERAL,
    /** Missing attributes, unbalanced directives, dangling references. */
    INVALID_STRUCTURE;

    public String code() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
