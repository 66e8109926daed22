package work.lcod.form.parse;

import java.util.Optional;

/**
 * Parse failure with the offending line (1-based, when known) and id.
 */
public final class DocumentException extends RuntimeException {
    private final DocumentErrorKind kind;
    private final Integer line;
    private final String ref;

    public DocumentException(DocumentErrorKind kind, String message, Integer line, String ref) {
        super(decorate(message, line));
        this.kind = kind;
        this.line = line;
        this.ref = ref;
    }

    public DocumentException(DocumentErrorKind kind, String message, Integer line, String ref, Throwable cause) {
        this(kind, message, line, ref);
        initCause(cause);
    }

    public DocumentErrorKind kind() {
        return kind;
    }

    public Optional<Integer> line() {
        return Optional.ofNullable(line);
    }

    public Optional<String> ref() {
        return Optional.ofNullable(ref);
    }

    private static String decorate(String message, Integer line) {
        return line == null ? message : message + " (line " + line + ")";
    }
}
