package work.lcod.form.patch;

/**
 * Raised when patch input is not a JSON array of well-formed patch objects.
 */
public final class PatchFormatException extends RuntimeException {
    public PatchFormatException(String message) {
        super(message);
    }

    public PatchFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
