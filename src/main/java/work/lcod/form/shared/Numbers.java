package work.lcod.form.shared;

import java.math.BigDecimal;

/**
 * Canonical text form of numbers: integral values print without a fraction, others in plain
 * (non-scientific) notation.
 */
public final class Numbers {
    private Numbers() {}

    public static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /** Number as a JSON-friendly boxed value: {@link Long} when integral, {@link Double} otherwise. */
    public static Number toJsonNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return (long) value;
        }
        return value;
    }
}
