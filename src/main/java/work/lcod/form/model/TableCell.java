package work.lcod.form.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Table cell. An answered cell holds a scalar value whose kind matches its column type; empty,
 * skipped and aborted cells hold none.
 */
public record TableCell(AnswerState state, Optional<FieldValue> value, Optional<String> reason) {
    private static final TableCell EMPTY = new TableCell(AnswerState.UNANSWERED, Optional.empty(), Optional.empty());

    public TableCell {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(reason, "reason");
        if ((state == AnswerState.ANSWERED) != value.isPresent()) {
            throw new IllegalArgumentException("Only answered cells carry a value");
        }
        if (value.isPresent()) {
            FieldKind kind = value.get().kind();
            if (kind != FieldKind.STRING && kind != FieldKind.NUMBER && kind != FieldKind.URL
                && kind != FieldKind.DATE && kind != FieldKind.YEAR) {
                throw new IllegalArgumentException("Table cells hold scalar values, got " + kind.wireName());
            }
        }
    }

    public static TableCell empty() {
        return EMPTY;
    }

    public static TableCell answered(FieldValue value) {
        return new TableCell(AnswerState.ANSWERED, Optional.of(value), Optional.empty());
    }

    public static TableCell skipped(String reason) {
        return new TableCell(AnswerState.SKIPPED, Optional.empty(), Optional.ofNullable(reason));
    }

    public static TableCell aborted(String reason) {
        return new TableCell(AnswerState.ABORTED, Optional.empty(), Optional.ofNullable(reason));
    }

    public boolean isEmpty() {
        return state == AnswerState.UNANSWERED;
    }
}
