package work.lcod.form.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Current answer state of one field. Only {@code ANSWERED} carries a value; {@code SKIPPED} and
 * {@code ABORTED} may carry a reason.
 */
public record FieldResponse(AnswerState state, Optional<FieldValue> value, Optional<String> reason) {
    private static final FieldResponse UNANSWERED = new FieldResponse(AnswerState.UNANSWERED, Optional.empty(), Optional.empty());

    public FieldResponse {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(reason, "reason");
        if ((state == AnswerState.ANSWERED) != value.isPresent()) {
            throw new IllegalArgumentException("A value is present exactly when the state is answered (state=" + state.wireName() + ")");
        }
        if (reason.isPresent() && state != AnswerState.SKIPPED && state != AnswerState.ABORTED) {
            throw new IllegalArgumentException("Only skipped or aborted responses carry a reason");
        }
        reason = reason.filter(text -> !text.isBlank());
    }

    public static FieldResponse unanswered() {
        return UNANSWERED;
    }

    public static FieldResponse answered(FieldValue value) {
        return new FieldResponse(AnswerState.ANSWERED, Optional.of(value), Optional.empty());
    }

    /** Answered response checked against the field it belongs to. */
    public static FieldResponse answered(Field field, FieldValue value) {
        requireKind(field, value);
        return answered(value);
    }

    public static FieldResponse skipped(String reason) {
        return new FieldResponse(AnswerState.SKIPPED, Optional.empty(), Optional.ofNullable(reason));
    }

    public static FieldResponse aborted(String reason) {
        return new FieldResponse(AnswerState.ABORTED, Optional.empty(), Optional.ofNullable(reason));
    }

    public boolean isAnswered() {
        return state == AnswerState.ANSWERED;
    }

    /** Answered with a non-empty value. */
    public boolean hasContent() {
        return value.map(v -> !v.isEmpty()).orElse(false);
    }

    static void requireKind(Field field, FieldValue value) {
        Objects.requireNonNull(value, "value");
        if (value.kind() != field.kind()) {
            throw new IllegalArgumentException(
                "Value of kind " + value.kind().wireName() + " does not match field '" + field.id()
                    + "' of kind " + field.kind().wireName()
            );
        }
    }
}
