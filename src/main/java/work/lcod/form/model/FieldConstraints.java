package work.lcod.form.model;

import java.time.LocalDate;

/**
 * Kind-specific constraints. Each kind only reads the components that apply to it; the others stay
 * {@code null}/{@code false}.
 */
public record FieldConstraints(
    Integer minLength,
    Integer maxLength,
    String pattern,
    boolean multiline,
    Double min,
    Double max,
    boolean integer,
    Integer minItems,
    Integer maxItems,
    boolean uniqueItems,
    Integer minSelections,
    Integer maxSelections,
    Integer minDone,
    boolean blockingApproval,
    LocalDate minDate,
    LocalDate maxDate,
    Integer minRows,
    Integer maxRows
) {
    public static final FieldConstraints NONE = builder().build();

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .minLength(minLength)
            .maxLength(maxLength)
            .pattern(pattern)
            .multiline(multiline)
            .min(min)
            .max(max)
            .integer(integer)
            .minItems(minItems)
            .maxItems(maxItems)
            .uniqueItems(uniqueItems)
            .minSelections(minSelections)
            .maxSelections(maxSelections)
            .minDone(minDone)
            .blockingApproval(blockingApproval)
            .minDate(minDate)
            .maxDate(maxDate)
            .minRows(minRows)
            .maxRows(maxRows);
    }

    public static final class Builder {
        private Integer minLength;
        private Integer maxLength;
        private String pattern;
        private boolean multiline;
        private Double min;
        private Double max;
        private boolean integer;
        private Integer minItems;
        private Integer maxItems;
        private boolean uniqueItems;
        private Integer minSelections;
        private Integer maxSelections;
        private Integer minDone;
        private boolean blockingApproval;
        private LocalDate minDate;
        private LocalDate maxDate;
        private Integer minRows;
        private Integer maxRows;

        public Builder minLength(Integer minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(Integer maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder multiline(boolean multiline) {
            this.multiline = multiline;
            return this;
        }

        public Builder min(Double min) {
            this.min = min;
            return this;
        }

        public Builder max(Double max) {
            this.max = max;
            return this;
        }

        public Builder integer(boolean integer) {
            this.integer = integer;
            return this;
        }

        public Builder minItems(Integer minItems) {
            this.minItems = minItems;
            return this;
        }

        public Builder maxItems(Integer maxItems) {
            this.maxItems = maxItems;
            return this;
        }

        public Builder uniqueItems(boolean uniqueItems) {
            this.uniqueItems = uniqueItems;
            return this;
        }

        public Builder minSelections(Integer minSelections) {
            this.minSelections = minSelections;
            return this;
        }

        public Builder maxSelections(Integer maxSelections) {
            this.maxSelections = maxSelections;
            return this;
        }

        public Builder minDone(Integer minDone) {
            this.minDone = minDone;
            return this;
        }

        public Builder blockingApproval(boolean blockingApproval) {
            this.blockingApproval = blockingApproval;
            return this;
        }

        public Builder minDate(LocalDate minDate) {
            this.minDate = minDate;
            return this;
        }

        public Builder maxDate(LocalDate maxDate) {
            this.maxDate = maxDate;
            return this;
        }

        public Builder minRows(Integer minRows) {
            this.minRows = minRows;
            return this;
        }

        public Builder maxRows(Integer maxRows) {
            this.maxRows = maxRows;
            return this;
        }

        public FieldConstraints build() {
            return new FieldConstraints(
                minLength,
                maxLength,
                pattern,
                multiline,
                min,
                max,
                integer,
                minItems,
                maxItems,
                uniqueItems,
                minSelections,
                maxSelections,
                minDone,
                blockingApproval,
                minDate,
                maxDate,
                minRows,
                maxRows
            );
        }
    }
}
