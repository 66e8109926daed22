package work.lcod.form.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed value of a field, one variant per {@link FieldKind}. {@link #kind()} always matches the
 * variant, and {@link FormDocument} refuses a value whose kind differs from its field's kind.
 */
public sealed interface FieldValue {
    FieldKind kind();

    /** True when the value carries no content (blank text, no items, no selection, no rows). */
    boolean isEmpty();

    record StringValue(String value) implements FieldValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public FieldKind kind() {
            return FieldKind.STRING;
        }

        @Override
        public boolean isEmpty() {
            return value.isBlank();
        }
    }

    record NumberValue(double value) implements FieldValue {
        public NumberValue {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Number value must be finite");
            }
        }

        @Override
        public FieldKind kind() {
            return FieldKind.NUMBER;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }
    }

    record StringListValue(List<String> items) implements FieldValue {
        public StringListValue {
            items = List.copyOf(items);
        }

        @Override
        public FieldKind kind() {
            return FieldKind.STRING_LIST;
        }

        @Override
        public boolean isEmpty() {
            return items.isEmpty();
        }
    }

    record UrlValue(String value) implements FieldValue {
        public UrlValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public FieldKind kind() {
            return FieldKind.URL;
        }

        @Override
        public boolean isEmpty() {
            return value.isBlank();
        }
    }

    record UrlListValue(List<String> items) implements FieldValue {
        public UrlListValue {
            items = List.copyOf(items);
        }

        @Override
        public FieldKind kind() {
            return FieldKind.URL_LIST;
        }

        @Override
        public boolean isEmpty() {
            return items.isEmpty();
        }
    }

    record DateValue(LocalDate value) implements FieldValue {
        public DateValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public FieldKind kind() {
            return FieldKind.DATE;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }
    }

    record YearValue(int value) implements FieldValue {
        @Override
        public FieldKind kind() {
            return FieldKind.YEAR;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }
    }

    record SingleSelectValue(Optional<String> selected) implements FieldValue {
        public SingleSelectValue {
            Objects.requireNonNull(selected, "selected");
        }

        public static SingleSelectValue of(String optionId) {
            return new SingleSelectValue(Optional.ofNullable(optionId));
        }

        @Override
        public FieldKind kind() {
            return FieldKind.SINGLE_SELECT;
        }

        @Override
        public boolean isEmpty() {
            return selected.isEmpty();
        }
    }

    /** Selected option ids, without duplicates, in the order they were given. */
    record MultiSelectValue(List<String> selected) implements FieldValue {
        public MultiSelectValue {
            selected = List.copyOf(new LinkedHashSet<>(selected));
        }

        @Override
        public FieldKind kind() {
            return FieldKind.MULTI_SELECT;
        }

        @Override
        public boolean isEmpty() {
            return selected.isEmpty();
        }
    }

    record CheckboxesValue(Map<String, CheckboxState> states) implements FieldValue {
        public CheckboxesValue {
            states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        }

        @Override
        public FieldKind kind() {
            return FieldKind.CHECKBOXES;
        }

        @Override
        public boolean isEmpty() {
            return states.values().stream()
                .allMatch(state -> state == CheckboxState.TODO || state == CheckboxState.UNFILLED);
        }
    }

    record TableValue(List<TableRow> rows) implements FieldValue {
        public TableValue {
            rows = List.copyOf(rows);
        }

        @Override
        public FieldKind kind() {
            return FieldKind.TABLE;
        }

        @Override
        public boolean isEmpty() {
            return rows.isEmpty();
        }
    }

    /** Empty value of the given kind, used when a field is answered with nothing. */
    static FieldValue emptyOf(FieldKind kind) {
        switch (kind) {
            case STRING:
                return new StringValue("");
            case STRING_LIST:
                return new StringListValue(List.of());
            case URL:
                return new UrlValue("");
            case URL_LIST:
                return new UrlListValue(List.of());
            case SINGLE_SELECT:
                return new SingleSelectValue(Optional.empty());
            case MULTI_SELECT:
                return new MultiSelectValue(List.of());
            case CHECKBOXES:
                return new CheckboxesValue(Map.of());
            case TABLE:
                return new TableValue(new ArrayList<>());
            default:
                throw new IllegalArgumentException("Kind " + kind.wireName() + " has no empty value");
        }
    }
}
