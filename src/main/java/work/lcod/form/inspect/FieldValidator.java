package work.lcod.form.inspect;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import work.lcod.form.model.CheckboxMode;
import work.lcod.form.model.CheckboxState;
import work.lcod.form.model.Field;
import work.lcod.form.model.FieldConstraints;
import work.lcod.form.model.FieldValue;
import work.lcod.form.model.TableCell;
import work.lcod.form.model.TableColumn;
import work.lcod.form.model.TableRow;
import work.lcod.form.shared.Numbers;

/**
 * Kind-specific checks on a field's value. {@link #violations} lists what makes a value invalid;
 * {@link #shortfall} reports a valid value that is not yet enough (open checkboxes, too few items).
 */
public final class FieldValidator {
    private FieldValidator() {}

    /** Valid value that does not yet satisfy completion rules. */
    public record Shortfall(IssueReason reason, String message) {}

    public static List<String> violations(Field field, FieldValue value) {
        var problems = new ArrayList<String>();
        FieldConstraints c = field.constraints();
        switch (value.kind()) {
            case STRING:
                checkText(((FieldValue.StringValue) value).value(), c, problems);
                break;
            case NUMBER: {
                double number = ((FieldValue.NumberValue) value).value();
                if (c.integer() && number != Math.rint(number)) {
                    problems.add("must be an integer, got " + Numbers.format(number));
                }
                if (c.min() != null && number < c.min()) {
                    problems.add("must be at least " + Numbers.format(c.min()) + ", got " + Numbers.format(number));
                }
                if (c.max() != null && number > c.max()) {
                    problems.add("must be at most " + Numbers.format(c.max()) + ", got " + Numbers.format(number));
                }
                break;
            }
            case STRING_LIST:
                checkItems(((FieldValue.StringListValue) value).items(), c, false, problems);
                break;
            case URL_LIST:
                checkItems(((FieldValue.UrlListValue) value).items(), c, true, problems);
                break;
            case URL: {
                String url = ((FieldValue.UrlValue) value).value();
                if (!url.isBlank() && !isUrl(url)) {
                    problems.add("'" + url + "' is not an http(s) URL");
                }
                break;
            }
            case DATE: {
                var date = ((FieldValue.DateValue) value).value();
                if (c.minDate() != null && date.isBefore(c.minDate())) {
                    problems.add("must be on or after " + c.minDate() + ", got " + date);
                }
                if (c.maxDate() != null && date.isAfter(c.maxDate())) {
                    problems.add("must be on or before " + c.maxDate() + ", got " + date);
                }
                break;
            }
            case YEAR: {
                int year = ((FieldValue.YearValue) value).value();
                if (c.min() != null && year < c.min()) {
                    problems.add("must be " + c.min().intValue() + " or later, got " + year);
                }
                if (c.max() != null && year > c.max()) {
                    problems.add("must be " + c.max().intValue() + " or earlier, got " + year);
                }
                break;
            }
            case SINGLE_SELECT:
                ((FieldValue.SingleSelectValue) value).selected()
                    .filter(id -> !field.hasOption(id))
                    .ifPresent(id -> problems.add("'" + id + "' is not an option"));
                break;
            case MULTI_SELECT: {
                List<String> selected = ((FieldValue.MultiSelectValue) value).selected();
                for (String id : selected) {
                    if (!field.hasOption(id)) {
                        problems.add("'" + id + "' is not an option");
                    }
                }
                if (c.maxSelections() != null && selected.size() > c.maxSelections()) {
                    problems.add("at most " + c.maxSelections() + " selections allowed, got " + selected.size());
                }
                break;
            }
            case CHECKBOXES: {
                CheckboxMode mode = field.checkboxMode();
                for (Map.Entry<String, CheckboxState> entry : ((FieldValue.CheckboxesValue) value).states().entrySet()) {
                    if (!field.hasOption(entry.getKey())) {
                        problems.add("'" + entry.getKey() + "' is not an option");
                    } else if (!mode.allows(entry.getValue())) {
                        problems.add("state '" + entry.getValue().wireName() + "' of '" + entry.getKey() + "' is not allowed in "
                            + mode.wireName() + " mode");
                    }
                }
                break;
            }
            case TABLE:
                checkTable(field, ((FieldValue.TableValue) value).rows(), problems);
                break;
            default:
                break;
        }
        return problems;
    }

    public static Optional<Shortfall> shortfall(Field field, FieldValue value) {
        FieldConstraints c = field.constraints();
        switch (value.kind()) {
            case STRING_LIST:
                return minimum(field, ((FieldValue.StringListValue) value).items().size(), c.minItems(), "items");
            case URL_LIST:
                return minimum(field, ((FieldValue.UrlListValue) value).items().size(), c.minItems(), "items");
            case MULTI_SELECT:
                return minimum(field, ((FieldValue.MultiSelectValue) value).selected().size(), c.minSelections(), "selections");
            case TABLE:
                return minimum(field, ((FieldValue.TableValue) value).rows().size(), c.minRows(), "rows");
            case CHECKBOXES:
                return checkboxShortfall(field, (FieldValue.CheckboxesValue) value);
            default:
                return Optional.empty();
        }
    }

    /** Whether a checkbox set is finished for its mode, or has {@code minDone} checked items. */
    public static boolean isCheckboxComplete(Field field, FieldValue.CheckboxesValue value) {
        return checkboxShortfall(field, value).isEmpty();
    }

    public static boolean isUrl(String text) {
        try {
            URI uri = new URI(text.strip());
            String scheme = uri.getScheme();
            return scheme != null
                && (scheme.toLowerCase(Locale.ROOT).equals("http") || scheme.toLowerCase(Locale.ROOT).equals("https"))
                && uri.getHost() != null;
        } catch (URISyntaxException ex) {
            return false;
        }
    }

    private static Optional<Shortfall> checkboxShortfall(Field field, FieldValue.CheckboxesValue value) {
        CheckboxMode mode = field.checkboxMode();
        Map<String, CheckboxState> states = value.states();
        if (field.constraints().minDone() != null) {
            CheckboxState done = mode == CheckboxMode.EXPLICIT ? CheckboxState.YES : CheckboxState.DONE;
            long count = field.options().stream().filter(option -> states.get(option.id()) == done).count();
            int minDone = field.constraints().minDone();
            if (count < minDone) {
                return Optional.of(new Shortfall(
                    IssueReason.CHECKBOX_INCOMPLETE,
                    "'" + field.label() + "' needs at least " + minDone + " " + done.wireName() + " item(s), has " + count
                ));
            }
            return Optional.empty();
        }
        long open = field.options().stream()
            .map(option -> states.getOrDefault(option.id(), mode.initialState()))
            .filter(state -> !isSettled(mode, state))
            .count();
        if (open == 0) {
            return Optional.empty();
        }
        return Optional.of(new Shortfall(
            IssueReason.CHECKBOX_INCOMPLETE,
            open + " of " + field.options().size() + " item(s) of '" + field.label() + "' still open"
        ));
    }

    private static boolean isSettled(CheckboxMode mode, CheckboxState state) {
        switch (mode) {
            case SIMPLE:
                return state == CheckboxState.DONE;
            case EXPLICIT:
                return state == CheckboxState.YES || state == CheckboxState.NO;
            default:
                return state == CheckboxState.DONE || state == CheckboxState.NA;
        }
    }

    private static Optional<Shortfall> minimum(Field field, int count, Integer minimum, String noun) {
        if (minimum == null || count >= minimum) {
            return Optional.empty();
        }
        return Optional.of(new Shortfall(
            IssueReason.MIN_ITEMS_NOT_MET,
            "'" + field.label() + "' needs at least " + minimum + " " + noun + ", has " + count
        ));
    }

    private static void checkText(String text, FieldConstraints c, List<String> problems) {
        int length = text.codePointCount(0, text.length());
        if (c.minLength() != null && length < c.minLength()) {
            problems.add("must be at least " + c.minLength() + " characters, got " + length);
        }
        if (c.maxLength() != null && length > c.maxLength()) {
            problems.add("must be at most " + c.maxLength() + " characters, got " + length);
        }
        if (c.pattern() != null) {
            try {
                if (!Pattern.compile(c.pattern()).matcher(text).find()) {
                    problems.add("does not match pattern " + c.pattern());
                }
            } catch (PatternSyntaxException ex) {
                problems.add("pattern " + c.pattern() + " is not a valid regular expression");
            }
        }
    }

    private static void checkItems(List<String> items, FieldConstraints c, boolean urls, List<String> problems) {
        if (c.maxItems() != null && items.size() > c.maxItems()) {
            problems.add("at most " + c.maxItems() + " items allowed, got " + items.size());
        }
        if (c.uniqueItems() && new HashSet<>(items).size() != items.size()) {
            problems.add("items must be unique");
        }
        if (urls) {
            for (String item : items) {
                if (!isUrl(item)) {
                    problems.add("'" + item + "' is not an http(s) URL");
                }
            }
        }
    }

    private static void checkTable(Field field, List<TableRow> rows, List<String> problems) {
        Integer maxRows = field.constraints().maxRows();
        if (maxRows != null && rows.size() > maxRows) {
            problems.add("at most " + maxRows + " rows allowed, got " + rows.size());
        }
        for (int i = 0; i < rows.size(); i++) {
            TableRow row = rows.get(i);
            for (String columnId : row.cells().keySet()) {
                if (field.column(columnId).isEmpty()) {
                    problems.add("row " + (i + 1) + " has unknown column '" + columnId + "'");
                }
            }
            for (TableColumn column : field.columns()) {
                TableCell cell = row.cell(column.id());
                if (cell.isEmpty()) {
                    if (column.required()) {
                        problems.add("row " + (i + 1) + " is missing required column '" + column.id() + "'");
                    }
                    continue;
                }
                if (cell.value().isEmpty()) {
                    continue;
                }
                FieldValue cellValue = cell.value().get();
                if (cellValue.kind() != column.type().cellKind()) {
                    problems.add("row " + (i + 1) + " column '" + column.id() + "' must be a " + column.type().wireName());
                } else if (cellValue instanceof FieldValue.UrlValue && !isUrl(((FieldValue.UrlValue) cellValue).value())) {
                    problems.add("row " + (i + 1) + " column '" + column.id() + "' is not an http(s) URL");
                }
            }
        }
    }
}
