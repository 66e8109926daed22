package work.lcod.form.parse;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.form.model.AnswerState;
import work.lcod.form.model.ColumnType;
import work.lcod.form.model.FieldKind;
import work.lcod.form.model.FieldValue;
import work.lcod.form.model.TableCell;

/**
 * Turns literal text into typed values. Used by the parser for value blocks and table cells.
 */
public final class LiteralReader {
    private static final Pattern NUMBER = Pattern.compile("-?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern YEAR = Pattern.compile("-?\\d{1,4}");
    private static final Pattern SENTINEL = Pattern.compile("^%(SKIP|ABORT)%(?:\\s*\\((.*)\\))?$", Pattern.DOTALL);

    /** A {@code %SKIP%} or {@code %ABORT%} marker with its optional reason. */
    public record Sentinel(AnswerState state, Optional<String> reason) {}

    private LiteralReader() {}

    public static Optional<Sentinel> sentinel(String text) {
        Matcher matcher = SENTINEL.matcher(text.strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        AnswerState state = "SKIP".equals(matcher.group(1)) ? AnswerState.SKIPPED : AnswerState.ABORTED;
        return Optional.of(new Sentinel(state, Optional.ofNullable(matcher.group(2)).map(String::strip).filter(r -> !r.isEmpty())));
    }

    /**
     * Reads a scalar of the given kind.
     *
     * @throws IllegalArgumentException when the text is not a literal of that kind
     */
    public static FieldValue scalar(FieldKind kind, String text) {
        switch (kind) {
            case STRING:
                return new FieldValue.StringValue(text);
            case URL:
                return new FieldValue.UrlValue(text.strip());
            case NUMBER: {
                String trimmed = text.strip();
                if (!NUMBER.matcher(trimmed).matches()) {
                    throw new IllegalArgumentException("'" + trimmed + "' is not a number");
                }
                return new FieldValue.NumberValue(Double.parseDouble(trimmed));
            }
            case DATE:
                try {
                    return new FieldValue.DateValue(LocalDate.parse(text.strip()));
                } catch (DateTimeParseException ex) {
                    throw new IllegalArgumentException("'" + text.strip() + "' is not an ISO date (YYYY-MM-DD)", ex);
                }
            case YEAR: {
                String trimmed = text.strip();
                if (!YEAR.matcher(trimmed).matches()) {
                    throw new IllegalArgumentException("'" + trimmed + "' is not a year");
                }
                return new FieldValue.YearValue(Integer.parseInt(trimmed));
            }
            default:
                throw new IllegalArgumentException("Kind " + kind.wireName() + " is not a scalar kind");
        }
    }

    /** One item per non-blank line, trimmed. */
    public static List<String> items(String text) {
        var items = new ArrayList<String>();
        for (String line : text.split("\n")) {
            String item = line.strip();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    /**
     * Reads a table cell. Blank text is an empty cell; sentinels mark skipped or aborted cells.
     *
     * @throws IllegalArgumentException when the text does not match the column type
     */
    public static TableCell cell(ColumnType type, String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return TableCell.empty();
        }
        Optional<Sentinel> sentinel = sentinel(trimmed);
        if (sentinel.isPresent()) {
            String reason = sentinel.get().reason().orElse(null);
            return sentinel.get().state() == AnswerState.SKIPPED ? TableCell.skipped(reason) : TableCell.aborted(reason);
        }
        return TableCell.answered(scalar(type.cellKind(), trimmed));
    }

    /** Splits a pipe-table line into trimmed cells, honouring {@code \|} escapes. */
    public static List<String> splitRow(String line) {
        String text = line.strip();
        if (text.startsWith("|")) {
            text = text.substring(1);
        }
        if (text.endsWith("|") && !text.endsWith("\\|")) {
            text = text.substring(0, text.length() - 1);
        }
        var cells = new ArrayList<String>();
        var current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) == '|') {
                current.append('|');
                i++;
            } else if (c == '|') {
                cells.add(current.toString().strip());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString().strip());
        return cells;
    }

    static boolean isSeparatorRow(List<String> cells) {
        return cells.stream().allMatch(cell -> cell.matches(":?-+:?"));
    }
}
