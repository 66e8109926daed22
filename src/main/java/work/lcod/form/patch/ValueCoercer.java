package work.lcod.form.patch;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.form.model.CheckboxMode;
import work.lcod.form.model.CheckboxState;
import work.lcod.form.model.ColumnType;
import work.lcod.form.model.Field;
import work.lcod.form.model.FieldOption;
import work.lcod.form.model.FieldResponse;
import work.lcod.form.model.FieldValue;
import work.lcod.form.model.TableCell;
import work.lcod.form.model.TableColumn;
import work.lcod.form.model.TableRow;
import work.lcod.form.parse.LiteralReader;

/**
 * Type-checks a {@code set_value} payload against its field and builds the typed value. Throws
 * {@link IllegalArgumentException} with a caller-facing message when the payload does not fit.
 */
final class ValueCoercer {
    private ValueCoercer() {}

    static FieldValue coerce(Field field, JsonNode node, FieldResponse current, List<String> notes) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("set_value on '" + field.id() + "' needs a value; use clear to empty a field");
        }
        switch (field.kind()) {
            case STRING:
                return new FieldValue.StringValue(text(field, node));
            case URL:
                return new FieldValue.UrlValue(text(field, node).strip());
            case NUMBER:
                if (!node.isNumber() || !Double.isFinite(node.doubleValue())) {
                    throw expected(field, "a number", node);
                }
                return new FieldValue.NumberValue(node.doubleValue());
            case DATE:
                try {
                    return new FieldValue.DateValue(LocalDate.parse(text(field, node).strip()));
                } catch (DateTimeParseException ex) {
                    throw expected(field, "an ISO date (YYYY-MM-DD)", node);
                }
            case YEAR:
                if (!node.isIntegralNumber() || !node.canConvertToInt()) {
                    throw expected(field, "an integer year", node);
                }
                return new FieldValue.YearValue(node.intValue());
            case STRING_LIST:
                return new FieldValue.StringListValue(items(field, node, notes));
            case URL_LIST:
                return new FieldValue.UrlListValue(items(field, node, notes));
            case SINGLE_SELECT: {
                String id = text(field, node);
                requireOptions(field, List.of(id));
                return FieldValue.SingleSelectValue.of(id);
            }
            case MULTI_SELECT:
                return multiSelect(field, node, notes);
            case CHECKBOXES:
                return checkboxes(field, node, current, notes);
            case TABLE:
                return table(field, node);
            default:
                throw new IllegalArgumentException("Unhandled kind " + field.kind());
        }
    }

    private static String text(Field field, JsonNode node) {
        if (!node.isTextual()) {
            throw expected(field, "a string", node);
        }
        return node.textValue();
    }

    private static List<String> items(Field field, JsonNode node, List<String> notes) {
        var raw = new ArrayList<String>();
        if (node.isTextual()) {
            notes.add("single string wrapped into a one-item list");
            raw.add(node.textValue());
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                if (!item.isTextual()) {
                    throw expected(field, "an array of strings", node);
                }
                raw.add(item.textValue());
            }
        } else {
            throw expected(field, "an array of strings", node);
        }
        var items = new ArrayList<String>();
        for (String item : raw) {
            if (item.contains("\n")) {
                throw new IllegalArgumentException("Items of '" + field.id() + "' must be single-line");
            }
            if (!item.isBlank()) {
                items.add(item.strip());
            }
        }
        return items;
    }

    private static FieldValue multiSelect(Field field, JsonNode node, List<String> notes) {
        var ids = new ArrayList<String>();
        if (node.isTextual()) {
            notes.add("single option id wrapped into a selection list");
            ids.add(node.textValue());
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                if (!item.isTextual()) {
                    throw expected(field, "an array of option ids", node);
                }
                ids.add(item.textValue());
            }
        } else {
            throw expected(field, "an array of option ids", node);
        }
        requireOptions(field, ids);
        Set<String> chosen = new LinkedHashSet<>(ids);
        return new FieldValue.MultiSelectValue(
            field.options().stream().map(FieldOption::id).filter(chosen::contains).collect(Collectors.toList())
        );
    }

    private static FieldValue checkboxes(Field field, JsonNode node, FieldResponse current, List<String> notes) {
        CheckboxMode mode = field.checkboxMode();
        var updates = new LinkedHashMap<String, CheckboxState>();
        if (node.isArray()) {
            var ids = new ArrayList<String>();
            for (JsonNode item : node) {
                if (!item.isTextual()) {
                    throw expected(field, "an object of option states", node);
                }
                ids.add(item.textValue());
            }
            requireOptions(field, ids);
            notes.add("option id list read as checked options");
            ids.forEach(id -> updates.put(id, mode.fromBoolean(true)));
        } else if (node.isObject()) {
            requireOptions(field, iterable(node.fieldNames()));
            var entries = node.fields();
            boolean coerced = false;
            while (entries.hasNext()) {
                var entry = entries.next();
                JsonNode state = entry.getValue();
                if (state.isBoolean()) {
                    updates.put(entry.getKey(), mode.fromBoolean(state.booleanValue()));
                    coerced = true;
                } else if (state.isTextual()) {
                    CheckboxState parsed = CheckboxState.fromWireName(state.textValue())
                        .filter(mode::allows)
                        .orElseThrow(() -> new IllegalArgumentException(
                            "State '" + state.textValue() + "' of option '" + entry.getKey() + "' is not allowed in "
                                + mode.wireName() + " checkboxes of '" + field.id() + "'"
                        ));
                    updates.put(entry.getKey(), parsed);
                } else {
                    throw expected(field, "an object of option states", node);
                }
            }
            if (coerced) {
                notes.add("boolean option states mapped onto " + mode.wireName() + " states");
            }
        } else {
            throw expected(field, "an object of option states", node);
        }
        Map<String, CheckboxState> base = current.value()
            .filter(value -> value instanceof FieldValue.CheckboxesValue)
            .map(value -> ((FieldValue.CheckboxesValue) value).states())
            .orElse(Map.of());
        var states = new LinkedHashMap<String, CheckboxState>();
        for (FieldOption option : field.options()) {
            CheckboxState state = updates.getOrDefault(option.id(), base.getOrDefault(option.id(), mode.initialState()));
            states.put(option.id(), state);
        }
        return new FieldValue.CheckboxesValue(states);
    }

    private static FieldValue table(Field field, JsonNode node) {
        if (!node.isArray()) {
            throw expected(field, "an array of row objects", node);
        }
        var rows = new ArrayList<TableRow>();
        int index = 0;
        for (JsonNode rowNode : node) {
            index++;
            if (!rowNode.isObject()) {
                throw expected(field, "an array of row objects", node);
            }
            var names = rowNode.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (field.column(name).isEmpty()) {
                    throw new IllegalArgumentException("Row " + index + " of '" + field.id() + "' has unknown column '" + name + "'");
                }
            }
            var cells = new LinkedHashMap<String, TableCell>();
            for (TableColumn column : field.columns()) {
                cells.put(column.id(), cell(field, column, rowNode.get(column.id()), index));
            }
            rows.add(new TableRow(cells));
        }
        return new FieldValue.TableValue(rows);
    }

    private static TableCell cell(Field field, TableColumn column, JsonNode node, int row) {
        if (node == null || node.isNull()) {
            return TableCell.empty();
        }
        String where = "row " + row + " column '" + column.id() + "' of '" + field.id() + "'";
        if (node.isTextual()) {
            String text = node.textValue();
            if (text.contains("\n")) {
                throw new IllegalArgumentException("Cell at " + where + " must be single-line");
            }
            if (text.isBlank()) {
                return TableCell.empty();
            }
            Optional<LiteralReader.Sentinel> sentinel = LiteralReader.sentinel(text);
            if (sentinel.isPresent()) {
                return LiteralReader.cell(column.type(), text);
            }
        }
        ColumnType type = column.type();
        switch (type) {
            case NUMBER:
                if (!node.isNumber() || !Double.isFinite(node.doubleValue())) {
                    throw new IllegalArgumentException("Cell at " + where + " must be a number, got " + node);
                }
                return TableCell.answered(new FieldValue.NumberValue(node.doubleValue()));
            case YEAR:
                if (!node.isIntegralNumber() || !node.canConvertToInt()) {
                    throw new IllegalArgumentException("Cell at " + where + " must be an integer year, got " + node);
                }
                return TableCell.answered(new FieldValue.YearValue(node.intValue()));
            default:
                if (!node.isTextual()) {
                    throw new IllegalArgumentException("Cell at " + where + " must be a " + type.wireName() + " string, got " + node);
                }
                try {
                    return LiteralReader.cell(type, node.textValue());
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException("Cell at " + where + ": " + ex.getMessage(), ex);
                }
        }
    }

    private static void requireOptions(Field field, Iterable<String> ids) {
        var unknown = new ArrayList<String>();
        for (String id : ids) {
            if (!field.hasOption(id)) {
                unknown.add(id);
            }
        }
        if (!unknown.isEmpty()) {
            String known = field.options().stream().map(FieldOption::id).collect(Collectors.joining(", "));
            throw new IllegalArgumentException(
                "Invalid option" + (unknown.size() > 1 ? "s " : " ") + unknown.stream().map(id -> "'" + id + "'").collect(Collectors.joining(", "))
                    + " for field '" + field.id() + "' (options: " + known + ")"
            );
        }
    }

    private static IllegalArgumentException expected(Field field, String shape, JsonNode node) {
        return new IllegalArgumentException(
            "Field '" + field.id() + "' of kind " + field.kind().wireName() + " expects " + shape + ", got " + node
        );
    }

    private static <T> Iterable<T> iterable(Iterator<T> iterator) {
        var list = new ArrayList<T>();
        iterator.forEachRemaining(list::add);
        return list;
    }
}
