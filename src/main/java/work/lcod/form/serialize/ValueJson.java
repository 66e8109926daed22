package work.lcod.form.serialize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import work.lcod.form.model.CheckboxState;
import work.lcod.form.model.FieldValue;
import work.lcod.form.model.TableCell;
import work.lcod.form.model.TableRow;
import work.lcod.form.shared.Numbers;

/**
 * JSON shape of field values. It is the same shape patches use for {@code set_value}, so a value
 * read here can be submitted back unchanged.
 */
public final class ValueJson {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueJson() {}

    public static JsonNode toJson(FieldValue value) {
        switch (value.kind()) {
            case STRING:
                return NODES.textNode(((FieldValue.StringValue) value).value());
            case URL:
                return NODES.textNode(((FieldValue.UrlValue) value).value());
            case NUMBER:
                return number(((FieldValue.NumberValue) value).value());
            case DATE:
                return NODES.textNode(((FieldValue.DateValue) value).value().toString());
            case YEAR:
                return NODES.numberNode(((FieldValue.YearValue) value).value());
            case STRING_LIST:
                return strings(((FieldValue.StringListValue) value).items());
            case URL_LIST:
                return strings(((FieldValue.UrlListValue) value).items());
            case SINGLE_SELECT:
                return ((FieldValue.SingleSelectValue) value).selected()
                    .<JsonNode>map(NODES::textNode)
                    .orElse(NODES.nullNode());
            case MULTI_SELECT:
                return strings(((FieldValue.MultiSelectValue) value).selected());
            case CHECKBOXES: {
                ObjectNode states = NODES.objectNode();
                for (Map.Entry<String, CheckboxState> entry : ((FieldValue.CheckboxesValue) value).states().entrySet()) {
                    states.put(entry.getKey(), entry.getValue().wireName());
                }
                return states;
            }
            case TABLE: {
                ArrayNode rows = NODES.arrayNode();
                for (TableRow row : ((FieldValue.TableValue) value).rows()) {
                    ObjectNode cells = rows.addObject();
                    for (Map.Entry<String, TableCell> entry : row.cells().entrySet()) {
                        cells.set(entry.getKey(), cellJson(entry.getValue()));
                    }
                }
                return rows;
            }
            default:
                throw new IllegalArgumentException("Unhandled kind " + value.kind());
        }
    }

    /** Answered cells as their scalar, empty cells as null, skipped or aborted cells as sentinels. */
    public static JsonNode cellJson(TableCell cell) {
        switch (cell.state()) {
            case ANSWERED:
                return toJson(cell.value().orElseThrow());
            case UNANSWERED:
                return NODES.nullNode();
            default:
                return NODES.textNode(CanonicalWriter.cellText(cell));
        }
    }

    private static JsonNode number(double value) {
        Number number = Numbers.toJsonNumber(value);
        return number instanceof Long ? NODES.numberNode((Long) number) : NODES.numberNode((Double) number);
    }

    private static ArrayNode strings(Iterable<String> items) {
        ArrayNode array = NODES.arrayNode();
        items.forEach(array::add);
        return array;
    }
}
