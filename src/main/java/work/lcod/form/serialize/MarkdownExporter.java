package work.lcod.form.serialize;

import java.util.List;
import java.util.stream.Collectors;
import work.lcod.form.model.CheckboxState;
import work.lcod.form.model.DocumentationBlock;
import work.lcod.form.model.Field;
import work.lcod.form.model.FieldGroup;
import work.lcod.form.model.FieldResponse;
import work.lcod.form.model.FieldValue;
import work.lcod.form.model.FormDocument;
import work.lcod.form.model.TableColumn;
import work.lcod.form.model.TableRow;

/**
 * Plain narrative markdown: title, group headings, one {@code **Label**: value} entry per field.
 * Read-only; the output does not parse back as a form.
 */
public final class MarkdownExporter {
    private MarkdownExporter() {}

    public static String export(FormDocument document) {
        var out = new StringBuilder();
        String title = document.schema().title().isBlank() ? document.schema().id() : document.schema().title();
        out.append("# ").append(title).append("\n\n");
        appendDocs(out, document, document.schema().id());
        for (FieldGroup group : document.schema().groups()) {
            if (!group.implicit()) {
                out.append("## ").append(group.title().isBlank() ? group.id() : group.title()).append("\n\n");
                appendDocs(out, document, group.id());
            }
            for (Field field : group.fields()) {
                appendField(out, field, document.response(field.id()));
                appendDocs(out, document, field.id());
            }
        }
        return out.toString();
    }

    private static void appendDocs(StringBuilder out, FormDocument document, String ref) {
        for (DocumentationBlock doc : document.docs()) {
            if (doc.ref().equals(ref) && !doc.body().isBlank()) {
                out.append(doc.body()).append("\n\n");
            }
        }
    }

    private static void appendField(StringBuilder out, Field field, FieldResponse response) {
        out.append("**").append(field.label()).append("**: ");
        switch (response.state()) {
            case SKIPPED:
                out.append("_(skipped").append(response.reason().map(r -> ": " + r).orElse("")).append(")_\n\n");
                return;
            case ABORTED:
                out.append("_(aborted").append(response.reason().map(r -> ": " + r).orElse("")).append(")_\n\n");
                return;
            case UNANSWERED:
                out.append("_(unanswered)_\n\n");
                return;
            default:
                break;
        }
        FieldValue value = response.value().orElseThrow();
        if (value.isEmpty()) {
            out.append("_(empty)_\n\n");
            return;
        }
        switch (value.kind()) {
            case STRING_LIST:
            case URL_LIST:
            case MULTI_SELECT:
            case CHECKBOXES:
                out.append('\n');
                for (String line : listLines(field, value)) {
                    out.append("- ").append(line).append('\n');
                }
                out.append('\n');
                break;
            case TABLE:
                out.append("\n\n").append(table(field, (FieldValue.TableValue) value)).append('\n');
                break;
            case SINGLE_SELECT: {
                String selected = ((FieldValue.SingleSelectValue) value).selected().orElseThrow();
                out.append(field.option(selected).map(option -> option.label()).orElse(selected)).append("\n\n");
                break;
            }
            default:
                out.append(CanonicalWriter.scalarText(value)).append("\n\n");
        }
    }

    private static List<String> listLines(Field field, FieldValue value) {
        switch (value.kind()) {
            case STRING_LIST:
                return ((FieldValue.StringListValue) value).items();
            case URL_LIST:
                return ((FieldValue.UrlListValue) value).items();
            case MULTI_SELECT:
                return ((FieldValue.MultiSelectValue) value).selected().stream()
                    .map(id -> field.option(id).map(option -> option.label()).orElse(id))
                    .collect(Collectors.toList());
            default:
                return ((FieldValue.CheckboxesValue) value).states().entrySet().stream()
                    .map(entry -> {
                        String label = field.option(entry.getKey()).map(option -> option.label()).orElse(entry.getKey());
                        CheckboxState state = entry.getValue();
                        return label + ": " + state.wireName();
                    })
                    .collect(Collectors.toList());
        }
    }

    private static String table(Field field, FieldValue.TableValue value) {
        var out = new StringBuilder("|");
        for (TableColumn column : field.columns()) {
            out.append(' ').append(column.label()).append(" |");
        }
        out.append("\n|");
        field.columns().forEach(column -> out.append(" --- |"));
        out.append('\n');
        for (TableRow row : value.rows()) {
            out.append('|');
            for (TableColumn column : field.columns()) {
                out.append(' ').append(CanonicalWriter.cellText(row.cell(column.id())).replace("|", "\\|")).append(" |");
            }
            out.append('\n');
        }
        return out.toString();
    }
}
