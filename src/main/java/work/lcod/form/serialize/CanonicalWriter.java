package work.lcod.form.serialize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.form.model.AnswerState;
import work.lcod.form.model.CheckboxMode;
import work.lcod.form.model.CheckboxState;
import work.lcod.form.model.ColumnType;
import work.lcod.form.model.DocumentationBlock;
import work.lcod.form.model.Field;
import work.lcod.form.model.FieldConstraints;
import work.lcod.form.model.FieldGroup;
import work.lcod.form.model.FieldKind;
import work.lcod.form.model.FieldOption;
import work.lcod.form.model.FieldPriority;
import work.lcod.form.model.FieldResponse;
import work.lcod.form.model.FieldValue;
import work.lcod.form.model.FormDocument;
import work.lcod.form.model.FormMetadata;
import work.lcod.form.model.HarnessLimits;
import work.lcod.form.model.Note;
import work.lcod.form.model.Roles;
import work.lcod.form.model.TableCell;
import work.lcod.form.model.TableColumn;
import work.lcod.form.model.TableRow;
import work.lcod.form.parse.LiteralReader;
import work.lcod.form.shared.Mappers;
import work.lcod.form.shared.Numbers;

/**
 * Canonical text for documents and single field directives.
 */
final class CanonicalWriter {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private CanonicalWriter() {}

    static String document(FormDocument document) {
        var out = new StringBuilder();
        out.append("---\n").append(frontmatter(document.metadata())).append("---\n\n");
        var form = new Tag("form").attr("id", document.schema().id());
        if (!document.schema().title().isBlank()) {
            form.attr("title", document.schema().title());
        }
        out.append(form).append("\n\n");
        for (DocumentationBlock doc : document.docs()) {
            String name = doc.tag().directive();
            out.append(new Tag(name).attr("ref", doc.ref())).append('\n');
            appendBody(out, doc.body());
            out.append("{% /").append(name).append(" %}\n\n");
        }
        for (FieldGroup group : document.schema().groups()) {
            if (group.implicit()) {
                for (Field field : group.fields()) {
                    out.append(field(field, document.response(field.id()))).append("\n\n");
                }
                continue;
            }
            out.append(groupTag(group)).append("\n\n");
            for (Field field : group.fields()) {
                out.append(field(field, document.response(field.id()))).append("\n\n");
            }
            out.append("{% /group %}\n\n");
        }
        for (Note note : document.notes()) {
            out.append(new Tag("note").attr("id", note.id()).attr("ref", note.ref()).attr("role", note.role())).append('\n');
            appendBody(out, note.text());
            out.append("{% /note %}\n\n");
        }
        out.append("{% /form %}\n");
        return out.toString();
    }

    /** Field directive from its open tag through {@code {% /field %}}, without a trailing newline. */
    static String field(Field field, FieldResponse response) {
        var tag = new Tag("field")
            .attr("kind", field.kind().wireName())
            .attr("id", field.id())
            .attr("label", field.label());
        if (field.required()) {
            tag.attr("required", true);
        }
        if (!field.role().equals(Roles.AGENT)) {
            tag.attr("role", field.role());
        }
        if (field.priority() != FieldPriority.MEDIUM) {
            tag.attr("priority", field.priority().wireName());
        }
        field.order().ifPresent(order -> tag.attr("order", order));
        field.parallel().ifPresent(parallel -> tag.attr("parallel", parallel));
        if (field.serial()) {
            tag.attr("serial", true);
        }
        field.dependsOn().ifPresent(dependsOn -> tag.attr("dependsOn", dependsOn));
        kindAttributes(field, tag);
        boolean explicitState = response.state() == AnswerState.SKIPPED
            || response.state() == AnswerState.ABORTED
            || response.value().map(value -> value.isEmpty() || looksLikeSentinel(value)).orElse(false);
        if (explicitState) {
            tag.attr("state", response.state().wireName());
        }

        var body = new ArrayList<String>();
        if (!field.prompt().isBlank()) {
            body.add(field.prompt());
        }
        List<String> valueLines = valueLines(field, response);
        if (!valueLines.isEmpty()) {
            if (!body.isEmpty()) {
                body.add("");
            }
            body.addAll(valueLines);
        }
        var out = new StringBuilder().append(tag).append('\n');
        for (String line : body) {
            out.append(line).append('\n');
        }
        return out.append("{% /field %}").toString();
    }

    private static void kindAttributes(Field field, Tag tag) {
        FieldConstraints c = field.constraints();
        switch (field.kind()) {
            case STRING:
                if (c.multiline()) {
                    tag.attr("multiline", true);
                }
                tag.optional("pattern", c.pattern()).optional("minLength", c.minLength()).optional("maxLength", c.maxLength());
                break;
            case NUMBER:
                tag.optionalNumber("min", c.min()).optionalNumber("max", c.max());
                if (c.integer()) {
                    tag.attr("integer", true);
                }
                break;
            case STRING_LIST:
            case URL_LIST:
                tag.optional("minItems", c.minItems()).optional("maxItems", c.maxItems());
                if (c.uniqueItems()) {
                    tag.attr("uniqueItems", true);
                }
                break;
            case MULTI_SELECT:
                tag.optional("minSelections", c.minSelections()).optional("maxSelections", c.maxSelections());
                break;
            case CHECKBOXES:
                if (field.checkboxMode() != CheckboxMode.MULTI) {
                    tag.attr("checkboxMode", field.checkboxMode().wireName());
                }
                tag.optional("minDone", c.minDone());
                if (c.blockingApproval()) {
                    tag.attr("approvalMode", "blocking");
                }
                break;
            case DATE:
                tag.optional("min", c.minDate() == null ? null : c.minDate().toString())
                    .optional("max", c.maxDate() == null ? null : c.maxDate().toString());
                break;
            case YEAR:
                tag.optional("min", c.min() == null ? null : (int) c.min().doubleValue())
                    .optional("max", c.max() == null ? null : (int) c.max().doubleValue());
                break;
            case TABLE:
                tableAttributes(field, tag);
                tag.optional("minRows", c.minRows()).optional("maxRows", c.maxRows());
                break;
            default:
                break;
        }
    }

    private static void tableAttributes(Field field, Tag tag) {
        ArrayNode ids = NODES.arrayNode();
        ArrayNode labels = NODES.arrayNode();
        ArrayNode types = NODES.arrayNode();
        boolean customLabels = false;
        boolean customTypes = false;
        for (TableColumn column : field.columns()) {
            ids.add(column.id());
            labels.add(column.label());
            customLabels |= !column.label().equals(column.id());
            if (column.required()) {
                types.add(NODES.objectNode().put("type", column.type().wireName()).put("required", true));
                customTypes = true;
            } else {
                types.add(column.type().wireName());
                customTypes |= column.type() != ColumnType.STRING;
            }
        }
        tag.attr("columnIds", ids);
        if (customLabels) {
            tag.attr("columnLabels", labels);
        }
        if (customTypes) {
            tag.attr("columnTypes", types);
        }
    }

    private static List<String> valueLines(Field field, FieldResponse response) {
        var lines = new ArrayList<String>();
        FieldValue value = response.value().orElse(null);
        switch (field.kind()) {
            case SINGLE_SELECT:
            case MULTI_SELECT:
            case CHECKBOXES:
                for (FieldOption option : field.options()) {
                    lines.add("- " + marker(field, option, value) + " " + option.label() + " {% #" + option.id() + " %}");
                }
                break;
            case TABLE:
                lines.addAll(tableLines(field, value));
                break;
            default:
                if (hasText(value)) {
                    lines.addAll(fence(scalarText(value)));
                }
                break;
        }
        if (response.state() == AnswerState.SKIPPED || response.state() == AnswerState.ABORTED) {
            if (response.reason().isPresent()) {
                String sentinel = response.state() == AnswerState.SKIPPED ? "%SKIP%" : "%ABORT%";
                lines.addAll(fence(sentinel + " (" + response.reason().get() + ")"));
            }
        }
        return lines;
    }

    /** Whitespace-only strings keep their block so they read back unchanged. */
    private static boolean hasText(FieldValue value) {
        if (value == null) {
            return false;
        }
        if (value instanceof FieldValue.StringValue) {
            return !((FieldValue.StringValue) value).value().isEmpty();
        }
        return !value.isEmpty();
    }

    /** An answer whose text would read back as a skip or abort marker. */
    private static boolean looksLikeSentinel(FieldValue value) {
        return !value.kind().hasOptions()
            && value.kind() != FieldKind.TABLE
            && hasText(value)
            && LiteralReader.sentinel(scalarText(value)).isPresent();
    }

    private static String marker(Field field, FieldOption option, FieldValue value) {
        switch (field.kind()) {
            case SINGLE_SELECT: {
                boolean selected = value instanceof FieldValue.SingleSelectValue
                    && ((FieldValue.SingleSelectValue) value).selected().filter(option.id()::equals).isPresent();
                return selected ? "[x]" : "[ ]";
            }
            case MULTI_SELECT: {
                boolean selected = value instanceof FieldValue.MultiSelectValue
                    && ((FieldValue.MultiSelectValue) value).selected().contains(option.id());
                return selected ? "[x]" : "[ ]";
            }
            default: {
                CheckboxState state = field.checkboxMode().initialState();
                if (value instanceof FieldValue.CheckboxesValue) {
                    state = ((FieldValue.CheckboxesValue) value).states().getOrDefault(option.id(), state);
                }
                return state.marker();
            }
        }
    }

    private static List<String> tableLines(Field field, FieldValue value) {
        var lines = new ArrayList<String>();
        var header = new StringBuilder("|");
        var separator = new StringBuilder("|");
        for (TableColumn column : field.columns()) {
            header.append(' ').append(escapeCell(column.label())).append(" |");
            separator.append(" --- |");
        }
        lines.add(header.toString());
        lines.add(separator.toString());
        if (value instanceof FieldValue.TableValue) {
            for (TableRow row : ((FieldValue.TableValue) value).rows()) {
                var line = new StringBuilder("|");
                for (TableColumn column : field.columns()) {
                    String text = cellText(row.cell(column.id()));
                    line.append(text.isEmpty() ? " " : " " + escapeCell(text) + " ").append('|');
                }
                lines.add(line.toString());
            }
        }
        return lines;
    }

    static String cellText(TableCell cell) {
        switch (cell.state()) {
            case ANSWERED:
                return scalarText(cell.value().orElseThrow());
            case SKIPPED:
                return "%SKIP%" + cell.reason().map(reason -> " (" + reason + ")").orElse("");
            case ABORTED:
                return "%ABORT%" + cell.reason().map(reason -> " (" + reason + ")").orElse("");
            default:
                return "";
        }
    }

    /** Plain text of a scalar or list value, one item per line for lists. */
    static String scalarText(FieldValue value) {
        switch (value.kind()) {
            case STRING:
                return ((FieldValue.StringValue) value).value();
            case URL:
                return ((FieldValue.UrlValue) value).value();
            case NUMBER:
                return Numbers.format(((FieldValue.NumberValue) value).value());
            case DATE:
                return ((FieldValue.DateValue) value).value().toString();
            case YEAR:
                return Integer.toString(((FieldValue.YearValue) value).value());
            case STRING_LIST:
                return String.join("\n", ((FieldValue.StringListValue) value).items());
            case URL_LIST:
                return String.join("\n", ((FieldValue.UrlListValue) value).items());
            default:
                throw new IllegalArgumentException("Kind " + value.kind().wireName() + " has no plain text form");
        }
    }

    private static List<String> fence(String content) {
        int longest = 2;
        for (String line : content.split("\n", -1)) {
            String stripped = line.strip();
            if (stripped.length() > longest && stripped.chars().allMatch(c -> c == '`')) {
                longest = stripped.length();
            }
        }
        String marker = "`".repeat(longest + 1);
        var lines = new ArrayList<String>();
        lines.add(marker + "value");
        lines.addAll(List.of(content.split("\n", -1)));
        lines.add(marker);
        return lines;
    }

    private static String escapeCell(String text) {
        return text.replace("|", "\\|");
    }

    private static void appendBody(StringBuilder out, String body) {
        if (!body.isBlank()) {
            out.append(body).append('\n');
        }
    }

    private static Tag groupTag(FieldGroup group) {
        var tag = new Tag("group").attr("id", group.id());
        if (!group.title().isBlank()) {
            tag.attr("title", group.title());
        }
        group.order().ifPresent(order -> tag.attr("order", order));
        group.parallel().ifPresent(parallel -> tag.attr("parallel", parallel));
        if (group.serial()) {
            tag.attr("serial", true);
        }
        return tag;
    }

    private static String frontmatter(FormMetadata metadata) {
        ObjectNode root = NODES.objectNode();
        ObjectNode markform = root.putObject("markform");
        markform.put("spec", metadata.specVersion());
        metadata.runMode().ifPresent(mode -> markform.put("run_mode", mode.wireName()));
        HarnessLimits limits = metadata.harnessLimits();
        if (!limits.isEmpty()) {
            ObjectNode harness = markform.putObject("harness");
            limits.maxTurns().ifPresent(value -> harness.put("max_turns", value));
            limits.maxPatchesPerTurn().ifPresent(value -> harness.put("max_patches_per_turn", value));
            limits.maxIssuesPerTurn().ifPresent(value -> harness.put("max_issues_per_turn", value));
        }
        if (!metadata.roles().equals(Roles.DEFAULTS)) {
            ArrayNode roles = root.putArray("roles");
            metadata.roles().forEach(roles::add);
        }
        if (!metadata.roleInstructions().isEmpty()) {
            ObjectNode instructions = root.putObject("role_instructions");
            for (Map.Entry<String, String> entry : metadata.roleInstructions().entrySet()) {
                instructions.put(entry.getKey(), entry.getValue());
            }
        }
        try {
            return Mappers.YAML.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /** Open tag being assembled; attribute values are written as JSON literals. */
    private static final class Tag {
        private final String name;
        private final ObjectNode attributes = NODES.objectNode();

        Tag(String name) {
            this.name = name;
        }

        Tag attr(String key, String value) {
            attributes.put(key, value);
            return this;
        }

        Tag attr(String key, int value) {
            attributes.put(key, value);
            return this;
        }

        Tag attr(String key, boolean value) {
            attributes.put(key, value);
            return this;
        }

        Tag attr(String key, JsonNode value) {
            attributes.set(key, value);
            return this;
        }

        Tag optional(String key, Object value) {
            if (value instanceof Integer) {
                attributes.put(key, (Integer) value);
            } else if (value != null) {
                attributes.put(key, value.toString());
            }
            return this;
        }

        Tag optionalNumber(String key, Double value) {
            if (value != null) {
                Number number = Numbers.toJsonNumber(value);
                if (number instanceof Long) {
                    attributes.put(key, (Long) number);
                } else {
                    attributes.put(key, (Double) number);
                }
            }
            return this;
        }

        @Override
        public String toString() {
            var out = new StringBuilder("{% ").append(name);
            var fields = attributes.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                out.append(' ').append(entry.getKey()).append('=');
                try {
                    out.append(Mappers.JSON.writeValueAsString(entry.getValue()));
                } catch (JsonProcessingException ex) {
                    throw new UncheckedIOException(ex);
                }
            }
            return out.append(" %}").toString();
        }
    }
}
