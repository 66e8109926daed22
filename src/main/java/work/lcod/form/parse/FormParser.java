package work.lcod.form.parse;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
import work.lcod.form.model.FormSchema;
import work.lcod.form.model.Note;
import work.lcod.form.model.Roles;
import work.lcod.form.model.SourceMap;
import work.lcod.form.model.TableCell;
import work.lcod.form.model.TableColumn;
import work.lcod.form.model.TableRow;

/**
 * Parses form text into a {@link FormDocument}. The structure pass builds the schema from the
 * directive tree; the value pass then reads each field's literal against its declared kind.
 */
public final class FormParser {
    private static final Logger log = LoggerFactory.getLogger(FormParser.class);

    private final String text;
    private final LineIndex lines;
    private final Map<String, Integer> declaredIds = new HashMap<>();
    private final List<ParsedField> parsedFields = new ArrayList<>();
    private final List<Directive> annotations = new ArrayList<>();

    private record ParsedField(Field field, Directive directive, FieldBody body) {}

    private FormParser(String text) {
        this.text = text;
        this.lines = new LineIndex(text);
    }

    /**
     * @throws DocumentException when the text is not a well-formed form
     */
    public static FormDocument parse(String text) {
        Objects.requireNonNull(text, "text");
        return new FormParser(text).run();
    }

    private FormDocument run() {
        var frontmatter = FrontmatterReader.read(text);
        FormMetadata metadata = frontmatter.metadata();
        List<Directive> roots = new TagScanner(text, lines).scan(frontmatter.bodyStart());
        Directive form = singleForm(roots);

        FormSchema schema = readSchema(form);
        checkDependencies(schema);
        checkParallelTags(schema);

        var responses = new LinkedHashMap<String, FieldResponse>();
        var spans = new ArrayList<SourceMap.FieldSpan>();
        for (ParsedField parsed : parsedFields) {
            FieldResponse response = readResponse(parsed);
            responses.put(parsed.field().id(), response);
            spans.add(new SourceMap.FieldSpan(parsed.field().id(), parsed.directive().start(), parsed.directive().end(), response));
        }

        var notes = new ArrayList<Note>();
        var docs = new ArrayList<DocumentationBlock>();
        readAnnotations(schema, notes, docs);

        var source = new SourceMap(text, spans, schema, metadata, notes, docs);
        log.debug(
            "Parsed form '{}': {} groups, {} fields, {} notes",
            schema.id(),
            schema.groups().size(),
            parsedFields.size(),
            notes.size()
        );
        return new FormDocument(metadata, schema, responses, notes, docs, Optional.of(source));
    }

    private Directive singleForm(List<Directive> roots) {
        Directive form = null;
        for (Directive root : roots) {
            if (!root.name().equals("form")) {
                throw structure("Directive '" + root.name() + "' must appear inside the form", root.line(), null);
            }
            if (form != null) {
                throw structure("Document declares more than one form", root.line(), null);
            }
            form = root;
        }
        if (form == null) {
            throw structure("Document has no form directive", null, null);
        }
        return form;
    }

    // structure pass

    private FormSchema readSchema(Directive form) {
        Attributes attrs = form.attributes();
        String formId = attrs.requireString("id");
        register(formId, form.line());
        var groups = new ArrayList<FieldGroup>();
        var implicitFields = new ArrayList<Field>();
        int implicitSlot = -1;
        for (Directive child : form.children()) {
            switch (child.name()) {
                case "group":
                    groups.add(readGroup(child));
                    break;
                case "field":
                    if (implicitSlot < 0) {
                        implicitSlot = groups.size();
                        groups.add(null);
                    }
                    implicitFields.add(readField(child, false));
                    break;
                case "form":
                    throw structure("Forms cannot be nested", child.line(), null);
                default:
                    annotations.add(child);
            }
        }
        if (implicitSlot >= 0) {
            Integer line = declaredIds.get(FieldGroup.IMPLICIT_ID);
            if (line != null) {
                throw new DocumentException(
                    DocumentErrorKind.DUPLICATE_ID,
                    "Id '" + FieldGroup.IMPLICIT_ID + "' is reserved for fields outside any group",
                    line,
                    FieldGroup.IMPLICIT_ID
                );
            }
            groups.set(implicitSlot, FieldGroup.implicitGroup(implicitFields));
        }
        return new FormSchema(formId, attrs.optionalString("title").orElse(""), groups);
    }

    private FieldGroup readGroup(Directive directive) {
        Attributes attrs = directive.attributes();
        String id = attrs.requireString("id");
        register(id, directive.line());
        var fields = new ArrayList<Field>();
        for (Directive child : directive.children()) {
            switch (child.name()) {
                case "field":
                    fields.add(readField(child, true));
                    break;
                case "group":
                case "form":
                    throw structure("Directive '" + child.name() + "' cannot appear inside group '" + id + "'", child.line(), id);
                default:
                    annotations.add(child);
            }
        }
        return new FieldGroup(
            id,
            attrs.optionalString("title").orElse(""),
            attrs.optionalInt("order"),
            attrs.optionalString("parallel"),
            attrs.flag("serial"),
            false,
            fields
        );
    }

    private Field readField(Directive directive, boolean inGroup) {
        Attributes attrs = directive.attributes();
        String id = attrs.requireString("id");
        int line = directive.line();
        FieldKind kind = attempt(() -> FieldKind.from(attrs.requireString("kind")), line, id);
        register(id, line);
        if (!directive.children().isEmpty()) {
            Directive nested = directive.children().get(0);
            throw structure("Directive '" + nested.name() + "' cannot appear inside field '" + id + "'", nested.line(), id);
        }
        if (inGroup && attrs.has("parallel")) {
            throw structure("Field '" + id + "' inside a group cannot declare 'parallel'; tag the group instead", line, id);
        }
        FieldBody body = FieldBody.read(
            directive.body(text),
            lines.lineOf(directive.openEnd()),
            kind.hasOptions(),
            kind == FieldKind.TABLE
        );
        Field.Builder builder = Field.builder(kind, id)
            .label(attrs.optionalString("label").orElse(null))
            .required(attrs.flag("required"))
            .role(attrs.optionalString("role").orElse(Roles.AGENT))
            .priority(attempt(() -> FieldPriority.from(attrs.optionalString("priority").orElse(null)), line, id))
            .order(attrs.optionalInt("order").orElse(null))
            .parallel(attrs.optionalString("parallel").orElse(null))
            .serial(attrs.flag("serial"))
            .dependsOn(attrs.optionalString("dependsOn").orElse(null))
            .prompt(body.prompt())
            .constraints(readConstraints(kind, attrs, id));
        if (kind.hasOptions()) {
            builder.options(readOptions(id, body));
        }
        if (kind == FieldKind.CHECKBOXES) {
            builder.checkboxMode(attempt(() -> CheckboxMode.from(attrs.optionalString("checkboxMode").orElse(null)), line, id));
        }
        if (kind == FieldKind.TABLE) {
            builder.columns(readColumns(id, attrs));
        }
        Field field = builder.build();
        parsedFields.add(new ParsedField(field, directive, body));
        return field;
    }

    private List<FieldOption> readOptions(String fieldId, FieldBody body) {
        var options = new ArrayList<FieldOption>();
        var seen = new HashSet<String>();
        for (FieldBody.OptionLine line : body.options()) {
            if (line.id() == null) {
                throw structure("Option '" + line.label() + "' of field '" + fieldId + "' has no {% #id %} annotation", line.line(), fieldId);
            }
            if (!seen.add(line.id())) {
                throw new DocumentException(
                    DocumentErrorKind.DUPLICATE_ID,
                    "Duplicate option id '" + line.id() + "' in field '" + fieldId + "'",
                    line.line(),
                    fieldId
                );
            }
            options.add(new FieldOption(line.id(), line.label()));
        }
        if (options.isEmpty()) {
            throw structure("Field '" + fieldId + "' declares no options", null, fieldId);
        }
        return options;
    }

    private List<TableColumn> readColumns(String fieldId, Attributes attrs) {
        List<String> ids = attrs.stringList("columnIds");
        if (ids.isEmpty()) {
            throw structure("Table field '" + fieldId + "' requires 'columnIds'", attrs.line(), fieldId);
        }
        List<String> labels = attrs.stringList("columnLabels");
        if (!labels.isEmpty() && labels.size() != ids.size()) {
            throw structure("Table field '" + fieldId + "' has " + labels.size() + " labels for " + ids.size() + " columns", attrs.line(), fieldId);
        }
        List<JsonNode> types = new ArrayList<>();
        attrs.raw("columnTypes").ifPresent(node -> {
            if (!node.isArray()) {
                throw attrs.invalid("columnTypes", "an array");
            }
            node.forEach(types::add);
        });
        if (!types.isEmpty() && types.size() != ids.size()) {
            throw structure("Table field '" + fieldId + "' has " + types.size() + " column types for " + ids.size() + " columns", attrs.line(), fieldId);
        }
        var columns = new ArrayList<TableColumn>();
        var seen = new HashSet<String>();
        for (int i = 0; i < ids.size(); i++) {
            String columnId = ids.get(i);
            if (!seen.add(columnId)) {
                throw new DocumentException(
                    DocumentErrorKind.DUPLICATE_ID,
                    "Duplicate column id '" + columnId + "' in field '" + fieldId + "'",
                    attrs.line(),
                    fieldId
                );
            }
            ColumnType type = ColumnType.STRING;
            boolean required = false;
            if (!types.isEmpty()) {
                JsonNode spec = types.get(i);
                if (spec.isTextual()) {
                    type = attempt(() -> ColumnType.from(spec.textValue()), attrs.line(), fieldId);
                } else if (spec.isObject()) {
                    JsonNode typeNode = spec.path("type");
                    type = attempt(() -> ColumnType.from(typeNode.isTextual() ? typeNode.textValue() : null), attrs.line(), fieldId);
                    required = spec.path("required").asBoolean(false);
                } else {
                    throw attrs.invalid("columnTypes", "an array of type names or {\"type\", \"required\"} objects");
                }
            }
            columns.add(new TableColumn(columnId, labels.isEmpty() ? columnId : labels.get(i), type, required));
        }
        return columns;
    }

    private FieldConstraints readConstraints(FieldKind kind, Attributes attrs, String fieldId) {
        var builder = FieldConstraints.builder();
        switch (kind) {
            case STRING:
                attrs.optionalString("pattern").ifPresent(pattern -> {
                    try {
                        Pattern.compile(pattern);
                    } catch (PatternSyntaxException ex) {
                        throw new DocumentException(DocumentErrorKind.INVALID_STRUCTURE, "Invalid pattern on field '" + fieldId + "': " + ex.getDescription(), attrs.line(), fieldId, ex);
                    }
                    builder.pattern(pattern);
                });
                builder.minLength(attrs.optionalCount("minLength").orElse(null))
                    .maxLength(attrs.optionalCount("maxLength").orElse(null))
                    .multiline(attrs.flag("multiline"));
                break;
            case NUMBER:
                builder.min(attrs.optionalNumber("min").orElse(null))
                    .max(attrs.optionalNumber("max").orElse(null))
                    .integer(attrs.flag("integer"));
                break;
            case STRING_LIST:
            case URL_LIST:
                builder.minItems(attrs.optionalCount("minItems").orElse(null))
                    .maxItems(attrs.optionalCount("maxItems").orElse(null))
                    .uniqueItems(attrs.flag("uniqueItems"));
                break;
            case MULTI_SELECT:
                builder.minSelections(attrs.optionalCount("minSelections").orElse(null))
                    .maxSelections(attrs.optionalCount("maxSelections").orElse(null));
                break;
            case CHECKBOXES: {
                String approval = attrs.optionalString("approvalMode").orElse("none");
                if (!approval.equals("none") && !approval.equals("blocking")) {
                    throw attrs.invalid("approvalMode", "\"none\" or \"blocking\"");
                }
                builder.minDone(attrs.optionalCount("minDone").orElse(null))
                    .blockingApproval(approval.equals("blocking"));
                break;
            }
            case DATE:
                builder.minDate(attrs.optionalDate("min").orElse(null))
                    .maxDate(attrs.optionalDate("max").orElse(null));
                break;
            case YEAR:
                builder.min(attrs.optionalInt("min").map(Integer::doubleValue).orElse(null))
                    .max(attrs.optionalInt("max").map(Integer::doubleValue).orElse(null));
                break;
            case TABLE:
                builder.minRows(attrs.optionalCount("minRows").orElse(null))
                    .maxRows(attrs.optionalCount("maxRows").orElse(null));
                break;
            default:
                break;
        }
        return builder.build();
    }

    private void checkDependencies(FormSchema schema) {
        for (Field field : schema.fields()) {
            if (field.dependsOn().isEmpty()) {
                continue;
            }
            int line = lineOf(field.id());
            String target = field.dependsOn().get();
            if (target.equals(field.id())) {
                throw structure("Field '" + field.id() + "' cannot depend on itself", line, field.id());
            }
            if (!schema.hasField(target)) {
                throw structure("Field '" + field.id() + "' depends on unknown field '" + target + "'", line, field.id());
            }
            var chain = new HashSet<String>();
            chain.add(field.id());
            Optional<String> next = Optional.of(target);
            while (next.isPresent()) {
                if (!chain.add(next.get())) {
                    throw structure("Dependency cycle through field '" + field.id() + "'", line, field.id());
                }
                next = schema.field(next.get()).flatMap(Field::dependsOn);
            }
        }
    }

    /** Everything sharing a parallel tag must sit at one order level and belong to one role. */
    private void checkParallelTags(FormSchema schema) {
        var orders = new LinkedHashMap<String, Set<Integer>>();
        var roles = new LinkedHashMap<String, Set<String>>();
        for (FieldGroup group : schema.groups()) {
            if (group.implicit()) {
                for (Field field : group.fields()) {
                    field.parallel().ifPresent(tag -> {
                        orders.computeIfAbsent(tag, t -> new HashSet<>()).add(schema.orderOf(field));
                        roles.computeIfAbsent(tag, t -> new HashSet<>()).add(field.role());
                    });
                }
            } else if (group.parallel().isPresent()) {
                String tag = group.parallel().get();
                orders.computeIfAbsent(tag, t -> new HashSet<>()).add(group.order().orElse(0));
                for (Field field : group.fields()) {
                    roles.computeIfAbsent(tag, t -> new HashSet<>()).add(field.role());
                }
            }
        }
        for (var entry : orders.entrySet()) {
            if (entry.getValue().size() > 1) {
                throw structure("Parallel tag '" + entry.getKey() + "' spans several order levels " + entry.getValue(), null, entry.getKey());
            }
            Set<String> tagRoles = roles.getOrDefault(entry.getKey(), Set.of());
            if (tagRoles.size() > 1) {
                throw structure("Parallel tag '" + entry.getKey() + "' mixes roles " + tagRoles, null, entry.getKey());
            }
        }
    }

    // value pass

    private FieldResponse readResponse(ParsedField parsed) {
        Field field = parsed.field();
        FieldBody body = parsed.body();
        int line = parsed.directive().line();
        Optional<AnswerState> declared = parsed.directive().attributes().optionalString("state")
            .map(state -> {
                AnswerState value = attempt(() -> AnswerState.from(state), line, field.id());
                if (value == AnswerState.UNANSWERED) {
                    throw structure("Field '" + field.id() + "' cannot declare state=\"unanswered\"", line, field.id());
                }
                return value;
            });
        // An explicit answered state makes the value block literal, even when it reads like a marker.
        Optional<LiteralReader.Sentinel> sentinel = declared.filter(state -> state == AnswerState.ANSWERED).isPresent()
            ? Optional.empty()
            : body.fence().flatMap(fence -> LiteralReader.sentinel(fence.content()));
        if (sentinel.isPresent()) {
            AnswerState state = sentinel.get().state();
            if (declared.isPresent() && declared.get() != state) {
                throw structure(
                    "Field '" + field.id() + "' declares state=\"" + declared.get().wireName() + "\" but its value block marks it "
                        + state.wireName(),
                    line,
                    field.id()
                );
            }
            if (readMarkedValue(field, body).isPresent()) {
                throw structure("Field '" + field.id() + "' is " + state.wireName() + " but also carries a value", line, field.id());
            }
            String reason = sentinel.get().reason().orElse(null);
            return state == AnswerState.SKIPPED ? FieldResponse.skipped(reason) : FieldResponse.aborted(reason);
        }
        if (declared.isPresent() && declared.get() != AnswerState.ANSWERED) {
            if (body.fence().isPresent() || readMarkedValue(field, body).isPresent()) {
                throw structure("Field '" + field.id() + "' is " + declared.get().wireName() + " but also carries a value", line, field.id());
            }
            return declared.get() == AnswerState.SKIPPED ? FieldResponse.skipped(null) : FieldResponse.aborted(null);
        }
        Optional<FieldValue> value = readValue(field, body);
        if (value.isPresent()) {
            return FieldResponse.answered(value.get());
        }
        if (declared.isPresent()) {
            return FieldResponse.answered(emptyValue(field, line));
        }
        return FieldResponse.unanswered();
    }

    private Optional<FieldValue> readValue(Field field, FieldBody body) {
        if (field.kind().hasOptions() || field.kind() == FieldKind.TABLE) {
            body.fence().ifPresent(fence -> {
                throw mismatch("Field '" + field.id() + "' of kind " + field.kind().wireName() + " takes no value block", fence.line(), field.id());
            });
            return readMarkedValue(field, body);
        }
        if (body.fence().isEmpty()) {
            return Optional.empty();
        }
        FieldBody.Fence fence = body.fence().get();
        switch (field.kind()) {
            case STRING_LIST:
                return Optional.of(new FieldValue.StringListValue(LiteralReader.items(fence.content())));
            case URL_LIST:
                return Optional.of(new FieldValue.UrlListValue(LiteralReader.items(fence.content())));
            default:
                try {
                    return Optional.of(LiteralReader.scalar(field.kind(), fence.content()));
                } catch (IllegalArgumentException ex) {
                    throw new DocumentException(
                        DocumentErrorKind.TYPE_MISMATCH_IN_LITERAL,
                        "Value of field '" + field.id() + "': " + ex.getMessage(),
                        fence.line(),
                        field.id(),
                        ex
                    );
                }
        }
    }

    /** Value carried by option markers or table rows; empty when nothing is marked. */
    private Optional<FieldValue> readMarkedValue(Field field, FieldBody body) {
        switch (field.kind()) {
            case SINGLE_SELECT: {
                List<String> selected = selectedOptions(field, body);
                if (selected.size() > 1) {
                    throw mismatch("Single-select field '" + field.id() + "' has " + selected.size() + " selected options", body.options().get(0).line(), field.id());
                }
                return selected.isEmpty() ? Optional.empty() : Optional.of(FieldValue.SingleSelectValue.of(selected.get(0)));
            }
            case MULTI_SELECT: {
                List<String> selected = selectedOptions(field, body);
                return selected.isEmpty() ? Optional.empty() : Optional.of(new FieldValue.MultiSelectValue(selected));
            }
            case CHECKBOXES: {
                CheckboxMode mode = field.checkboxMode();
                var states = new LinkedHashMap<String, CheckboxState>();
                for (FieldBody.OptionLine option : body.options()) {
                    CheckboxState state = CheckboxState.fromMarker(option.marker(), mode)
                        .filter(mode::allows)
                        .orElseThrow(() -> mismatch(
                            "Marker " + option.marker() + " is not allowed in " + mode.wireName() + " checkboxes of field '" + field.id() + "'",
                            option.line(),
                            field.id()
                        ));
                    states.put(option.id(), state);
                }
                var value = new FieldValue.CheckboxesValue(states);
                return value.isEmpty() ? Optional.empty() : Optional.of(value);
            }
            case TABLE:
                return readTable(field, body);
            default:
                return Optional.empty();
        }
    }

    private List<String> selectedOptions(Field field, FieldBody body) {
        var selected = new ArrayList<String>();
        for (FieldBody.OptionLine option : body.options()) {
            switch (option.marker()) {
                case "[ ]":
                    break;
                case "[x]":
                case "[X]":
                    selected.add(option.id());
                    break;
                default:
                    throw mismatch("Marker " + option.marker() + " is not a selection marker (field '" + field.id() + "')", option.line(), field.id());
            }
        }
        return selected;
    }

    private Optional<FieldValue> readTable(Field field, FieldBody body) {
        List<FieldBody.TableLine> tableLines = body.tableLines();
        if (tableLines.isEmpty()) {
            return Optional.empty();
        }
        List<TableColumn> columns = field.columns();
        FieldBody.TableLine header = tableLines.get(0);
        if (LiteralReader.splitRow(header.text()).size() != columns.size()) {
            throw structure("Table header of field '" + field.id() + "' does not list its " + columns.size() + " columns", header.line(), field.id());
        }
        if (tableLines.size() < 2 || !LiteralReader.isSeparatorRow(LiteralReader.splitRow(tableLines.get(1).text()))) {
            throw structure("Table of field '" + field.id() + "' lacks a separator row", header.line(), field.id());
        }
        var rows = new ArrayList<TableRow>();
        for (FieldBody.TableLine line : tableLines.subList(2, tableLines.size())) {
            List<String> cells = LiteralReader.splitRow(line.text());
            if (cells.size() != columns.size()) {
                throw mismatch("Row of table '" + field.id() + "' has " + cells.size() + " cells for " + columns.size() + " columns", line.line(), field.id());
            }
            var row = new LinkedHashMap<String, TableCell>();
            for (int i = 0; i < columns.size(); i++) {
                TableColumn column = columns.get(i);
                try {
                    row.put(column.id(), LiteralReader.cell(column.type(), cells.get(i)));
                } catch (IllegalArgumentException ex) {
                    throw new DocumentException(
                        DocumentErrorKind.TYPE_MISMATCH_IN_LITERAL,
                        "Column '" + column.id() + "' of table '" + field.id() + "': " + ex.getMessage(),
                        line.line(),
                        field.id(),
                        ex
                    );
                }
            }
            rows.add(new TableRow(row));
        }
        return rows.isEmpty() ? Optional.empty() : Optional.of(new FieldValue.TableValue(rows));
    }

    private FieldValue emptyValue(Field field, int line) {
        switch (field.kind()) {
            case NUMBER:
            case DATE:
            case YEAR:
                throw mismatch("Field '" + field.id() + "' is answered but has no " + field.kind().wireName() + " value", line, field.id());
            case CHECKBOXES: {
                var states = new LinkedHashMap<String, CheckboxState>();
                for (FieldOption option : field.options()) {
                    states.put(option.id(), field.checkboxMode().initialState());
                }
                return new FieldValue.CheckboxesValue(states);
            }
            default:
                return FieldValue.emptyOf(field.kind());
        }
    }

    private void readAnnotations(FormSchema schema, List<Note> notes, List<DocumentationBlock> docs) {
        var noteIds = new HashSet<String>();
        for (Directive directive : annotations) {
            Attributes attrs = directive.attributes();
            if (!directive.children().isEmpty()) {
                throw structure("Directive '" + directive.name() + "' cannot contain other directives", directive.line(), null);
            }
            String ref = attrs.requireString("ref");
            if (!schema.isKnownRef(ref)) {
                throw structure("'" + directive.name() + "' references unknown id '" + ref + "'", directive.line(), ref);
            }
            String body = directive.body(text).strip();
            if (directive.name().equals("note")) {
                String id = attrs.requireString("id");
                if (!noteIds.add(id)) {
                    throw new DocumentException(DocumentErrorKind.DUPLICATE_ID, "Duplicate note id '" + id + "'", directive.line(), id);
                }
                notes.add(new Note(id, ref, attrs.optionalString("role").orElse(Roles.AGENT), body));
            } else {
                var tag = DocumentationBlock.Tag.valueOf(directive.name().toUpperCase(Locale.ROOT));
                docs.add(new DocumentationBlock(tag, ref, body));
            }
        }
    }

    // helpers

    private void register(String id, int line) {
        Integer previous = declaredIds.putIfAbsent(id, line);
        if (previous != null) {
            throw new DocumentException(
                DocumentErrorKind.DUPLICATE_ID,
                "Duplicate id '" + id + "' (first declared on line " + previous + ")",
                line,
                id
            );
        }
    }

    private int lineOf(String id) {
        return declaredIds.getOrDefault(id, 0);
    }

    private static <T> T attempt(Supplier<T> conversion, int line, String ref) {
        try {
            return conversion.get();
        } catch (IllegalArgumentException ex) {
            throw new DocumentException(DocumentErrorKind.INVALID_STRUCTURE, ex.getMessage(), line, ref, ex);
        }
    }

    private static DocumentException structure(String message, Integer line, String ref) {
        return new DocumentException(DocumentErrorKind.INVALID_STRUCTURE, message, line, ref);
    }

    private static DocumentException mismatch(String message, Integer line, String ref) {
        return new DocumentException(DocumentErrorKind.TYPE_MISMATCH_IN_LITERAL, message, line, ref);
    }
}
