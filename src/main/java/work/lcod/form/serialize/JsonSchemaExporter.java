package work.lcod.form.serialize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import work.lcod.form.model.CheckboxState;
import work.lcod.form.model.Field;
import work.lcod.form.model.FieldConstraints;
import work.lcod.form.model.FieldGroup;
import work.lcod.form.model.FieldKind;
import work.lcod.form.model.FieldOption;
import work.lcod.form.model.FormDocument;
import work.lcod.form.model.FormSchema;
import work.lcod.form.model.TableColumn;
import work.lcod.form.shared.Mappers;

/**
 * JSON Schema (draft 2020-12) description of a form. Standard keywords describe the value shapes;
 * {@code x-markform} objects carry what JSON Schema cannot (kind, role, order, options, columns,
 * group layout) so the form schema can be rebuilt from the export.
 */
public final class JsonSchemaExporter {
    public static final String DIALECT = "https://json-schema.org/draft/2020-12/schema";
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonSchemaExporter() {}

    public static ObjectNode toTree(FormDocument document) {
        FormSchema schema = document.schema();
        ObjectNode root = NODES.objectNode();
        root.put("$schema", DIALECT);
        root.put("$id", schema.id());
        if (!schema.title().isBlank()) {
            root.put("title", schema.title());
        }
        root.put("type", "object");
        ObjectNode properties = root.putObject("properties");
        ArrayNode required = NODES.arrayNode();
        for (Field field : schema.fields()) {
            properties.set(field.id(), fieldSchema(schema, field));
            if (field.required()) {
                required.add(field.id());
            }
        }
        if (!required.isEmpty()) {
            root.set("required", required);
        }
        root.put("additionalProperties", false);

        ObjectNode extension = root.putObject("x-markform");
        extension.put("spec", document.metadata().specVersion());
        document.metadata().runMode().ifPresent(mode -> extension.put("runMode", mode.wireName()));
        ArrayNode roles = extension.putArray("roles");
        document.metadata().roles().forEach(roles::add);
        ArrayNode groups = extension.putArray("groups");
        for (FieldGroup group : schema.groups()) {
            ObjectNode node = groups.addObject();
            node.put("id", group.id());
            if (!group.title().isBlank()) {
                node.put("title", group.title());
            }
            node.put("implicit", group.implicit());
            group.order().ifPresent(order -> node.put("order", order));
            group.parallel().ifPresent(tag -> node.put("parallel", tag));
            if (group.serial()) {
                node.put("serial", true);
            }
            ArrayNode fields = node.putArray("fields");
            group.fields().forEach(field -> fields.add(field.id()));
        }
        return root;
    }

    public static String export(FormDocument document) {
        try {
            return Mappers.JSON_PRETTY.writeValueAsString(toTree(document));
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static ObjectNode fieldSchema(FormSchema schema, Field field) {
        ObjectNode node = NODES.objectNode();
        node.put("title", field.label());
        if (!field.prompt().isBlank()) {
            node.put("description", field.prompt());
        }
        FieldConstraints c = field.constraints();
        switch (field.kind()) {
            case STRING:
                node.put("type", "string");
                putIfSet(node, "minLength", c.minLength());
                putIfSet(node, "maxLength", c.maxLength());
                if (c.pattern() != null) {
                    node.put("pattern", c.pattern());
                }
                break;
            case NUMBER:
                node.put("type", c.integer() ? "integer" : "number");
                if (c.min() != null) {
                    node.put("minimum", c.min());
                }
                if (c.max() != null) {
                    node.put("maximum", c.max());
                }
                break;
            case YEAR:
                node.put("type", "integer");
                if (c.min() != null) {
                    node.put("minimum", c.min().intValue());
                }
                if (c.max() != null) {
                    node.put("maximum", c.max().intValue());
                }
                break;
            case URL:
                node.put("type", "string").put("format", "uri");
                break;
            case DATE:
                node.put("type", "string").put("format", "date");
                break;
            case STRING_LIST:
            case URL_LIST: {
                node.put("type", "array");
                ObjectNode items = node.putObject("items").put("type", "string");
                if (field.kind() == FieldKind.URL_LIST) {
                    items.put("format", "uri");
                }
                putIfSet(node, "minItems", c.minItems());
                putIfSet(node, "maxItems", c.maxItems());
                if (c.uniqueItems()) {
                    node.put("uniqueItems", true);
                }
                break;
            }
            case SINGLE_SELECT:
                node.put("type", "string");
                node.set("enum", optionIds(field));
                break;
            case MULTI_SELECT:
                node.put("type", "array");
                node.putObject("items").set("enum", optionIds(field));
                node.put("uniqueItems", true);
                putIfSet(node, "minItems", c.minSelections());
                putIfSet(node, "maxItems", c.maxSelections());
                break;
            case CHECKBOXES: {
                node.put("type", "object");
                ObjectNode properties = node.putObject("properties");
                ArrayNode states = NODES.arrayNode();
                for (CheckboxState state : CheckboxState.values()) {
                    if (field.checkboxMode().allows(state)) {
                        states.add(state.wireName());
                    }
                }
                for (FieldOption option : field.options()) {
                    properties.putObject(option.id()).put("type", "string").set("enum", states.deepCopy());
                }
                node.put("additionalProperties", false);
                break;
            }
            case TABLE: {
                node.put("type", "array");
                ObjectNode row = node.putObject("items").put("type", "object");
                ObjectNode columns = row.putObject("properties");
                ArrayNode requiredColumns = NODES.arrayNode();
                for (TableColumn column : field.columns()) {
                    ObjectNode columnNode = columns.putObject(column.id()).put("title", column.label());
                    switch (column.type()) {
                        case NUMBER:
                            columnNode.put("type", "number");
                            break;
                        case YEAR:
                            columnNode.put("type", "integer");
                            break;
                        case URL:
                            columnNode.put("type", "string").put("format", "uri");
                            break;
                        case DATE:
                            columnNode.put("type", "string").put("format", "date");
                            break;
                        default:
                            columnNode.put("type", "string");
                    }
                    if (column.required()) {
                        requiredColumns.add(column.id());
                    }
                }
                if (!requiredColumns.isEmpty()) {
                    row.set("required", requiredColumns);
                }
                putIfSet(node, "minItems", c.minRows());
                putIfSet(node, "maxItems", c.maxRows());
                break;
            }
            default:
                break;
        }
        node.set("x-markform", extension(schema, field));
        return node;
    }

    private static ObjectNode extension(FormSchema schema, Field field) {
        FieldConstraints c = field.constraints();
        ObjectNode node = NODES.objectNode();
        node.put("kind", field.kind().wireName());
        node.put("label", field.label());
        node.put("required", field.required());
        node.put("role", field.role());
        node.put("priority", field.priority().wireName());
        schema.groupOf(field.id()).ifPresent(group -> node.put("group", group.id()));
        field.order().ifPresent(order -> node.put("order", order));
        field.parallel().ifPresent(tag -> node.put("parallel", tag));
        if (field.serial()) {
            node.put("serial", true);
        }
        field.dependsOn().ifPresent(dependsOn -> node.put("dependsOn", dependsOn));
        if (c.multiline()) {
            node.put("multiline", true);
        }
        if (c.minDate() != null) {
            node.put("minDate", c.minDate().toString());
        }
        if (c.maxDate() != null) {
            node.put("maxDate", c.maxDate().toString());
        }
        if (field.kind().hasOptions()) {
            ArrayNode options = node.putArray("options");
            for (FieldOption option : field.options()) {
                options.addObject().put("id", option.id()).put("label", option.label());
            }
        }
        if (field.checkboxMode() != null) {
            node.put("checkboxMode", field.checkboxMode().wireName());
            node.put("approvalMode", c.blockingApproval() ? "blocking" : "none");
            putIfSet(node, "minDone", c.minDone());
        }
        if (!field.columns().isEmpty()) {
            ArrayNode columns = node.putArray("columns");
            for (TableColumn column : field.columns()) {
                columns.addObject()
                    .put("id", column.id())
                    .put("label", column.label())
                    .put("type", column.type().wireName())
                    .put("required", column.required());
            }
            putIfSet(node, "minRows", c.minRows());
            putIfSet(node, "maxRows", c.maxRows());
        }
        return node;
    }

    private static ArrayNode optionIds(Field field) {
        ArrayNode ids = NODES.arrayNode();
        field.options().forEach(option -> ids.add(option.id()));
        return ids;
    }

    private static void putIfSet(ObjectNode node, String key, Integer value) {
        if (value != null) {
            node.put(key, value);
        }
    }
}
