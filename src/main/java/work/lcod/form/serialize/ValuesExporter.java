package work.lcod.form.serialize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.util.Map;
import work.lcod.form.model.FieldResponse;
import work.lcod.form.model.FormDocument;
import work.lcod.form.shared.Mappers;

/**
 * Exports responses as {@code {fieldId: {state, value?, reason?}}}.
 */
public final class ValuesExporter {
    private ValuesExporter() {}

    public static ObjectNode toTree(FormDocument document) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, FieldResponse> entry : document.responses().entrySet()) {
            FieldResponse response = entry.getValue();
            ObjectNode node = root.putObject(entry.getKey());
            node.put("state", response.state().wireName());
            response.value().ifPresent(value -> node.set("value", ValueJson.toJson(value)));
            response.reason().ifPresent(reason -> node.put("reason", reason));
        }
        return root;
    }

    public static String toJson(FormDocument document) {
        try {
            return Mappers.JSON_PRETTY.writeValueAsString(toTree(document));
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static String toYaml(FormDocument document) {
        try {
            return Mappers.YAML.writeValueAsString(toTree(document));
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
