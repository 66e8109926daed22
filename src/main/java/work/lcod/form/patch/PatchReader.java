package work.lcod.form.patch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.form.shared.Mappers;

/**
 * Reads patch batches: a JSON array of {@code {fieldId, operation, value?, reason?}} objects.
 */
public final class PatchReader {
    private PatchReader() {}

    public static List<Patch> read(String json) {
        JsonNode root;
        try {
            root = Mappers.JSON.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new PatchFormatException("Patches are not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        return read(root);
    }

    public static List<Patch> read(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new PatchFormatException("Patches must be a JSON array");
        }
        var patches = new ArrayList<Patch>();
        int index = 0;
        for (JsonNode entry : root) {
            patches.add(readEntry(entry, index++));
        }
        return patches;
    }

    private static Patch readEntry(JsonNode entry, int index) {
        if (!entry.isObject()) {
            throw new PatchFormatException("Patch #" + index + " is not an object");
        }
        JsonNode fieldId = entry.get("fieldId");
        if (fieldId == null || !fieldId.isTextual() || fieldId.textValue().isBlank()) {
            throw new PatchFormatException("Patch #" + index + " has no 'fieldId'");
        }
        JsonNode operation = entry.get("operation");
        if (operation == null || !operation.isTextual()) {
            throw new PatchFormatException("Patch #" + index + " has no 'operation'");
        }
        PatchOperation op;
        try {
            op = PatchOperation.from(operation.textValue());
        } catch (IllegalArgumentException ex) {
            throw new PatchFormatException("Patch #" + index + ": " + ex.getMessage(), ex);
        }
        JsonNode reason = entry.get("reason");
        if (reason != null && !reason.isNull() && !reason.isTextual()) {
            throw new PatchFormatException("Patch #" + index + ": 'reason' must be a string");
        }
        return new Patch(
            fieldId.textValue(),
            op,
            Optional.ofNullable(entry.get("value")),
            Optional.ofNullable(reason).filter(JsonNode::isTextual).map(JsonNode::textValue)
        );
    }
}
