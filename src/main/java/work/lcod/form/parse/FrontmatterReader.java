package work.lcod.form.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.form.model.FormMetadata;
import work.lcod.form.model.HarnessLimits;
import work.lcod.form.model.RunMode;
import work.lcod.form.shared.Mappers;

/**
 * Reads the leading {@code ---} YAML block into {@link FormMetadata}.
 */
final class FrontmatterReader {
    private static final Set<String> HARNESS_KEYS = Set.of("max_turns", "max_patches_per_turn", "max_issues_per_turn");

    record Result(FormMetadata metadata, int bodyStart) {}

    private FrontmatterReader() {}

    static Result read(String text) {
        if (!text.startsWith("---")) {
            return new Result(FormMetadata.DEFAULTS, 0);
        }
        int firstLineEnd = text.indexOf('\n');
        if (firstLineEnd < 0 || !TagScanner.stripCarriageReturn(text.substring(0, firstLineEnd)).strip().equals("---")) {
            return new Result(FormMetadata.DEFAULTS, 0);
        }
        int lineStart = firstLineEnd + 1;
        while (lineStart <= text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            int end = lineEnd < 0 ? text.length() : lineEnd;
            String line = TagScanner.stripCarriageReturn(text.substring(lineStart, end));
            if (line.strip().equals("---")) {
                String yaml = text.substring(firstLineEnd + 1, lineStart);
                int bodyStart = lineEnd < 0 ? text.length() : lineEnd + 1;
                return new Result(toMetadata(yaml), bodyStart);
            }
            if (lineEnd < 0) {
                break;
            }
            lineStart = lineEnd + 1;
        }
        throw malformed("Frontmatter is not closed with '---'", 1);
    }

    private static FormMetadata toMetadata(String yaml) {
        JsonNode root;
        try {
            root = Mappers.YAML.readTree(yaml);
        } catch (JsonProcessingException ex) {
            int line = ex.getLocation() == null ? 1 : ex.getLocation().getLineNr() + 1;
            throw new DocumentException(
                DocumentErrorKind.MALFORMED_FRONTMATTER,
                "Invalid YAML in frontmatter: " + ex.getOriginalMessage(),
                line,
                null,
                ex
            );
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return FormMetadata.DEFAULTS;
        }
        if (!root.isObject()) {
            throw malformed("Frontmatter must be a mapping", 2);
        }
        String specVersion = null;
        Optional<RunMode> runMode = Optional.empty();
        HarnessLimits limits = HarnessLimits.NONE;
        JsonNode markform = root.get("markform");
        if (markform != null && !markform.isNull()) {
            if (!markform.isObject()) {
                throw malformed("'markform' must be a mapping", 2);
            }
            specVersion = textOrNull(markform.get("spec"), "markform.spec");
            String mode = textOrNull(markform.get("run_mode"), "markform.run_mode");
            if (mode != null) {
                try {
                    runMode = Optional.of(RunMode.from(mode));
                } catch (IllegalArgumentException ex) {
                    throw new DocumentException(DocumentErrorKind.MALFORMED_FRONTMATTER, ex.getMessage(), null, null, ex);
                }
            }
            limits = readHarness(markform.get("harness"));
        }
        return new FormMetadata(specVersion, runMode, readRoles(root.get("roles")), readInstructions(root.get("role_instructions")), limits);
    }

    private static HarnessLimits readHarness(JsonNode harness) {
        if (harness == null || harness.isNull()) {
            return HarnessLimits.NONE;
        }
        if (!harness.isObject()) {
            throw malformed("'markform.harness' must be a mapping", null);
        }
        var names = harness.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!HARNESS_KEYS.contains(name)) {
                throw malformed("Unknown harness setting '" + name + "'", null);
            }
        }
        return new HarnessLimits(
            positive(harness, "max_turns"),
            positive(harness, "max_patches_per_turn"),
            positive(harness, "max_issues_per_turn")
        );
    }

    private static Optional<Integer> positive(JsonNode harness, String name) {
        JsonNode node = harness.get(name);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() <= 0) {
            throw malformed("Harness setting '" + name + "' must be a positive integer", null);
        }
        return Optional.of(node.intValue());
    }

    private static List<String> readRoles(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw malformed("'roles' must be a list of role names", null);
        }
        var roles = new ArrayList<String>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.textValue().isBlank()) {
                throw malformed("'roles' must be a list of role names", null);
            }
            roles.add(item.textValue());
        }
        return roles;
    }

    private static Map<String, String> readInstructions(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw malformed("'role_instructions' must map role names to text", null);
        }
        var instructions = new LinkedHashMap<String, String>();
        var entries = node.fields();
        while (entries.hasNext()) {
            var entry = entries.next();
            if (!entry.getValue().isTextual()) {
                throw malformed("Instructions for role '" + entry.getKey() + "' must be text", null);
            }
            instructions.put(entry.getKey(), entry.getValue().textValue());
        }
        return instructions;
    }

    private static String textOrNull(JsonNode node, String name) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw malformed("'" + name + "' must be a scalar", null);
        }
        return node.asText();
    }

    private static DocumentException malformed(String message, Integer line) {
        return new DocumentException(DocumentErrorKind.MALFORMED_FRONTMATTER, message, line, null);
    }
}
