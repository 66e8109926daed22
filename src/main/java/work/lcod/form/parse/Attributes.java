package work.lcod.form.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.form.shared.Mappers;

/**
 * Attributes of one directive tag. Values are JSON literals: {@code id="x" required=true
 * order=2 columnIds=["a","b"]}.
 */
final class Attributes {
    private final String directive;
    private final int line;
    private final Map<String, JsonNode> values;

    private Attributes(String directive, int line, Map<String, JsonNode> values) {
        this.directive = directive;
        this.line = line;
        this.values = Collections.unmodifiableMap(values);
    }

    static Attributes parse(String text, String directive, int line) {
        var values = new LinkedHashMap<String, JsonNode>();
        int i = 0;
        int length = text.length();
        while (true) {
            while (i < length && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            if (i >= length) {
                break;
            }
            int keyStart = i;
            while (i < length && isKeyChar(text.charAt(i))) {
                i++;
            }
            if (i == keyStart) {
                throw structure("Unexpected character '" + text.charAt(i) + "' in '" + directive + "' attributes", line);
            }
            String key = text.substring(keyStart, i);
            if (i >= length || text.charAt(i) != '=') {
                throw structure("Attribute '" + key + "' on '" + directive + "' has no value", line);
            }
            i++;
            int valueEnd = scanValue(text, i, line);
            String literal = text.substring(i, valueEnd);
            JsonNode value;
            try {
                value = Mappers.JSON.readTree(literal);
            } catch (JsonProcessingException ex) {
                throw new DocumentException(
                    DocumentErrorKind.INVALID_STRUCTURE,
                    "Attribute '" + key + "' on '" + directive + "' is not a valid literal: " + literal,
                    line,
                    null,
                    ex
                );
            }
            if (values.put(key, value) != null) {
                throw structure("Attribute '" + key + "' repeated on '" + directive + "'", line);
            }
            i = valueEnd;
        }
        return new Attributes(directive, line, values);
    }

    private static boolean isKeyChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    private static int scanValue(String text, int start, int line) {
        int length = text.length();
        if (start >= length) {
            throw structure("Missing attribute value", line);
        }
        char first = text.charAt(start);
        if (first == '"') {
            return skipString(text, start, line);
        }
        if (first == '[' || first == '{') {
            int depth = 0;
            int i = start;
            while (i < length) {
                char c = text.charAt(i);
                if (c == '"') {
                    i = skipString(text, i, line);
                    continue;
                }
                if (c == '[' || c == '{') {
                    depth++;
                } else if (c == ']' || c == '}') {
                    depth--;
                    if (depth == 0) {
                        return i + 1;
                    }
                }
                i++;
            }
            throw structure("Unbalanced brackets in attribute value", line);
        }
        int i = start;
        while (i < length && !Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int skipString(String text, int start, int line) {
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            i++;
        }
        throw structure("Unterminated string in attribute value", line);
    }

    private static DocumentException structure(String message, int line) {
        return new DocumentException(DocumentErrorKind.INVALID_STRUCTURE, message, line, null);
    }

    int line() {
        return line;
    }

    boolean has(String name) {
        return values.containsKey(name) && !values.get(name).isNull();
    }

    Set<String> names() {
        return values.keySet();
    }

    String requireString(String name) {
        return optionalString(name).orElseThrow(() -> structure(
            "Directive '" + directive + "' requires attribute '" + name + "'",
            line
        ));
    }

    Optional<String> optionalString(String name) {
        JsonNode node = values.get(name);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isTextual()) {
            throw invalid(name, "a string");
        }
        return Optional.of(node.textValue());
    }

    boolean flag(String name) {
        JsonNode node = values.get(name);
        if (node == null || node.isNull()) {
            return false;
        }
        if (!node.isBoolean()) {
            throw invalid(name, "true or false");
        }
        return node.booleanValue();
    }

    Optional<Integer> optionalInt(String name) {
        JsonNode node = values.get(name);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw invalid(name, "an integer");
        }
        return Optional.of(node.intValue());
    }

    Optional<Integer> optionalCount(String name) {
        Optional<Integer> value = optionalInt(name);
        if (value.isPresent() && value.get() < 0) {
            throw invalid(name, "a non-negative integer");
        }
        return value;
    }

    Optional<Double> optionalNumber(String name) {
        JsonNode node = values.get(name);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isNumber()) {
            throw invalid(name, "a number");
        }
        return Optional.of(node.doubleValue());
    }

    Optional<LocalDate> optionalDate(String name) {
        return optionalString(name).map(text -> {
            try {
                return LocalDate.parse(text);
            } catch (DateTimeParseException ex) {
                throw invalid(name, "an ISO date (YYYY-MM-DD)");
            }
        });
    }

    List<String> stringList(String name) {
        JsonNode node = values.get(name);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw invalid(name, "an array of strings");
        }
        var items = new ArrayList<String>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw invalid(name, "an array of strings");
            }
            items.add(item.textValue());
        }
        return items;
    }

    Optional<JsonNode> raw(String name) {
        return Optional.ofNullable(values.get(name)).filter(node -> !node.isNull());
    }

    DocumentException invalid(String name, String expected) {
        return new DocumentException(
            DocumentErrorKind.INVALID_STRUCTURE,
            "Attribute '" + name + "' on '" + directive + "' must be " + expected,
            line,
            optionalIdQuietly()
        );
    }

    private String optionalIdQuietly() {
        JsonNode id = values.get("id");
        return id != null && id.isTextual() ? id.textValue() : null;
    }
}
