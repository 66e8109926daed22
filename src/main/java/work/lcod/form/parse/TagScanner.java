package work.lcod.form.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the directive tree of a document body. Tags must open and close on a single line; fenced
 * code blocks are skipped so value literals never read as tags.
 */
final class TagScanner {
    static final Set<String> DIRECTIVES = Set.of(
        "form", "group", "field", "note", "description", "instructions", "documentation"
    );
    private static final Pattern NAME = Pattern.compile("^([A-Za-z_][A-Za-z0-9_-]*)(.*)$", Pattern.DOTALL);
    private static final Pattern FENCE_OPEN = Pattern.compile("^\\s*(`{3,}|~{3,}).*$");

    private final String text;
    private final LineIndex lines;

    TagScanner(String text, LineIndex lines) {
        this.text = text;
        this.lines = lines;
    }

    List<Directive> scan(int from) {
        List<Directive> roots = new ArrayList<>();
        Deque<Directive> open = new ArrayDeque<>();
        String fence = null;
        int lineStart = from;
        while (lineStart < text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = text.length();
            }
            String line = stripCarriageReturn(text.substring(lineStart, lineEnd));
            if (fence != null) {
                if (line.strip().equals(fence)) {
                    fence = null;
                }
            } else {
                Matcher fenceMatcher = FENCE_OPEN.matcher(line);
                if (fenceMatcher.matches()) {
                    fence = fenceMatcher.group(1);
                } else {
                    scanLine(line, lineStart, roots, open);
                }
            }
            lineStart = lineEnd + 1;
        }
        if (fence != null) {
            throw new DocumentException(DocumentErrorKind.INVALID_STRUCTURE, "Unterminated fenced block", lines.lineOf(text.length()), null);
        }
        if (!open.isEmpty()) {
            Directive unclosed = open.peek();
            throw new DocumentException(
                DocumentErrorKind.INVALID_STRUCTURE,
                "Unclosed directive '" + unclosed.name() + "'",
                unclosed.line(),
                unclosed.attributes().optionalString("id").orElse(null)
            );
        }
        return roots;
    }

    private void scanLine(String line, int lineOffset, List<Directive> roots, Deque<Directive> open) {
        int cursor = 0;
        while (true) {
            int tagStart = line.indexOf("{%", cursor);
            if (tagStart < 0) {
                return;
            }
            int tagEnd = line.indexOf("%}", tagStart + 2);
            int lineNumber = lines.lineOf(lineOffset + tagStart);
            if (tagEnd < 0) {
                throw new DocumentException(DocumentErrorKind.INVALID_STRUCTURE, "Unterminated directive tag", lineNumber, null);
            }
            String inner = line.substring(tagStart + 2, tagEnd).strip();
            int absoluteStart = lineOffset + tagStart;
            int absoluteEnd = lineOffset + tagEnd + 2;
            handleTag(inner, absoluteStart, absoluteEnd, lineNumber, roots, open);
            cursor = tagEnd + 2;
        }
    }

    private void handleTag(String inner, int start, int end, int lineNumber, List<Directive> roots, Deque<Directive> open) {
        if (inner.startsWith("#")) {
            // option id annotation, read by the field body reader
            return;
        }
        if (inner.startsWith("/")) {
            String name = inner.substring(1).strip();
            if (open.isEmpty() || !open.peek().name().equals(name)) {
                String expected = open.isEmpty() ? "nothing" : "'" + open.peek().name() + "'";
                throw new DocumentException(
                    DocumentErrorKind.INVALID_STRUCTURE,
                    "Closing tag '" + name + "' does not match " + expected,
                    lineNumber,
                    null
                );
            }
            open.pop().close(start, end);
            return;
        }
        Matcher matcher = NAME.matcher(inner);
        if (!matcher.matches()) {
            throw new DocumentException(DocumentErrorKind.INVALID_STRUCTURE, "Malformed directive tag '" + inner + "'", lineNumber, null);
        }
        String name = matcher.group(1);
        if (!DIRECTIVES.contains(name)) {
            throw new DocumentException(DocumentErrorKind.UNKNOWN_DIRECTIVE, "Unknown directive '" + name + "'", lineNumber, null);
        }
        String rest = matcher.group(2).strip();
        boolean selfClosing = rest.endsWith("/");
        if (selfClosing) {
            rest = rest.substring(0, rest.length() - 1).strip();
        }
        Attributes attributes = Attributes.parse(rest, name, lineNumber);
        Directive directive = new Directive(name, attributes, start, end, lineNumber);
        if (open.isEmpty()) {
            roots.add(directive);
        } else {
            open.peek().children().add(directive);
        }
        if (!selfClosing) {
            open.push(directive);
        }
    }

    static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
