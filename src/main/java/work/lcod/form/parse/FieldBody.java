package work.lcod.form.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The body of a field directive split into prompt text, the {@code value} fence, option lines and
 * table lines.
 */
record FieldBody(String prompt, Optional<Fence> fence, List<OptionLine> options, List<TableLine> tableLines) {
    private static final Pattern FENCE = Pattern.compile("^\\s*(`{3,}|~{3,})\\s*(.*?)\\s*$");
    private static final Pattern OPTION = Pattern.compile(
        "^\\s*[-*]\\s+(\\[[^\\]]\\])\\s*(.*?)\\s*(?:\\{%\\s*#([A-Za-z0-9_.-]+)\\s*%\\})?\\s*$"
    );

    record Fence(String content, int line) {}

    record OptionLine(String marker, String label, String id, int line) {}

    record TableLine(String text, int line) {}

    static FieldBody read(String body, int bodyLine, boolean optionKind, boolean tableKind) {
        String[] lines = body.split("\n", -1);
        var prompt = new ArrayList<String>();
        var options = new ArrayList<OptionLine>();
        var tableLines = new ArrayList<TableLine>();
        Fence fence = null;
        int i = 0;
        while (i < lines.length) {
            String line = TagScanner.stripCarriageReturn(lines[i]);
            int lineNumber = bodyLine + i;
            Matcher fenceMatcher = FENCE.matcher(line);
            if (fenceMatcher.matches()) {
                String marker = fenceMatcher.group(1);
                int close = i + 1;
                while (close < lines.length && !TagScanner.stripCarriageReturn(lines[close]).strip().equals(marker)) {
                    close++;
                }
                if ("value".equals(fenceMatcher.group(2))) {
                    if (fence != null) {
                        throw new DocumentException(DocumentErrorKind.INVALID_STRUCTURE, "Field has more than one value block", lineNumber, null);
                    }
                    var content = new ArrayList<String>();
                    for (int j = i + 1; j < close && j < lines.length; j++) {
                        content.add(TagScanner.stripCarriageReturn(lines[j]));
                    }
                    fence = new Fence(String.join("\n", content), lineNumber);
                } else {
                    for (int j = i; j <= close && j < lines.length; j++) {
                        prompt.add(TagScanner.stripCarriageReturn(lines[j]));
                    }
                }
                i = close + 1;
                continue;
            }
            if (optionKind) {
                Matcher option = OPTION.matcher(line);
                if (option.matches()) {
                    options.add(new OptionLine(option.group(1), option.group(2), option.group(3), lineNumber));
                    i++;
                    continue;
                }
            }
            if (tableKind && line.strip().startsWith("|")) {
                tableLines.add(new TableLine(line.strip(), lineNumber));
                i++;
                continue;
            }
            prompt.add(line);
            i++;
        }
        return new FieldBody(String.join("\n", prompt).strip(), Optional.ofNullable(fence), options, tableLines);
    }
}
