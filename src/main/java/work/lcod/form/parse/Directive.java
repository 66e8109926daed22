package work.lcod.form.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code {% name ... %}...{% /name %}} region of the document. Offsets are absolute positions in
 * the parsed text; {@code end} is just past the closing tag.
 */
final class Directive {
    private final String name;
    private final Attributes attributes;
    private final int start;
    private final int openEnd;
    private final int line;
    private final List<Directive> children = new ArrayList<>();
    private int closeStart;
    private int end;

    Directive(String name, Attributes attributes, int start, int openEnd, int line) {
        this.name = name;
        this.attributes = attributes;
        this.start = start;
        this.openEnd = openEnd;
        this.line = line;
        this.closeStart = openEnd;
        this.end = openEnd;
    }

    String name() {
        return name;
    }

    Attributes attributes() {
        return attributes;
    }

    int start() {
        return start;
    }

    int openEnd() {
        return openEnd;
    }

    int closeStart() {
        return closeStart;
    }

    int end() {
        return end;
    }

    int line() {
        return line;
    }

    List<Directive> children() {
        return children;
    }

    void close(int closeStart, int end) {
        this.closeStart = closeStart;
        this.end = end;
    }

    String body(String text) {
        return text.substring(openEnd, closeStart);
    }
}
