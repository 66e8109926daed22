package work.lcod.form.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Positional record of the text a document was parsed from, together with what that text parsed
 * into. Only the serializer reads it.
 */
public record SourceMap(
    String rawText,
    List<FieldSpan> fieldSpans,
    FormSchema parsedSchema,
    FormMetadata parsedMetadata,
    List<Note> parsedNotes,
    List<DocumentationBlock> parsedDocs
) {
    public SourceMap {
        Objects.requireNonNull(rawText, "rawText");
        fieldSpans = fieldSpans == null ? List.of() : List.copyOf(fieldSpans);
        Objects.requireNonNull(parsedSchema, "parsedSchema");
        Objects.requireNonNull(parsedMetadata, "parsedMetadata");
        parsedNotes = parsedNotes == null ? List.of() : List.copyOf(parsedNotes);
        parsedDocs = parsedDocs == null ? List.of() : List.copyOf(parsedDocs);
    }

    public Optional<FieldSpan> span(String fieldId) {
        return fieldSpans.stream().filter(span -> span.fieldId().equals(fieldId)).findFirst();
    }

    /**
     * Character range {@code [start, end)} of a field directive, closing tag included, and the
     * response it was parsed into.
     */
    public record FieldSpan(String fieldId, int start, int end, FieldResponse parsedResponse) {
        public FieldSpan {
            Objects.requireNonNull(fieldId, "fieldId");
            Objects.requireNonNull(parsedResponse, "parsedResponse");
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid span for field '" + fieldId + "': " + start + ".." + end);
            }
        }
    }
}
