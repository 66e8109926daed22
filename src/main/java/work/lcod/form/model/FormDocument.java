package work.lcod.form.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable aggregate: schema, one response per field, notes, documentation blocks and metadata.
 * Every field has a response (unanswered when none was given) and every answered value matches its
 * field's kind.
 */
public record FormDocument(
    FormMetadata metadata,
    FormSchema schema,
    Map<String, FieldResponse> responses,
    List<Note> notes,
    List<DocumentationBlock> docs,
    Optional<SourceMap> source
) {
    public FormDocument {
        metadata = metadata == null ? FormMetadata.DEFAULTS : metadata;
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(responses, "responses");
        notes = notes == null ? List.of() : List.copyOf(notes);
        docs = docs == null ? List.of() : List.copyOf(docs);
        Objects.requireNonNull(source, "source");
        for (String fieldId : responses.keySet()) {
            if (!schema.hasField(fieldId)) {
                throw new IllegalArgumentException("Response for unknown field '" + fieldId + "'");
            }
        }
        var ordered = new LinkedHashMap<String, FieldResponse>();
        for (Field field : schema.fields()) {
            FieldResponse response = responses.getOrDefault(field.id(), FieldResponse.unanswered());
            response.value().ifPresent(value -> FieldResponse.requireKind(field, value));
            ordered.put(field.id(), response);
        }
        responses = Collections.unmodifiableMap(ordered);
    }

    public static FormDocument of(FormSchema schema, Map<String, FieldResponse> responses) {
        return new FormDocument(FormMetadata.DEFAULTS, schema, responses, List.of(), List.of(), Optional.empty());
    }

    public FieldResponse response(String fieldId) {
        return responses.getOrDefault(fieldId, FieldResponse.unanswered());
    }

    public List<Note> notesFor(String ref) {
        return notes.stream().filter(note -> note.ref().equals(ref)).toList();
    }

    /** Copy with the given responses replaced; the source map is kept for formatting preservation. */
    public FormDocument withResponses(Map<String, FieldResponse> updates) {
        var merged = new LinkedHashMap<>(responses);
        merged.putAll(updates);
        return new FormDocument(metadata, schema, merged, notes, docs, source);
    }

    /** Copy that forgets its original text, so the serializer regenerates everything. */
    public FormDocument withoutSource() {
        return new FormDocument(metadata, schema, responses, notes, docs, Optional.empty());
    }
}
