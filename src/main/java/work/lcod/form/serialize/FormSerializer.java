package work.lcod.form.serialize;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.form.model.FormDocument;
import work.lcod.form.model.SourceMap;

/**
 * Renders a {@link FormDocument} back to form text.
 */
public final class FormSerializer {
    private static final Logger log = LoggerFactory.getLogger(FormSerializer.class);

    private FormSerializer() {}

    public static String serialize(FormDocument document) {
        return serialize(document, SerializeOptions.PRESERVE);
    }

    public static String serialize(FormDocument document, SerializeOptions options) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(options, "options");
        if (options.preserveOriginalFormatting() && document.source().isPresent()) {
            SourceMap source = document.source().get();
            if (sameOutline(document, source)) {
                return splice(document, source);
            }
            log.debug("Schema, metadata or annotations of '{}' changed since parsing; regenerating", document.schema().id());
        }
        return CanonicalWriter.document(document);
    }

    /** True when everything outside field values still matches what the text was parsed into. */
    private static boolean sameOutline(FormDocument document, SourceMap source) {
        return source.parsedSchema().equals(document.schema())
            && source.parsedMetadata().equals(document.metadata())
            && source.parsedNotes().equals(document.notes())
            && source.parsedDocs().equals(document.docs());
    }

    private static String splice(FormDocument document, SourceMap source) {
        String raw = source.rawText();
        var out = new StringBuilder(raw.length());
        int cursor = 0;
        int rewritten = 0;
        for (SourceMap.FieldSpan span : source.fieldSpans()) {
            out.append(raw, cursor, span.start());
            var response = document.response(span.fieldId());
            if (response.equals(span.parsedResponse())) {
                out.append(raw, span.start(), span.end());
            } else {
                var field = document.schema().field(span.fieldId()).orElseThrow();
                out.append(CanonicalWriter.field(field, response));
                rewritten++;
            }
            cursor = span.end();
        }
        out.append(raw, cursor, raw.length());
        log.debug("Serialized '{}' preserving formatting, {} field(s) rewritten", document.schema().id(), rewritten);
        return out.toString();
    }
}
