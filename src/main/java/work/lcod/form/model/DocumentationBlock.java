package work.lcod.form.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Informational markdown attached to the form, a group or a field.
 */
public record DocumentationBlock(Tag tag, String ref, String body) {
    public DocumentationBlock {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(ref, "ref");
        body = body == null ? "" : body;
    }

    public enum Tag {
        DESCRIPTION,
        INSTRUCTIONS,
        DOCUMENTATION;

        public String directive() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
