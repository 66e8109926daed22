package work.lcod.form.model;

import java.util.Objects;

/**
 * Free-text annotation on a field, group or the form. Notes never affect validation.
 */
public record Note(String id, String ref, String role, String text) {
    public Note {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(role, "role");
        text = text == null ? "" : text;
    }
}
