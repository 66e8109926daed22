package work.lcod.form.model;

import java.util.Objects;

public record FieldOption(String id, String label) {
    public FieldOption {
        Objects.requireNonNull(id, "id");
        label = label == null ? id : label;
    }
}
