package work.lcod.form.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single typed slot in the form schema.
 */
public record Field(
    String id,
    FieldKind kind,
    String label,
    boolean required,
    String role,
    FieldPriority priority,
    Optional<Integer> order,
    Optional<String> parallel,
    boolean serial,
    Optional<String> dependsOn,
    String prompt,
    List<FieldOption> options,
    CheckboxMode checkboxMode,
    List<TableColumn> columns,
    FieldConstraints constraints
) {
    public Field {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        label = label == null || label.isBlank() ? id : label;
        role = role == null || role.isBlank() ? Roles.AGENT : role;
        priority = priority == null ? FieldPriority.MEDIUM : priority;
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(parallel, "parallel");
        Objects.requireNonNull(dependsOn, "dependsOn");
        prompt = prompt == null ? "" : prompt;
        options = options == null ? List.of() : List.copyOf(options);
        checkboxMode = kind == FieldKind.CHECKBOXES
            ? (checkboxMode == null ? CheckboxMode.MULTI : checkboxMode)
            : null;
        columns = columns == null ? List.of() : List.copyOf(columns);
        constraints = constraints == null ? FieldConstraints.NONE : constraints;
        if (!kind.hasOptions() && !options.isEmpty()) {
            throw new IllegalArgumentException("Field '" + id + "' of kind " + kind.wireName() + " cannot declare options");
        }
        if (kind != FieldKind.TABLE && !columns.isEmpty()) {
            throw new IllegalArgumentException("Field '" + id + "' of kind " + kind.wireName() + " cannot declare columns");
        }
    }

    public Optional<FieldOption> option(String optionId) {
        return options.stream().filter(option -> option.id().equals(optionId)).findFirst();
    }

    public boolean hasOption(String optionId) {
        return option(optionId).isPresent();
    }

    public Optional<TableColumn> column(String columnId) {
        return columns.stream().filter(column -> column.id().equals(columnId)).findFirst();
    }

    public static Builder builder(FieldKind kind, String id) {
        return new Builder(kind, id);
    }

    public Builder toBuilder() {
        return new Builder(kind, id)
            .label(label)
            .required(required)
            .role(role)
            .priority(priority)
            .order(order.orElse(null))
            .parallel(parallel.orElse(null))
            .serial(serial)
            .dependsOn(dependsOn.orElse(null))
            .prompt(prompt)
            .options(options)
            .checkboxMode(checkboxMode)
            .columns(columns)
            .constraints(constraints);
    }

    public static final class Builder {
        private final FieldKind kind;
        private final String id;
        private String label;
        private boolean required;
        private String role = Roles.AGENT;
        private FieldPriority priority = FieldPriority.MEDIUM;
        private Integer order;
        private String parallel;
        private boolean serial;
        private String dependsOn;
        private String prompt = "";
        private List<FieldOption> options = List.of();
        private CheckboxMode checkboxMode;
        private List<TableColumn> columns = List.of();
        private FieldConstraints constraints = FieldConstraints.NONE;

        private Builder(FieldKind kind, String id) {
            this.kind = kind;
            this.id = id;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder priority(FieldPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder order(Integer order) {
            this.order = order;
            return this;
        }

        public Builder parallel(String parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder serial(boolean serial) {
            this.serial = serial;
            return this;
        }

        public Builder dependsOn(String dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder options(List<FieldOption> options) {
            this.options = options;
            return this;
        }

        public Builder checkboxMode(CheckboxMode checkboxMode) {
            this.checkboxMode = checkboxMode;
            return this;
        }

        public Builder columns(List<TableColumn> columns) {
            this.columns = columns;
            return this;
        }

        public Builder constraints(FieldConstraints constraints) {
            this.constraints = constraints;
            return this;
        }

        public Field build() {
            return new Field(
                id,
                kind,
                label,
                required,
                role,
                priority,
                Optional.ofNullable(order),
                Optional.ofNullable(parallel),
                serial,
                Optional.ofNullable(dependsOn),
                prompt,
                options,
                checkboxMode,
                columns,
                constraints
            );
        }
    }
}
