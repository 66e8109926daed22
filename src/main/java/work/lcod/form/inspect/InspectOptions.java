package work.lcod.form.inspect;

import java.util.LinkedHashSet;
import java.util.Set;
import work.lcod.form.model.Roles;

/**
 * Inspection settings. An empty role set, or one containing {@code *}, disables role filtering.
 */
public record InspectOptions(Set<String> targetRoles) {
    public static final InspectOptions DEFAULTS = new InspectOptions(Set.of());

    public InspectOptions {
        targetRoles = targetRoles == null ? Set.of() : Set.copyOf(targetRoles);
    }

    public boolean filtersRoles() {
        return !targetRoles.isEmpty() && !targetRoles.contains(Roles.WILDCARD);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<String> targetRoles = new LinkedHashSet<>();

        public Builder targetRole(String role) {
            targetRoles.add(role);
            return this;
        }

        public Builder targetRoles(Set<String> roles) {
            targetRoles.addAll(roles);
            return this;
        }

        public InspectOptions build() {
            return new InspectOptions(targetRoles);
        }
    }
}
