package work.lcod.form.harness;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.lcod.form.model.HarnessLimits;

/**
 * Limits of one fill run. {@code maxFieldsPerTurn} and {@code maxGroupsPerTurn} cap the scope of
 * the issues shown per turn; empty means uncapped.
 */
public record HarnessConfig(
    int maxTurns,
    int maxPatchesPerTurn,
    int maxIssuesPerTurn,
    Optional<Integer> maxFieldsPerTurn,
    Optional<Integer> maxGroupsPerTurn,
    Set<String> targetRoles
) {
    public static final int DEFAULT_MAX_TURNS = 100;
    public static final int DEFAULT_MAX_PATCHES_PER_TURN = 20;
    public static final int DEFAULT_MAX_ISSUES_PER_TURN = 10;
    public static final HarnessConfig DEFAULTS = builder().build();

    public HarnessConfig {
        requirePositive(maxTurns, "maxTurns");
        requirePositive(maxPatchesPerTurn, "maxPatchesPerTurn");
        requirePositive(maxIssuesPerTurn, "maxIssuesPerTurn");
        Objects.requireNonNull(maxFieldsPerTurn, "maxFieldsPerTurn");
        Objects.requireNonNull(maxGroupsPerTurn, "maxGroupsPerTurn");
        targetRoles = targetRoles == null ? Set.of() : Set.copyOf(targetRoles);
    }

    /** Copy where limits declared in a form's frontmatter replace this config's values. */
    public HarnessConfig withFormLimits(HarnessLimits limits) {
        return toBuilder()
            .maxTurns(limits.maxTurns().orElse(maxTurns))
            .maxPatchesPerTurn(limits.maxPatchesPerTurn().orElse(maxPatchesPerTurn))
            .maxIssuesPerTurn(limits.maxIssuesPerTurn().orElse(maxIssuesPerTurn))
            .build();
    }

    public Builder toBuilder() {
        return builder()
            .maxTurns(maxTurns)
            .maxPatchesPerTurn(maxPatchesPerTurn)
            .maxIssuesPerTurn(maxIssuesPerTurn)
            .maxFieldsPerTurn(maxFieldsPerTurn.orElse(null))
            .maxGroupsPerTurn(maxGroupsPerTurn.orElse(null))
            .targetRoles(targetRoles);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    public static final class Builder {
        private int maxTurns = DEFAULT_MAX_TURNS;
        private int maxPatchesPerTurn = DEFAULT_MAX_PATCHES_PER_TURN;
        private int maxIssuesPerTurn = DEFAULT_MAX_ISSUES_PER_TURN;
        private Integer maxFieldsPerTurn;
        private Integer maxGroupsPerTurn;
        private Set<String> targetRoles = new LinkedHashSet<>();

        public Builder maxTurns(int maxTurns) {
            this.maxTurns = maxTurns;
            return this;
        }

        public Builder maxPatchesPerTurn(int maxPatchesPerTurn) {
            this.maxPatchesPerTurn = maxPatchesPerTurn;
            return this;
        }

        public Builder maxIssuesPerTurn(int maxIssuesPerTurn) {
            this.maxIssuesPerTurn = maxIssuesPerTurn;
            return this;
        }

        public Builder maxFieldsPerTurn(Integer maxFieldsPerTurn) {
            this.maxFieldsPerTurn = maxFieldsPerTurn;
            return this;
        }

        public Builder maxGroupsPerTurn(Integer maxGroupsPerTurn) {
            this.maxGroupsPerTurn = maxGroupsPerTurn;
            return this;
        }

        public Builder targetRoles(Set<String> targetRoles) {
            this.targetRoles = new LinkedHashSet<>(targetRoles);
            return this;
        }

        public HarnessConfig build() {
            return new HarnessConfig(
                maxTurns,
                maxPatchesPerTurn,
                maxIssuesPerTurn,
                Optional.ofNullable(maxFieldsPerTurn),
                Optional.ofNullable(maxGroupsPerTurn),
                targetRoles
            );
        }
    }
}
