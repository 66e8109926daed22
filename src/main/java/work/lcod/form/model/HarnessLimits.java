package work.lcod.form.model;

import java.util.Optional;

/**
 * Harness limits declared in frontmatter. Absent values defer to the caller's defaults.
 */
public record HarnessLimits(Optional<Integer> maxTurns, Optional<Integer> maxPatchesPerTurn, Optional<Integer> maxIssuesPerTurn) {
    public static final HarnessLimits NONE = new HarnessLimits(Optional.empty(), Optional.empty(), Optional.empty());

    public boolean isEmpty() {
        return maxTurns.isEmpty() && maxPatchesPerTurn.isEmpty() && maxIssuesPerTurn.isEmpty();
    }
}
