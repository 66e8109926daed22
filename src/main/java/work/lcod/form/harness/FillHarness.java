package work.lcod.form.harness;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.form.inspect.FormInspector;
import work.lcod.form.inspect.InspectOptions;
import work.lcod.form.inspect.Issue;
import work.lcod.form.inspect.IssueFilters;
import work.lcod.form.inspect.IssuePipeline;
import work.lcod.form.model.FormDocument;
import work.lcod.form.patch.ApplyResult;
import work.lcod.form.patch.Patch;
import work.lcod.form.patch.PatchApplier;

/**
 * Turn loop: inspect, show the agent a capped slice of ready issues, apply what it proposes.
 */
public final class FillHarness {
    private static final Logger log = LoggerFactory.getLogger(FillHarness.class);

    private FillHarness() {}

    public static FillResult run(FormDocument document, FormAgent agent, HarnessConfig config) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(config, "config");
        var options = InspectOptions.builder().targetRoles(config.targetRoles()).build();
        IssuePipeline caps = IssuePipeline.of(
            IssueFilters.byScope(document.schema(), config.maxFieldsPerTurn().orElse(null), config.maxGroupsPerTurn().orElse(null)),
            IssueFilters.byCount(config.maxIssuesPerTurn())
        );
        var turns = new ArrayList<TurnRecord>();
        FormDocument current = document;
        for (int turn = 1; turn <= config.maxTurns(); turn++) {
            List<Issue> open = FormInspector.inspect(current, options).issues();
            if (open.isEmpty()) {
                log.info("Form '{}' complete after {} turn(s)", current.schema().id(), turns.size());
                return new FillResult(FillStatus.COMPLETE, current, turns);
            }
            List<Issue> ready = IssueFilters.filterIssuesByOrder(current.schema()).apply(open);
            List<Issue> shown = caps.apply(ready.isEmpty() ? open : ready);
            List<Patch> proposed = agent.proposePatches(current, shown, config.maxPatchesPerTurn());
            if (proposed.isEmpty()) {
                log.info("Agent stopped on turn {} with {} open issue(s)", turn, open.size());
                return new FillResult(FillStatus.AGENT_STOPPED, current, turns);
            }
            List<Patch> patches = proposed.size() > config.maxPatchesPerTurn()
                ? proposed.subList(0, config.maxPatchesPerTurn())
                : proposed;
            ApplyResult result = PatchApplier.apply(current, patches);
            current = result.document();
            int remaining = FormInspector.inspect(current, options).issues().size();
            turns.add(new TurnRecord(turn, shown.size(), patches.size(), result.status(), remaining));
            log.info(
                "Turn {}: {} issue(s) shown, {} patch(es) {}, {} remaining",
                turn,
                shown.size(),
                patches.size(),
                result.status().wireName(),
                remaining
            );
        }
        boolean done = FormInspector.inspect(current, options).issues().isEmpty();
        if (!done) {
            log.info("Stopped after {} turn(s) with work remaining", config.maxTurns());
        }
        return new FillResult(done ? FillStatus.COMPLETE : FillStatus.MAX_TURNS, current, turns);
    }
}
