package work.lcod.form.harness;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.form.inspect.Issue;
import work.lcod.form.model.FieldResponse;
import work.lcod.form.model.FormDocument;
import work.lcod.form.patch.Patch;
import work.lcod.form.serialize.ValueJson;

/**
 * Agent that answers from an already completed copy of the form.
 */
public final class MockAgent implements FormAgent {
    static final String NO_ANSWER = "No answer in the reference form";

    private final FormDocument completed;

    public MockAgent(FormDocument completed) {
        this.completed = Objects.requireNonNull(completed, "completed");
    }

    @Override
    public List<Patch> proposePatches(FormDocument document, List<Issue> issues, int maxPatches) {
        var patches = new ArrayList<Patch>();
        for (Issue issue : issues) {
            if (patches.size() >= maxPatches) {
                break;
            }
            if (!completed.schema().hasField(issue.ref())) {
                continue;
            }
            patches.add(toPatch(issue.ref(), completed.response(issue.ref())));
        }
        return patches;
    }

    private static Patch toPatch(String fieldId, FieldResponse answer) {
        switch (answer.state()) {
            case ANSWERED:
                return Patch.setValue(fieldId, ValueJson.toJson(answer.value().orElseThrow()));
            case ABORTED:
                return Patch.abort(fieldId, answer.reason().orElse(null));
            case SKIPPED:
                return Patch.skip(fieldId, answer.reason().orElse(null));
            default:
                return Patch.skip(fieldId, NO_ANSWER);
        }
    }
}
