package work.lcod.form.harness;

import java.util.List;
import work.lcod.form.inspect.Issue;
import work.lcod.form.model.FormDocument;
import work.lcod.form.patch.Patch;

/**
 * Whoever answers the form: a model-backed agent, a human front end, or a test double.
 */
public interface FormAgent {
    /**
     * Proposes patches for some of the shown issues. An empty list means the agent gives up.
     */
    List<Patch> proposePatches(FormDocument document, List<Issue> issues, int maxPatches);
}
