package work.lcod.form.inspect;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered composition of {@link IssueFilter} stages.
 */
public final class IssuePipeline implements IssueFilter {
    private final List<IssueFilter> stages;

    private IssuePipeline(List<IssueFilter> stages) {
        this.stages = List.copyOf(stages);
    }

    public static IssuePipeline of(IssueFilter... stages) {
        return new IssuePipeline(List.of(stages));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<Issue> apply(List<Issue> issues) {
        List<Issue> current = issues;
        for (IssueFilter stage : stages) {
            current = stage.apply(current);
        }
        return List.copyOf(current);
    }

    public int size() {
        return stages.size();
    }

    public static final class Builder {
        private final List<IssueFilter> stages = new ArrayList<>();

        public Builder add(IssueFilter stage) {
            stages.add(stage);
            return this;
        }

        public IssuePipeline build() {
            return new IssuePipeline(stages);
        }
    }
}
