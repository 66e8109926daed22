package work.lcod.form.inspect;

import java.util.List;

/**
 * One stage of issue filtering: takes an ordered issue list and returns an ordered subset.
 */
@FunctionalInterface
public interface IssueFilter {
    List<Issue> apply(List<Issue> issues);

    default IssueFilter then(IssueFilter next) {
        return issues -> next.apply(apply(issues));
    }
}
