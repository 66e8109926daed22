package work.lcod.form.inspect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.form.model.FormDocument;
import work.lcod.form.support.FormFixtures;

class IssueFiltersTest {
    private final FormDocument survey = FormFixtures.load("survey.form.md");
    private final List<Issue> issues = FormInspector.inspect(survey).issues();

    private static List<String> refs(List<Issue> issues) {
        return issues.stream().map(Issue::ref).toList();
    }

    private static Issue issue(String ref, String blockedBy) {
        return new Issue(
            ref,
            IssueScope.FIELD,
            IssueReason.MISSING_REQUIRED_VALUE,
            "missing",
            Severity.REQUIRED,
            2,
            Optional.ofNullable(blockedBy)
        );
    }

    @Test
    void orderLevelKeepsTheLowestOpenLevel() {
        assertEquals(List.of("age", "checks", "tags"), refs(IssueFilters.byOrderLevel(survey.schema()).apply(issues)));
        assertEquals(List.of(), IssueFilters.byOrderLevel(survey.schema()).apply(List.of()));
    }

    @Test
    void readinessDropsBlockedIssues() {
        var mixed = List.of(issue("a", null), issue("b", "a"), issue("c", null));

        assertEquals(List.of("a", "c"), refs(IssueFilters.byReadiness().apply(mixed)));
    }

    @Test
    void scopeCapsDistinctFieldsAndGroups() {
        assertEquals(List.of("age", "checks"), refs(IssueFilters.byScope(survey.schema(), 2, null).apply(issues)));
        assertEquals(List.of("age", "checks", "tags"), refs(IssueFilters.byScope(survey.schema(), null, 1).apply(issues)));
        assertEquals(issues, IssueFilters.byScope(survey.schema(), null, null).apply(issues));
    }

    @Test
    void countCapTruncates() {
        assertEquals(List.of("age"), refs(IssueFilters.byCount(1).apply(issues)));
        assertEquals(List.of(), IssueFilters.byCount(0).apply(issues));
        assertThrows(IllegalArgumentException.class, () -> IssueFilters.byCount(-1));
    }

    @Test
    void roleFilterMatchesFieldRoles() {
        assertEquals(refs(issues), refs(IssueFilters.byRole(survey.schema(), Set.of("agent")).apply(issues)));
        assertEquals(List.of(), IssueFilters.byRole(survey.schema(), Set.of("user")).apply(issues));
    }

    @Test
    void pipelineAppliesStagesInOrder() {
        var pipeline = IssuePipeline.builder()
            .add(IssueFilters.filterIssuesByOrder(survey.schema()))
            .add(IssueFilters.byScope(survey.schema(), null, 1))
            .add(IssueFilters.byCount(2))
            .build();

        assertEquals(3, pipeline.size());
        assertEquals(List.of("age", "checks"), refs(pipeline.apply(issues)));
        assertEquals(pipeline.apply(issues), IssuePipeline.of(
            IssueFilters.byReadiness(),
            IssueFilters.byOrderLevel(survey.schema()),
            IssueFilters.byCount(2)
        ).apply(issues));
    }
}
