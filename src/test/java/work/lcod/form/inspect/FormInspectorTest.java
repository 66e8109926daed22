package work.lcod.form.inspect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.form.model.AnswerState;
import work.lcod.form.patch.Patch;
import work.lcod.form.patch.PatchApplier;
import work.lcod.form.support.FormFixtures;

class FormInspectorTest {
    private static List<String> refs(InspectResult result) {
        return result.issues().stream().map(Issue::ref).toList();
    }

    @Test
    void ordersIssuesByPrioritySeverityAndDeclaration() {
        var result = FormInspector.inspect(FormFixtures.load("survey.form.md"));

        assertEquals(List.of("age", "checks", "tags", "founded"), refs(result));
        var age = result.issues().get(0);
        assertEquals(IssueReason.MISSING_REQUIRED_VALUE, age.reason());
        assertEquals(Severity.REQUIRED, age.severity());
        assertEquals(2, age.priority());
        assertEquals(IssueReason.CHECKBOX_INCOMPLETE, result.issues().get(1).reason());
        var tags = result.issues().get(2);
        assertEquals(IssueReason.MIN_ITEMS_NOT_MET, tags.reason());
        assertEquals(Severity.RECOMMENDED, tags.severity());
        assertEquals(4, tags.priority());
        var founded = result.issues().get(3);
        assertEquals(IssueReason.OPTIONAL_UNANSWERED, founded.reason());
        assertEquals(4, founded.priority());
    }

    @Test
    void summarizesStructureAndProgress() {
        var result = FormInspector.inspect(FormFixtures.load("survey.form.md"));

        assertEquals(FormState.INCOMPLETE, result.formState());
        assertEquals(2, result.structureSummary().groupCount());
        assertEquals(9, result.structureSummary().fieldCount());
        assertEquals(3, result.structureSummary().requiredFieldCount());
        assertEquals(Integer.valueOf(1), result.structureSummary().fieldsByKind().get("table"));

        var counts = result.progressSummary().counts();
        assertEquals(9, counts.totalFields());
        assertEquals(6, counts.answered());
        assertEquals(1, counts.skipped());
        assertEquals(2, counts.unanswered());
        assertEquals(0, counts.invalid());

        var due = result.progressSummary().field("due");
        assertEquals(AnswerState.SKIPPED, due.state());
        assertTrue(due.resolved());
        assertFalse(result.progressSummary().field("tags").resolved());
    }

    @Test
    void inspectionIsRepeatable() {
        var doc = FormFixtures.load("survey.form.md");

        assertEquals(FormInspector.inspect(doc), FormInspector.inspect(doc));
    }

    @Test
    void emptyAndCompleteStates() {
        var optionalOnly = FormFixtures.parseForm("{% field kind=\"string\" id=\"a\" %}\n{% /field %}\n");
        assertEquals(FormState.COMPLETE, FormInspector.inspect(optionalOnly).formState());

        var noFields = FormFixtures.parseForm("{% group id=\"g\" title=\"G\" %}\n{% /group %}\n");
        assertEquals(FormState.EMPTY, FormInspector.inspect(noFields).formState());

        var filled = FormFixtures.load("simple-filled.form.md");
        var result = FormInspector.inspect(filled);
        assertEquals(FormState.COMPLETE, result.formState());
        assertTrue(result.isComplete());
        assertEquals(List.of("sources"), refs(result));
        assertEquals(5, result.issues().get(0).priority());
    }

    @Test
    void invalidValueMakesTheFormInvalid() {
        var doc = FormFixtures.load("simple.form.md");
        var applied = PatchApplier.apply(doc, List.of(Patch.setValue("employees", IntNode.valueOf(0))));

        var result = FormInspector.inspect(applied.document());

        assertEquals(FormState.INVALID, result.formState());
        var first = result.issues().get(0);
        assertEquals("employees", first.ref());
        assertEquals(IssueReason.INVALID_VALUE_FOR_KIND, first.reason());
        assertEquals(1, first.priority());
        assertTrue(first.message().contains("at least 1"));
    }

    @Test
    void skippingARequiredFieldResolvesIt() {
        var doc = FormFixtures.load("simple-filled.form.md");
        var applied = PatchApplier.apply(doc, List.of(Patch.skip("company", "confidential")));

        var result = applied.inspection();

        assertEquals(FormState.COMPLETE, result.formState());
        assertFalse(refs(result).contains("company"));
    }

    @Test
    void dependentFieldIsBlockedUntilItsDependencyIsSettled() {
        var doc = FormFixtures.parseForm("""
            {% field kind="string" id="a" required=true %}
            {% /field %}

            {% field kind="string" id="b" required=true dependsOn="a" %}
            {% /field %}
            """);

        var before = FormInspector.inspect(doc);
        assertEquals(Optional.empty(), before.issues().get(0).blockedBy());
        assertEquals(Optional.of("a"), before.issues().get(1).blockedBy());

        var after = PatchApplier.apply(doc, List.of(Patch.setValue("a", TextNode.valueOf("done")))).inspection();
        assertEquals(List.of("b"), refs(after));
        assertFalse(after.issues().get(0).isBlocked());
    }

    @Test
    void orderFilteringKeepsOnlyTheReadyDependency() {
        var doc = FormFixtures.parseForm("""
            {% field kind="string" id="a" required=true %}
            {% /field %}

            {% field kind="string" id="b" required=true dependsOn="a" %}
            {% /field %}
            """);

        var issues = FormInspector.inspect(doc).issues();
        assertEquals(List.of("a", "b"), issues.stream().map(Issue::ref).toList());
        assertEquals(2, issues.get(0).priority());

        var ready = IssueFilters.filterIssuesByOrder(doc.schema()).apply(issues);
        assertEquals(List.of("a"), ready.stream().map(Issue::ref).toList());
        assertFalse(ready.get(0).isBlocked());
    }

    @Test
    void blockingChecklistBlocksLaterFields() {
        var doc = FormFixtures.parseForm("""
            {% field kind="checkboxes" id="gate" required=true approvalMode="blocking" checkboxMode="simple" %}
            - [ ] Approved {% #ok %}
            {% /field %}

            {% field kind="string" id="after" required=true %}
            {% /field %}
            """);

        var before = FormInspector.inspect(doc);
        assertEquals(Optional.of("gate"), before.issues().get(1).blockedBy());

        var states = JsonNodeFactory.instance.objectNode().put("ok", true);
        var after = PatchApplier.apply(doc, List.of(Patch.setValue("gate", states))).inspection();
        assertEquals(List.of("after"), refs(after));
        assertFalse(after.issues().get(0).isBlocked());
    }

    @Test
    void roleFilterHidesOtherRoles() {
        var doc = FormFixtures.load("survey.form.md");
        var userOnly = InspectOptions.builder().targetRole("user").build();

        assertTrue(FormInspector.inspect(doc, userOnly).issues().isEmpty());
        assertEquals(4, FormInspector.inspect(doc, InspectOptions.builder().targetRoles(Set.of("*")).build()).issues().size());
    }
}
