package work.lcod.form.patch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.form.inspect.FormInspector;
import work.lcod.form.inspect.FormState;
import work.lcod.form.inspect.IssueReason;
import work.lcod.form.inspect.Severity;
import work.lcod.form.model.AnswerState;
import work.lcod.form.model.CheckboxState;
import work.lcod.form.model.FieldResponse;
import work.lcod.form.model.FieldValue;
import work.lcod.form.model.FormDocument;
import work.lcod.form.shared.Mappers;
import work.lcod.form.support.FormFixtures;

class PatchApplierTest {
    private final FormDocument simple = FormFixtures.load("simple.form.md");

    private static JsonNode json(String literal) {
        try {
            return Mappers.JSON.readTree(literal);
        } catch (Exception ex) {
            throw new IllegalStateException(ex);
        }
    }

    @Test
    void appliesValidBatch() {
        var result = PatchApplier.apply(simple, List.of(
            Patch.setValue("company", TextNode.valueOf("Acme")),
            Patch.setValue("employees", IntNode.valueOf(12))
        ));

        assertEquals(ApplyStatus.APPLIED, result.status());
        assertEquals(FieldResponse.answered(new FieldValue.StringValue("Acme")), result.document().response("company"));
        assertEquals(FieldResponse.answered(new FieldValue.NumberValue(12)), result.document().response("employees"));
        assertEquals(FormInspector.inspect(result.document()), result.inspection());
        assertTrue(result.rejections().isEmpty());
    }

    @Test
    void anyStructuralProblemRejectsTheWholeBatch() {
        var result = PatchApplier.apply(simple, List.of(
            Patch.setValue("company", TextNode.valueOf("Acme")),
            Patch.setValue("employees", TextNode.valueOf("many")),
            Patch.setValue("ghost", TextNode.valueOf("boo"))
        ));

        assertEquals(ApplyStatus.REJECTED, result.status());
        assertSame(simple, result.document());
        assertEquals(2, result.rejections().size());
        assertEquals(1, result.rejections().get(0).patchIndex());
        assertEquals("employees", result.rejections().get(0).fieldId());
        assertEquals("Unknown field 'ghost'", result.rejections().get(1).message());
        assertEquals(FormInspector.inspect(simple), result.inspection());
    }

    @Test
    void invalidOptionNamesTheKnownOptions() {
        var result = PatchApplier.apply(simple, List.of(Patch.setValue("markets", json("[\"eu\", \"mars\"]"))));

        assertEquals(ApplyStatus.REJECTED, result.status());
        assertEquals(
            "Invalid option 'mars' for field 'markets' (options: eu, us, asia)",
            result.rejections().get(0).message()
        );
    }

    @Test
    void nullValueIsRejected() {
        var result = PatchApplier.apply(simple, List.of(Patch.setValue("company", NullNode.getInstance())));

        assertEquals(ApplyStatus.REJECTED, result.status());
    }

    @Test
    void constraintViolationsApplyAsPartial() {
        var result = PatchApplier.apply(simple, List.of(
            Patch.setValue("company", TextNode.valueOf("Acme")),
            Patch.setValue("employees", IntNode.valueOf(0))
        ));

        assertEquals(ApplyStatus.PARTIAL, result.status());
        assertEquals(FieldResponse.answered(new FieldValue.NumberValue(0)), result.document().response("employees"));
        assertEquals("employees", result.inspection().issues().get(0).ref());
    }

    @Test
    void lenientCoercionsAreReportedAsWarnings() {
        var result = PatchApplier.apply(simple, List.of(
            Patch.setValue("markets", TextNode.valueOf("asia")),
            Patch.setValue("sources", TextNode.valueOf("https://a.example")),
            Patch.setValue("review", json("{\"cited\": true}"))
        ));

        assertEquals(ApplyStatus.APPLIED, result.status());
        assertEquals(3, result.warnings().size());
        assertEquals(List.of(0, 1, 2), result.warnings().stream().map(PatchWarning::patchIndex).toList());
        assertEquals(new FieldValue.MultiSelectValue(List.of("asia")), result.document().response("markets").value().orElseThrow());
        assertEquals(
            new FieldValue.UrlListValue(List.of("https://a.example")),
            result.document().response("sources").value().orElseThrow()
        );
        assertEquals(
            new FieldValue.CheckboxesValue(Map.of("figures", CheckboxState.TODO, "cited", CheckboxState.DONE)),
            result.document().response("review").value().orElseThrow()
        );
    }

    @Test
    void multiSelectFollowsOptionOrder() {
        var result = PatchApplier.apply(simple, List.of(Patch.setValue("markets", json("[\"asia\", \"eu\"]"))));

        assertEquals(new FieldValue.MultiSelectValue(List.of("eu", "asia")), result.document().response("markets").value().orElseThrow());
    }

    @Test
    void checkboxUpdatesMergeWithCurrentStates() {
        var first = PatchApplier.apply(simple, List.of(Patch.setValue("review", json("{\"figures\": \"done\"}"))));
        var second = PatchApplier.apply(first.document(), List.of(Patch.setValue("review", json("[\"cited\"]"))));

        assertEquals(
            new FieldValue.CheckboxesValue(Map.of("figures", CheckboxState.DONE, "cited", CheckboxState.DONE)),
            second.document().response("review").value().orElseThrow()
        );
    }

    @Test
    void checkboxStateMustFitTheMode() {
        var result = PatchApplier.apply(simple, List.of(Patch.setValue("review", json("{\"figures\": \"active\"}"))));

        assertEquals(ApplyStatus.REJECTED, result.status());
    }

    @Test
    void lastPatchForAFieldWins() {
        var result = PatchApplier.apply(simple, List.of(
            Patch.setValue("company", TextNode.valueOf("First")),
            Patch.skip("company", "changed my mind"),
            Patch.setValue("company", TextNode.valueOf("Final"))
        ));

        assertEquals(FieldResponse.answered(new FieldValue.StringValue("Final")), result.document().response("company"));
    }

    @Test
    void skipAbortAndClear() {
        var filled = FormFixtures.load("simple-filled.form.md");
        var result = PatchApplier.apply(filled, List.of(
            Patch.skip("sources", "none public"),
            Patch.abort("markets", "no data"),
            Patch.clear("company")
        ));

        assertEquals(FieldResponse.skipped("none public"), result.document().response("sources"));
        assertEquals(FieldResponse.aborted("no data"), result.document().response("markets"));
        assertEquals(FieldResponse.unanswered(), result.document().response("company"));
    }

    @Test
    void tableRowsAreCoercedPerColumn() {
        var survey = FormFixtures.load("survey.form.md");
        var result = PatchApplier.apply(survey, List.of(
            Patch.setValue("team", json("[{\"who\": \"Bo\", \"age\": 40}, {\"who\": \"Cy\", \"age\": \"%SKIP% (private)\"}]"))
        ));

        assertEquals(ApplyStatus.APPLIED, result.status());
        var table = (FieldValue.TableValue) result.document().response("team").value().orElseThrow();
        assertEquals(2, table.rows().size());
        assertEquals(new FieldValue.NumberValue(40), table.rows().get(0).cell("age").value().orElseThrow());
        assertEquals(AnswerState.SKIPPED, table.rows().get(1).cell("age").state());

        var badCell = PatchApplier.apply(survey, List.of(Patch.setValue("team", json("[{\"who\": \"Bo\", \"age\": \"forty\"}]"))));
        assertEquals(ApplyStatus.REJECTED, badCell.status());
        var badColumn = PatchApplier.apply(survey, List.of(Patch.setValue("team", json("[{\"nick\": \"B\"}]"))));
        assertEquals(ApplyStatus.REJECTED, badColumn.status());
    }

    @Test
    void applyingTwiceIsIdempotent() {
        var patches = List.of(
            Patch.setValue("company", TextNode.valueOf("Acme")),
            Patch.setValue("markets", json("[\"us\"]"))
        );
        var once = PatchApplier.apply(simple, patches);
        var twice = PatchApplier.apply(once.document(), patches);

        assertEquals(once.document().responses(), twice.document().responses());
        assertEquals(once.inspection(), twice.inspection());
    }

    @Test
    void requiredChoiceFromMissingToComplete() {
        var doc = FormFixtures.parseForm("""
            {% field kind="single_select" id="choice" label="Choice" required=true %}
            - [ ] A {% #a %}
            - [ ] B {% #b %}
            {% /field %}
            """);

        var before = FormInspector.inspect(doc);
        assertEquals(FormState.INCOMPLETE, before.formState());
        assertEquals(1, before.issues().size());
        var issue = before.issues().get(0);
        assertEquals(IssueReason.MISSING_REQUIRED_VALUE, issue.reason());
        assertEquals(Severity.REQUIRED, issue.severity());
        assertEquals(2, issue.priority());

        var wrong = PatchApplier.apply(doc, List.of(Patch.setValue("choice", TextNode.valueOf("c"))));
        assertEquals(ApplyStatus.REJECTED, wrong.status());
        assertEquals("Invalid option 'c' for field 'choice' (options: a, b)", wrong.rejections().get(0).message());

        var right = PatchApplier.apply(doc, List.of(Patch.setValue("choice", TextNode.valueOf("a"))));
        assertEquals(ApplyStatus.APPLIED, right.status());
        assertEquals(FormState.COMPLETE, right.inspection().formState());
        assertTrue(FormInspector.inspect(right.document()).issues().isEmpty());
    }
}
