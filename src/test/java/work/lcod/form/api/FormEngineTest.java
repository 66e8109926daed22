package work.lcod.form.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.form.harness.FillStatus;
import work.lcod.form.harness.HarnessConfig;
import work.lcod.form.harness.MockAgent;
import work.lcod.form.inspect.FormState;
import work.lcod.form.model.AnswerState;
import work.lcod.form.patch.ApplyStatus;
import work.lcod.form.patch.PatchFormatException;
import work.lcod.form.support.FormFixtures;

class FormEngineTest {
    @TempDir
    Path dir;

    @Test
    void parsePatchAndSerialize() {
        var doc = FormEngine.parse(FormFixtures.text("simple.form.md"));
        var result = FormEngine.applyPatches(doc, """
            [
              {"fieldId": "company", "operation": "set_value", "value": "Acme Corp"},
              {"fieldId": "employees", "operation": "set_value", "value": 250},
              {"fieldId": "markets", "operation": "set_value", "value": ["asia", "eu"]},
              {"fieldId": "review", "operation": "set_value", "value": {"figures": "done", "cited": "done"}}
            ]
            """);

        assertEquals(ApplyStatus.APPLIED, result.status());
        assertEquals(FormState.COMPLETE, result.inspection().formState());
        assertEquals(
            FormFixtures.load("simple-filled.form.md").responses(),
            FormEngine.parse(FormEngine.serialize(result.document())).responses()
        );
    }

    @Test
    void malformedPatchJsonFails() {
        var doc = FormFixtures.load("simple.form.md");

        assertThrows(PatchFormatException.class, () -> FormEngine.applyPatches(doc, "{}"));
    }

    @Test
    void loadReadsFromDisk() throws IOException {
        Path file = Files.writeString(dir.resolve("survey.form.md"), FormFixtures.text("survey.form.md"));

        var doc = FormEngine.load(file);

        assertEquals("survey", doc.schema().id());
        assertEquals(FormState.INCOMPLETE, FormEngine.inspect(doc).formState());
        assertEquals(2, FormEngine.computeExecutionPlan(doc).remainingFieldCount());
        assertTrue(FormEngine.exportJsonSchema(doc).contains("\"survey\""));
        assertTrue(FormEngine.exportValues(doc).contains("\"Alice\""));
        assertTrue(FormEngine.exportMarkdown(doc).contains("**Name**: Alice"));
    }

    @Test
    void fillHonoursFrontmatterLimits() {
        var survey = FormFixtures.load("survey.form.md");
        var config = HarnessConfig.builder().maxTurns(1).build();

        // Copying its own answers cannot close the checkbox and list shortfalls.
        var result = FormEngine.fill(survey, new MockAgent(survey), config);

        assertEquals(FillStatus.MAX_TURNS, result.status());
        assertEquals(20, result.turns().size());
        assertEquals(AnswerState.SKIPPED, result.document().response("age").state());
    }
}
