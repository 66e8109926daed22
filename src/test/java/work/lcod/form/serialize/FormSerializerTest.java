package work.lcod.form.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import work.lcod.form.model.AnswerState;
import work.lcod.form.model.FieldResponse;
import work.lcod.form.model.FieldValue;
import work.lcod.form.model.FormDocument;
import work.lcod.form.model.Note;
import work.lcod.form.parse.FormParser;
import work.lcod.form.patch.Patch;
import work.lcod.form.patch.PatchApplier;
import work.lcod.form.support.FormFixtures;

class FormSerializerTest {
    private static void assertSameContent(FormDocument expected, FormDocument actual) {
        assertEquals(expected.schema(), actual.schema());
        assertEquals(expected.responses(), actual.responses());
        assertEquals(expected.notes(), actual.notes());
        assertEquals(expected.docs(), actual.docs());
        assertEquals(expected.metadata(), actual.metadata());
    }

    @ParameterizedTest
    @ValueSource(strings = {"survey.form.md", "simple.form.md", "simple-filled.form.md"})
    void untouchedDocumentSerializesByteForByte(String fixture) {
        String text = FormFixtures.text(fixture);
        assertEquals(text, FormSerializer.serialize(FormParser.parse(text)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"survey.form.md", "simple.form.md", "simple-filled.form.md"})
    void canonicalTextParsesBackToTheSameDocument(String fixture) {
        var doc = FormFixtures.load(fixture);
        String canonical = FormSerializer.serialize(doc, SerializeOptions.CANONICAL);
        var reparsed = FormParser.parse(canonical);

        assertSameContent(doc, reparsed);
        assertEquals(canonical, FormSerializer.serialize(reparsed, SerializeOptions.CANONICAL));
    }

    @Test
    void preserveModeRewritesOnlyChangedFields() {
        String text = FormFixtures.text("survey.form.md");
        var doc = FormParser.parse(text);
        var result = PatchApplier.apply(doc, List.of(Patch.setValue("age", IntNode.valueOf(42))));

        String output = FormSerializer.serialize(result.document());

        assertTrue(output.contains("How old are you?\n\n```value\n42\n```\n{% /field %}"));
        assertTrue(output.contains("{% field kind=\"string_list\" id=\"tags\" label=\"Tags\" minItems=2 %}\n```value\nalpha\n```"));
        assertTrue(output.startsWith(text.substring(0, text.indexOf("{% field kind=\"number\""))));
        assertTrue(output.endsWith(text.substring(text.indexOf("{% field kind=\"string_list\""))));
        assertEquals(
            FieldResponse.answered(new FieldValue.NumberValue(42)),
            FormParser.parse(output).response("age")
        );
    }

    @Test
    void skippedFieldIsWrittenWithStateAndReason() {
        var doc = FormFixtures.load("simple.form.md");
        var result = PatchApplier.apply(doc, List.of(Patch.skip("sources", "none found")));

        String output = FormSerializer.serialize(result.document());

        assertTrue(output.contains("{% field kind=\"url_list\" id=\"sources\" label=\"Sources\" state=\"skipped\" %}"));
        assertTrue(output.contains("```value\n%SKIP% (none found)\n```"));
        assertEquals(FieldResponse.skipped("none found"), FormParser.parse(output).response("sources"));
    }

    @Test
    void structuralChangeFallsBackToCanonicalOutput() {
        String text = FormFixtures.text("survey.form.md");
        var doc = FormParser.parse(text);
        var withNote = new FormDocument(
            doc.metadata(),
            doc.schema(),
            doc.responses(),
            List.of(doc.notes().get(0), new Note("n2", "age", "user", "Ask again later.")),
            doc.docs(),
            doc.source()
        );

        String output = FormSerializer.serialize(withNote);

        assertFalse(output.equals(text));
        assertTrue(output.contains("{% note id=\"n2\" ref=\"age\" role=\"user\" %}\nAsk again later.\n{% /note %}"));
        assertEquals(2, FormParser.parse(output).notes().size());
    }

    @Test
    void valueContainingBackticksGetsALongerFence() {
        var doc = FormFixtures.parseForm("{% field kind=\"string\" id=\"code\" multiline=true %}\n{% /field %}\n");
        String snippet = "before\n```\nafter";
        var result = PatchApplier.apply(doc, List.of(Patch.setValue("code", TextNode.valueOf(snippet))));

        String output = FormSerializer.serialize(result.document(), SerializeOptions.CANONICAL);

        assertTrue(output.contains("````value\nbefore\n```\nafter\n````"));
        assertEquals(
            FieldResponse.answered(new FieldValue.StringValue(snippet)),
            FormParser.parse(output).response("code")
        );
    }

    @Test
    void emptyAnswerRoundTripsThroughStateAttribute() {
        var doc = FormFixtures.parseForm("{% field kind=\"string_list\" id=\"items\" %}\n{% /field %}\n");
        var answered = doc.withResponses(Map.of("items", FieldResponse.answered(new FieldValue.StringListValue(List.of()))));

        String output = FormSerializer.serialize(answered, SerializeOptions.CANONICAL);

        assertTrue(output.contains("state=\"answered\""));
        assertEquals(answered.responses(), FormParser.parse(output).responses());
    }

    @Test
    void answersThatReadLikeMarkersStayAnswered() {
        var doc = FormFixtures.parseForm("""
            {% field kind="string" id="note" %}
            {% /field %}

            {% field kind="string_list" id="steps" %}
            {% /field %}
            """);
        var result = PatchApplier.apply(doc, List.of(
            Patch.setValue("note", TextNode.valueOf("%SKIP% (later)")),
            Patch.setValue("steps", TextNode.valueOf("%ABORT%"))
        ));
        assertEquals(AnswerState.ANSWERED, result.document().response("note").state());

        for (SerializeOptions options : List.of(SerializeOptions.PRESERVE, SerializeOptions.CANONICAL)) {
            String output = FormSerializer.serialize(result.document(), options);
            var reparsed = FormParser.parse(output);

            assertTrue(output.contains("state=\"answered\""));
            assertEquals(FieldResponse.answered(new FieldValue.StringValue("%SKIP% (later)")), reparsed.response("note"));
            assertEquals(FieldResponse.answered(new FieldValue.StringListValue(List.of("%ABORT%"))), reparsed.response("steps"));
        }
    }

    @Test
    void whitespaceOnlyStringKeepsItsText() {
        var doc = FormFixtures.parseForm("{% field kind=\"string\" id=\"pad\" %}\n{% /field %}\n");
        var answered = doc.withResponses(Map.of("pad", FieldResponse.answered(new FieldValue.StringValue("   "))));

        String output = FormSerializer.serialize(answered, SerializeOptions.CANONICAL);

        assertTrue(output.contains("```value\n   \n```"));
        assertEquals(answered.responses(), FormParser.parse(output).responses());
    }
}
