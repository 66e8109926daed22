package work.lcod.form.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.form.support.FormFixtures;

class ExportersTest {
    @Test
    void valuesExportCarriesStateValueAndReason() {
        var tree = ValuesExporter.toTree(FormFixtures.load("survey.form.md"));

        assertEquals("answered", tree.path("name").path("state").asText());
        assertEquals("Alice", tree.path("name").path("value").asText());
        assertEquals("unanswered", tree.path("age").path("state").asText());
        assertFalse(tree.path("age").has("value"));
        assertEquals("skipped", tree.path("due").path("state").asText());
        assertEquals("not decided", tree.path("due").path("reason").asText());
        assertEquals("done", tree.path("checks").path("value").path("docs").asText());
        assertEquals(31, tree.path("team").path("value").path(0).path("age").asInt());
    }

    @Test
    void valuesExportRendersYaml() {
        String yaml = ValuesExporter.toYaml(FormFixtures.load("survey.form.md"));

        assertTrue(yaml.contains("name:\n  state: answered\n  value: Alice"));
    }

    @Test
    void jsonSchemaDescribesFieldsAndExtensions() {
        var schema = JsonSchemaExporter.toTree(FormFixtures.load("survey.form.md"));

        assertEquals(JsonSchemaExporter.DIALECT, schema.path("$schema").asText());
        assertEquals("survey", schema.path("$id").asText());
        assertEquals("object", schema.path("type").asText());
        assertTrue(schema.path("properties").has("team"));
        assertEquals(3, schema.path("required").size());
        assertEquals("name", schema.path("required").path(0).asText());
        assertEquals("basics", schema.path("x-markform").path("groups").path(0).path("id").asText());
        assertEquals("number", schema.path("properties").path("age").path("x-markform").path("kind").asText());
    }

    @Test
    void markdownExportIsNarrative() {
        String markdown = MarkdownExporter.export(FormFixtures.load("survey.form.md"));

        assertTrue(markdown.startsWith("# Survey\n\nFree markdown describing the form.\n\n## Basics\n\n"));
        assertTrue(markdown.contains("**Name**: Alice\n"));
        assertTrue(markdown.contains("**Rating**: Neutral\n"));
        assertTrue(markdown.contains("**Age**: _(unanswered)_"));
        assertTrue(markdown.contains("**Due**: _(skipped: not decided)_"));
    }
}
