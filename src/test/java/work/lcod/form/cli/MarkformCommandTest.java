package work.lcod.form.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.form.harness.FillStatus;
import work.lcod.form.inspect.FormState;
import work.lcod.form.patch.ApplyStatus;
import work.lcod.form.shared.Mappers;
import work.lcod.form.support.FormFixtures;

class MarkformCommandTest {
    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Path simple;
    private Path filled;

    @BeforeEach
    void copyFixtures() throws IOException {
        simple = write("simple.form.md", FormFixtures.text("simple.form.md"));
        filled = write("simple-filled.form.md", FormFixtures.text("simple-filled.form.md"));
    }

    private Path write(String name, String text) throws IOException {
        return Files.writeString(dir.resolve(name), text, StandardCharsets.UTF_8);
    }

    private int run(String... args) {
        CommandLine cmd = Main.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private JsonNode json() throws IOException {
        return Mappers.JSON.readTree(out.toString());
    }

    @Test
    void inspectPrintsJsonReport() throws IOException {
        assertEquals(0, run("inspect", simple.toString()));

        JsonNode report = json();
        assertEquals(FormState.INCOMPLETE.wireName(), report.get("formState").asText());
        assertEquals("company", report.get("issues").get(0).get("ref").asText());
    }

    @Test
    void configFileSwitchesReportFormat() throws IOException {
        write("markform.toml", "[output]\nformat = \"yaml\"\n");

        assertEquals(0, run("inspect", simple.toString()));

        assertTrue(out.toString().contains("formState: " + FormState.INCOMPLETE.wireName()));
    }

    @Test
    void missingExplicitConfigFails() {
        int code = run("inspect", "--config", dir.resolve("absent.toml").toString(), simple.toString());

        assertEquals(1, code);
        assertTrue(err.toString().contains("Config file not found"));
    }

    @Test
    void applyWritesUpdatedFormInPlace() throws IOException {
        Path patches = write("patches.json", "[{\"fieldId\": \"company\", \"operation\": \"set_value\", \"value\": \"Initech\"}]");

        assertEquals(0, run("apply", simple.toString(), "--patches", patches.toString()));

        assertEquals(ApplyStatus.APPLIED.wireName(), json().get("applyStatus").asText());
        assertTrue(Files.readString(simple).contains("```value\nInitech\n```"));
    }

    @Test
    void rejectedApplyLeavesFileAlone() throws IOException {
        String before = Files.readString(simple);
        Path patches = write("patches.json", "[{\"fieldId\": \"nope\", \"operation\": \"clear\"}]");

        assertEquals(1, run("apply", simple.toString(), "-p", patches.toString()));

        assertEquals(ApplyStatus.REJECTED.wireName(), json().get("applyStatus").asText());
        assertEquals("Unknown field 'nope'", json().get("rejections").get(0).get("message").asText());
        assertEquals(before, Files.readString(simple));
    }

    @Test
    void dryRunDoesNotWrite() throws IOException {
        String before = Files.readString(simple);
        Path patches = write("patches.json", "[{\"fieldId\": \"company\", \"operation\": \"set_value\", \"value\": \"Initech\"}]");

        assertEquals(0, run("apply", simple.toString(), "-p", patches.toString(), "--dry-run"));

        assertEquals(before, Files.readString(simple));
    }

    @Test
    void fillWithMockAgentReachesComplete() throws IOException {
        Path target = dir.resolve("out/filled.form.md");

        assertEquals(0, run("fill", simple.toString(), "--mock", filled.toString(), "-o", target.toString()));

        assertEquals(FillStatus.COMPLETE.wireName(), json().get("status").asText());
        String written = Files.readString(target);
        assertTrue(written.contains("Acme Corp"));
        assertTrue(written.contains("%SKIP%"));
    }

    @Test
    void fillStoppedByTurnLimitExitsNonZero() throws IOException {
        assertEquals(1, run("fill", simple.toString(), "--mock", filled.toString(), "--max-turns", "1", "--max-patches", "1"));

        assertEquals(FillStatus.MAX_TURNS.wireName(), json().get("status").asText());
    }

    @Test
    void exportValuesAndSchema() throws IOException {
        assertEquals(0, run("export", filled.toString()));
        assertEquals("Acme Corp", json().get("company").get("value").asText());

        out.getBuffer().setLength(0);
        assertEquals(0, run("export", "--format", "json-schema", filled.toString()));
        assertEquals("object", json().get("type").asText());
    }

    @Test
    void unknownExportFormatIsUsageError() {
        assertEquals(2, run("export", "--format", "pdf", filled.toString()));
        assertTrue(err.toString().contains("Unknown export format 'pdf'"));
    }

    @Test
    void normalizeWritesCanonicalLayout() throws IOException {
        Path target = dir.resolve("normal.form.md");

        assertEquals(0, run("normalize", filled.toString(), "-o", target.toString()));

        assertEquals(Files.readString(filled), Files.readString(target));
    }

    @Test
    void planReportsSerialItems() throws IOException {
        assertEquals(0, run("plan", simple.toString()));

        JsonNode plan = json();
        assertEquals(5, plan.get("looseSerial").size());
        assertFalse(plan.get("parallelBatches").elements().hasNext());
    }

    @Test
    void missingSubcommandIsUsageError() {
        assertEquals(2, run());
    }

    @Test
    void versionNamesTheFormFormat() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().contains("form format MF/0.1"));
    }
}
