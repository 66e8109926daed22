package work.lcod.form.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliConfigTest {
    @TempDir
    Path dir;

    @Test
    void readsHarnessOutputAndRoles() throws IOException {
        Path file = Files.writeString(dir.resolve(CliConfig.FILE_NAME), """
            [harness]
            max_turns = 5
            max_issues_per_turn = 3

            [output]
            format = "yaml"

            [inspect]
            roles = ["user"]
            """);

        CliConfig config = CliConfig.load(file);

        assertEquals(Optional.of(5), config.maxTurns());
        assertEquals(Optional.empty(), config.maxPatchesPerTurn());
        assertEquals(Optional.of(OutputFormat.YAML), config.format());
        assertEquals(List.of("user"), config.roles());
        var harness = config.harnessDefaults().build();
        assertEquals(5, harness.maxTurns());
        assertEquals(20, harness.maxPatchesPerTurn());
        assertEquals(3, harness.maxIssuesPerTurn());
    }

    @Test
    void locatesFileNextToTheForm() throws IOException {
        Files.writeString(dir.resolve(CliConfig.FILE_NAME), "[harness]\nmax_turns = 2\n");

        assertEquals(Optional.of(2), CliConfig.locate(null, dir.resolve("a.form.md")).maxTurns());
    }

    @Test
    void noFileMeansEmpty() throws IOException {
        assertEquals(CliConfig.EMPTY, CliConfig.locate(null, dir.resolve("a.form.md")));
    }

    @Test
    void rejectsBadValues() throws IOException {
        Path negative = Files.writeString(dir.resolve("neg.toml"), "[harness]\nmax_turns = -1\n");
        Path format = Files.writeString(dir.resolve("fmt.toml"), "[output]\nformat = \"xml\"\n");
        Path broken = Files.writeString(dir.resolve("broken.toml"), "[harness\n");

        assertThrows(IllegalArgumentException.class, () -> CliConfig.load(negative));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.load(format));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.load(broken));
    }
}
