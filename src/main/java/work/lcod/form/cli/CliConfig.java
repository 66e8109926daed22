package work.lcod.form.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import work.lcod.form.harness.HarnessConfig;

/**
 * Settings read from {@code markform.toml}. Every value is optional; command line flags and form
 * frontmatter take precedence over them.
 */
record CliConfig(
    Optional<Integer> maxTurns,
    Optional<Integer> maxPatchesPerTurn,
    Optional<Integer> maxIssuesPerTurn,
    Optional<OutputFormat> format,
    List<String> roles
) {
    static final String FILE_NAME = "markform.toml";
    static final CliConfig EMPTY = new CliConfig(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), List.of());

    CliConfig {
        roles = List.copyOf(roles);
    }

    /**
     * Loads {@code explicit} when given (it must exist), otherwise {@code markform.toml} next to the
     * form when there is one.
     */
    static CliConfig locate(Path explicit, Path form) throws IOException {
        if (explicit != null) {
            if (!Files.isRegularFile(explicit)) {
                throw new IllegalArgumentException("Config file not found: " + explicit);
            }
            return load(explicit);
        }
        Path parent = form.toAbsolutePath().getParent();
        if (parent != null) {
            Path candidate = parent.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return load(candidate);
            }
        }
        return EMPTY;
    }

    static CliConfig load(Path path) throws IOException {
        TomlParseResult result = Toml.parse(path);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid " + path.getFileName() + ": " + result.errors().get(0).toString());
        }
        Optional<OutputFormat> format = Optional.ofNullable(result.getString("output.format")).map(OutputFormat::from);
        return new CliConfig(
            positive(result, "harness.max_turns"),
            positive(result, "harness.max_patches_per_turn"),
            positive(result, "harness.max_issues_per_turn"),
            format,
            strings(result.getArray("inspect.roles"))
        );
    }

    /** Defaults overlaid with the values this file sets. */
    HarnessConfig.Builder harnessDefaults() {
        var builder = HarnessConfig.DEFAULTS.toBuilder();
        maxTurns.ifPresent(builder::maxTurns);
        maxPatchesPerTurn.ifPresent(builder::maxPatchesPerTurn);
        maxIssuesPerTurn.ifPresent(builder::maxIssuesPerTurn);
        return builder;
    }

    private static Optional<Integer> positive(TomlParseResult result, String key) {
        if (!result.contains(key)) {
            return Optional.empty();
        }
        if (!result.isLong(key)) {
            throw new IllegalArgumentException("'" + key + "' must be an integer");
        }
        long value = result.getLong(key);
        if (value <= 0 || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("'" + key + "' must be a positive integer, got " + value);
        }
        return Optional.of((int) value);
    }

    private static List<String> strings(TomlArray array) {
        if (array == null) {
            return List.of();
        }
        var values = new ArrayList<String>();
        for (int i = 0; i < array.size(); i++) {
            Object item = array.get(i);
            if (!(item instanceof String)) {
                throw new IllegalArgumentException("'inspect.roles' must only contain strings");
            }
            values.add((String) item);
        }
        return values;
    }
}
