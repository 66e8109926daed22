package work.lcod.form.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;
import work.lcod.form.api.FormEngine;
import work.lcod.form.harness.FillHarness;
import work.lcod.form.harness.FillStatus;
import work.lcod.form.harness.HarnessConfig;
import work.lcod.form.harness.MockAgent;
import work.lcod.form.model.HarnessLimits;
import work.lcod.form.serialize.SerializeOptions;

/**
 * Drives the fill loop with a mock agent. Limits resolve as: flag, then form frontmatter, then
 * {@code [harness]} in the config file, then built-in defaults.
 */
@CommandLine.Command(
    name = "fill",
    description = "Fill a form turn by turn from a completed copy of it.",
    mixinStandardHelpOptions = true
)
final class FillCommand extends FormCommand {
    @CommandLine.Option(
        names = "--mock",
        required = true,
        paramLabel = "COMPLETED",
        description = "Completed form the mock agent copies its answers from."
    )
    Path mock;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "PATH",
        description = "Write the filled form here.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path output;

    @CommandLine.Option(names = "--max-turns", paramLabel = "N", defaultValue = CommandLine.Option.NULL_VALUE)
    Integer maxTurns;

    @CommandLine.Option(names = "--max-patches", paramLabel = "N", defaultValue = CommandLine.Option.NULL_VALUE)
    Integer maxPatches;

    @CommandLine.Option(names = "--max-issues", paramLabel = "N", defaultValue = CommandLine.Option.NULL_VALUE)
    Integer maxIssues;

    @CommandLine.Option(names = "--max-fields", paramLabel = "N", defaultValue = CommandLine.Option.NULL_VALUE)
    Integer maxFields;

    @CommandLine.Option(names = "--max-groups", paramLabel = "N", defaultValue = CommandLine.Option.NULL_VALUE)
    Integer maxGroups;

    @CommandLine.Option(
        names = "--roles",
        paramLabel = "ROLE[,ROLE...]",
        description = "Only fill fields for these roles ('*' for all).",
        split = ","
    )
    List<String> roles = new ArrayList<>();

    @CommandLine.Option(
        names = "--format",
        paramLabel = "json|yaml",
        description = "Report format (default: [output] format, else json).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String format;

    @Override
    int run() throws Exception {
        var document = loadForm();
        var agent = new MockAgent(FormEngine.load(mock));
        var result = FillHarness.run(document, agent, resolveConfig(document.metadata().harnessLimits()));
        if (output != null) {
            writeText(output, FormEngine.serialize(result.document(), SerializeOptions.PRESERVE));
        }
        emit(result.toSerializableMap(), format(format));
        return result.status() == FillStatus.COMPLETE ? 0 : 1;
    }

    private HarnessConfig resolveConfig(HarnessLimits formLimits) throws IOException {
        var builder = config().harnessDefaults().build().withFormLimits(formLimits).toBuilder();
        if (maxTurns != null) {
            builder.maxTurns(maxTurns);
        }
        if (maxPatches != null) {
            builder.maxPatchesPerTurn(maxPatches);
        }
        if (maxIssues != null) {
            builder.maxIssuesPerTurn(maxIssues);
        }
        if (maxFields != null) {
            builder.maxFieldsPerTurn(maxFields);
        }
        if (maxGroups != null) {
            builder.maxGroupsPerTurn(maxGroups);
        }
        return builder.targetRoles(roles(roles)).build();
    }
}
