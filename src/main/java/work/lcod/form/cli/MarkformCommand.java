package work.lcod.form.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "markform",
    description = "Inspect, patch, plan and export markdown forms.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        InspectCommand.class,
        ApplyCommand.class,
        PlanCommand.class,
        ExportCommand.class,
        NormalizeCommand.class,
        FillCommand.class
    }
)
final class MarkformCommand implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand.");
    }
}
