package work.lcod.form.cli;

import picocli.CommandLine;
import work.lcod.form.api.FormEngine;

@CommandLine.Command(
    name = "plan",
    description = "Print the execution plan of the fields still to be answered.",
    mixinStandardHelpOptions = true
)
final class PlanCommand extends FormCommand {
    @CommandLine.Option(
        names = "--format",
        paramLabel = "json|yaml",
        description = "Plan format (default: [output] format, else json).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String format;

    @Override
    int run() throws Exception {
        var plan = FormEngine.computeExecutionPlan(loadForm());
        emit(plan.toSerializableMap(), format(format));
        return 0;
    }
}
