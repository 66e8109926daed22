package work.lcod.form.cli;

import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;
import work.lcod.form.api.FormEngine;
import work.lcod.form.inspect.InspectOptions;

@CommandLine.Command(
    name = "inspect",
    description = "Print structure, progress, form state and prioritized issues.",
    mixinStandardHelpOptions = true
)
final class InspectCommand extends FormCommand {
    @CommandLine.Option(
        names = "--format",
        paramLabel = "json|yaml",
        description = "Report format (default: [output] format, else json).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String format;

    @CommandLine.Option(
        names = "--roles",
        paramLabel = "ROLE[,ROLE...]",
        description = "Only report fields for these roles ('*' for all).",
        split = ","
    )
    List<String> roles = new ArrayList<>();

    @Override
    int run() throws Exception {
        var document = loadForm();
        var options = InspectOptions.builder().targetRoles(roles(roles)).build();
        emit(FormEngine.inspect(document, options).toSerializableMap(), format(format));
        return 0;
    }
}
