package work.lcod.form.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import work.lcod.form.api.FormEngine;
import work.lcod.form.serialize.SerializeOptions;

@CommandLine.Command(
    name = "normalize",
    description = "Re-emit the form in canonical layout.",
    mixinStandardHelpOptions = true
)
final class NormalizeCommand extends FormCommand {
    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "PATH",
        description = "Write here instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path output;

    @Override
    int run() throws Exception {
        String text = FormEngine.serialize(loadForm(), SerializeOptions.CANONICAL);
        if (output != null) {
            writeText(output, text);
        } else {
            print(text);
        }
        return 0;
    }
}
