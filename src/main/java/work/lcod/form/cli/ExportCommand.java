package work.lcod.form.cli;

import java.nio.file.Path;
import java.util.Locale;
import picocli.CommandLine;
import work.lcod.form.api.FormEngine;
import work.lcod.form.model.FormDocument;
import work.lcod.form.serialize.ValuesExporter;

@CommandLine.Command(
    name = "export",
    description = "Export the form as plain markdown, a JSON Schema or its values.",
    mixinStandardHelpOptions = true
)
final class ExportCommand extends FormCommand {
    @CommandLine.Option(
        names = "--format",
        paramLabel = "markdown|json-schema|values|values-yaml",
        description = "Export format.",
        defaultValue = "values"
    )
    String format;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "PATH",
        description = "Write here instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path output;

    @Override
    int run() throws Exception {
        String text = render(loadForm(), format.trim().toLowerCase(Locale.ROOT));
        if (output != null) {
            writeText(output, text);
        } else {
            print(text);
        }
        return 0;
    }

    private String render(FormDocument document, String kind) {
        switch (kind) {
            case "markdown":
                return FormEngine.exportMarkdown(document);
            case "json-schema":
                return FormEngine.exportJsonSchema(document);
            case "values":
                return FormEngine.exportValues(document);
            case "values-yaml":
                return ValuesExporter.toYaml(document);
            default:
                throw new CommandLine.ParameterException(
                    spec.commandLine(),
                    "Unknown export format '" + format + "' (expected markdown, json-schema, values or values-yaml)"
                );
        }
    }
}
