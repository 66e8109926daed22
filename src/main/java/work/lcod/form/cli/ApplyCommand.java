package work.lcod.form.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;
import work.lcod.form.api.FormEngine;
import work.lcod.form.patch.ApplyStatus;
import work.lcod.form.patch.PatchReader;
import work.lcod.form.serialize.SerializeOptions;

@CommandLine.Command(
    name = "apply",
    description = "Apply a JSON array of patches as one batch and write the updated form.",
    mixinStandardHelpOptions = true
)
final class ApplyCommand extends FormCommand {
    @CommandLine.Option(
        names = {"-p", "--patches"},
        required = true,
        paramLabel = "PATH|-",
        description = "JSON patch array; use '-' to read from stdin."
    )
    String patches;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "PATH",
        description = "Write the updated form here instead of back to FILE.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path output;

    @CommandLine.Option(names = "--normalize", description = "Write the updated form in canonical layout.")
    boolean normalize;

    @CommandLine.Option(names = "--dry-run", description = "Report the outcome without writing the form.")
    boolean dryRun;

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
        var batch = PatchReader.read(readPatches());
        var result = FormEngine.applyPatches(document, batch);
        if (result.status() != ApplyStatus.REJECTED && !dryRun) {
            var options = normalize ? SerializeOptions.CANONICAL : SerializeOptions.PRESERVE;
            writeText(output != null ? output : form, FormEngine.serialize(result.document(), options));
        }
        emit(result.toSerializableMap(), format(format));
        return result.status() == ApplyStatus.REJECTED ? 1 : 0;
    }

    private String readPatches() throws IOException {
        if ("-".equals(patches)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(patches), StandardCharsets.UTF_8);
    }
}
