package work.lcod.form.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.form.api.FormEngine;
import work.lcod.form.model.FormDocument;
import work.lcod.form.shared.Mappers;

/**
 * Shared plumbing of the subcommands: the form argument, config lookup, verbosity and output.
 */
abstract class FormCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Form document to read.")
    Path form;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log engine activity at debug level on stderr.")
    boolean verbose;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "TOML",
        description = "Config file (default: markform.toml next to FILE, when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path configPath;

    private CliConfig config;

    @Override
    public final Integer call() throws Exception {
        if (verbose) {
            ((Logger) LoggerFactory.getLogger("work.lcod.form")).setLevel(Level.DEBUG);
        }
        return run();
    }

    abstract int run() throws Exception;

    FormDocument loadForm() throws IOException {
        return FormEngine.load(form);
    }

    CliConfig config() throws IOException {
        if (config == null) {
            config = CliConfig.locate(configPath, form);
        }
        return config;
    }

    /** Roles given on the command line win over {@code [inspect] roles}. */
    Set<String> roles(List<String> flagRoles) throws IOException {
        List<String> flags = splitRoles(flagRoles);
        List<String> chosen = flags.isEmpty() ? config().roles() : flags;
        return new LinkedHashSet<>(chosen);
    }

    OutputFormat format(String flagFormat) throws IOException {
        if (flagFormat != null) {
            return OutputFormat.from(flagFormat);
        }
        return config().format().orElse(OutputFormat.JSON);
    }

    void emit(Map<String, Object> payload, OutputFormat format) throws JsonProcessingException {
        String text = format == OutputFormat.YAML
            ? Mappers.YAML.writeValueAsString(payload)
            : Mappers.JSON_PRETTY.writeValueAsString(payload);
        print(text);
    }

    void print(String text) {
        PrintWriter out = spec.commandLine().getOut();
        out.print(text.endsWith("\n") ? text : text + "\n");
        out.flush();
    }

    static void writeText(Path target, String text) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, text, StandardCharsets.UTF_8);
    }

    private static List<String> splitRoles(List<String> raw) {
        var roles = new ArrayList<String>();
        if (raw != null) {
            for (String entry : raw) {
                for (String role : entry.split(",")) {
                    if (!role.isBlank()) {
                        roles.add(role.trim());
                    }
                }
            }
        }
        return roles;
    }
}
