package work.lcod.form.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /** Fully wired command line, shared by {@link #main} and embedders that capture output. */
    public static CommandLine commandLine() {
        return new CommandLine(new MarkformCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
