package it.unimib.datai.fnship.cli;

import it.unimib.datai.fnship.cli.commands.RootCommand;
import picocli.CommandLine;

public final class FnshipCli {
    private FnshipCli() {}

    public static void main(String[] args) {
        int exitCode;
        try (RootCommand root = new RootCommand()) {
            exitCode = commandLine(root).execute(args);
        }
        System.exit(exitCode);
    }

    /**
     * Command line with {@code @file} expansion disabled (the invoke payload uses {@code @path})
     * and failures reported as a single message on stderr.
     */
    public static CommandLine commandLine(RootCommand root) {
        CommandLine cli = new CommandLine(root);
        cli.setExpandAtFiles(false);
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            commandLine.getErr().println("Error: " + ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnExecutionException();
        });
        return cli;
    }
}
