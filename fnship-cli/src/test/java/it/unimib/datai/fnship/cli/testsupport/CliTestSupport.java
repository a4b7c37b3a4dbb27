package it.unimib.datai.fnship.cli.testsupport;

import it.unimib.datai.fnship.cli.FnshipCli;
import it.unimib.datai.fnship.cli.commands.RootCommand;
import it.unimib.datai.fnship.deployer.service.FunctionDeployer;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

public final class CliTestSupport {

    private CliTestSupport() {
    }

    public static CommandLine cliWith(FunctionDeployer deployer) {
        return FnshipCli.commandLine(new RootCommand(context -> deployer));
    }

    public static CommandResult executeAndCapture(CommandLine cli, String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StringWriter err = new StringWriter();
        cli.setErr(new PrintWriter(err));
        PrintStream prev = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        try {
            int exit = cli.execute(args);
            return new CommandResult(exit, out.toString(StandardCharsets.UTF_8), err.toString());
        } finally {
            System.setOut(prev);
        }
    }

    public record CommandResult(int exitCode, String stdout, String stderr) {
    }
}
