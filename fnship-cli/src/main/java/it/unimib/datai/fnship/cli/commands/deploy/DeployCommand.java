package it.unimib.datai.fnship.cli.commands.deploy;

import it.unimib.datai.fnship.cli.commands.RootCommand;
import it.unimib.datai.fnship.cli.io.SourceFiles;
import it.unimib.datai.fnship.common.model.DeployOptions;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;

@Command(name = "deploy", description = "Create a function from a source file and wait until it is active.")
public class DeployCommand implements Runnable {

    @ParentCommand
    RootCommand root;

    @Parameters(index = "0", description = "Function name")
    String name;

    @Option(names = {"-f", "--file"}, required = true, description = "Path to the handler source file.")
    Path file;

    @Option(names = "--runtime", description = "Runtime identifier (default: nodejs18.x).")
    String runtime;

    @Option(names = "--handler", description = "Handler entry point (default: index.handler).")
    String handler;

    @Option(names = "--timeout", description = "Timeout in seconds (default: 10).")
    Integer timeout;

    @Option(names = "--memory", description = "Memory in MB (default: 128).")
    Integer memory;

    @Option(names = "--description", description = "Function description.")
    String description;

    @Option(names = "--role", description = "Execution role name (default: from context, else fnship-lambda-role).")
    String role;

    @Override
    public void run() {
        String code = SourceFiles.read(file);
        DeployOptions options = new DeployOptions(runtime, handler, timeout, memory, description, role);
        String arn = FunctionErrors.await(root.deployer().deploy(name, code, options));
        System.out.println(arn);
    }
}
