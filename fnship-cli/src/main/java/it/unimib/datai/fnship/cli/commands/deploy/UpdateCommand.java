package it.unimib.datai.fnship.cli.commands.deploy;

import it.unimib.datai.fnship.cli.commands.RootCommand;
import it.unimib.datai.fnship.cli.io.SourceFiles;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;

@Command(name = "update", description = "Replace the code of an existing function and wait for the update to finish.")
public class UpdateCommand implements Runnable {

    @ParentCommand
    RootCommand root;

    @Parameters(index = "0", description = "Function name")
    String name;

    @Option(names = {"-f", "--file"}, required = true, description = "Path to the handler source file.")
    Path file;

    @Option(names = "--runtime", description = "Runtime of the function, selects the archive entry extension.")
    String runtime;

    @Override
    public void run() {
        String code = SourceFiles.read(file);
        String arn = FunctionErrors.await(root.deployer().update(name, code, runtime));
        System.out.println(arn);
    }
}
