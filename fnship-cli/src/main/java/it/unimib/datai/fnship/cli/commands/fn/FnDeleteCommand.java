package it.unimib.datai.fnship.cli.commands.fn;

import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "delete", description = "Delete a function by name.")
public class FnDeleteCommand implements Runnable {

    @picocli.CommandLine.ParentCommand
    FnCommand parent;

    @Parameters(index = "0", description = "Function name")
    String name;

    @Override
    public void run() {
        FunctionErrors.await(parent.root.deployer().delete(name));
    }
}
