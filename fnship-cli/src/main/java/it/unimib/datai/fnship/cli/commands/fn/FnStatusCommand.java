package it.unimib.datai.fnship.cli.commands.fn;

import it.unimib.datai.fnship.cli.io.JsonIO;
import it.unimib.datai.fnship.common.model.FunctionStatus;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "status", description = "Show the state and last update status of a function.")
public class FnStatusCommand implements Runnable {

    @picocli.CommandLine.ParentCommand
    FnCommand parent;

    @Parameters(index = "0", description = "Function name")
    String name;

    @Override
    public void run() {
        FunctionStatus status = FunctionErrors.await(parent.root.deployer().status(name));
        System.out.println(JsonIO.write(status));
    }
}
