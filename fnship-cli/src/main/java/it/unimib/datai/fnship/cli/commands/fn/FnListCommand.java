package it.unimib.datai.fnship.cli.commands.fn;

import it.unimib.datai.fnship.common.model.FunctionSummary;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import picocli.CommandLine.Command;

import java.util.List;

@Command(name = "list", description = "List deployed functions.")
public class FnListCommand implements Runnable {

    @picocli.CommandLine.ParentCommand
    FnCommand parent;

    @Override
    public void run() {
        List<FunctionSummary> functions = FunctionErrors.await(parent.root.deployer().listFunctions());
        for (FunctionSummary f : functions) {
            System.out.printf("%s\t%s\t%s%n", f.name(), f.runtime(), f.arn());
        }
    }
}
