package it.unimib.datai.fnship.cli.commands.context;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "use", description = "Make an existing context the current one.")
public class ContextUseCommand implements Runnable {

    @ParentCommand
    ContextCommand parent;

    @Parameters(index = "0", description = "Context name.")
    String name;

    @Override
    public void run() {
        parent.update(cfg -> cfg.useContext(name));
        System.out.printf("Switched to context %s%n", name);
    }
}
