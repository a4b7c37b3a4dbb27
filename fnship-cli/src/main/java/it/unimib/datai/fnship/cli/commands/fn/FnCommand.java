package it.unimib.datai.fnship.cli.commands.fn;

import it.unimib.datai.fnship.cli.commands.RootCommand;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
        name = "fn",
        description = "Inspect and remove deployed functions.",
        subcommands = {
                FnListCommand.class,
                FnStatusCommand.class,
                FnDeleteCommand.class
        }
)
public class FnCommand {

    @ParentCommand
    RootCommand root;
}
