package it.unimib.datai.fnship.cli.commands.context;

import it.unimib.datai.fnship.cli.commands.RootCommand;
import it.unimib.datai.fnship.cli.config.Config;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.function.Consumer;

@Command(
        name = "context",
        description = "Manage named contexts in the config file.",
        subcommands = {
                ContextSetCommand.class,
                ContextUseCommand.class,
                ContextListCommand.class
        }
)
public class ContextCommand {

    @ParentCommand
    RootCommand root;

    Config load() {
        return root.configStore().load();
    }

    void update(Consumer<Config> change) {
        Config cfg = load();
        change.accept(cfg);
        root.configStore().save(cfg);
    }
}
