package it.unimib.datai.fnship.cli.commands.context;

import it.unimib.datai.fnship.cli.config.Config;
import it.unimib.datai.fnship.cli.config.Context;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.Map;

@Command(name = "list", description = "List saved contexts; the current one is marked with *.")
public class ContextListCommand implements Runnable {

    @ParentCommand
    ContextCommand parent;

    @Override
    public void run() {
        Config cfg = parent.load();
        for (Map.Entry<String, Context> entry : cfg.getContexts().entrySet()) {
            String marker = entry.getKey().equals(cfg.getCurrentContext()) ? "*" : " ";
            Context ctx = entry.getValue() == null ? new Context() : entry.getValue();
            System.out.printf("%s %s\t%s\t%s%n", marker, entry.getKey(),
                    ctx.getRegion() == null ? "-" : ctx.getRegion(),
                    ctx.getEndpoint() == null ? "-" : ctx.getEndpoint());
        }
    }
}
