package it.unimib.datai.fnship.cli.commands.context;

import it.unimib.datai.fnship.cli.config.Context;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "set", description = "Create or update a context. Options left out keep their saved value.")
public class ContextSetCommand implements Runnable {

    @ParentCommand
    ContextCommand parent;

    @Parameters(index = "0", description = "Context name.")
    String name;

    @Option(names = {"--region"}, description = "AWS region.")
    String region;

    @Option(names = {"--endpoint"}, description = "AWS endpoint override.")
    String endpoint;

    @Option(names = {"--no-endpoint"}, description = "Remove the saved endpoint override.")
    boolean clearEndpoint;

    @Option(names = {"--profile"}, description = "AWS credentials profile.")
    String profile;

    @Option(names = {"--role"}, description = "Execution role name used by deploy.")
    String roleName;

    @Option(names = {"--activation-timeout"}, description = "Seconds to wait for a deployed function to become active.")
    Integer activationTimeoutSeconds;

    @Option(names = {"--use"}, description = "Also make this the current context.")
    boolean use;

    @Override
    public void run() {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Context name must not be blank");
        }
        if (endpoint != null && clearEndpoint) {
            throw new IllegalArgumentException("--endpoint and --no-endpoint are mutually exclusive");
        }
        if (activationTimeoutSeconds != null && activationTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("--activation-timeout must be positive");
        }

        parent.update(cfg -> {
            Context ctx = cfg.contextOrNew(name);
            if (region != null) {
                ctx.setRegion(region);
            }
            if (endpoint != null) {
                ctx.setEndpoint(endpoint);
            }
            if (clearEndpoint) {
                ctx.setEndpoint(null);
            }
            if (profile != null) {
                ctx.setProfile(profile);
            }
            if (roleName != null) {
                ctx.setRoleName(roleName);
            }
            if (activationTimeoutSeconds != null) {
                ctx.setActivationTimeoutSeconds(activationTimeoutSeconds);
            }
            if (use || cfg.getCurrentContext() == null) {
                cfg.useContext(name);
            }
        });
        System.out.printf("Saved context %s%n", name);
    }
}
