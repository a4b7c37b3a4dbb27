package it.unimib.datai.fnship.cli.commands;

import it.unimib.datai.fnship.cli.commands.context.ContextCommand;
import it.unimib.datai.fnship.cli.commands.deploy.DeployCommand;
import it.unimib.datai.fnship.cli.commands.deploy.UpdateCommand;
import it.unimib.datai.fnship.cli.commands.fn.FnCommand;
import it.unimib.datai.fnship.cli.commands.invoke.InvokeCommand;
import it.unimib.datai.fnship.cli.config.ConfigStore;
import it.unimib.datai.fnship.cli.config.ResolvedContext;
import it.unimib.datai.fnship.deployer.service.FunctionDeployer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

@Command(
        name = "fnship",
        mixinStandardHelpOptions = true,
        description = "Deploy, update and invoke AWS Lambda functions from a single source file.",
        subcommands = {
                DeployCommand.class,
                UpdateCommand.class,
                InvokeCommand.class,
                FnCommand.class,
                ContextCommand.class
        }
)
public class RootCommand implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RootCommand.class);

    @Option(names = {"--config"}, description = "Path to config file (default: ~/.config/fnship/config.yaml).")
    Path configPath;

    @Option(names = {"--region"}, description = "AWS region (overrides config/env).")
    String region;

    @Option(names = {"--endpoint"}, description = "AWS endpoint override, e.g. a local emulator (overrides config/env).")
    String endpoint;

    @Option(names = {"--profile"}, description = "AWS credentials profile (overrides config/env).")
    String profile;

    private final DeployerFactory deployerFactory;
    private ConfigStore store;
    private ResolvedContext resolved;
    private FunctionDeployer deployer;

    public RootCommand() {
        this(DeployerFactory.aws());
    }

    public RootCommand(DeployerFactory deployerFactory) {
        this.deployerFactory = deployerFactory;
    }

    public ConfigStore configStore() {
        if (store == null) {
            store = (configPath == null) ? new ConfigStore() : new ConfigStore(configPath);
        }
        return store;
    }

    public ResolvedContext resolvedContext() {
        if (resolved == null) {
            ResolvedContext base = configStore().loadResolvedContext();
            resolved = new ResolvedContext(
                    base.contextName(),
                    firstNonBlank(region, base.region()),
                    firstNonBlank(endpoint, base.endpoint()),
                    firstNonBlank(profile, base.profile()),
                    base.roleName(),
                    base.activationTimeoutSeconds());
        }
        return resolved;
    }

    public FunctionDeployer deployer() {
        if (deployer == null) {
            ResolvedContext ctx = resolvedContext();
            log.debug("Using context {} (region={}, endpoint={}, profile={})",
                    ctx.contextName(), ctx.region(), ctx.endpoint(), ctx.profile());
            deployer = deployerFactory.create(ctx);
        }
        return deployer;
    }

    /** Releases the deployer's clients if a command created it. */
    @Override
    public void close() {
        if (deployer != null) {
            deployer.close();
            deployer = null;
        }
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a;
        }
        if (b != null && !b.isBlank()) {
            return b;
        }
        return null;
    }
}
