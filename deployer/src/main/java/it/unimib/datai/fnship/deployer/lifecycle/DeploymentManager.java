package it.unimib.datai.fnship.deployer.lifecycle;

import it.unimib.datai.fnship.common.model.DeployOptions;
import it.unimib.datai.fnship.common.model.FunctionArtifact;
import it.unimib.datai.fnship.common.model.FunctionConfiguration;
import it.unimib.datai.fnship.deployer.activation.ActivationTarget;
import it.unimib.datai.fnship.deployer.activation.ActivationWaiter;
import it.unimib.datai.fnship.deployer.compute.ComputeService;
import it.unimib.datai.fnship.deployer.compute.FunctionConfigurationResolver;
import it.unimib.datai.fnship.deployer.compute.FunctionNames;
import it.unimib.datai.fnship.deployer.config.DeployerProperties;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import it.unimib.datai.fnship.deployer.error.InvalidInputException;
import it.unimib.datai.fnship.deployer.identity.RoleResolver;
import it.unimib.datai.fnship.deployer.packaging.CodePackager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Creates a function and waits until it is active.
 * The execution role is resolved (or created) first and left in place if a later step fails.
 */
public class DeploymentManager {
    private static final Logger log = LoggerFactory.getLogger(DeploymentManager.class);
    static final String OPERATION = "deploy";

    private final RoleResolver roleResolver;
    private final ComputeService compute;
    private final ActivationWaiter waiter;
    private final FunctionConfigurationResolver configurationResolver;
    private final DeployerProperties properties;

    public DeploymentManager(RoleResolver roleResolver,
                             ComputeService compute,
                             ActivationWaiter waiter,
                             DeployerProperties properties) {
        this.roleResolver = roleResolver;
        this.compute = compute;
        this.waiter = waiter;
        this.configurationResolver = new FunctionConfigurationResolver(properties.functionDefaults());
        this.properties = properties;
    }

    /**
     * Completes with the function's remote identifier once the function has been observed ACTIVE.
     */
    public CompletableFuture<String> deploy(String name, String code, DeployOptions options) {
        DeployOptions opts = options == null ? DeployOptions.defaults() : options;
        FunctionArtifact artifact;
        try {
            FunctionNames.require(name);
            FunctionConfiguration configuration = configurationResolver.resolve(opts);
            artifact = CodePackager.forRuntime(configuration.runtime()).artifact(code, configuration);
        } catch (InvalidInputException e) {
            return CompletableFuture.failedFuture(e);
        }

        String roleName = opts.roleName() == null || opts.roleName().isBlank()
                ? properties.defaultRoleName()
                : opts.roleName();

        CompletableFuture<String> deployed = FunctionErrors
                .guard(() -> roleResolver.ensureRole(roleName, properties.trustPolicy(), properties.managedPolicyArn()))
                .thenCompose(roleArn -> {
                    log.debug("Creating function {} with role {} ({} bytes)", name, roleArn, artifact.size());
                    return compute.createResource(name, roleArn, artifact);
                })
                .thenCompose(arn -> {
                    log.info("Created function {} ({}), waiting for it to become active", name, arn);
                    return waiter.awaitReady(name, compute::getResourceState, ActivationTarget.ACTIVE,
                                    properties.activationTimeout())
                            .thenApply(ignored -> arn);
                })
                .whenComplete((arn, error) -> {
                    if (error == null) {
                        log.info("Function {} is active", name);
                    }
                });
        return FunctionErrors.wrapFailures(deployed, OPERATION, name);
    }
}
