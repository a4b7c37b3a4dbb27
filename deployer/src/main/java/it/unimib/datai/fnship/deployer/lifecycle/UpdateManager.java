package it.unimib.datai.fnship.deployer.lifecycle;

import it.unimib.datai.fnship.common.model.FunctionArtifact;
import it.unimib.datai.fnship.deployer.activation.ActivationTarget;
import it.unimib.datai.fnship.deployer.activation.ActivationWaiter;
import it.unimib.datai.fnship.deployer.compute.ComputeService;
import it.unimib.datai.fnship.deployer.compute.FunctionConfigurationResolver;
import it.unimib.datai.fnship.deployer.compute.FunctionNames;
import it.unimib.datai.fnship.deployer.config.DeployerProperties;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import it.unimib.datai.fnship.deployer.error.InvalidInputException;
import it.unimib.datai.fnship.deployer.packaging.CodePackager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

public class UpdateManager {
    private static final Logger log = LoggerFactory.getLogger(UpdateManager.class);
    static final String OPERATION = "update";

    private final ComputeService compute;
    private final ActivationWaiter waiter;
    private final FunctionConfigurationResolver configurationResolver;
    private final DeployerProperties properties;

    public UpdateManager(ComputeService compute, ActivationWaiter waiter, DeployerProperties properties) {
        this.compute = compute;
        this.waiter = waiter;
        this.configurationResolver = new FunctionConfigurationResolver(properties.functionDefaults());
        this.properties = properties;
    }

    public CompletableFuture<String> update(String name, String code) {
        return update(name, code, null);
    }

    /**
     * Pushes new code to an existing function. {@code runtime} only selects the archive entry
     * extension; the function's configuration is left untouched.
     */
    public CompletableFuture<String> update(String name, String code, String runtime) {
        FunctionArtifact artifact;
        try {
            FunctionNames.require(name);
            String resolvedRuntime = configurationResolver.resolveRuntime(runtime);
            artifact = CodePackager.forRuntime(resolvedRuntime).artifact(code, null);
        } catch (InvalidInputException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<String> updated = FunctionErrors.guard(() -> compute.updateResourceCode(name, artifact))
                .thenCompose(arn -> {
                    log.info("Uploaded new code for {} ({}), waiting for the update to complete", name, arn);
                    return waiter.awaitReady(name, compute::getResourceState, ActivationTarget.UPDATED,
                                    properties.updateTimeout())
                            .thenApply(ignored -> arn);
                });
        return FunctionErrors.wrapFailures(updated, OPERATION, name);
    }
}
