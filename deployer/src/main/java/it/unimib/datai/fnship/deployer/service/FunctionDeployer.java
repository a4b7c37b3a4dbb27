package it.unimib.datai.fnship.deployer.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import it.unimib.datai.fnship.common.model.DeployOptions;
import it.unimib.datai.fnship.common.model.FunctionStatus;
import it.unimib.datai.fnship.common.model.FunctionSummary;
import it.unimib.datai.fnship.deployer.activation.ActivationWaiter;
import it.unimib.datai.fnship.deployer.compute.ComputeService;
import it.unimib.datai.fnship.deployer.compute.FunctionNames;
import it.unimib.datai.fnship.deployer.config.DeployerProperties;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import it.unimib.datai.fnship.deployer.error.InvalidInputException;
import it.unimib.datai.fnship.deployer.identity.IdentityService;
import it.unimib.datai.fnship.deployer.identity.RoleResolver;
import it.unimib.datai.fnship.deployer.invoke.Invoker;
import it.unimib.datai.fnship.deployer.lifecycle.DeploymentManager;
import it.unimib.datai.fnship.deployer.lifecycle.UpdateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Entry point for deploying, updating, invoking, listing and deleting functions.
 * Every call is independent; failures carry the operation and function name.
 */
public class FunctionDeployer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FunctionDeployer.class);

    private final DeploymentManager deploymentManager;
    private final UpdateManager updateManager;
    private final Invoker invoker;
    private final ComputeService compute;
    private final DeployerMetrics metrics;
    private final IdentityService identity;

    public FunctionDeployer(DeploymentManager deploymentManager,
                            UpdateManager updateManager,
                            Invoker invoker,
                            ComputeService compute,
                            DeployerMetrics metrics,
                            IdentityService identity) {
        this.deploymentManager = deploymentManager;
        this.updateManager = updateManager;
        this.invoker = invoker;
        this.compute = compute;
        this.metrics = metrics;
        this.identity = identity;
    }

    public static FunctionDeployer create(IdentityService identity,
                                          ComputeService compute,
                                          DeployerProperties properties,
                                          MeterRegistry meterRegistry) {
        return create(identity, compute, properties, new ActivationWaiter(properties.pollInterval()), meterRegistry);
    }

    public static FunctionDeployer create(IdentityService identity,
                                          ComputeService compute,
                                          DeployerProperties properties,
                                          ActivationWaiter waiter,
                                          MeterRegistry meterRegistry) {
        ObjectMapper mapper = new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return new FunctionDeployer(
                new DeploymentManager(new RoleResolver(identity), compute, waiter, properties),
                new UpdateManager(compute, waiter, properties),
                new Invoker(compute, mapper),
                compute,
                new DeployerMetrics(meterRegistry),
                identity
        );
    }

    public CompletableFuture<String> deploy(String name, String code, DeployOptions options) {
        return observe("deploy", name, () -> deploymentManager.deploy(name, code, options));
    }

    public CompletableFuture<String> update(String name, String code) {
        return update(name, code, null);
    }

    public CompletableFuture<String> update(String name, String code, String runtime) {
        return observe("update", name, () -> updateManager.update(name, code, runtime));
    }

    public CompletableFuture<JsonNode> invoke(String name, Object payload) {
        return observe("invoke", name, () -> invoker.invoke(name, payload));
    }

    public CompletableFuture<FunctionStatus> status(String name) {
        return observe("status", name, () -> passThrough("status", name, () -> compute.getResourceState(name)));
    }

    public CompletableFuture<Void> delete(String name) {
        return observe("delete", name, () -> passThrough("delete", name, () -> compute.deleteResource(name))
                .thenRun(() -> log.info("Deleted function {}", name)));
    }

    public CompletableFuture<List<FunctionSummary>> listFunctions() {
        return observe("listFunctions", null, () -> {
            CompletableFuture<List<FunctionSummary>> listed = FunctionErrors.guard(compute::listResources)
                    .thenApply(functions -> functions == null ? List.<FunctionSummary>of() : functions);
            return FunctionErrors.wrapFailures(listed, "listFunctions", null);
        });
    }

    /**
     * Closes the compute and identity services this deployer was built with.
     * Both are closed even when the first one fails.
     */
    @Override
    public void close() {
        RuntimeException failure = null;
        for (AutoCloseable resource : new AutoCloseable[]{compute, identity}) {
            if (resource == null) {
                continue;
            }
            try {
                resource.close();
            } catch (Exception e) {
                if (failure == null) {
                    failure = new IllegalStateException("Failed to close deployer clients", e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static <T> CompletableFuture<T> passThrough(String operation,
                                                        String name,
                                                        Supplier<CompletableFuture<T>> call) {
        try {
            FunctionNames.require(name);
        } catch (InvalidInputException e) {
            return CompletableFuture.failedFuture(e);
        }
        return FunctionErrors.wrapFailures(FunctionErrors.guard(call), operation, name);
    }

    private <T> CompletableFuture<T> observe(String operation, String name, Supplier<CompletableFuture<T>> call) {
        long started = System.nanoTime();
        return FunctionErrors.guard(call).whenComplete((value, error) -> {
            if (error == null) {
                metrics.success(operation, name, Duration.ofNanos(System.nanoTime() - started));
            } else {
                Throwable cause = FunctionErrors.unwrap(error);
                log.debug("{} failed: {}", operation, cause.getMessage());
                metrics.failure(operation, name, cause);
            }
        });
    }
}
