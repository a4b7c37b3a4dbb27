package it.unimib.datai.fnship.deployer.identity;

import it.unimib.datai.fnship.common.model.ExecutionIdentity;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Ensures an execution role exists and carries the managed policy the compute service needs.
 */
public class RoleResolver {
    private static final Logger log = LoggerFactory.getLogger(RoleResolver.class);

    private final IdentityService identityService;

    public RoleResolver(IdentityService identityService) {
        this.identityService = identityService;
    }

    /**
     * Returns the ARN of {@code roleName}, creating the role and attaching {@code managedPolicyArn}
     * when the lookup finds nothing. An existing role is returned as-is.
     */
    public CompletableFuture<String> ensureRole(String roleName, String trustPolicy, String managedPolicyArn) {
        return FunctionErrors.guard(() -> identityService.findIdentity(roleName)).thenCompose(found -> {
            if (found.isPresent()) {
                log.debug("Using existing execution role {} ({})", roleName, found.get().arn());
                return CompletableFuture.completedFuture(found.get().arn());
            }
            return createRole(roleName, trustPolicy, managedPolicyArn);
        });
    }

    private CompletableFuture<String> createRole(String roleName, String trustPolicy, String managedPolicyArn) {
        return identityService.createIdentity(roleName, trustPolicy)
                .handle((created, error) -> {
                    if (error == null) {
                        log.info("Created execution role {} ({})", roleName, created.arn());
                        return attach(created, managedPolicyArn);
                    }
                    Throwable cause = FunctionErrors.unwrap(error);
                    if (cause instanceof IdentityAlreadyExistsException) {
                        log.warn("Execution role {} was created concurrently, reusing it", roleName);
                        return adoptExisting(roleName, managedPolicyArn);
                    }
                    return CompletableFuture.<String>failedFuture(cause);
                })
                .thenCompose(arn -> arn);
    }

    private CompletableFuture<String> adoptExisting(String roleName, String managedPolicyArn) {
        return identityService.findIdentity(roleName).thenCompose(identity -> {
            if (identity.isEmpty()) {
                return CompletableFuture.failedFuture(new IllegalStateException(
                        "Execution role " + roleName + " reported as existing but could not be found"));
            }
            ExecutionIdentity existing = identity.get();
            return identityService.attachedPolicies(roleName).thenCompose(policies -> policies.contains(managedPolicyArn)
                    ? CompletableFuture.completedFuture(existing.arn())
                    : attach(existing, managedPolicyArn));
        });
    }

    private CompletableFuture<String> attach(ExecutionIdentity identity, String managedPolicyArn) {
        return identityService.attachGrant(identity.name(), managedPolicyArn)
                .thenApply(ignored -> {
                    log.info("Attached {} to execution role {}", managedPolicyArn, identity.name());
                    return identity.arn();
                });
    }
}
