package it.unimib.datai.fnship.aws;

import it.unimib.datai.fnship.common.model.ExecutionIdentity;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import it.unimib.datai.fnship.deployer.identity.IdentityAlreadyExistsException;
import it.unimib.datai.fnship.deployer.identity.IdentityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.iam.IamAsyncClient;
import software.amazon.awssdk.services.iam.model.AttachRolePolicyRequest;
import software.amazon.awssdk.services.iam.model.AttachedPolicy;
import software.amazon.awssdk.services.iam.model.CreateRoleRequest;
import software.amazon.awssdk.services.iam.model.EntityAlreadyExistsException;
import software.amazon.awssdk.services.iam.model.GetRoleRequest;
import software.amazon.awssdk.services.iam.model.ListAttachedRolePoliciesRequest;
import software.amazon.awssdk.services.iam.model.NoSuchEntityException;
import software.amazon.awssdk.services.iam.model.Role;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Execution roles backed by IAM.
 */
public class IamIdentityService implements IdentityService {
    private static final Logger log = LoggerFactory.getLogger(IamIdentityService.class);

    private final IamAsyncClient iam;

    public IamIdentityService(IamAsyncClient iam) {
        this.iam = iam;
    }

    @Override
    public CompletableFuture<Optional<ExecutionIdentity>> findIdentity(String name) {
        return iam.getRole(GetRoleRequest.builder().roleName(name).build())
                .thenApply(response -> Optional.of(toIdentity(response.role())))
                .handle((identity, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(identity);
                    }
                    Throwable cause = FunctionErrors.unwrap(error);
                    if (cause instanceof NoSuchEntityException) {
                        log.debug("Role {} does not exist", name);
                        return CompletableFuture.completedFuture(Optional.<ExecutionIdentity>empty());
                    }
                    return CompletableFuture.<Optional<ExecutionIdentity>>failedFuture(cause);
                })
                .thenCompose(result -> result);
    }

    @Override
    public CompletableFuture<ExecutionIdentity> createIdentity(String name, String trustPolicy) {
        CreateRoleRequest request = CreateRoleRequest.builder()
                .roleName(name)
                .assumeRolePolicyDocument(trustPolicy)
                .description("Execution role managed by fnship")
                .build();
        return iam.createRole(request)
                .handle((response, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(toIdentity(response.role()));
                    }
                    Throwable cause = FunctionErrors.unwrap(error);
                    if (cause instanceof EntityAlreadyExistsException) {
                        return CompletableFuture.<ExecutionIdentity>failedFuture(
                                new IdentityAlreadyExistsException(name, cause));
                    }
                    return CompletableFuture.<ExecutionIdentity>failedFuture(cause);
                })
                .thenCompose(result -> result);
    }

    @Override
    public CompletableFuture<Void> attachGrant(String name, String policyArn) {
        return iam.attachRolePolicy(AttachRolePolicyRequest.builder().roleName(name).policyArn(policyArn).build())
                .thenApply(response -> null);
    }

    /**
     * Follows the listing marker until IAM reports the last page.
     */
    @Override
    public CompletableFuture<Set<String>> attachedPolicies(String name) {
        return policyPage(name, null, new HashSet<>());
    }

    @Override
    public void close() {
        iam.close();
    }

    private CompletableFuture<Set<String>> policyPage(String name, String marker, Set<String> collected) {
        ListAttachedRolePoliciesRequest request = ListAttachedRolePoliciesRequest.builder()
                .roleName(name)
                .marker(marker)
                .build();
        return iam.listAttachedRolePolicies(request).thenCompose(response -> {
            response.attachedPolicies().stream()
                    .map(AttachedPolicy::policyArn)
                    .forEach(collected::add);
            if (Boolean.TRUE.equals(response.isTruncated()) && response.marker() != null) {
                return policyPage(name, response.marker(), collected);
            }
            log.debug("Role {} has {} attached policies", name, collected.size());
            return CompletableFuture.completedFuture(Set.copyOf(collected));
        });
    }

    private static ExecutionIdentity toIdentity(Role role) {
        return new ExecutionIdentity(role.roleName(), role.arn());
    }
}
