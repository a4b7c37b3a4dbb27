package it.unimib.datai.fnship.deployer.identity;

import it.unimib.datai.fnship.common.model.ExecutionIdentity;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Identity provider the deployer bootstraps execution roles through.
 */
public interface IdentityService extends AutoCloseable {

    /**
     * Completes with an empty optional when no identity with that name exists.
     * Every other lookup failure completes the future exceptionally.
     */
    CompletableFuture<Optional<ExecutionIdentity>> findIdentity(String name);

    /**
     * Completes exceptionally with {@link IdentityAlreadyExistsException} when the name is taken.
     */
    CompletableFuture<ExecutionIdentity> createIdentity(String name, String trustPolicy);

    CompletableFuture<Void> attachGrant(String name, String policyArn);

    /** Completes with the ARNs of every policy attached to the identity. */
    CompletableFuture<Set<String>> attachedPolicies(String name);

    /** Releases the underlying client. */
    @Override
    default void close() {
    }
}
