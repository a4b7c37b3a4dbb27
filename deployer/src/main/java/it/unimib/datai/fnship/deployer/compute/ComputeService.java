package it.unimib.datai.fnship.deployer.compute;

import it.unimib.datai.fnship.common.model.FunctionArtifact;
import it.unimib.datai.fnship.common.model.FunctionStatus;
import it.unimib.datai.fnship.common.model.FunctionSummary;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Remote compute service hosting deployed functions.
 * Methods that address a function fail with {@link FunctionNotFoundException} when it does not exist.
 */
public interface ComputeService extends AutoCloseable {

    /** Creates the function and completes with its remote identifier. */
    CompletableFuture<String> createResource(String name, String roleArn, FunctionArtifact artifact);

    /** Replaces the function code and completes with its remote identifier. */
    CompletableFuture<String> updateResourceCode(String name, FunctionArtifact artifact);

    CompletableFuture<FunctionStatus> getResourceState(String name);

    /** Completes with the raw response body; an empty array when the function returned nothing. */
    CompletableFuture<byte[]> invokeResource(String name, byte[] payload);

    CompletableFuture<Void> deleteResource(String name);

    CompletableFuture<List<FunctionSummary>> listResources();

    /** Releases the underlying client. */
    @Override
    default void close() {
    }
}
