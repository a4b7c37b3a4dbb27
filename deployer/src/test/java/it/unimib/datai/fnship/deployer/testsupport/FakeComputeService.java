package it.unimib.datai.fnship.deployer.testsupport;

import it.unimib.datai.fnship.common.model.FunctionArtifact;
import it.unimib.datai.fnship.common.model.FunctionStatus;
import it.unimib.datai.fnship.common.model.FunctionSummary;
import it.unimib.datai.fnship.deployer.compute.ComputeService;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory compute service. Status polls are answered from a script; the last entry repeats.
 */
public class FakeComputeService implements ComputeService {
    public static final String ARN_PREFIX = "arn:aws:lambda:us-east-1:123456789012:function:";

    private final Deque<CompletableFuture<FunctionStatus>> statuses = new ArrayDeque<>();
    public final List<String> calls = new ArrayList<>();
    public final List<FunctionArtifact> artifacts = new ArrayList<>();
    public String lastRoleArn;
    public byte[] lastPayload;
    public CompletableFuture<String> createResult;
    public CompletableFuture<String> updateResult;
    public CompletableFuture<byte[]> invokeResult = CompletableFuture.completedFuture(new byte[0]);
    public CompletableFuture<Void> deleteResult = CompletableFuture.completedFuture(null);
    public CompletableFuture<List<FunctionSummary>> listResult = CompletableFuture.completedFuture(List.of());
    public int polls;
    public boolean closed;

    public FakeComputeService statuses(FunctionStatus... script) {
        for (FunctionStatus status : script) {
            statuses.add(CompletableFuture.completedFuture(status));
        }
        return this;
    }

    public FakeComputeService statusFuture(CompletableFuture<FunctionStatus> future) {
        statuses.add(future);
        return this;
    }

    @Override
    public CompletableFuture<String> createResource(String name, String roleArn, FunctionArtifact artifact) {
        calls.add("create:" + name);
        lastRoleArn = roleArn;
        artifacts.add(artifact);
        return createResult != null ? createResult : CompletableFuture.completedFuture(ARN_PREFIX + name);
    }

    @Override
    public CompletableFuture<String> updateResourceCode(String name, FunctionArtifact artifact) {
        calls.add("update:" + name);
        artifacts.add(artifact);
        return updateResult != null ? updateResult : CompletableFuture.completedFuture(ARN_PREFIX + name);
    }

    @Override
    public CompletableFuture<FunctionStatus> getResourceState(String name) {
        polls++;
        calls.add("state:" + name);
        if (statuses.isEmpty()) {
            return CompletableFuture.completedFuture(FunctionStatus.of(null));
        }
        return statuses.size() > 1 ? statuses.poll() : statuses.peek();
    }

    @Override
    public CompletableFuture<byte[]> invokeResource(String name, byte[] payload) {
        calls.add("invoke:" + name);
        lastPayload = payload;
        return invokeResult;
    }

    @Override
    public CompletableFuture<Void> deleteResource(String name) {
        calls.add("delete:" + name);
        return deleteResult;
    }

    @Override
    public CompletableFuture<List<FunctionSummary>> listResources() {
        calls.add("list");
        return listResult;
    }

    @Override
    public void close() {
        closed = true;
    }
}
