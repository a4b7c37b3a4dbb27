package it.unimib.datai.fnship.aws;

import it.unimib.datai.fnship.common.model.FunctionArtifact;
import it.unimib.datai.fnship.common.model.FunctionConfiguration;
import it.unimib.datai.fnship.common.model.FunctionState;
import it.unimib.datai.fnship.common.model.FunctionStatus;
import it.unimib.datai.fnship.common.model.FunctionSummary;
import it.unimib.datai.fnship.common.model.UpdateStatus;
import it.unimib.datai.fnship.deployer.compute.ComputeService;
import it.unimib.datai.fnship.deployer.compute.FunctionNotFoundException;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.lambda.LambdaAsyncClient;
import software.amazon.awssdk.services.lambda.model.CreateFunctionRequest;
import software.amazon.awssdk.services.lambda.model.DeleteFunctionRequest;
import software.amazon.awssdk.services.lambda.model.FunctionCode;
import software.amazon.awssdk.services.lambda.model.GetFunctionConfigurationRequest;
import software.amazon.awssdk.services.lambda.model.GetFunctionConfigurationResponse;
import software.amazon.awssdk.services.lambda.model.InvokeRequest;
import software.amazon.awssdk.services.lambda.model.LastUpdateStatus;
import software.amazon.awssdk.services.lambda.model.ListFunctionsRequest;
import software.amazon.awssdk.services.lambda.model.ResourceNotFoundException;
import software.amazon.awssdk.services.lambda.model.State;
import software.amazon.awssdk.services.lambda.model.UpdateFunctionCodeRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Functions backed by AWS Lambda. Every call maps Lambda's not-found error to {@link FunctionNotFoundException}.
 */
public class LambdaComputeService implements ComputeService {
    private static final Logger log = LoggerFactory.getLogger(LambdaComputeService.class);

    private final LambdaAsyncClient lambda;

    public LambdaComputeService(LambdaAsyncClient lambda) {
        this.lambda = lambda;
    }

    @Override
    public void close() {
        lambda.close();
    }

    @Override
    public CompletableFuture<String> createResource(String name, String roleArn, FunctionArtifact artifact) {
        FunctionConfiguration config = artifact.configuration();
        CreateFunctionRequest request = CreateFunctionRequest.builder()
                .functionName(name)
                .role(roleArn)
                .runtime(config.runtime())
                .handler(config.handler())
                .timeout(config.timeoutSeconds())
                .memorySize(config.memorySizeMb())
                .description(config.description())
                .code(FunctionCode.builder().zipFile(SdkBytes.fromByteArray(artifact.archive())).build())
                .build();
        return call(name, () -> lambda.createFunction(request))
                .thenApply(response -> response.functionArn());
    }

    @Override
    public CompletableFuture<String> updateResourceCode(String name, FunctionArtifact artifact) {
        UpdateFunctionCodeRequest request = UpdateFunctionCodeRequest.builder()
                .functionName(name)
                .zipFile(SdkBytes.fromByteArray(artifact.archive()))
                .build();
        return call(name, () -> lambda.updateFunctionCode(request))
                .thenApply(response -> response.functionArn());
    }

    @Override
    public CompletableFuture<FunctionStatus> getResourceState(String name) {
        GetFunctionConfigurationRequest request = GetFunctionConfigurationRequest.builder().functionName(name).build();
        return call(name, () -> lambda.getFunctionConfiguration(request))
                .thenApply(LambdaComputeService::toStatus);
    }

    @Override
    public CompletableFuture<byte[]> invokeResource(String name, byte[] payload) {
        InvokeRequest request = InvokeRequest.builder()
                .functionName(name)
                .payload(SdkBytes.fromByteArray(payload))
                .build();
        return call(name, () -> lambda.invoke(request)).thenApply(response -> {
            if (response.functionError() != null) {
                log.warn("Function {} reported an error: {}", name, response.functionError());
            }
            return response.payload() == null ? new byte[0] : response.payload().asByteArray();
        });
    }

    @Override
    public CompletableFuture<Void> deleteResource(String name) {
        return call(name, () -> lambda.deleteFunction(DeleteFunctionRequest.builder().functionName(name).build()))
                .thenApply(response -> null);
    }

    @Override
    public CompletableFuture<List<FunctionSummary>> listResources() {
        return listPage(null, new ArrayList<>());
    }

    private CompletableFuture<List<FunctionSummary>> listPage(String marker, List<FunctionSummary> collected) {
        ListFunctionsRequest request = ListFunctionsRequest.builder().marker(marker).build();
        return lambda.listFunctions(request).thenCompose(response -> {
            response.functions().forEach(fn -> collected.add(toSummary(fn)));
            String next = response.nextMarker();
            if (next == null || next.isEmpty()) {
                return CompletableFuture.completedFuture(collected);
            }
            return listPage(next, collected);
        });
    }

    private static <T> CompletableFuture<T> call(String name, Supplier<CompletableFuture<T>> request) {
        return request.get()
                .handle((value, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(value);
                    }
                    Throwable cause = FunctionErrors.unwrap(error);
                    if (cause instanceof ResourceNotFoundException) {
                        return CompletableFuture.<T>failedFuture(new FunctionNotFoundException(name, cause));
                    }
                    return CompletableFuture.<T>failedFuture(cause);
                })
                .thenCompose(result -> result);
    }

    static FunctionStatus toStatus(GetFunctionConfigurationResponse response) {
        return new FunctionStatus(toState(response.state()), toUpdateStatus(response.lastUpdateStatus()),
                firstNonNull(response.stateReason(), response.lastUpdateStatusReason()));
    }

    private static FunctionState toState(State state) {
        if (state == null) {
            return null;
        }
        switch (state) {
            case PENDING:
                return FunctionState.PENDING;
            case ACTIVE:
                return FunctionState.ACTIVE;
            case INACTIVE:
                return FunctionState.INACTIVE;
            case FAILED:
                return FunctionState.FAILED;
            default:
                return null;
        }
    }

    private static UpdateStatus toUpdateStatus(LastUpdateStatus status) {
        if (status == null) {
            return null;
        }
        switch (status) {
            case SUCCESSFUL:
                return UpdateStatus.SUCCESSFUL;
            case FAILED:
                return UpdateStatus.FAILED;
            case IN_PROGRESS:
                return UpdateStatus.IN_PROGRESS;
            default:
                return null;
        }
    }

    private static FunctionSummary toSummary(software.amazon.awssdk.services.lambda.model.FunctionConfiguration fn) {
        return new FunctionSummary(fn.functionName(), fn.functionArn(), fn.runtimeAsString(), fn.handler(),
                fn.memorySize(), fn.timeout(), fn.description(), fn.lastModified());
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
