package it.unimib.datai.fnship.deployer.error;

import it.unimib.datai.fnship.deployer.activation.ActivationTimeoutException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FunctionErrorsTest {

    @Test
    void unwrap_nestedCompletionWrappers_returnsRootFailure() {
        IllegalStateException root = new IllegalStateException("boom");

        Throwable unwrapped = FunctionErrors.unwrap(new CompletionException(new ExecutionException(root)));

        assertThat(unwrapped).isSameAs(root);
    }

    @Test
    void wrap_typedErrors_passThrough() {
        InvalidInputException invalid = new InvalidInputException("bad");
        MalformedResponseException malformed = new MalformedResponseException("fn", null);

        assertThat(FunctionErrors.wrap("deploy", "fn", new CompletionException(invalid))).isSameAs(invalid);
        assertThat(FunctionErrors.wrap("invoke", "fn", malformed)).isSameAs(malformed);
    }

    @Test
    void wrap_activationTimeout_mappedPerOperation() {
        ActivationTimeoutException timeout = new ActivationTimeoutException("fn", Duration.ofSeconds(2), null);

        assertThat(FunctionErrors.wrap("deploy", "fn", timeout)).isInstanceOf(DeploymentTimeoutException.class);
        assertThat(FunctionErrors.wrap("update", "fn", timeout)).isInstanceOf(UpdateTimeoutException.class);
        assertThat(FunctionErrors.wrap("status", "fn", timeout)).isInstanceOf(RemoteFailureException.class);
    }

    @Test
    void wrap_unknownError_remoteFailureCarryingContext() {
        RuntimeException wrapped = FunctionErrors.wrap("delete", "fn", new IllegalStateException("AccessDenied"));

        assertThat(wrapped).isInstanceOf(RemoteFailureException.class);
        RemoteFailureException failure = (RemoteFailureException) wrapped;
        assertThat(failure.operation()).isEqualTo("delete");
        assertThat(failure.functionName()).isEqualTo("fn");
        assertThat(failure).hasMessage("delete(fn) failed: AccessDenied");
    }

    @Test
    void wrap_noFunctionName_messageUsesOperationOnly() {
        assertThat(FunctionErrors.wrap("listFunctions", null, new RuntimeException()))
                .hasMessage("listFunctions failed: RuntimeException");
    }

    @Test
    void await_failedFuture_rethrowsUnwrappedCause() {
        CompletableFuture<String> failed = FunctionErrors.wrapFailures(
                CompletableFuture.failedFuture(new IllegalStateException("down")), "status", "fn");

        assertThatThrownBy(() -> FunctionErrors.await(failed))
                .isInstanceOf(RemoteFailureException.class)
                .hasMessage("status(fn) failed: down");
    }

    @Test
    void await_completedFuture_returnsValue() {
        assertThat(FunctionErrors.await(CompletableFuture.completedFuture("ok"))).isEqualTo("ok");
    }

    @Test
    void guard_callThrows_failedFutureWithSameException() {
        IllegalStateException thrown = new IllegalStateException("client closed");

        CompletableFuture<String> result = FunctionErrors.guard(() -> {
            throw thrown;
        });

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join).hasCause(thrown);
    }

    @Test
    void guard_callReturnsNull_failedFuture() {
        CompletableFuture<String> result = FunctionErrors.guard(() -> null);

        assertThatThrownBy(result::join)
                .cause()
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("call returned no future");
    }

    @Test
    void guard_callReturnsFuture_sameInstance() {
        CompletableFuture<String> future = new CompletableFuture<>();

        assertThat(FunctionErrors.guard(() -> future)).isSameAs(future);
    }
}
