package it.unimib.datai.fnship.deployer.error;

import it.unimib.datai.fnship.deployer.activation.ActivationTimeoutException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

public final class FunctionErrors {

    private FunctionErrors() {}

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Maps a failure of {@code operation} on {@code functionName} to the error surfaced to callers.
     * Typed deployer errors pass through; activation timeouts become the operation's timeout;
     * anything else is a remote failure.
     */
    public static RuntimeException wrap(String operation, String functionName, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof FunctionOperationException op) {
            return op;
        }
        if (cause instanceof InvalidInputException invalid) {
            return invalid;
        }
        if (cause instanceof ActivationTimeoutException timeout) {
            if ("deploy".equals(operation)) {
                return new DeploymentTimeoutException(functionName, timeout.maxWait(), timeout);
            }
            if ("update".equals(operation)) {
                return new UpdateTimeoutException(functionName, timeout.maxWait(), timeout);
            }
        }
        return new RemoteFailureException(operation, functionName, cause);
    }

    /**
     * Starts {@code call} and returns its future. A call that throws, or returns no future,
     * yields a failed future instead.
     */
    public static <T> CompletableFuture<T> guard(Supplier<CompletableFuture<T>> call) {
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("call returned no future"));
        }
        return future;
    }

    /**
     * Completes with the result of {@code future}, or fails with its error mapped through {@link #wrap}.
     */
    public static <T> CompletableFuture<T> wrapFailures(CompletableFuture<T> future, String operation, String functionName) {
        return future.handle((value, error) -> error == null
                        ? CompletableFuture.completedFuture(value)
                        : CompletableFuture.<T>failedFuture(wrap(operation, functionName, error)))
                .thenCompose(result -> result);
    }

    /**
     * Waits for {@code future} and rethrows its failure without the completion wrapper.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }
}
