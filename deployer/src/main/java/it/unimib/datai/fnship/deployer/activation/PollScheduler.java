package it.unimib.datai.fnship.deployer.activation;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Timing primitives used between and around activation polls.
 */
public interface PollScheduler {

    /** Completes after {@code delay} without occupying the calling thread. */
    CompletableFuture<Void> delay(Duration delay);

    /** Mirrors {@code future}, failing with {@link java.util.concurrent.TimeoutException} once {@code budget} elapses. */
    <T> CompletableFuture<T> within(CompletableFuture<T> future, Duration budget);

    static PollScheduler system() {
        return new PollScheduler() {
            @Override
            public CompletableFuture<Void> delay(Duration delay) {
                return CompletableFuture.runAsync(() -> {},
                        CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
            }

            @Override
            public <T> CompletableFuture<T> within(CompletableFuture<T> future, Duration budget) {
                return future.copy().orTimeout(Math.max(1, budget.toMillis()), TimeUnit.MILLISECONDS);
            }
        };
    }
}
