package it.unimib.datai.fnship.deployer.activation;

import it.unimib.datai.fnship.common.model.FunctionStatus;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Polls a remote function until it reaches an {@link ActivationTarget}, fails, or the wait budget runs out.
 * Each poll is bounded by the budget left, so a slow status call cannot stretch the overall wait.
 */
public class ActivationWaiter {
    private static final Logger log = LoggerFactory.getLogger(ActivationWaiter.class);

    private final Clock clock;
    private final PollScheduler scheduler;
    private final Duration pollInterval;

    public ActivationWaiter(Duration pollInterval) {
        this(Clock.systemUTC(), PollScheduler.system(), pollInterval);
    }

    public ActivationWaiter(Clock clock, PollScheduler scheduler, Duration pollInterval) {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.clock = clock;
        this.scheduler = scheduler;
        this.pollInterval = pollInterval;
    }

    public CompletableFuture<Void> awaitReady(String resourceName,
                                              Function<String, CompletableFuture<FunctionStatus>> poll,
                                              ActivationTarget target,
                                              Duration maxWait) {
        Wait wait = new Wait(resourceName, poll, target, maxWait, clock.instant().plus(maxWait));
        return attempt(wait);
    }

    private CompletableFuture<Void> attempt(Wait wait) {
        Duration remaining = wait.remaining(clock);
        if (remaining.isZero()) {
            return CompletableFuture.failedFuture(wait.timedOut());
        }

        wait.attempts++;
        CompletableFuture<FunctionStatus> polled = FunctionErrors.guard(() -> wait.poll.apply(wait.resourceName));

        return scheduler.within(polled, remaining)
                .handle((status, error) -> error == null
                        ? onStatus(wait, status)
                        : onPollError(wait, error))
                .thenCompose(next -> next);
    }

    private CompletableFuture<Void> onStatus(Wait wait, FunctionStatus status) {
        wait.lastStatus = status;
        ActivationPhase phase = wait.target.evaluate(status);
        log.debug("Poll {} for {} ({}): {} -> {}", wait.attempts, wait.resourceName, wait.target, status, phase);

        switch (phase) {
            case READY:
                return CompletableFuture.completedFuture(null);
            case FAILED:
                return CompletableFuture.failedFuture(new ActivationFailedException(wait.resourceName, status));
            default:
                Duration remaining = wait.remaining(clock);
                if (remaining.isZero()) {
                    return CompletableFuture.failedFuture(wait.timedOut());
                }
                Duration sleep = remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval;
                return scheduler.delay(sleep).thenCompose(ignored -> attempt(wait));
        }
    }

    private CompletableFuture<Void> onPollError(Wait wait, Throwable error) {
        Throwable cause = FunctionErrors.unwrap(error);
        if (cause instanceof TimeoutException) {
            return CompletableFuture.failedFuture(wait.timedOut());
        }
        return CompletableFuture.failedFuture(cause);
    }

    private static final class Wait {
        private final String resourceName;
        private final Function<String, CompletableFuture<FunctionStatus>> poll;
        private final ActivationTarget target;
        private final Duration maxWait;
        private final Instant deadline;
        private FunctionStatus lastStatus;
        private int attempts;

        private Wait(String resourceName,
                     Function<String, CompletableFuture<FunctionStatus>> poll,
                     ActivationTarget target,
                     Duration maxWait,
                     Instant deadline) {
            this.resourceName = resourceName;
            this.poll = poll;
            this.target = target;
            this.maxWait = maxWait;
            this.deadline = deadline;
        }

        private Duration remaining(Clock clock) {
            Duration left = Duration.between(clock.instant(), deadline);
            return left.isNegative() ? Duration.ZERO : left;
        }

        private ActivationTimeoutException timedOut() {
            log.debug("Gave up on {} after {} polls", resourceName, attempts);
            return new ActivationTimeoutException(resourceName, maxWait, lastStatus);
        }
    }
}
