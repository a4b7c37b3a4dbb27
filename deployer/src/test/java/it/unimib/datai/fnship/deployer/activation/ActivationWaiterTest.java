package it.unimib.datai.fnship.deployer.activation;

import it.unimib.datai.fnship.common.model.FunctionState;
import it.unimib.datai.fnship.common.model.FunctionStatus;
import it.unimib.datai.fnship.common.model.UpdateStatus;
import it.unimib.datai.fnship.deployer.testsupport.FakeComputeService;
import it.unimib.datai.fnship.deployer.testsupport.ImmediateScheduler;
import it.unimib.datai.fnship.deployer.testsupport.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ActivationWaiterTest {

    private ManualClock clock;
    private ImmediateScheduler scheduler;
    private FakeComputeService compute;
    private ActivationWaiter waiter;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        scheduler = new ImmediateScheduler(clock);
        compute = new FakeComputeService();
        waiter = new ActivationWaiter(clock, scheduler, Duration.ofSeconds(1));
    }

    @Test
    void awaitReady_pendingThenActive_completesAfterThreePolls() {
        compute.statuses(FunctionStatus.of(FunctionState.PENDING),
                FunctionStatus.of(FunctionState.PENDING),
                FunctionStatus.of(FunctionState.ACTIVE));

        waiter.awaitReady("fn", compute::getResourceState, ActivationTarget.ACTIVE, Duration.ofSeconds(180)).join();

        assertThat(compute.polls).isEqualTo(3);
        assertThat(scheduler.delays()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    @Test
    void awaitReady_alreadyActive_singlePollNoDelay() {
        compute.statuses(FunctionStatus.of(FunctionState.ACTIVE));

        waiter.awaitReady("fn", compute::getResourceState, ActivationTarget.ACTIVE, Duration.ofSeconds(5)).join();

        assertThat(compute.polls).isEqualTo(1);
        assertThat(scheduler.delays()).isEmpty();
    }

    @Test
    void awaitReady_neverActive_timesOutAtBudget() {
        compute.statuses(FunctionStatus.of(FunctionState.PENDING));
        Instant start = clock.instant();

        CompletionException error = assertThrows(CompletionException.class, () -> waiter
                .awaitReady("fn", compute::getResourceState, ActivationTarget.ACTIVE, Duration.ofSeconds(3))
                .join());

        assertThat(error.getCause()).isInstanceOf(ActivationTimeoutException.class);
        ActivationTimeoutException timeout = (ActivationTimeoutException) error.getCause();
        assertThat(timeout.maxWait()).isEqualTo(Duration.ofSeconds(3));
        assertThat(timeout.lastStatus().state()).isEqualTo(FunctionState.PENDING);
        assertThat(Duration.between(start, clock.instant())).isEqualTo(Duration.ofSeconds(3));
        assertThat(compute.polls).isEqualTo(3);
    }

    @Test
    void awaitReady_lastSleepTrimmedToRemainingBudget() {
        compute.statuses(FunctionStatus.of(FunctionState.PENDING));
        ActivationWaiter slow = new ActivationWaiter(clock, scheduler, Duration.ofSeconds(2));

        assertThatThrownBy(() -> slow
                .awaitReady("fn", compute::getResourceState, ActivationTarget.ACTIVE, Duration.ofSeconds(3))
                .join())
                .hasCauseInstanceOf(ActivationTimeoutException.class);

        assertThat(scheduler.delays()).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(1));
    }

    @Test
    void awaitReady_hangingPoll_boundedByBudget() {
        compute.statusFuture(new CompletableFuture<>());
        Instant start = clock.instant();

        assertThatThrownBy(() -> waiter
                .awaitReady("fn", compute::getResourceState, ActivationTarget.ACTIVE, Duration.ofSeconds(10))
                .join())
                .hasCauseInstanceOf(ActivationTimeoutException.class);

        assertThat(Duration.between(start, clock.instant())).isEqualTo(Duration.ofSeconds(10));
        assertThat(compute.polls).isEqualTo(1);
    }

    @Test
    void awaitReady_pollReturnsNull_failedFutureInsteadOfThrow() {
        CompletableFuture<Void> result = waiter.awaitReady("fn", name -> null, ActivationTarget.ACTIVE,
                Duration.ofSeconds(5));

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join).hasRootCauseInstanceOf(IllegalStateException.class);
        assertThat(scheduler.delays()).isEmpty();
    }

    @Test
    void awaitReady_pollThrows_failedFutureInsteadOfThrow() {
        CompletableFuture<Void> result = waiter.awaitReady("fn", name -> {
            throw new IllegalStateException("client closed");
        }, ActivationTarget.ACTIVE, Duration.ofSeconds(5));

        assertThatThrownBy(result::join).hasRootCauseMessage("client closed");
    }

    @Test
    void awaitReady_failedState_stopsImmediately() {
        compute.statuses(FunctionStatus.of(FunctionState.PENDING),
                new FunctionStatus(FunctionState.FAILED, null, "InvalidRuntime"));

        assertThatThrownBy(() -> waiter
                .awaitReady("fn", compute::getResourceState, ActivationTarget.ACTIVE, Duration.ofSeconds(60))
                .join())
                .hasCauseInstanceOf(ActivationFailedException.class)
                .hasMessageContaining("InvalidRuntime");
        assertThat(compute.polls).isEqualTo(2);
    }

    @Test
    void awaitReady_pollError_propagatesWithoutRetry() {
        compute.statusFuture(CompletableFuture.failedFuture(new IllegalStateException("throttled")));

        assertThatThrownBy(() -> waiter
                .awaitReady("fn", compute::getResourceState, ActivationTarget.ACTIVE, Duration.ofSeconds(60))
                .join())
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageContaining("throttled");
        assertThat(compute.polls).isEqualTo(1);
    }

    @Test
    void awaitReady_updateTarget_waitsForSuccessfulUpdate() {
        compute.statuses(FunctionStatus.updating(UpdateStatus.IN_PROGRESS),
                FunctionStatus.updating(UpdateStatus.SUCCESSFUL));

        waiter.awaitReady("fn", compute::getResourceState, ActivationTarget.UPDATED, Duration.ofSeconds(60)).join();

        assertThat(compute.polls).isEqualTo(2);
    }

    @Test
    void constructor_nonPositiveInterval_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ActivationWaiter(clock, scheduler, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new ActivationWaiter(Duration.ofMillis(-1)));
    }
}
