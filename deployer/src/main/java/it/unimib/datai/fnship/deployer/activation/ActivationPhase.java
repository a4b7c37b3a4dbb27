package it.unimib.datai.fnship.deployer.activation;

/**
 * Outcome of evaluating one polled status. Running out of time is reported by
 * {@link ActivationTimeoutException}, not by a phase.
 */
public enum ActivationPhase {
    PENDING,
    READY,
    FAILED
}
