package it.unimib.datai.fnship.deployer.error;

import java.time.Duration;

/**
 * The function was created but did not become active within the wait budget.
 * It may still exist remotely.
 */
public final class DeploymentTimeoutException extends FunctionOperationException {
    private final Duration maxWait;

    public DeploymentTimeoutException(String functionName, Duration maxWait, Throwable cause) {
        super("deploy", functionName, "function not active after " + maxWait.toSeconds() + "s", cause);
        this.maxWait = maxWait;
    }

    public Duration maxWait() {
        return maxWait;
    }
}
