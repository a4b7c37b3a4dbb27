package it.unimib.datai.fnship.deployer.activation;

import it.unimib.datai.fnship.common.model.FunctionStatus;

import java.time.Duration;

public final class ActivationTimeoutException extends RuntimeException {
    private final String resourceName;
    private final Duration maxWait;
    private final FunctionStatus lastStatus;

    public ActivationTimeoutException(String resourceName, Duration maxWait, FunctionStatus lastStatus) {
        super("Timed out after " + maxWait.toMillis() + "ms waiting for " + resourceName
                + (lastStatus == null ? "" : " (last status " + lastStatus + ")"));
        this.resourceName = resourceName;
        this.maxWait = maxWait;
        this.lastStatus = lastStatus;
    }

    public String resourceName() {
        return resourceName;
    }

    public Duration maxWait() {
        return maxWait;
    }

    public FunctionStatus lastStatus() {
        return lastStatus;
    }
}
