package it.unimib.datai.fnship.deployer.error;

import java.time.Duration;

public final class UpdateTimeoutException extends FunctionOperationException {
    private final Duration maxWait;

    public UpdateTimeoutException(String functionName, Duration maxWait, Throwable cause) {
        super("update", functionName, "code update not completed after " + maxWait.toSeconds() + "s", cause);
        this.maxWait = maxWait;
    }

    public Duration maxWait() {
        return maxWait;
    }
}
