package it.unimib.datai.fnship.deployer.activation;

import it.unimib.datai.fnship.common.model.FunctionStatus;

public final class ActivationFailedException extends RuntimeException {
    private final String resourceName;
    private final FunctionStatus status;

    public ActivationFailedException(String resourceName, FunctionStatus status) {
        super(resourceName + " reached a failed state" + (status.reason() == null ? "" : ": " + status.reason()));
        this.resourceName = resourceName;
        this.status = status;
    }

    public String resourceName() {
        return resourceName;
    }

    public FunctionStatus status() {
        return status;
    }
}
