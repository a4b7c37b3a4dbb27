package it.unimib.datai.fnship.common.model;

/**
 * Optional settings for a deploy call. Null fields fall back to the deployer defaults.
 */
public record DeployOptions(
        String runtime,
        String handler,
        Integer timeout,
        Integer memorySize,
        String description,
        String roleName
) {
    public static DeployOptions defaults() {
        return new DeployOptions(null, null, null, null, null, null);
    }

    public DeployOptions withRuntime(String runtime) {
        return new DeployOptions(runtime, handler, timeout, memorySize, description, roleName);
    }

    public DeployOptions withRoleName(String roleName) {
        return new DeployOptions(runtime, handler, timeout, memorySize, description, roleName);
    }
}
