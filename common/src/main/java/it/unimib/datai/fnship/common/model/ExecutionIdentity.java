package it.unimib.datai.fnship.common.model;

/**
 * Execution role assumed by the compute service on behalf of a function.
 * Shared across deployments and never deleted by the deployer.
 */
public record ExecutionIdentity(
        String name,
        String arn
) {
    public ExecutionIdentity {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
    }
}
