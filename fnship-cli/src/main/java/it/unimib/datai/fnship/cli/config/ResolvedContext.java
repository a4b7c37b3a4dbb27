package it.unimib.datai.fnship.cli.config;

/**
 * Effective connection settings after applying the selected context, environment overrides and flags.
 */
public record ResolvedContext(
        String contextName,
        String region,
        String endpoint,
        String profile,
        String roleName,
        Integer activationTimeoutSeconds
) {
    public static ResolvedContext empty() {
        return new ResolvedContext(null, null, null, null, null, null);
    }
}
