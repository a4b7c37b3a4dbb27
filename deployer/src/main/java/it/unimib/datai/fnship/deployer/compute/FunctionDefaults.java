package it.unimib.datai.fnship.deployer.compute;

public record FunctionDefaults(
        String runtime,
        String handler,
        int timeoutSeconds,
        int memorySizeMb,
        String description
) {
    public static final String DEFAULT_RUNTIME = "nodejs18.x";
    public static final String DEFAULT_HANDLER = "index.handler";
    public static final int DEFAULT_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_MEMORY_SIZE_MB = 128;
    public static final String DEFAULT_DESCRIPTION = "Created by fnship";

    public static FunctionDefaults standard() {
        return new FunctionDefaults(
                DEFAULT_RUNTIME,
                DEFAULT_HANDLER,
                DEFAULT_TIMEOUT_SECONDS,
                DEFAULT_MEMORY_SIZE_MB,
                DEFAULT_DESCRIPTION
        );
    }
}
