package it.unimib.datai.fnship.common.model;

public record FunctionConfiguration(
        String runtime,
        String handler,
        int timeoutSeconds,
        int memorySizeMb,
        String description
) {
}
