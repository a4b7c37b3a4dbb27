package it.unimib.datai.fnship.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunctionSummary(
        String name,
        String arn,
        String runtime,
        String handler,
        Integer memorySizeMb,
        Integer timeoutSeconds,
        String description,
        String lastModified
) {
}
