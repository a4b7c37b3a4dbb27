package it.unimib.datai.fnship.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunctionStatus(
        FunctionState state,
        UpdateStatus lastUpdateStatus,
        String reason
) {
    public static FunctionStatus of(FunctionState state) {
        return new FunctionStatus(state, null, null);
    }

    public static FunctionStatus updating(UpdateStatus lastUpdateStatus) {
        return new FunctionStatus(FunctionState.ACTIVE, lastUpdateStatus, null);
    }
}
