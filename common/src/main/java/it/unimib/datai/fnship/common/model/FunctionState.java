package it.unimib.datai.fnship.common.model;

public enum FunctionState {
    PENDING,
    ACTIVE,
    INACTIVE,
    FAILED
}
