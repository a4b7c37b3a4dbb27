package it.unimib.datai.fnship.common.model;

public enum UpdateStatus {
    IN_PROGRESS,
    SUCCESSFUL,
    FAILED
}
