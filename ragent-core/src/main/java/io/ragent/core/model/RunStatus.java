package io.ragent.core.model;

public enum RunStatus {
    COMPLETED,
    FAILED,
    ABORTED,
    CANCELLED
}
