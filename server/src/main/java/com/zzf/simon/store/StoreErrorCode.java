package com.zzf.simon.store;

public enum StoreErrorCode {
    UNAVAILABLE(true),
    DEADLINE_EXCEEDED(true),
    RESOURCE_EXHAUSTED(true),
    ABORTED(true),
    INTERNAL(true),
    NOT_FOUND(false),
    ALREADY_EXISTS(false),
    PERMISSION_DENIED(false),
    INVALID_ARGUMENT(false);

    private final boolean transientFailure;

    StoreErrorCode(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
