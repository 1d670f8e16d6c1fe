package com.zzf.simon.store;

public class StoreException extends RuntimeException {
    private final StoreErrorCode code;

    public StoreException(StoreErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public StoreException(StoreErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public StoreErrorCode getCode() {
        return code;
    }

    public boolean isTransient() {
        return code.isTransient();
    }
}
