package com.zzf.simon.client;

/**
 * Failure talking to the Simon server. {@link #isTransient()} tells callers whether a retry can help.
 */
public class SimonApiException extends RuntimeException {

    public enum Kind {
        VALIDATION,
        UNAUTHENTICATED,
        FORBIDDEN,
        NOT_FOUND,
        CONFLICT,
        RATE_LIMITED,
        SERVER,
        NETWORK,
        DECODING
    }

    private final Kind kind;
    private final int status;
    private final String code;
    private final Long retryAfterSeconds;

    public SimonApiException(Kind kind, int status, String code, String message, Long retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
        this.code = code;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static SimonApiException network(String message, Throwable cause) {
        return new SimonApiException(Kind.NETWORK, 0, "NETWORK", message, null, cause);
    }

    public static SimonApiException decoding(String message, Throwable cause) {
        return new SimonApiException(Kind.DECODING, 0, "DECODING", message, null, cause);
    }

    public static SimonApiException fromStatus(int status, String code, String message, Long retryAfterSeconds) {
        return new SimonApiException(kindOf(status), status, code, message, retryAfterSeconds, null);
    }

    static Kind kindOf(int status) {
        switch (status) {
            case 400:
                return Kind.VALIDATION;
            case 401:
                return Kind.UNAUTHENTICATED;
            case 403:
                return Kind.FORBIDDEN;
            case 404:
                return Kind.NOT_FOUND;
            case 409:
                return Kind.CONFLICT;
            case 429:
                return Kind.RATE_LIMITED;
            default:
                return status >= 500 ? Kind.SERVER : Kind.VALIDATION;
        }
    }

    public boolean isTransient() {
        return kind == Kind.NETWORK || kind == Kind.SERVER;
    }

    public Kind getKind() {
        return kind;
    }

    public int getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
